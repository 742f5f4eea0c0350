package io.github.eutro.irgraph.core.ext;

import io.github.eutro.irgraph.core.ir.Block;
import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ir.Region;
import io.github.eutro.irgraph.core.ops.OpVerifier;

import java.util.Set;

public class CommonExts {
    // owners, kept up to date by the owning lists
    public static final Ext<Block> OWNING_BLOCK = Ext.create(Block.class, "OWNING_BLOCK");
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    public static final Ext<Operation> OWNING_OPERATION = Ext.create(Operation.class, "OWNING_OPERATION");

    // op key traits
    public static final Ext<Boolean> IS_TERMINATOR = Ext.create(Boolean.class, "IS_TERMINATOR");
    public static final Ext<Boolean> ISOLATED_FROM_ABOVE = Ext.create(Boolean.class, "ISOLATED_FROM_ABOVE");
    public static final Ext<Set<String>> INHERENT_ATTRS = Ext.create(Set.class, "INHERENT_ATTRS");
    public static final Ext<OpVerifier> VERIFIER = Ext.create(OpVerifier.class, "VERIFIER");

    public static <T extends ExtContainer> T markTerminator(T t) {
        t.attachExt(IS_TERMINATOR, true);
        return t;
    }

    public static <T extends ExtContainer> T markIsolated(T t) {
        t.attachExt(ISOLATED_FROM_ABOVE, true);
        return t;
    }
}
