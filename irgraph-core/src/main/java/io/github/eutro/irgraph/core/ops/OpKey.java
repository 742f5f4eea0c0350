package io.github.eutro.irgraph.core.ops;

import io.github.eutro.irgraph.core.ext.CommonExts;
import io.github.eutro.irgraph.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An operation key, representing a registered kind of operation.
 * <p>
 * Traits of the operation, like being a terminator, and its verifier,
 * are attached to the key as exts.
 */
public class OpKey extends ExtHolder {
    public final String mnemonic;
    public final String description;

    public OpKey(String mnemonic, String description) {
        this.mnemonic = mnemonic;
        this.description = description;
    }

    public String getDialect() {
        int dot = mnemonic.indexOf('.');
        return dot < 0 ? "" : mnemonic.substring(0, dot);
    }

    public boolean isTerminator() {
        return getNullable(CommonExts.IS_TERMINATOR) == Boolean.TRUE;
    }

    public boolean isIsolatedFromAbove() {
        return getNullable(CommonExts.ISOLATED_FROM_ABOVE) == Boolean.TRUE;
    }

    /**
     * Get the names of the attributes that are inherent to this operation,
     * and so stored as properties.
     *
     * @return The names.
     */
    public Set<String> getInherentAttrs() {
        return getExt(CommonExts.INHERENT_ATTRS).orElse(Collections.emptySet());
    }

    public @Nullable OpVerifier getVerifier() {
        return getNullable(CommonExts.VERIFIER);
    }

    public OpKey withInherentAttrs(String... names) {
        attachExt(CommonExts.INHERENT_ATTRS, Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(names))));
        return this;
    }

    public OpKey withVerifier(OpVerifier verifier) {
        attachExt(CommonExts.VERIFIER, verifier);
        return this;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
