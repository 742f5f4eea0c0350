package io.github.eutro.irgraph.edit.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class RegionInfo {
    public final String id;
    public final String parentOp;
    public final List<String> blocks;

    public RegionInfo(String id, String parentOp, List<String> blocks) {
        this.id = id;
        this.parentOp = parentOp;
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
    }
}
