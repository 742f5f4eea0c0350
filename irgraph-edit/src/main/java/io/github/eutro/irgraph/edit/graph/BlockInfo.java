package io.github.eutro.irgraph.edit.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class BlockInfo {
    public final String id;
    public final List<String> arguments;
    public final String parentRegion;
    public final List<String> operations;

    public BlockInfo(String id, List<String> arguments, String parentRegion, List<String> operations) {
        this.id = id;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.parentRegion = parentRegion;
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }
}
