package io.github.eutro.irgraph.edit.display;

import io.github.eutro.irgraph.edit.graph.*;

/**
 * Renders graphs as Graphviz DOT, for debugging.
 * <p>
 * Every region becomes a cluster nested in the cluster of its parent region,
 * every operation a box, and every block with arguments an ellipse. Edges run
 * from the producer of a value to its user, labelled with the operand index.
 */
public class GraphDisplay {
    public static String toDot(Graph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph irgraph {\n");
        sb.append("  compound=true;\n");
        sb.append("  node [shape=box, fontname=\"monospace\"];\n");
        for (RegionInfo region : graph.regions) {
            if (region.parentOp.equals(graph.moduleId)) {
                appendRegion(sb, graph, region, 1);
            }
        }
        for (EdgeInfo edge : graph.edges) {
            ValueInfo value = graph.getValue(edge.fromValue);
            if (value == null || value.ownerId == null) continue;
            sb.append("  ");
            quote(sb, value.ownerId);
            sb.append(" -> ");
            quote(sb, edge.toOp);
            sb.append(" [label=\"").append(edge.toOperandIndex).append("\"];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void appendRegion(StringBuilder sb, Graph graph, RegionInfo region, int depth) {
        indent(sb, depth).append("subgraph ");
        quote(sb, "cluster_" + region.id);
        sb.append(" {\n");
        indent(sb, depth + 1).append("label=");
        quote(sb, region.id);
        sb.append(";\n");
        for (String blockId : region.blocks) {
            BlockInfo block = graph.getBlock(blockId);
            if (block == null) continue;
            if (!block.arguments.isEmpty()) {
                indent(sb, depth + 1);
                quote(sb, block.id);
                sb.append(" [shape=ellipse, label=");
                quote(sb, block.id + "(" + String.join(", ", block.arguments) + ")");
                sb.append("];\n");
            }
            for (String opId : block.operations) {
                OperationInfo op = graph.getOperation(opId);
                if (op == null) continue;
                indent(sb, depth + 1);
                quote(sb, op.id);
                sb.append(" [label=");
                quote(sb, op.id + "\n" + op.name);
                sb.append("];\n");
                for (String regionId : op.regions) {
                    RegionInfo nested = graph.getRegion(regionId);
                    if (nested != null) appendRegion(sb, graph, nested, depth + 1);
                }
            }
        }
        indent(sb, depth).append("}\n");
    }

    private static StringBuilder indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        return sb;
    }

    private static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
    }
}
