package com.geico.poc.planexplain.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Directed graph of a plan, ready for an external layout tool.
 * <p>
 * Node ids are assigned in creation order ({@code n0}, {@code n1}, ...).
 * {@link #toDot()} renders Graphviz DOT with record-shaped nodes.
 */
public class PlanGraph {
    
    private final String name;
    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    
    public PlanGraph(String name) {
        this.name = name;
    }
    
    public GraphNode addNode(String label) {
        GraphNode node = new GraphNode("n" + nodes.size(), label);
        nodes.add(node);
        return node;
    }
    
    public GraphEdge addEdge(GraphNode from, GraphNode to) {
        GraphEdge edge = new GraphEdge(from, to);
        edges.add(edge);
        return edge;
    }
    
    public String getName() {
        return name;
    }
    
    public List<GraphNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }
    
    public List<GraphEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }
    
    /**
     * Render the graph in Graphviz DOT format
     */
    public String toDot() {
        StringBuilder output = new StringBuilder();
        output.append("digraph ").append(quote(name)).append(" {\n");
        output.append("  node [shape=record, style=rounded];\n");
        for (GraphNode node : nodes) {
            StringBuilder label = new StringBuilder(escapeSpecialCharacters(node.getLabel()));
            if (!node.getAttributes().isEmpty()) {
                label.append('|');
                for (String attribute : node.getAttributes()) {
                    label.append(escapeSpecialCharacters(attribute)).append("\\l");
                }
            }
            output.append("  ").append(node.getId())
                .append(" [label=\"{").append(label).append("}\"");
            if (node.getTooltip() != null) {
                output.append(", tooltip=").append(quote(node.getTooltip()));
            }
            output.append("];\n");
        }
        for (GraphEdge edge : edges) {
            output.append("  ").append(edge.getFrom().getId())
                .append(" -> ").append(edge.getTo().getId()).append(";\n");
        }
        output.append("}\n");
        return output.toString();
    }
    
    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
    
    // Record labels treat these as field separators
    private static String escapeSpecialCharacters(String label) {
        return label
            .replace("\\", "\\\\")
            .replace("\n", " ")
            .replace("<", "\\<")
            .replace(">", "\\>")
            .replace("\"", "\\\"")
            .replace("{", "\\{")
            .replace("}", "\\}")
            .replace("|", "\\|");
    }
}
