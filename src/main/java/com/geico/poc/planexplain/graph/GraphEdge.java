package com.geico.poc.planexplain.graph;

/**
 * Directed edge from a plan node to one of its inputs
 */
public class GraphEdge {
    
    private final GraphNode from;
    private final GraphNode to;
    
    GraphEdge(GraphNode from, GraphNode to) {
        this.from = from;
        this.to = to;
    }
    
    public GraphNode getFrom() {
        return from;
    }
    
    public GraphNode getTo() {
        return to;
    }
    
    @Override
    public String toString() {
        return from.getId() + " -> " + to.getId();
    }
}
