package com.geico.poc.planexplain.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a plan graph: a label, visible attribute lines and an optional tooltip.
 */
public class GraphNode {
    
    private final String id;
    private final String label;
    private final List<String> attributes = new ArrayList<>();
    private String tooltip;
    
    GraphNode(String id, String label) {
        this.id = id;
        this.label = label;
    }
    
    public String getId() {
        return id;
    }
    
    public String getLabel() {
        return label;
    }
    
    public void addAttribute(String attribute) {
        attributes.add(attribute);
    }
    
    public List<String> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }
    
    /**
     * Set the hover text; a later call replaces an earlier one
     */
    public void addTooltip(String tooltip) {
        this.tooltip = tooltip;
    }
    
    public String getTooltip() {
        return tooltip;
    }
    
    @Override
    public String toString() {
        return id + "[" + label + "]";
    }
}
