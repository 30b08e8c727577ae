package com.geico.poc.planexplain.dto;

import com.geico.poc.planexplain.model.PlanDescription;

/**
 * Explain output for one plan: the description tree, its JSON document and its DOT graph.
 */
public class ExplainResult {
    private final PlanDescription description;
    private final String json;
    private final String dot;

    public ExplainResult(PlanDescription description, String json, String dot) {
        this.description = description;
        this.json = json;
        this.dot = dot;
    }

    public PlanDescription getDescription() {
        return description;
    }

    public String getJson() {
        return json;
    }

    public String getDot() {
        return dot;
    }
}
