package com.geico.poc.planexplain.stats;

import com.geico.poc.planexplain.plan.PlanNode;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-count samples for the nodes of one plan, collected while profiling.
 * <p>
 * Keyed by node identity: two equal-looking operators in the same plan keep
 * separate samples. Read-only once handed to the description builder.
 */
public class PlanStatistics {
    
    private final Map<PlanNode, RowsReceived> rowsByNode = new IdentityHashMap<>();
    
    /**
     * Record that one call of {@code node} returned {@code rows} rows
     */
    public void record(PlanNode node, int rows) {
        rowsByNode.computeIfAbsent(node, n -> new RowsReceived()).add(rows);
    }
    
    /**
     * Samples for a node; empty if none were recorded
     */
    public List<Integer> samplesFor(PlanNode node) {
        RowsReceived rows = rowsByNode.get(node);
        if (rows == null) {
            return List.of();
        }
        return rows.getSamples();
    }
    
    public boolean contains(PlanNode node) {
        return rowsByNode.containsKey(node);
    }
    
    public int getNodeCount() {
        return rowsByNode.size();
    }
    
    @Override
    public String toString() {
        return String.format("PlanStatistics[nodes=%d]", rowsByNode.size());
    }
}
