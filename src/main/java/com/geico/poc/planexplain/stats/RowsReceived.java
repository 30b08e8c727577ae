package com.geico.poc.planexplain.stats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by each call of one plan node, in call order.
 */
public class RowsReceived {
    
    private final List<Integer> samples = new ArrayList<>();
    
    public void add(int rows) {
        if (rows < 0) {
            throw new IllegalArgumentException("row count must be non-negative, got " + rows);
        }
        samples.add(rows);
    }
    
    public List<Integer> getSamples() {
        return Collections.unmodifiableList(samples);
    }
    
    public int size() {
        return samples.size();
    }
    
    public boolean isEmpty() {
        return samples.isEmpty();
    }
    
    @Override
    public String toString() {
        return samples.toString();
    }
}
