package com.geico.poc.planexplain.stats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregates over the row-count samples recorded for one plan node.
 */
public final class RowStatistics {
    
    private RowStatistics() {
    }
    
    /**
     * Number of recorded calls, one sample per call
     */
    public static int count(List<Integer> samples) {
        return samples.size();
    }
    
    /**
     * Arithmetic mean of the samples. Callers must check for an empty list first.
     */
    public static double mean(List<Integer> samples) {
        requireSamples(samples);
        long total = 0;
        for (int sample : samples) {
            total += sample;
        }
        return (double) total / samples.size();
    }
    
    /**
     * Median of the samples: the middle element for an odd count, the average of
     * the two middle elements for an even count. The given list is not modified.
     */
    public static double median(List<Integer> samples) {
        requireSamples(samples);
        List<Integer> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        
        int n = sorted.size();
        if (n % 2 == 0) {
            long mid1 = sorted.get(n / 2 - 1);
            long mid2 = sorted.get(n / 2);
            return (mid1 + mid2) / 2.0;
        }
        return sorted.get(n / 2);
    }
    
    private static void requireSamples(List<Integer> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("no row-count samples recorded");
        }
    }
}
