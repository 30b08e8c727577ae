package com.geico.poc.planexplain.stats;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for row-count aggregates: count, mean and median.
 */
public class RowStatisticsTest {
    
    @Test
    public void testMean() {
        assertEquals(2.0, RowStatistics.mean(List.of(1, 2, 3)));
        assertEquals(2.5, RowStatistics.mean(List.of(2, 3)));
        assertEquals(7.0, RowStatistics.mean(List.of(7)));
    }
    
    @Test
    public void testMeanDoesNotOverflow() {
        List<Integer> samples = List.of(Integer.MAX_VALUE, Integer.MAX_VALUE);
        assertEquals((double) Integer.MAX_VALUE, RowStatistics.mean(samples));
    }
    
    @Test
    public void testMedianOddCount() {
        assertEquals(2.0, RowStatistics.median(List.of(3, 1, 2)));
        assertEquals(5.0, RowStatistics.median(List.of(5)));
    }
    
    @Test
    public void testMedianEvenCount() {
        assertEquals(2.5, RowStatistics.median(List.of(3, 1, 2, 4)));
        assertEquals(0.5, RowStatistics.median(List.of(0, 1)));
    }
    
    @Test
    public void testMedianDoesNotMutateInput() {
        List<Integer> samples = new ArrayList<>(Arrays.asList(3, 1, 2, 4));
        RowStatistics.median(samples);
        assertEquals(Arrays.asList(3, 1, 2, 4), samples, "median must sort a copy");
    }
    
    @Test
    public void testCount() {
        assertEquals(3, RowStatistics.count(List.of(1, 1, 1)));
        assertEquals(0, RowStatistics.count(List.of()));
    }
    
    @Test
    public void testEmptySamplesRejected() {
        assertThrows(IllegalArgumentException.class, () -> RowStatistics.mean(List.of()));
        assertThrows(IllegalArgumentException.class, () -> RowStatistics.median(List.of()));
    }
}
