package com.geico.poc.planexplain.stats;

import com.geico.poc.planexplain.plan.FakePlanNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PlanStatisticsTest {
    
    @Test
    public void testSamplesAreRecordedInCallOrder() {
        PlanStatistics stats = new PlanStatistics();
        FakePlanNode route = new FakePlanNode("Route");
        
        stats.record(route, 5);
        stats.record(route, 0);
        stats.record(route, 2);
        
        assertEquals(List.of(5, 0, 2), stats.samplesFor(route));
        assertTrue(stats.contains(route));
        assertEquals(1, stats.getNodeCount());
    }
    
    @Test
    public void testNodesAreKeyedByIdentity() {
        PlanStatistics stats = new PlanStatistics();
        FakePlanNode first = new FakePlanNode("Route");
        FakePlanNode second = new FakePlanNode("Route");
        
        stats.record(first, 1);
        
        assertEquals(List.of(1), stats.samplesFor(first));
        assertTrue(stats.samplesFor(second).isEmpty(), "unrecorded node has no samples");
        assertFalse(stats.contains(second));
    }
    
    @Test
    public void testNegativeRowCountRejected() {
        PlanStatistics stats = new PlanStatistics();
        assertThrows(IllegalArgumentException.class, () -> stats.record(new FakePlanNode("Route"), -1));
    }
    
    @Test
    public void testSamplesAreReadOnly() {
        RowsReceived rows = new RowsReceived();
        rows.add(3);
        assertThrows(UnsupportedOperationException.class, () -> rows.getSamples().add(4));
    }
}
