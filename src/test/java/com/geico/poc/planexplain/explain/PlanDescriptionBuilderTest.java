package com.geico.poc.planexplain.explain;

import com.geico.poc.planexplain.config.PlanExplainConfig;
import com.geico.poc.planexplain.json.PlanJson;
import com.geico.poc.planexplain.model.InputInfo;
import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.FakePlanNode;
import com.geico.poc.planexplain.plan.PlanInputs;
import com.geico.poc.planexplain.plan.PlanNode;
import com.geico.poc.planexplain.stats.PlanStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for building description trees from plan trees.
 */
public class PlanDescriptionBuilderTest {
    
    private PlanExplainConfig config;
    private PlanDescriptionBuilder builder;
    
    @BeforeEach
    public void setUp() {
        config = new PlanExplainConfig();
        builder = new PlanDescriptionBuilder(config);
    }
    
    // ========================================
    // Tree shape
    // ========================================
    
    @Test
    public void testLeafHasEmptyInputs() {
        PlanDescription description = builder.build(new FakePlanNode("Route"));
        
        assertNotNull(description.getInputs());
        assertTrue(description.getInputs().isEmpty());
    }
    
    @Test
    public void testInputOrderMirrorsPlan() {
        FakePlanNode concat = new FakePlanNode("Concatenate")
            .input(new FakePlanNode("A"))
            .input(new FakePlanNode("B"))
            .input(new FakePlanNode("C"));
        
        PlanDescription description = builder.build(concat);
        
        assertEquals(3, description.getInputs().size());
        assertEquals("A", description.getInputs().get(0).getOperatorType());
        assertEquals("B", description.getInputs().get(1).getOperatorType());
        assertEquals("C", description.getInputs().get(2).getOperatorType());
        for (PlanDescription input : description.getInputs()) {
            assertTrue(input.getInputs().isEmpty());
            assertNull(input.getInputName(), "no infos, no input name");
        }
    }
    
    @Test
    public void testOwnFieldsKept() {
        PlanDescription description = builder.build(new FakePlanNode("Route").variant("Scatter").field("Query", "q"));
        
        assertEquals("Route:Scatter", description.getLabel());
        assertEquals("q", description.getOther().get("Query"));
    }
    
    // ========================================
    // Input infos
    // ========================================
    
    @Test
    public void testInputInfoMerged() {
        FakePlanNode child = new FakePlanNode("Route").field("X", "own").field("Z", 1);
        FakePlanNode parent = new FakePlanNode("Join")
            .input(child, InputInfo.named("Left").with("X", "y"));
        
        PlanDescription input = builder.build(parent).getInputs().get(0);
        
        assertEquals("Left", input.getInputName());
        assertEquals("y", input.getOther().get("X"), "parent metadata overrides the child's own field");
        assertEquals(1, input.getOther().get("Z"));
        assertFalse(input.getOther().containsKey("InputName"));
        assertEquals(2, input.getOther().size());
    }
    
    @Test
    public void testUnnamedInputInfoAddsFieldsOnly() {
        FakePlanNode parent = new FakePlanNode("Subquery")
            .input(new FakePlanNode("Route"), InputInfo.unnamed().with("Outer", true))
            .input(new FakePlanNode("Route"), InputInfo.named("SubQuery"));
        
        PlanDescription description = builder.build(parent);
        
        assertNull(description.getInputs().get(0).getInputName());
        assertEquals(true, description.getInputs().get(0).getOther().get("Outer"));
        assertEquals("SubQuery", description.getInputs().get(1).getInputName());
    }
    
    @Test
    public void testInfosMustMatchInputs() {
        PlanNode node = new FakePlanNode("Route");
        assertThrows(IllegalArgumentException.class,
            () -> PlanInputs.of(List.of(node), List.of(InputInfo.named("A"), InputInfo.named("B"))));
    }
    
    // ========================================
    // Stats
    // ========================================
    
    @Test
    public void testStatsAttachedByIdentity() {
        FakePlanNode left = new FakePlanNode("Route");
        FakePlanNode right = new FakePlanNode("Route");
        FakePlanNode join = new FakePlanNode("Join").input(left).input(right);
        
        PlanStatistics stats = new PlanStatistics();
        stats.record(join, 3);
        stats.record(left, 1);
        stats.record(left, 2);
        
        PlanDescription description = builder.build(join, stats);
        
        assertEquals(List.of(3), description.getStats());
        assertEquals(List.of(1, 2), description.getInputs().get(0).getStats());
        assertTrue(description.getInputs().get(1).getStats().isEmpty(), "absent entry means no stats");
    }
    
    @Test
    public void testNoStatsMapping() {
        PlanDescription description = builder.build(new FakePlanNode("Route"), null);
        assertFalse(description.hasStats());
    }
    
    @Test
    public void testSelfReportedNameAndStatsIgnored() {
        PlanNode node = new PlanNode() {
            @Override
            public PlanDescription describe() {
                return PlanDescription.builder("Route")
                    .inputName("Stale")
                    .stats(List.of(9))
                    .build();
            }
            
            @Override
            public PlanInputs inputs() {
                return PlanInputs.none();
            }
        };
        
        PlanDescription unprofiled = builder.build(node);
        assertNull(unprofiled.getInputName(), "only a parent assigns input names");
        assertFalse(unprofiled.hasStats(), "stats come only from the samples passed in");
        assertEquals("{\"OperatorType\":\"Route\"}", new PlanJson(config).toJson(unprofiled));
        
        PlanStatistics stats = new PlanStatistics();
        stats.record(node, 4);
        assertEquals(List.of(4), builder.build(node, stats).getStats());
        assertFalse(builder.build(node, new PlanStatistics()).hasStats());
    }
    
    // ========================================
    // Depth guard
    // ========================================
    
    @Test
    public void testCyclicPlanReported() {
        config.setMaxDepth(64);
        PlanDescriptionBuilder guarded = new PlanDescriptionBuilder(config);
        
        PlanNode cyclic = new PlanNode() {
            @Override
            public PlanDescription describe() {
                return PlanDescription.builder("Loop").build();
            }
            
            @Override
            public PlanInputs inputs() {
                return PlanInputs.of(List.of(this));
            }
        };
        
        assertThrows(PlanEncodingException.class, () -> guarded.build(cyclic));
    }
    
    @Test
    public void testTreeAtMaxDepthAccepted() {
        config.setMaxDepth(3);
        PlanDescriptionBuilder guarded = new PlanDescriptionBuilder(config);
        FakePlanNode plan = new FakePlanNode("L1").input(new FakePlanNode("L2").input(new FakePlanNode("L3")));
        
        assertEquals("L3", guarded.build(plan).getInputs().get(0).getInputs().get(0).getOperatorType());
        assertThrows(PlanEncodingException.class, () -> guarded.build(new FakePlanNode("L0").input(plan)));
    }
}
