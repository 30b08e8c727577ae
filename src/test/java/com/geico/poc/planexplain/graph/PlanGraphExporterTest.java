package com.geico.poc.planexplain.graph;

import com.geico.poc.planexplain.config.PlanExplainConfig;
import com.geico.poc.planexplain.explain.PlanEncodingException;
import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.util.OrderedMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PlanGraphExporterTest {
    
    private PlanExplainConfig config;
    private PlanGraphExporter exporter;
    
    @BeforeEach
    public void setUp() {
        config = new PlanExplainConfig();
        exporter = new PlanGraphExporter(config);
    }
    
    @Test
    public void testLabels() {
        PlanGraph graph = exporter.export(PlanDescription.builder("Route").variant("Scatter").build());
        assertEquals("Route:Scatter", graph.getNodes().get(0).getLabel());
        
        graph = exporter.export(PlanDescription.builder("Limit").build());
        assertEquals("Limit", graph.getNodes().get(0).getLabel());
    }
    
    @Test
    public void testQueryBecomesTooltipAndFieldQueryIsHidden() {
        PlanDescription description = PlanDescription.builder("Route")
            .field("Query", "SELECT 1")
            .field("FieldQuery", "SELECT 1 FROM dual WHERE 1 != 1")
            .field("Table", "user")
            .build();
        
        GraphNode node = exporter.export(description).getNodes().get(0);
        
        assertEquals("SELECT 1", node.getTooltip());
        assertEquals(List.of("Table:user"), node.getAttributes());
        for (String attribute : node.getAttributes()) {
            assertFalse(attribute.contains("SELECT"), attribute);
        }
    }
    
    @Test
    public void testStringListExpandedAndAttributesSorted() {
        PlanDescription description = PlanDescription.builder("Projection")
            .field("Zeta", 5)
            .field("Expressions", List.of("a + 1 as x", "b as y"))
            .field("JoinVars", OrderedMap.of(Map.of("b", 2, "a", 1)))
            .build();
        
        GraphNode node = exporter.export(description).getNodes().get(0);
        
        assertEquals(List.of("Expressions", "a + 1 as x", "b as y", "JoinVars:a:1 b:2", "Zeta:5"),
            node.getAttributes());
        assertNull(node.getTooltip());
    }
    
    @Test
    public void testChildrenBuiltBeforeParent() {
        PlanDescription description = PlanDescription.builder("Join")
            .inputs(List.of(
                PlanDescription.builder("Left").build(),
                PlanDescription.builder("Right").build()))
            .build();
        
        PlanGraph graph = exporter.export(description);
        
        assertEquals(3, graph.getNodes().size());
        assertEquals("Left", graph.getNodes().get(0).getLabel());
        assertEquals("Right", graph.getNodes().get(1).getLabel());
        assertEquals("Join", graph.getNodes().get(2).getLabel());
        
        assertEquals(2, graph.getEdges().size());
        assertSame(graph.getNodes().get(2), graph.getEdges().get(0).getFrom());
        assertSame(graph.getNodes().get(0), graph.getEdges().get(0).getTo());
        assertSame(graph.getNodes().get(1), graph.getEdges().get(1).getTo());
    }
    
    @Test
    public void testDepthLimit() {
        config.setMaxDepth(1);
        PlanGraphExporter shallow = new PlanGraphExporter(config);
        PlanDescription description = PlanDescription.builder("Limit")
            .inputs(List.of(PlanDescription.builder("Route").build()))
            .build();
        
        assertThrows(PlanEncodingException.class, () -> shallow.export(description));
    }
    
    @Test
    public void testGraphName() {
        config.getGraph().setName("profile");
        PlanGraph graph = new PlanGraphExporter(config).export(PlanDescription.builder("Route").build());
        assertEquals("profile", graph.getName());
        assertTrue(graph.toDot().startsWith("digraph \"profile\" {"));
    }
}
