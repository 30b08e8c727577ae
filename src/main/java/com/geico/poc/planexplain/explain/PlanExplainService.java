package com.geico.poc.planexplain.explain;

import com.geico.poc.planexplain.dto.ExplainResult;
import com.geico.poc.planexplain.graph.PlanGraph;
import com.geico.poc.planexplain.graph.PlanGraphExporter;
import com.geico.poc.planexplain.json.PlanJson;
import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.plan.PlanNode;
import com.geico.poc.planexplain.stats.PlanStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces EXPLAIN / profile JSON and plan graphs for executable plans.
 */
@Service
public class PlanExplainService {
    
    private static final Logger log = LoggerFactory.getLogger(PlanExplainService.class);
    
    private final PlanDescriptionBuilder descriptionBuilder;
    private final PlanJson planJson;
    private final PlanGraphExporter graphExporter;
    
    public PlanExplainService(PlanDescriptionBuilder descriptionBuilder, PlanJson planJson,
                              PlanGraphExporter graphExporter) {
        this.descriptionBuilder = descriptionBuilder;
        this.planJson = planJson;
        this.graphExporter = graphExporter;
    }
    
    /**
     * Explain JSON for a plan. With {@code stats}, every node that has samples also
     * reports NoOfCalls, AvgNumberOfRows and MedianNumberOfRows.
     */
    public String explain(PlanNode plan, PlanStatistics stats) {
        try {
            PlanDescription description = descriptionBuilder.build(plan, stats);
            String json = planJson.toJson(description);
            log.info("EXPLAIN{} {} ({} bytes)", stats != null ? " profile" : "", description.getLabel(), json.length());
            return json;
        } catch (PlanEncodingException e) {
            log.error("Failed to explain plan {}", plan, e);
            throw e;
        }
    }
    
    /**
     * Graph of a plan, without runtime statistics
     */
    public PlanGraph graph(PlanNode plan) {
        try {
            PlanDescription description = descriptionBuilder.build(plan);
            PlanGraph graph = graphExporter.export(description);
            log.info("Graph for {}: {} nodes", description.getLabel(), graph.getNodes().size());
            return graph;
        } catch (PlanEncodingException e) {
            log.error("Failed to graph plan {}", plan, e);
            throw e;
        }
    }
    
    /**
     * Description, JSON and DOT graph of a plan from a single walk of the plan tree
     */
    public ExplainResult describe(PlanNode plan, PlanStatistics stats) {
        try {
            PlanDescription description = descriptionBuilder.build(plan, stats);
            String json = planJson.toJson(description);
            String dot = graphExporter.export(description).toDot();
            return new ExplainResult(description, json, dot);
        } catch (PlanEncodingException e) {
            log.error("Failed to describe plan {}", plan, e);
            throw e;
        }
    }
}
