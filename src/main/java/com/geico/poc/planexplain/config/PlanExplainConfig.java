package com.geico.poc.planexplain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for plan description, explain JSON and graph output
 */
@Configuration
@ConfigurationProperties(prefix = "plan-explain")
public class PlanExplainConfig {
    
    public static final int DEFAULT_MAX_DEPTH = 512;
    
    /**
     * Deepest plan tree any recursive walk (builder, serializer, graph exporter)
     * will follow before failing. Guards against cyclic input.
     */
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private JsonConfig json = new JsonConfig();
    private GraphConfig graph = new GraphConfig();
    
    public int getMaxDepth() {
        return maxDepth;
    }
    
    public void setMaxDepth(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("plan-explain.max-depth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }
    
    public JsonConfig getJson() {
        return json;
    }
    
    public void setJson(JsonConfig json) {
        this.json = json;
    }
    
    public GraphConfig getGraph() {
        return graph;
    }
    
    public void setGraph(GraphConfig graph) {
        this.graph = graph;
    }
    
    /**
     * JSON explain output configuration
     */
    public static class JsonConfig {
        private boolean prettyPrint = false;
        private boolean escapeHtml = false;
        
        public boolean isPrettyPrint() {
            return prettyPrint;
        }
        
        public void setPrettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
        }
        
        public boolean isEscapeHtml() {
            return escapeHtml;
        }
        
        public void setEscapeHtml(boolean escapeHtml) {
            this.escapeHtml = escapeHtml;
        }
    }
    
    /**
     * Graph (DOT) output configuration
     */
    public static class GraphConfig {
        private String name = "plan";
        
        public String getName() {
            return name;
        }
        
        public void setName(String name) {
            this.name = name;
        }
    }
}
