package com.geico.poc.planexplain.calcite;

import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.externalize.RelWriterImpl;
import org.apache.calcite.sql.SqlExplainLevel;
import org.apache.calcite.util.Pair;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the explain terms of a single {@link RelNode} without descending
 * into its inputs.
 */
class RelTermCollector extends RelWriterImpl {
    
    private final List<Pair<String, Object>> terms = new ArrayList<>();
    
    private RelTermCollector() {
        super(new PrintWriter(new StringWriter()), SqlExplainLevel.EXPPLAN_ATTRIBUTES, false);
    }
    
    static List<Pair<String, Object>> termsOf(RelNode rel) {
        RelTermCollector collector = new RelTermCollector();
        rel.explain(collector);
        return collector.terms;
    }
    
    @Override
    protected void explain_(RelNode rel, List<Pair<String, Object>> values) {
        terms.addAll(values);
    }
}
