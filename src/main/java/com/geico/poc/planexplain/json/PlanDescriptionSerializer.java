package com.geico.poc.planexplain.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.geico.poc.planexplain.model.ExtensionFields;
import com.geico.poc.planexplain.model.PlanDescription;
import com.geico.poc.planexplain.stats.RowStatistics;
import com.geico.poc.planexplain.topo.Destination;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes a plan description as a flat JSON object with a fixed field order.
 * <p>
 * Order: InputName, OperatorType, Variant, Keyspace, TargetDestination,
 * TargetTabletType, NoOfCalls/AvgNumberOfRows/MedianNumberOfRows, the extension
 * fields in key order, then Inputs. Every field except OperatorType is omitted
 * when unset; extension fields are omitted when they hold their kind's default.
 */
public class PlanDescriptionSerializer extends StdSerializer<PlanDescription> {
    
    /**
     * Length of {@link Destination#NAME_PREFIX}, stripped from destinations in output
     */
    public static final int DESTINATION_PREFIX_LENGTH = 11;
    
    private final int maxDepth;
    
    public PlanDescriptionSerializer(int maxDepth) {
        super(PlanDescription.class);
        this.maxDepth = maxDepth;
    }
    
    @Override
    public void serialize(PlanDescription description, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        write(description, gen, provider, 1);
    }
    
    private void write(PlanDescription description, JsonGenerator gen, SerializerProvider provider, int depth)
            throws IOException {
        if (depth > maxDepth) {
            throw JsonMappingException.from(gen, "plan description deeper than " + maxDepth + " levels");
        }
        gen.writeStartObject();
        
        if (notEmpty(description.getInputName())) {
            gen.writeStringField("InputName", description.getInputName());
        }
        gen.writeStringField("OperatorType", description.getOperatorType());
        if (notEmpty(description.getVariant())) {
            gen.writeStringField("Variant", description.getVariant());
        }
        if (description.getKeyspace() != null) {
            provider.defaultSerializeField("Keyspace", description.getKeyspace(), gen);
        }
        if (description.getTargetDestination() != null) {
            gen.writeStringField("TargetDestination", destinationName(gen, description.getTargetDestination()));
        }
        if (!description.getTargetTabletType().isUnknown()) {
            gen.writeStringField("TargetTabletType", description.getTargetTabletType().name());
        }
        if (description.hasStats()) {
            List<Integer> stats = description.getStats();
            gen.writeNumberField("NoOfCalls", RowStatistics.count(stats));
            writeRowCount(gen, "AvgNumberOfRows", RowStatistics.mean(stats));
            writeRowCount(gen, "MedianNumberOfRows", RowStatistics.median(stats));
        }
        for (Map.Entry<String, Object> field : description.getOther().asMap().entrySet()) {
            if (ExtensionFields.isDefaultValue(field.getValue())) {
                continue;
            }
            provider.defaultSerializeField(field.getKey(), field.getValue(), gen);
        }
        if (!description.getInputs().isEmpty()) {
            gen.writeArrayFieldStart("Inputs");
            for (PlanDescription input : description.getInputs()) {
                write(input, gen, provider, depth + 1);
            }
            gen.writeEndArray();
        }
        
        gen.writeEndObject();
    }
    
    /**
     * Canonical destination name without the shared {@code Destination} prefix,
     * e.g. {@code Shard(-80)} for {@code DestinationShard(-80)}
     */
    static String destinationName(JsonGenerator gen, Destination destination) throws JsonMappingException {
        String name = destination.toString();
        if (name == null || name.length() < DESTINATION_PREFIX_LENGTH) {
            throw JsonMappingException.from(gen, "destination has no canonical name: " + name);
        }
        return name.substring(DESTINATION_PREFIX_LENGTH);
    }
    
    // Whole numbers are written without a fraction, e.g. 1 rather than 1.0
    private static void writeRowCount(JsonGenerator gen, String field, double value) throws IOException {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            gen.writeNumberField(field, (long) value);
        } else {
            gen.writeNumberField(field, value);
        }
    }
    
    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
