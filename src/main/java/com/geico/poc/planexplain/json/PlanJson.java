package com.geico.poc.planexplain.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.geico.poc.planexplain.config.PlanExplainConfig;
import com.geico.poc.planexplain.explain.PlanEncodingException;
import com.geico.poc.planexplain.model.PlanDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Encodes plan descriptions as explain/profile JSON.
 * <p>
 * Output is all-or-nothing: on any encoding failure a {@link PlanEncodingException}
 * is thrown and no partial document is returned.
 */
@Component
public class PlanJson {
    
    private static final Logger log = LoggerFactory.getLogger(PlanJson.class);
    
    private final ObjectMapper objectMapper;
    
    public PlanJson(PlanExplainConfig config) {
        SimpleModule module = new SimpleModule("plan-description");
        module.addSerializer(PlanDescription.class, new PlanDescriptionSerializer(config.getMaxDepth()));
        
        this.objectMapper = new ObjectMapper();
        objectMapper.registerModule(module);
        if (config.getJson().isPrettyPrint()) {
            objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        if (config.getJson().isEscapeHtml()) {
            objectMapper.getFactory().setCharacterEscapes(new HtmlCharacterEscapes());
        }
    }
    
    /**
     * Serialize a description tree to JSON
     */
    public String toJson(PlanDescription description) {
        try {
            return objectMapper.writeValueAsString(description);
        } catch (JsonProcessingException e) {
            log.debug("Failed to encode plan description {}: {}", description, e.getMessage());
            throw new PlanEncodingException("encoding failed: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Escapes {@code <}, {@code >} and {@code &} so output can be embedded in HTML
     */
    static class HtmlCharacterEscapes extends CharacterEscapes {
        
        private final int[] asciiEscapes;
        
        HtmlCharacterEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            asciiEscapes['<'] = CharacterEscapes.ESCAPE_STANDARD;
            asciiEscapes['>'] = CharacterEscapes.ESCAPE_STANDARD;
            asciiEscapes['&'] = CharacterEscapes.ESCAPE_STANDARD;
        }
        
        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }
        
        @Override
        public SerializableString getEscapeSequence(int ch) {
            return null;
        }
    }
}
