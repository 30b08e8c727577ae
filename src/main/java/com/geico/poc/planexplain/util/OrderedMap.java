package com.geico.poc.planexplain.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializable;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Key-sorted view of a string to integer map, for output that must not depend
 * on hash ordering.
 * <p>
 * Renders as a JSON object in key order, both standalone ({@link #toJson()}) and
 * when embedded in another Jackson-encoded value, and as space separated
 * {@code key:value} pairs from {@link #toString()}.
 */
public class OrderedMap extends JsonSerializable.Base {
    
    private static final ObjectMapper objectMapper = new ObjectMapper();
    
    private final List<Entry> entries;
    
    private OrderedMap(List<Entry> entries) {
        this.entries = entries;
    }
    
    public static OrderedMap of(Map<String, Integer> in) {
        List<Entry> entries = new ArrayList<>(in.size());
        in.forEach((key, value) -> entries.add(new Entry(key, value)));
        entries.sort(Comparator.comparing(Entry::getKey));
        return new OrderedMap(entries);
    }
    
    /**
     * Number of entries
     */
    public int size() {
        return entries.size();
    }
    
    /**
     * Whether the key at {@code i} sorts before the key at {@code j}
     */
    public boolean less(int i, int j) {
        return entries.get(i).getKey().compareTo(entries.get(j).getKey()) < 0;
    }
    
    public void swap(int i, int j) {
        Collections.swap(entries, i, j);
    }
    
    public Entry get(int index) {
        return entries.get(index);
    }
    
    /**
     * JSON object with the entries in key order
     */
    public String toJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(this);
    }
    
    @Override
    public void serialize(JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        for (Entry entry : entries) {
            gen.writeFieldName(entry.getKey());
            if (entry.getValue() == null) {
                gen.writeNull();
            } else {
                gen.writeNumber(entry.getValue());
            }
        }
        gen.writeEndObject();
    }
    
    @Override
    public void serializeWithType(JsonGenerator gen, SerializerProvider provider, TypeSerializer typeSer)
            throws IOException {
        serialize(gen, provider);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderedMap)) return false;
        return entries.equals(((OrderedMap) o).entries);
    }
    
    @Override
    public int hashCode() {
        return entries.hashCode();
    }
    
    @Override
    public String toString() {
        return entries.stream()
            .map(entry -> entry.getKey() + ":" + entry.getValue())
            .collect(Collectors.joining(" "));
    }
    
    public static final class Entry {
        private final String key;
        private final Integer value;
        
        Entry(String key, Integer value) {
            this.key = Objects.requireNonNull(key, "key");
            this.value = value;
        }
        
        public String getKey() {
            return key;
        }
        
        public Integer getValue() {
            return value;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry other = (Entry) o;
            return key.equals(other.key) && Objects.equals(value, other.value);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(key, value);
        }
    }
}
