package com.geico.poc.planexplain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Operator-specific fields of a plan description, kept sorted by key.
 * <p>
 * Values are strings, numbers, booleans, lists or any other value Jackson can
 * encode. A value equal to its kind's default (see {@link #isDefaultValue(Object)})
 * is kept here but omitted from explain output.
 */
public class ExtensionFields {
    
    private final TreeMap<String, Object> fields;
    private final boolean readOnly;
    
    public ExtensionFields() {
        this(new TreeMap<>(), false);
    }
    
    private ExtensionFields(TreeMap<String, Object> fields, boolean readOnly) {
        this.fields = fields;
        this.readOnly = readOnly;
    }
    
    public static ExtensionFields empty() {
        return new ExtensionFields();
    }
    
    /**
     * Unmodifiable copy of the given fields
     */
    public static ExtensionFields copyOf(ExtensionFields source) {
        return new ExtensionFields(new TreeMap<>(source.fields), true);
    }
    
    public static ExtensionFields copyOf(Map<String, ?> source) {
        ExtensionFields result = new ExtensionFields();
        source.forEach(result::put);
        return copyOf(result);
    }
    
    /**
     * Set a field, replacing any value already stored under the key.
     * List values are copied; later changes to the caller's list are not seen.
     */
    public ExtensionFields put(String key, Object value) {
        checkWritable();
        if (value instanceof List) {
            value = Collections.unmodifiableList(new ArrayList<>((List<?>) value));
        }
        fields.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }
    
    /**
     * Merge every field of {@code other} into this one. Same-named keys are overwritten.
     */
    public ExtensionFields putAll(ExtensionFields other) {
        checkWritable();
        fields.putAll(other.fields);
        return this;
    }
    
    public Object get(String key) {
        return fields.get(key);
    }
    
    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }
    
    public Set<String> keys() {
        return Collections.unmodifiableSet(fields.keySet());
    }
    
    /**
     * Fields in ascending key order
     */
    public SortedMap<String, Object> asMap() {
        return Collections.unmodifiableSortedMap(fields);
    }
    
    public int size() {
        return fields.size();
    }
    
    public boolean isEmpty() {
        return fields.isEmpty();
    }
    
    /**
     * True for null, the empty string, numeric zero and {@code false}.
     * Empty lists and negative numbers are not defaults.
     */
    public static boolean isDefaultValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() == 0;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() == 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0.0;
        }
        return false;
    }
    
    /**
     * True if the value is a list whose elements are all strings
     */
    public static boolean isStringList(Object value) {
        if (!(value instanceof List)) {
            return false;
        }
        for (Object element : (List<?>) value) {
            if (!(element instanceof CharSequence)) {
                return false;
            }
        }
        return true;
    }
    
    private void checkWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("extension fields are read-only");
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtensionFields)) return false;
        return fields.equals(((ExtensionFields) o).fields);
    }
    
    @Override
    public int hashCode() {
        return fields.hashCode();
    }
    
    @Override
    public String toString() {
        return fields.toString();
    }
}
