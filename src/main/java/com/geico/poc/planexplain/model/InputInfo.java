package com.geico.poc.planexplain.model;

/**
 * Metadata a parent plan node supplies about one of its inputs.
 * <p>
 * The input name (for example {@code Left} or {@code Outer}) becomes the child
 * description's input name; every field is merged into the child's extension
 * fields, overwriting what the child reported about itself.
 */
public class InputInfo {
    
    private final String inputName;
    private final ExtensionFields fields = new ExtensionFields();
    
    private InputInfo(String inputName) {
        this.inputName = inputName;
    }
    
    public static InputInfo named(String inputName) {
        return new InputInfo(inputName);
    }
    
    public static InputInfo unnamed() {
        return new InputInfo(null);
    }
    
    public InputInfo with(String key, Object value) {
        fields.put(key, value);
        return this;
    }
    
    /**
     * Role of the input, or null if the parent does not name it
     */
    public String getInputName() {
        return inputName;
    }
    
    public ExtensionFields getFields() {
        return ExtensionFields.copyOf(fields);
    }
    
    @Override
    public String toString() {
        return "InputInfo(name=" + inputName + ", fields=" + fields + ")";
    }
}
