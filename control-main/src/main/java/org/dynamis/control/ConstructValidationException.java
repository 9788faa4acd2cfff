package org.dynamis.control;

/**
 * Raised when a builder is finalized with a missing or invalid field.
 * No value is created.
 */
public class ConstructValidationException extends ControlFlowException {

    private final String typeName;
    private final String fieldName;

    public ConstructValidationException(String message, String typeName, String fieldName) {
        super(message);
        this.typeName = typeName;
        this.fieldName = fieldName;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
