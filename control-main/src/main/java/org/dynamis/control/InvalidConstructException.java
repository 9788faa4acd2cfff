package org.dynamis.control;

/**
 * Raised when the expression of a node that is legal to hold but illegal to render
 * is requested, for example a standalone condition without a guard.
 */
public class InvalidConstructException extends ControlFlowException {

    private final String fieldName;

    public InvalidConstructException(String message, String fieldName) {
        super(message);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
