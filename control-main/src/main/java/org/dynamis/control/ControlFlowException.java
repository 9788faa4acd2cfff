package org.dynamis.control;

public class ControlFlowException extends RuntimeException {

    public ControlFlowException(String message) {
        super(message);
    }
}
