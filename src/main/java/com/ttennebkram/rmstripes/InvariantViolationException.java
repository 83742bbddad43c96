package com.ttennebkram.rmstripes;

/**
 * Internal postcondition failure. Indicates a logic defect, never bad input.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
