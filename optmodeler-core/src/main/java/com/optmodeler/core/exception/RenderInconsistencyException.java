package com.optmodeler.core.exception;

/**
 * Internal invariant violation found while rendering, such as an unmerged term in a sum.
 *
 * <p>Always a defect in the modeling layer, never caused by user input.
 */
public class RenderInconsistencyException extends ModelingException {

    public RenderInconsistencyException(String message) {
        super(message);
    }
}
