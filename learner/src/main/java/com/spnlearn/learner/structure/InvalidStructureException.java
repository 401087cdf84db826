package com.spnlearn.learner.structure;

/**
 * Raised when a built tree fails the validity check. This points to a defect
 * in tree construction, not to bad input.
 */
public class InvalidStructureException extends RuntimeException {
    public InvalidStructureException(String message) {
        super(message);
    }
}
