package com.fringe.exceptions;

/**
 * Base sealed class for all Fringe engine exceptions.
 * The hierarchy is closed: only invalid phase-shift input is reported as a checked failure,
 * every other stage is total over well-formed input.
 */
public sealed class FringeException extends Exception
    permits UnsupportedStepCountException, ShapeMismatchException {
    
    public FringeException(String message) {
        super(message);
    }
    
    public FringeException(String message, Throwable cause) {
        super(message, cause);
    }
}
