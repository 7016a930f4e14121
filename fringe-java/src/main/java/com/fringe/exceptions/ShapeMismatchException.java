package com.fringe.exceptions;

/**
 * Exception thrown when the frames of one phase-shifted series do not share the same
 * dimensions, or when the number of frames disagrees with the requested step count.
 */
public final class ShapeMismatchException extends FringeException {
    
    public ShapeMismatchException(String message) {
        super(message);
    }
}
