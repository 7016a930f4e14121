package com.fringe.exceptions;

/**
 * Exception thrown when a phase calculation is requested for a step count
 * that has no phase-shifting formula.
 */
public final class UnsupportedStepCountException extends FringeException {
    
    private final int stepCount;
    
    public UnsupportedStepCountException(int stepCount) {
        super(String.format("unsupported phase step count %d, expected 3, 4 or 5", stepCount));
        this.stepCount = stepCount;
    }
    
    /**
     * Returns the rejected step count.
     */
    public int getStepCount() {
        return stepCount;
    }
}
