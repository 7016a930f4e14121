package com.fringe.core;

/**
 * Parameters controlling height scaling, threshold unwrapping and tile partitioning.
 * <p>
 * {@code wavelength} is the wavelength-equivalent scale used both to convert radians to height
 * and as the size of the wrap discontinuity in height units: a jump is any adjacent difference larger
 * than {@link #jumpLimit()}, and each detected jump is corrected by {@link #correctionStep()}.
 *
 * @param wavelength  wavelength-equivalent scale, positive
 * @param threshold   jump threshold as a fraction of half a wavelength, in (0, 1]
 * @param horizontal  whether row scans are performed
 * @param vertical    whether column scans are performed
 * @param tileSize    edge length of a tile in pixels
 * @param iterations  number of full horizontal and vertical scan repetitions
 */
public record UnwrapParameters(
    double wavelength,
    double threshold,
    boolean horizontal,
    boolean vertical,
    int tileSize,
    int iterations
) {
    
    /** Default wavelength in angstroms (750 nm), the phase processor's instrument value. */
    public static final double DEFAULT_WAVELENGTH = 7500.0;
    public static final double DEFAULT_THRESHOLD = 0.8;
    /** Default tile edge in pixels, the phase processor's value rather than the capture delimiter of 10. */
    public static final int DEFAULT_TILE_SIZE = 32;
    public static final int DEFAULT_ITERATIONS = 1;
    
    public UnwrapParameters {
        if (!(wavelength > 0) || Double.isInfinite(wavelength)) {
            throw new IllegalArgumentException("wavelength must be positive and finite");
        }
        
        if (!(threshold > 0) || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1]");
        }
        
        if (tileSize < 1) {
            throw new IllegalArgumentException("tile size must be positive");
        }
        
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be at least 1");
        }
    }
    
    /**
     * Parameters matching the instrument defaults.
     */
    public static UnwrapParameters defaults() {
        return builder().build();
    }
    
    /**
     * Smallest adjacent difference treated as a wrap artifact.
     */
    public double jumpLimit() {
        return 0.5 * wavelength * threshold;
    }
    
    /**
     * Offset applied for every detected jump.
     */
    public double correctionStep() {
        return 0.5 * wavelength;
    }
    
    public UnwrapParameters withWavelength(double newWavelength) {
        return new UnwrapParameters(newWavelength, threshold, horizontal, vertical, tileSize, iterations);
    }
    
    public UnwrapParameters withThreshold(double newThreshold) {
        return new UnwrapParameters(wavelength, newThreshold, horizontal, vertical, tileSize, iterations);
    }
    
    public UnwrapParameters withAxes(boolean newHorizontal, boolean newVertical) {
        return new UnwrapParameters(wavelength, threshold, newHorizontal, newVertical, tileSize, iterations);
    }
    
    public UnwrapParameters withTileSize(int newTileSize) {
        return new UnwrapParameters(wavelength, threshold, horizontal, vertical, newTileSize, iterations);
    }
    
    public UnwrapParameters withIterations(int newIterations) {
        return new UnwrapParameters(wavelength, threshold, horizontal, vertical, tileSize, newIterations);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Builder for unwrap parameters, initialised with the instrument defaults.
     */
    public static class Builder {
        private double wavelength = DEFAULT_WAVELENGTH;
        private double threshold = DEFAULT_THRESHOLD;
        private boolean horizontal = true;
        private boolean vertical = true;
        private int tileSize = DEFAULT_TILE_SIZE;
        private int iterations = DEFAULT_ITERATIONS;
        
        public Builder wavelength(double wavelength) {
            this.wavelength = wavelength;
            return this;
        }
        
        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }
        
        public Builder horizontal(boolean horizontal) {
            this.horizontal = horizontal;
            return this;
        }
        
        public Builder vertical(boolean vertical) {
            this.vertical = vertical;
            return this;
        }
        
        public Builder tileSize(int tileSize) {
            this.tileSize = tileSize;
            return this;
        }
        
        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }
        
        public UnwrapParameters build() {
            return new UnwrapParameters(wavelength, threshold, horizontal, vertical, tileSize, iterations);
        }
    }
}
