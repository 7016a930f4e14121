package com.fringe.phase;

import com.fringe.core.HeightMap;

/**
 * Converts phase in radians to height: {@code height = phase * wavelength / (2 pi)}.
 */
public class HeightScaler {
    
    private final double wavelength;
    
    public HeightScaler(double wavelength) {
        if (!(wavelength > 0)) {
            throw new IllegalArgumentException("wavelength must be positive");
        }
        this.wavelength = wavelength;
    }
    
    public double wavelength() {
        return wavelength;
    }
    
    public double scaleFactor() {
        return wavelength / (2 * Math.PI);
    }
    
    public HeightMap scale(HeightMap phase) {
        double factor = scaleFactor();
        var height = phase.copy();
        for (int y = 0; y < height.height(); y++) {
            for (int x = 0; x < height.width(); x++) {
                height.set(x, y, phase.get(x, y) * factor);
            }
        }
        return height;
    }
}
