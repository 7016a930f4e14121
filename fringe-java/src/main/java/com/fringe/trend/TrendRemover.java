package com.fringe.trend;

import com.fringe.core.HeightMap;

/**
 * Estimates a low-order polynomial trend from the edge profiles of a map and subtracts it.
 * Implementations are pure: the input map is left untouched and an empty map is returned as is.
 */
public interface TrendRemover {
    
    /**
     * Returns a new map with the trend removed.
     */
    HeightMap remove(HeightMap map);
    
    /**
     * Degree of the fitted polynomial.
     */
    int degree();
    
    static TrendRemover linear() {
        return new LinearTrendRemover();
    }
    
    static TrendRemover polynomial() {
        return new PolynomialTrendRemover();
    }
}
