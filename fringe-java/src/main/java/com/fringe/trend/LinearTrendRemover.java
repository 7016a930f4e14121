package com.fringe.trend;

import com.fringe.core.HeightMap;

import java.util.Objects;

/**
 * Removes tilt. A line fitted to the first row is subtracted from every row; a line is then fitted
 * to the first column of that result and subtracted from every column.
 */
public class LinearTrendRemover implements TrendRemover {
    
    @Override
    public HeightMap remove(HeightMap map) {
        Objects.requireNonNull(map, "map cannot be null");
        var result = map.copy();
        if (map.isEmpty()) {
            return result;
        }
        
        var horizontal = PolynomialFit.trend(result.row(0), 1);
        for (int y = 0; y < result.height(); y++) {
            for (int x = 0; x < result.width(); x++) {
                result.set(x, y, result.get(x, y) - horizontal[x]);
            }
        }
        
        var vertical = PolynomialFit.trend(result.column(0), 1);
        for (int y = 0; y < result.height(); y++) {
            for (int x = 0; x < result.width(); x++) {
                result.set(x, y, result.get(x, y) - vertical[y]);
            }
        }
        return result;
    }
    
    @Override
    public int degree() {
        return 1;
    }
}
