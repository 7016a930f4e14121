package com.fringe.trend;

import com.fringe.core.HeightMap;

import java.util.Objects;

/**
 * Removes curvature. Second-degree curves are fitted independently to the first row and the first
 * column of the input; the row trend is subtracted from every row and the column trend from every
 * column. Both curves carry the corner height, so their mean constant term is added back once
 * unless one of the fits was degenerate.
 */
public class PolynomialTrendRemover implements TrendRemover {
    
    @Override
    public HeightMap remove(HeightMap map) {
        Objects.requireNonNull(map, "map cannot be null");
        var result = map.copy();
        if (map.isEmpty()) {
            return result;
        }
        
        var rowFit = PolynomialFit.fit(map.row(0), 2);
        var columnFit = PolynomialFit.fit(map.column(0), 2);
        var horizontal = PolynomialFit.evaluate(rowFit, map.width());
        var vertical = PolynomialFit.evaluate(columnFit, map.height());
        double corner = PolynomialFit.isZero(rowFit) || PolynomialFit.isZero(columnFit)
            ? 0.0
            : 0.5 * (rowFit[0] + columnFit[0]);
        
        for (int y = 0; y < result.height(); y++) {
            for (int x = 0; x < result.width(); x++) {
                result.set(x, y, map.get(x, y) - horizontal[x] - vertical[y] + corner);
            }
        }
        return result;
    }
    
    @Override
    public int degree() {
        return 2;
    }
}
