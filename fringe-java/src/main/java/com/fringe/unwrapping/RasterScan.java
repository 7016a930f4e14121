package com.fringe.unwrapping;

import com.fringe.core.HeightMap;
import com.fringe.core.ScanAxis;

/**
 * One raster pass of the cumulative step corrector.
 * <p>
 * Each line starts with {@code lastValue = line[0]} and a zero offset. For every following sample
 * {@code v} on a trusted pixel, a difference {@code v - lastValue} above {@code limit} lowers the
 * offset by {@code step}, a difference below {@code -limit} raises it, and {@code lastValue} becomes
 * {@code v}. Untrusted pixels leave both untouched. Every pixel is written as {@code v + offset}.
 * The source map is read only; the result is a fresh map.
 */
final class RasterScan {
    
    /**
     * Decides whether a pixel may move the running offset.
     */
    @FunctionalInterface
    interface PixelFilter {
        boolean trusted(int x, int y);
        
        PixelFilter ALL = (x, y) -> true;
    }
    
    private RasterScan() {}
    
    static HeightMap scan(HeightMap source, ScanAxis axis, double limit, double step, PixelFilter filter) {
        var target = source.copy();
        if (source.isEmpty()) {
            return target;
        }
        
        if (axis == ScanAxis.HORIZONTAL) {
            for (int y = 0; y < source.height(); y++) {
                double lastValue = source.get(0, y);
                double offset = 0.0;
                for (int x = 1; x < source.width(); x++) {
                    double v = source.get(x, y);
                    if (filter.trusted(x, y)) {
                        offset += correction(v - lastValue, limit, step);
                        lastValue = v;
                    }
                    target.set(x, y, v + offset);
                }
            }
        } else {
            for (int x = 0; x < source.width(); x++) {
                double lastValue = source.get(x, 0);
                double offset = 0.0;
                for (int y = 1; y < source.height(); y++) {
                    double v = source.get(x, y);
                    if (filter.trusted(x, y)) {
                        offset += correction(v - lastValue, limit, step);
                        lastValue = v;
                    }
                    target.set(x, y, v + offset);
                }
            }
        }
        return target;
    }
    
    private static double correction(double difference, double limit, double step) {
        if (difference > limit) {
            return -step;
        }
        if (difference < -limit) {
            return step;
        }
        return 0.0;
    }
}
