package com.fringe.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense grid of phase or height values, stored row-major as {@code values[y * width + x]}.
 * <p>
 * A map is produced fresh for every measurement and is never shared between concurrent
 * computations. Processing stages read a map and return a new one; they do not alias their input.
 */
public final class HeightMap {
    
    private final int width;
    private final int height;
    private final double[] values;
    
    /**
     * Creates a zero-filled map.
     */
    public HeightMap(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("map dimensions must be non-negative");
        }
        this.width = width;
        this.height = height;
        this.values = new double[width * height];
    }
    
    private HeightMap(int width, int height, double[] values) {
        this.width = width;
        this.height = height;
        this.values = values;
    }
    
    /**
     * Creates a map from a row-major value array, copying it.
     */
    public static HeightMap of(int width, int height, double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("map dimensions must be non-negative");
        }
        if (values.length != width * height) {
            throw new IllegalArgumentException(
                String.format("values length (%d) must match %dx%d", values.length, width, height));
        }
        return new HeightMap(width, height, values.clone());
    }
    
    /**
     * Creates a map from rows, {@code rows[y][x]}.
     */
    public static HeightMap fromArray(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        int height = rows.length;
        int width = height == 0 ? 0 : rows[0].length;
        var map = new HeightMap(width, height);
        for (int y = 0; y < height; y++) {
            if (rows[y].length != width) {
                throw new IllegalArgumentException(
                    String.format("row %d has %d values, expected %d", y, rows[y].length, width));
            }
            System.arraycopy(rows[y], 0, map.values, y * width, width);
        }
        return map;
    }
    
    public int width() {
        return width;
    }
    
    public int height() {
        return height;
    }
    
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
    
    public double get(int x, int y) {
        return values[y * width + x];
    }
    
    public void set(int x, int y, double value) {
        values[y * width + x] = value;
    }
    
    public boolean sameShape(HeightMap other) {
        return width == other.width && height == other.height;
    }
    
    public HeightMap copy() {
        return new HeightMap(width, height, values.clone());
    }
    
    /**
     * Returns a copy of row {@code y}.
     */
    public double[] row(int y) {
        return Arrays.copyOfRange(values, y * width, (y + 1) * width);
    }
    
    /**
     * Returns a copy of column {@code x}.
     */
    public double[] column(int x) {
        var column = new double[height];
        for (int y = 0; y < height; y++) {
            column[y] = values[y * width + x];
        }
        return column;
    }
    
    /**
     * Copies the pixels of {@code region} into a new map of the region's size.
     */
    public HeightMap subMap(TileRegion region) {
        checkRegion(region);
        var tile = new HeightMap(region.width(), region.height());
        for (int y = 0; y < region.height(); y++) {
            System.arraycopy(values, (region.y() + y) * width + region.x(),
                             tile.values, y * region.width(), region.width());
        }
        return tile;
    }
    
    /**
     * Writes {@code tile} into this map at the origin of {@code region}.
     */
    public void paste(TileRegion region, HeightMap tile) {
        checkRegion(region);
        if (tile.width != region.width() || tile.height != region.height()) {
            throw new IllegalArgumentException(
                String.format("tile %dx%d does not fit region %dx%d",
                             tile.width, tile.height, region.width(), region.height()));
        }
        for (int y = 0; y < region.height(); y++) {
            System.arraycopy(tile.values, y * region.width(),
                             values, (region.y() + y) * width + region.x(), region.width());
        }
    }
    
    private void checkRegion(TileRegion region) {
        Objects.requireNonNull(region, "region cannot be null");
        if (region.endX() > width || region.endY() > height) {
            throw new IndexOutOfBoundsException(
                String.format("region %s exceeds map %dx%d", region, width, height));
        }
    }
    
    /**
     * Largest absolute difference between horizontally or vertically adjacent pixels.
     */
    public double maxAdjacentDifference() {
        double max = 0.0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double v = values[y * width + x];
                if (x + 1 < width) {
                    max = Math.max(max, Math.abs(values[y * width + x + 1] - v));
                }
                if (y + 1 < height) {
                    max = Math.max(max, Math.abs(values[(y + 1) * width + x] - v));
                }
            }
        }
        return max;
    }
    
    /**
     * Returns the map as rows, {@code result[y][x]}.
     */
    public double[][] toArray() {
        var rows = new double[height][];
        for (int y = 0; y < height; y++) {
            rows[y] = row(y);
        }
        return rows;
    }
    
    /**
     * Returns a copy of the row-major backing values.
     */
    public double[] values() {
        return values.clone();
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HeightMap other)) return false;
        return width == other.width && height == other.height && Arrays.equals(values, other.values);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(width, height, Arrays.hashCode(values));
    }
    
    @Override
    public String toString() {
        return String.format("HeightMap[%dx%d]", width, height);
    }
}
