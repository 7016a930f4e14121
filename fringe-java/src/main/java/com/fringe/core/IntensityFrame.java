package com.fringe.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * One captured phase step: a dense grid of intensity samples promoted to double precision.
 * Samples are stored row-major, {@code samples[y * width + x]}.
 */
public record IntensityFrame(int width, int height, double[] samples) {
    
    public IntensityFrame {
        Objects.requireNonNull(samples, "samples cannot be null");
        
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("frame dimensions must be non-negative");
        }
        
        if (samples.length != width * height) {
            throw new IllegalArgumentException(
                String.format("samples length (%d) must match %dx%d", samples.length, width, height));
        }
        
        samples = samples.clone();
    }
    
    /**
     * Creates a frame from rows of double samples; {@code rows[y][x]}.
     */
    public static IntensityFrame of(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        int height = rows.length;
        int width = height == 0 ? 0 : rows[0].length;
        var samples = new double[width * height];
        for (int y = 0; y < height; y++) {
            checkRowLength(rows[y].length, width, y);
            System.arraycopy(rows[y], 0, samples, y * width, width);
        }
        return new IntensityFrame(width, height, samples);
    }
    
    /**
     * Creates a frame from rows of integer camera samples (8 or 16 bit grey levels).
     */
    public static IntensityFrame of(int[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        int height = rows.length;
        int width = height == 0 ? 0 : rows[0].length;
        var samples = new double[width * height];
        for (int y = 0; y < height; y++) {
            checkRowLength(rows[y].length, width, y);
            for (int x = 0; x < width; x++) {
                samples[y * width + x] = rows[y][x];
            }
        }
        return new IntensityFrame(width, height, samples);
    }
    
    /**
     * Creates a frame from rows of single precision samples.
     */
    public static IntensityFrame of(float[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        int height = rows.length;
        int width = height == 0 ? 0 : rows[0].length;
        var samples = new double[width * height];
        for (int y = 0; y < height; y++) {
            checkRowLength(rows[y].length, width, y);
            for (int x = 0; x < width; x++) {
                samples[y * width + x] = rows[y][x];
            }
        }
        return new IntensityFrame(width, height, samples);
    }
    
    private static void checkRowLength(int length, int width, int row) {
        if (length != width) {
            throw new IllegalArgumentException(
                String.format("row %d has %d samples, expected %d", row, length, width));
        }
    }
    
    public double get(int x, int y) {
        return samples[y * width + x];
    }
    
    public boolean sameShape(IntensityFrame other) {
        return width == other.width && height == other.height;
    }
    
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntensityFrame other)) return false;
        return width == other.width && height == other.height
            && Arrays.equals(samples, other.samples);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(width, height, Arrays.hashCode(samples));
    }
    
    @Override
    public String toString() {
        return String.format("IntensityFrame[%dx%d]", width, height);
    }
}
