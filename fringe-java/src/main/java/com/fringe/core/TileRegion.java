package com.fringe.core;

/**
 * Rectangular pixel region of a map, {@code [x, x + width) x [y, y + height)}.
 */
public record TileRegion(int x, int y, int width, int height) {
    
    public TileRegion {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("region origin must be non-negative");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("region size must be non-negative");
        }
    }
    
    /**
     * Returns the tile at grid position ({@code tileColumn}, {@code tileRow}) clipped to the
     * image extent.
     */
    public static TileRegion ofTile(int tileColumn, int tileRow, int tileSize, int imageWidth, int imageHeight) {
        int x = tileColumn * tileSize;
        int y = tileRow * tileSize;
        int endX = (int) Math.min((long) x + tileSize, imageWidth);
        int endY = (int) Math.min((long) y + tileSize, imageHeight);
        return new TileRegion(x, y, Math.max(0, endX - x), Math.max(0, endY - y));
    }
    
    public int endX() {
        return x + width;
    }
    
    public int endY() {
        return y + height;
    }
    
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}
