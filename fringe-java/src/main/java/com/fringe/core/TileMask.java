package com.fringe.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-tile flags marking tiles that still contain an uncorrected jump after local unwrapping.
 * <p>
 * Tiles are addressed {@code [tileColumn, tileRow]}; pixel ({@code x}, {@code y}) belongs to tile
 * ({@code x / tileSize}, {@code y / tileSize}). The grid is {@code ceil(width / tileSize)} by
 * {@code ceil(height / tileSize)} even when the last tiles are clipped by the image extent.
 */
public final class TileMask {
    
    private final int tileSize;
    private final int tileColumns;
    private final int tileRows;
    private final boolean[] bad;
    
    public TileMask(int imageWidth, int imageHeight, int tileSize) {
        if (tileSize < 1) {
            throw new IllegalArgumentException("tile size must be positive");
        }
        if (imageWidth < 0 || imageHeight < 0) {
            throw new IllegalArgumentException("image dimensions must be non-negative");
        }
        this.tileSize = tileSize;
        this.tileColumns = tilesFor(imageWidth, tileSize);
        this.tileRows = tilesFor(imageHeight, tileSize);
        this.bad = new boolean[tileColumns * tileRows];
    }
    
    /**
     * Creates a mask in which every tile of the image is marked bad.
     */
    public static TileMask allBad(int imageWidth, int imageHeight, int tileSize) {
        var mask = new TileMask(imageWidth, imageHeight, tileSize);
        Arrays.fill(mask.bad, true);
        return mask;
    }
    
    /**
     * Number of tiles needed to cover {@code size} pixels.
     */
    public static int tilesFor(int size, int tileSize) {
        return size == 0 ? 0 : (size - 1) / tileSize + 1;
    }
    
    public int tileSize() {
        return tileSize;
    }
    
    public int tileColumns() {
        return tileColumns;
    }
    
    public int tileRows() {
        return tileRows;
    }
    
    public boolean isBad(int tileColumn, int tileRow) {
        checkTile(tileColumn, tileRow);
        return bad[tileRow * tileColumns + tileColumn];
    }
    
    public void setBad(int tileColumn, int tileRow, boolean value) {
        checkTile(tileColumn, tileRow);
        bad[tileRow * tileColumns + tileColumn] = value;
    }
    
    /**
     * Whether the tile enclosing pixel ({@code x}, {@code y}) is marked bad.
     */
    public boolean isBadAtPixel(int x, int y) {
        return bad[(y / tileSize) * tileColumns + x / tileSize];
    }
    
    public int badTileCount() {
        int count = 0;
        for (boolean b : bad) {
            if (b) count++;
        }
        return count;
    }
    
    public int tileCount() {
        return bad.length;
    }
    
    private void checkTile(int tileColumn, int tileRow) {
        if (tileColumn < 0 || tileColumn >= tileColumns || tileRow < 0 || tileRow >= tileRows) {
            throw new IndexOutOfBoundsException(
                String.format("tile (%d, %d) out of bounds [0, %d) x [0, %d)",
                             tileColumn, tileRow, tileColumns, tileRows));
        }
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TileMask other)) return false;
        return tileSize == other.tileSize && tileColumns == other.tileColumns
            && tileRows == other.tileRows && Arrays.equals(bad, other.bad);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(tileSize, tileColumns, tileRows, Arrays.hashCode(bad));
    }
    
    @Override
    public String toString() {
        return String.format("TileMask[%dx%d tiles of %d, %d bad]", tileColumns, tileRows, tileSize, badTileCount());
    }
}
