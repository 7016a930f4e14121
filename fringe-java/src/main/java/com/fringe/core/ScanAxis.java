package com.fringe.core;

/**
 * Direction of a raster scan over a map.
 */
public enum ScanAxis {
    /** Rows, left to right. */
    HORIZONTAL,
    /** Columns, top to bottom. */
    VERTICAL
}
