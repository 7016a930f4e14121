package com.fringe.unwrapping;

import com.fringe.core.HeightMap;
import com.fringe.core.TileMask;

import java.util.Objects;

/**
 * Output of tile partitioning: the assembled map and the mask of tiles that kept a jump.
 */
public record TileUnwrapResult(HeightMap map, TileMask mask) {
    
    public TileUnwrapResult {
        Objects.requireNonNull(map, "map cannot be null");
        Objects.requireNonNull(mask, "mask cannot be null");
    }
}
