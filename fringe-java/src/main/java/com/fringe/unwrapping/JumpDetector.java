package com.fringe.unwrapping;

import com.fringe.core.HeightMap;
import com.fringe.core.TileRegion;
import com.fringe.core.UnwrapParameters;

import java.util.Objects;

/**
 * Classifies a region as containing an uncorrected jump: any horizontally or vertically adjacent
 * pair whose absolute difference exceeds the jump limit. Never modifies the map.
 */
public class JumpDetector {
    
    public boolean hasJump(HeightMap map, UnwrapParameters params) {
        return countJumps(map, new TileRegion(0, 0, map.width(), map.height()), params.jumpLimit()) > 0;
    }
    
    public boolean hasJump(HeightMap map, TileRegion region, UnwrapParameters params) {
        return countJumps(map, region, params.jumpLimit()) > 0;
    }
    
    /**
     * Counts every adjacent pair inside {@code region} whose difference exceeds {@code limit}.
     * Pairs that straddle the region border are not considered.
     */
    public int countJumps(HeightMap map, TileRegion region, double limit) {
        Objects.requireNonNull(map, "map cannot be null");
        Objects.requireNonNull(region, "region cannot be null");
        if (region.endX() > map.width() || region.endY() > map.height()) {
            throw new IndexOutOfBoundsException(
                String.format("region %s exceeds map %dx%d", region, map.width(), map.height()));
        }
        
        int jumps = 0;
        for (int y = region.y(); y < region.endY(); y++) {
            for (int x = region.x(); x < region.endX(); x++) {
                double v = map.get(x, y);
                if (x + 1 < region.endX() && Math.abs(map.get(x + 1, y) - v) > limit) {
                    jumps++;
                }
                if (y + 1 < region.endY() && Math.abs(map.get(x, y + 1) - v) > limit) {
                    jumps++;
                }
            }
        }
        return jumps;
    }
}
