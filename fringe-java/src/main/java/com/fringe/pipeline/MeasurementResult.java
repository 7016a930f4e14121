package com.fringe.pipeline;

import com.fringe.core.HeightMap;
import com.fringe.core.TileMask;

import java.util.Objects;
import java.util.Optional;

/**
 * Finished output of one measurement. The height map holds final values: scaled, unwrapped and
 * post-processed.
 *
 * @param heightMap     final height map
 * @param tileMask      mask of tiles with residual jumps, present for tiled strategies
 * @param elapsedNanos  wall time spent in the pipeline
 */
public record MeasurementResult(HeightMap heightMap, Optional<TileMask> tileMask, long elapsedNanos) {
    
    public MeasurementResult {
        Objects.requireNonNull(heightMap, "heightMap cannot be null");
        Objects.requireNonNull(tileMask, "tileMask cannot be null");
    }
}
