package com.fringe.unwrapping;

import com.fringe.core.HeightMap;
import com.fringe.core.TileMask;
import com.fringe.core.TileRegion;
import com.fringe.core.UnwrapParameters;
import com.fringe.performance.ParallelTileOperations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Localises threshold unwrapping to a grid of tiles so that clustered large jumps cannot corrupt
 * the whole map.
 * <p>
 * Every tile is unwrapped on its own with a single iteration and then checked for a residual jump.
 * The unwrapped tiles are assembled into a map of the original size and the residual flags into a
 * {@link TileMask}. Boundary tiles are clipped to the image, never padded. Optionally the assembled
 * map is handed to the {@link MaskedGlobalCorrector}.
 */
public class TilePartitioner {
    
    private static final Logger log = LoggerFactory.getLogger(TilePartitioner.class);
    
    private final SequentialThresholdUnwrapper unwrapper;
    private final JumpDetector detector;
    private final MaskedGlobalCorrector corrector;
    private final boolean parallel;
    
    public TilePartitioner() {
        this(false);
    }
    
    /**
     * @param parallel whether tiles are processed on the shared work-stealing pool
     */
    public TilePartitioner(boolean parallel) {
        this(new SequentialThresholdUnwrapper(), new JumpDetector(), new MaskedGlobalCorrector(), parallel);
    }
    
    public TilePartitioner(SequentialThresholdUnwrapper unwrapper, JumpDetector detector,
                           MaskedGlobalCorrector corrector, boolean parallel) {
        this.unwrapper = Objects.requireNonNull(unwrapper, "unwrapper cannot be null");
        this.detector = Objects.requireNonNull(detector, "detector cannot be null");
        this.corrector = Objects.requireNonNull(corrector, "corrector cannot be null");
        this.parallel = parallel;
    }
    
    /**
     * Unwraps tile by tile and, when {@code globalCorrection} is set, runs the masked global pass
     * over the assembled map.
     */
    public TileUnwrapResult partition(HeightMap map, UnwrapParameters params, boolean globalCorrection) {
        Objects.requireNonNull(map, "map cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        
        int tileSize = params.tileSize();
        var mask = new TileMask(map.width(), map.height(), tileSize);
        var assembled = new HeightMap(map.width(), map.height());
        int columns = mask.tileColumns();
        int tileCount = mask.tileCount();
        
        var outcomes = ParallelTileOperations.mapTiles(tileCount, index -> {
            var region = TileRegion.ofTile(index % columns, index / columns, tileSize, map.width(), map.height());
            var tile = unwrapper.unwrap(map.subMap(region), params, 1);
            boolean jump = detector.hasJump(tile, params);
            return new TileOutcome(region, tile, jump);
        }, parallel);
        
        for (int index = 0; index < tileCount; index++) {
            var outcome = outcomes.get(index);
            assembled.paste(outcome.region(), outcome.tile());
            mask.setBad(index % columns, index / columns, outcome.jump());
        }
        
        log.debug("Partitioned {} into {} tiles of {}, {} with residual jumps",
                  map, tileCount, tileSize, mask.badTileCount());
        
        var result = globalCorrection ? corrector.correct(assembled, mask, params) : assembled;
        return new TileUnwrapResult(result, mask);
    }
    
    private record TileOutcome(TileRegion region, HeightMap tile, boolean jump) {}
}
