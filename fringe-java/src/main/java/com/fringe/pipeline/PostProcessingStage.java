package com.fringe.pipeline;

import com.fringe.core.HeightMap;

/**
 * One caller-selected step applied to the unwrapped height map, such as trend removal or an
 * additional threshold unwrap. Stages must not modify their input.
 */
@FunctionalInterface
public interface PostProcessingStage {
    
    HeightMap apply(HeightMap map);
    
    /**
     * Returns a stage applying this stage and then {@code after}.
     */
    default PostProcessingStage andThen(PostProcessingStage after) {
        return map -> after.apply(apply(map));
    }
}
