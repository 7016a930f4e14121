package com.fringe.phase;

import com.fringe.core.HeightMap;
import com.fringe.core.IntensityFrame;
import com.fringe.exceptions.ShapeMismatchException;
import com.fringe.exceptions.UnsupportedStepCountException;

import java.util.List;
import java.util.Objects;

/**
 * Converts a phase-shifted series of intensity frames into a wrapped phase map in (-pi, pi].
 */
public class WrappedPhaseCalculator {
    
    /**
     * Computes the wrapped phase of a series whose length is the step count.
     *
     * @param frames ordered frames, one per phase step
     * @return wrapped phase in radians, same shape as the frames
     * @throws UnsupportedStepCountException if the series is not 3, 4 or 5 frames long
     * @throws ShapeMismatchException if the frames differ in dimensions
     */
    public HeightMap compute(List<IntensityFrame> frames)
            throws UnsupportedStepCountException, ShapeMismatchException {
        Objects.requireNonNull(frames, "frames cannot be null");
        return compute(frames, frames.size());
    }
    
    /**
     * Computes the wrapped phase of a series captured with {@code steps} phase steps.
     *
     * @throws UnsupportedStepCountException if {@code steps} is not 3, 4 or 5
     * @throws ShapeMismatchException if the series length differs from {@code steps}
     *                                or the frames differ in dimensions
     */
    public HeightMap compute(List<IntensityFrame> frames, int steps)
            throws UnsupportedStepCountException, ShapeMismatchException {
        Objects.requireNonNull(frames, "frames cannot be null");
        var formula = PhaseShiftFormula.forSteps(steps)
            .orElseThrow(() -> new UnsupportedStepCountException(steps));
        
        if (frames.size() != steps) {
            throw new ShapeMismatchException(
                String.format("expected %d frames for %d-step formula, got %d", steps, steps, frames.size()));
        }
        
        var first = Objects.requireNonNull(frames.get(0), "frame 0 cannot be null");
        for (int i = 1; i < frames.size(); i++) {
            var frame = Objects.requireNonNull(frames.get(i), "frame cannot be null");
            if (!frame.sameShape(first)) {
                throw new ShapeMismatchException(
                    String.format("frame %d is %dx%d, expected %dx%d",
                                 i, frame.width(), frame.height(), first.width(), first.height()));
            }
        }
        
        int width = first.width();
        int height = first.height();
        var phase = new HeightMap(width, height);
        var intensities = new double[steps];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int s = 0; s < steps; s++) {
                    intensities[s] = frames.get(s).get(x, y);
                }
                phase.set(x, y, formula.phase(intensities));
            }
        }
        return phase;
    }
}
