package com.fringe.phase;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed-form phase-shifting formulas for 60 degree phase steps.
 * <p>
 * Each formula is a pair of fixed linear combinations of the N frame intensities; the wrapped
 * phase is {@code atan2(numerator, denominator)}. The coefficients set the physical scale of the
 * result and must not be changed.
 */
public enum PhaseShiftFormula {
    
    THREE_STEP(3,
        1.0,          new double[]{2, -3, 1},
        Math.sqrt(3), new double[]{0, 1, -1}),
    
    FOUR_STEP(4,
        5.0,          new double[]{1, -1, -1, 1},
        Math.sqrt(3), new double[]{2, 1, -1, -2}),
    
    FIVE_STEP(5,
        Math.sqrt(3), new double[]{2, -3, -4, 0, 5},
        1.0,          new double[]{8, 3, -4, -6, -1});
    
    private final int steps;
    private final double numeratorScale;
    private final double[] numeratorCoefficients;
    private final double denominatorScale;
    private final double[] denominatorCoefficients;
    
    PhaseShiftFormula(int steps, double numeratorScale, double[] numeratorCoefficients,
                      double denominatorScale, double[] denominatorCoefficients) {
        this.steps = steps;
        this.numeratorScale = numeratorScale;
        this.numeratorCoefficients = numeratorCoefficients;
        this.denominatorScale = denominatorScale;
        this.denominatorCoefficients = denominatorCoefficients;
    }
    
    /**
     * Returns the formula for {@code steps} frames, if one exists.
     */
    public static Optional<PhaseShiftFormula> forSteps(int steps) {
        return Arrays.stream(values()).filter(f -> f.steps == steps).findFirst();
    }
    
    public int steps() {
        return steps;
    }
    
    /**
     * Numerator for one pixel given its intensity in each frame, {@code intensities[step]}.
     */
    public double numerator(double[] intensities) {
        return numeratorScale * combine(numeratorCoefficients, intensities);
    }
    
    public double denominator(double[] intensities) {
        return denominatorScale * combine(denominatorCoefficients, intensities);
    }
    
    /**
     * Wrapped phase for one pixel, in (-pi, pi].
     */
    public double phase(double[] intensities) {
        double phase = Math.atan2(numerator(intensities), denominator(intensities));
        // atan2 yields -pi only for a negative zero numerator
        return phase == -Math.PI ? Math.PI : phase;
    }
    
    private static double combine(double[] coefficients, double[] intensities) {
        double sum = 0.0;
        for (int i = 0; i < coefficients.length; i++) {
            sum += coefficients[i] * intensities[i];
        }
        return sum;
    }
}
