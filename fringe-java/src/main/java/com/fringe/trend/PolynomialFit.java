package com.fringe.trend;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Least-squares polynomial fit of a one-dimensional profile sampled at {@code x = 0, 1, ..., n - 1}.
 * <p>
 * A fit that cannot be solved (fewer samples than coefficients, a rank-deficient design matrix or
 * non-finite input) yields an all-zero trend instead of an error.
 */
public final class PolynomialFit {
    
    private static final Logger log = LoggerFactory.getLogger(PolynomialFit.class);
    
    private static final double SINGULARITY_THRESHOLD = 1e-10;
    
    private PolynomialFit() {}
    
    /**
     * Fits a polynomial of {@code degree} to {@code profile}.
     *
     * @return coefficients in ascending order, {@code c[0] + c[1] x + ... + c[degree] x^degree},
     *         all zero when the fit is degenerate
     */
    public static double[] fit(double[] profile, int degree) {
        Objects.requireNonNull(profile, "profile cannot be null");
        if (degree < 0) {
            throw new IllegalArgumentException("degree must be non-negative");
        }
        
        int n = profile.length;
        var zero = new double[degree + 1];
        if (n < degree + 1) {
            log.debug("Degenerate fit: {} samples for degree {}", n, degree);
            return zero;
        }
        
        var design = new double[n][degree + 1];
        for (int i = 0; i < n; i++) {
            double power = 1.0;
            for (int j = 0; j <= degree; j++) {
                design[i][j] = power;
                power *= i;
            }
        }
        
        var solver = new QRDecomposition(new Array2DRowRealMatrix(design, false), SINGULARITY_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            log.debug("Degenerate fit: singular design matrix for {} samples, degree {}", n, degree);
            return zero;
        }
        
        var coefficients = solver.solve(new ArrayRealVector(profile)).toArray();
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                log.debug("Degenerate fit: non-finite coefficient for degree {}", degree);
                return zero;
            }
        }
        return coefficients;
    }
    
    /**
     * Whether every coefficient is zero, as returned for a degenerate fit.
     */
    public static boolean isZero(double[] coefficients) {
        for (double c : coefficients) {
            if (c != 0.0) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Evaluates ascending {@code coefficients} at {@code x = 0, 1, ..., size - 1}.
     */
    public static double[] evaluate(double[] coefficients, int size) {
        var values = new double[size];
        for (int x = 0; x < size; x++) {
            double value = 0.0;
            for (int j = coefficients.length - 1; j >= 0; j--) {
                value = value * x + coefficients[j];
            }
            values[x] = value;
        }
        return values;
    }
    
    /**
     * Fitted trend of {@code profile}, sampled at every profile position.
     */
    public static double[] trend(double[] profile, int degree) {
        return evaluate(fit(profile, degree), profile.length);
    }
}
