package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Gaussian kernel smoother with an automatically selected kernel width.
 *
 * <p>Time is normalized to [0, 1] over the curve. Each sample is weighted by
 * {@code exp(-gamma * dt^2) / sigma^2}. Gamma is picked from {@link #GAMMA_GRID} by the
 * best leave-one-out coefficient of determination, which is also reported as the score.
 */
@Component
@Slf4j
public class GaussianKernelLightCurveFitter implements LightCurveFitter {

    static final double[] GAMMA_GRID = {1, 3, 10, 30, 100, 300, 1_000, 3_000, 10_000, 30_000};

    private static final int MIN_FINITE_SAMPLES = 3;

    @Override
    public FitResult fit(LightCurve curve, double[] uncertainty) {
        if (uncertainty.length != curve.size()) {
            throw new IllegalArgumentException("Uncertainty has " + uncertainty.length
                    + " entries for " + curve.size() + " samples");
        }
        if (curve.countFinite() < MIN_FINITE_SAMPLES) {
            return new FitResult(LightCurve.missing(curve.getTimes()), Double.NaN, Double.NaN);
        }

        double[] t = normalizedTimes(curve);
        double[] y = curve.toArray();
        double[] weights = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            double sigma = uncertainty[i];
            weights[i] = Double.isFinite(y[i]) && sigma > 0 ? 1.0 / (sigma * sigma) : 0.0;
        }

        double bestGamma = Double.NaN;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (double gamma : GAMMA_GRID) {
            double score = leaveOneOutScore(t, y, weights, gamma);
            if (score > bestScore) {
                bestScore = score;
                bestGamma = gamma;
            }
        }
        if (Double.isNaN(bestGamma)) {
            return new FitResult(LightCurve.missing(curve.getTimes()), Double.NaN, Double.NaN);
        }

        double[] fitted = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            fitted[i] = smooth(t, y, weights, bestGamma, i, false);
        }
        log.trace("Selected gamma {} with score {}", bestGamma, bestScore);
        return new FitResult(curve.withValues(fitted), bestGamma, bestScore);
    }

    private double leaveOneOutScore(double[] t, double[] y, double[] weights, double gamma) {
        double sum = 0;
        int n = 0;
        for (int i = 0; i < y.length; i++) {
            if (weights[i] > 0) {
                sum += y[i];
                n++;
            }
        }
        double mean = sum / n;

        double residual = 0;
        double total = 0;
        for (int i = 0; i < y.length; i++) {
            if (weights[i] == 0) {
                continue;
            }
            double predicted = smooth(t, y, weights, gamma, i, true);
            if (!Double.isFinite(predicted)) {
                return Double.NEGATIVE_INFINITY;
            }
            residual += (y[i] - predicted) * (y[i] - predicted);
            total += (y[i] - mean) * (y[i] - mean);
        }
        if (total == 0) {
            return residual == 0 ? 1.0 : Double.NEGATIVE_INFINITY;
        }
        return 1.0 - residual / total;
    }

    private double smooth(double[] t, double[] y, double[] weights, double gamma, int at, boolean leaveOut) {
        double numerator = 0;
        double denominator = 0;
        for (int j = 0; j < y.length; j++) {
            if (weights[j] == 0 || (leaveOut && j == at)) {
                continue;
            }
            double dt = t[j] - t[at];
            double w = weights[j] * Math.exp(-gamma * dt * dt);
            numerator += w * y[j];
            denominator += w;
        }
        return denominator > 0 ? numerator / denominator : Double.NaN;
    }

    private double[] normalizedTimes(LightCurve curve) {
        double[] t = new double[curve.size()];
        LocalDateTime first = curve.timeAt(0);
        double span = Duration.between(first, curve.timeAt(curve.size() - 1)).toMillis();
        for (int i = 0; i < t.length; i++) {
            double offset = Duration.between(first, curve.timeAt(i)).toMillis();
            t[i] = span > 0 ? offset / span : 0.0;
        }
        return t;
    }
}
