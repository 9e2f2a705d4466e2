package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.jedi.catalog.TestCurves.T0;
import static com.jedi.catalog.TestCurves.constant;
import static com.jedi.catalog.TestCurves.curve;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("GaussianKernelLightCurveFitter Tests")
class GaussianKernelLightCurveFitterTest {

    private final GaussianKernelLightCurveFitter fitter = new GaussianKernelLightCurveFitter();

    @Test
    @DisplayName("Flat curve is reproduced with a perfect score")
    void flatCurve() {
        LightCurve flat = curve(T0, 1, -2, -2, -2, -2, -2);

        FitResult result = fitter.fit(flat, constant(5, 0.002545));

        assertThat(result.score()).isEqualTo(1.0);
        assertThat(result.gamma()).isEqualTo(GaussianKernelLightCurveFitter.GAMMA_GRID[0]);
        for (double value : result.fitted().toArray()) {
            assertThat(value).isCloseTo(-2.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Fitted values are defined at every sample, including missing ones")
    void fillsGaps() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = -Math.sin(Math.PI * i / values.length) * 3;
        }
        values[10] = Double.NaN;
        LightCurve dimming = curve(T0, 1, values);

        FitResult result = fitter.fit(dimming, constant(values.length, 0.002545));

        assertThat(result.fitted().size()).isEqualTo(values.length);
        assertThat(result.fitted().countFinite()).isEqualTo(values.length);
        assertThat(GaussianKernelLightCurveFitter.GAMMA_GRID).contains(result.gamma());
        assertThat(result.score()).isGreaterThan(0.9);
    }

    @Test
    @DisplayName("Fewer than three finite samples give an undefined fit")
    void tooFewSamples() {
        LightCurve sparse = curve(T0, 1, 1, Double.NaN, 2, Double.NaN);

        FitResult result = fitter.fit(sparse, constant(4, 0.002545));

        assertThat(result.fitted().isAllMissing()).isTrue();
        assertThat(result.gamma()).isNaN();
        assertThat(result.score()).isNaN();
    }

    @Test
    @DisplayName("Uncertainty must match the curve length")
    void uncertaintyLength() {
        double[] uncertainty = new double[2];
        Arrays.fill(uncertainty, 0.1);

        assertThatThrownBy(() -> fitter.fit(curve(T0, 1, 1, 2, 3), uncertainty))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
