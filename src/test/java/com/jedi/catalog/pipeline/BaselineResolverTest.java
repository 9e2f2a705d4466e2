package com.jedi.catalog.pipeline;

import com.jedi.catalog.series.IrradianceTable;
import com.jedi.catalog.series.LightCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.jedi.catalog.TestCurves.T0;
import static com.jedi.catalog.TestCurves.constant;
import static com.jedi.catalog.TestCurves.minutes;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BaselineResolver Tests")
class BaselineResolverTest {

    private static final int SAMPLES = 20 * 60;

    private final List<LightCurve> estimatedCurves = new ArrayList<>();
    private final List<LocalDateTime> flareStarts = new ArrayList<>();

    private final BaselineResolver resolver = new BaselineResolver((curve, flareStart) -> {
        estimatedCurves.add(curve);
        flareStarts.add(flareStart);
        return curve.valueAt(0);
    });

    private final IrradianceTable table = IrradianceTable.builder(minutes(T0, SAMPLES, 1))
            .channel("17.1", constant(SAMPLES, 2.0))
            .channel("30.4", constant(SAMPLES, 4.0))
            .build();

    @Test
    @DisplayName("Empty state is always recomputed, even after a short gap")
    void firstComputation() {
        FlareEvent flare = new FlareEvent(1, T0.plusMinutes(290), T0.plusMinutes(300), "C1.0");

        BaselineResolution resolution = resolver.resolve(T0.plusMinutes(270), flare, table, 240, BaselineState.empty());

        assertThat(resolution.recomputed()).isTrue();
        assertThat(resolution.minutesSinceLastFlare()).isEqualTo(30.0);
        assertThat(resolution.state().windowStart()).isEqualTo(T0.plusMinutes(60));
        assertThat(resolution.state().windowEnd()).isEqualTo(T0.plusMinutes(300));
        assertThat(resolution.state().irradiance()).containsExactly(Map.entry("17.1", 2.0), Map.entry("30.4", 4.0));
    }

    @Test
    @DisplayName("Each channel is estimated over the closed pre-flare window with the flare start")
    void estimatorInputs() {
        FlareEvent flare = new FlareEvent(1, T0.plusMinutes(290), T0.plusMinutes(300), "C1.0");

        resolver.resolve(T0, flare, table, 240, BaselineState.empty());

        assertThat(estimatedCurves).hasSize(2);
        assertThat(estimatedCurves.get(0).size()).isEqualTo(241);
        assertThat(estimatedCurves.get(0).timeAt(0)).isEqualTo(T0.plusMinutes(60));
        assertThat(flareStarts).containsOnly(T0.plusMinutes(290));
    }

    @Test
    @DisplayName("Gap within the threshold reuses values and window bounds")
    void reuse() {
        BaselineState previous = new BaselineState(Map.of("17.1", 7.0, "30.4", 8.0), T0, T0.plusMinutes(240));
        FlareEvent flare = new FlareEvent(2, T0.plusMinutes(400), T0.plusMinutes(420), "M2.0");

        BaselineResolution resolution = resolver.resolve(T0.plusMinutes(180), flare, table, 240, previous);

        assertThat(resolution.recomputed()).isFalse();
        assertThat(resolution.state()).isSameAs(previous);
        assertThat(estimatedCurves).isEmpty();
    }

    @Test
    @DisplayName("Gap exactly at the threshold still reuses")
    void gapEqualToThreshold() {
        BaselineState previous = new BaselineState(Map.of("17.1", 7.0), T0, T0.plusMinutes(240));
        FlareEvent flare = new FlareEvent(2, T0.plusMinutes(470), T0.plusMinutes(480), "M2.0");

        assertThat(resolver.resolve(T0.plusMinutes(240), flare, table, 240, previous).recomputed()).isFalse();
    }

    @Test
    @DisplayName("Gap above the threshold recomputes")
    void recompute() {
        BaselineState previous = new BaselineState(Map.of("17.1", 7.0, "30.4", 8.0), T0, T0.plusMinutes(240));
        FlareEvent flare = new FlareEvent(2, T0.plusMinutes(590), T0.plusMinutes(600), "M2.0");

        BaselineResolution resolution = resolver.resolve(T0.plusMinutes(300), flare, table, 240, previous);

        assertThat(resolution.recomputed()).isTrue();
        assertThat(resolution.state().valueFor("17.1")).isEqualTo(2.0);
        assertThat(resolution.state().windowStart()).isEqualTo(T0.plusMinutes(360));
    }
}
