package com.jedi.catalog.pipeline;

import com.google.common.base.Preconditions;
import com.jedi.catalog.algorithm.CorrectionResult;
import com.jedi.catalog.algorithm.FitResult;
import com.jedi.catalog.catalog.CatalogCsvWriter;
import com.jedi.catalog.catalog.CatalogRow;
import com.jedi.catalog.catalog.CatalogSchema;
import com.jedi.catalog.catalog.LightCurveMetrics;
import com.jedi.catalog.catalog.PairMetrics;
import com.jedi.catalog.config.CatalogSettings;
import com.jedi.catalog.series.IrradianceTable;
import com.jedi.catalog.series.LightCurve;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives the flares through the pipeline one at a time, in index order, and appends one
 * catalog row per flare as soon as the flare is done.
 *
 * <p>The first flare (index 0) only anchors the gap of the second one and gets no row.
 * The pre-flare baseline is the only state carried from one flare to the next.
 * A failing collaborator stops the run with a {@link CatalogProcessingException};
 * rows appended before it stay in the file.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CatalogPipeline {

    static final int LOG_INTERVAL = 100;

    private final BaselineResolver baselineResolver;
    private final PairwiseCorrectionStage correctionStage;
    private final FittingStage fittingStage;
    private final ParameterizationStage parameterizationStage;

    /**
     * Result of one flare: its row and the baseline to hand to the next flare.
     */
    record FlareOutcome(CatalogRow row, BaselineState baseline, boolean analyzed) {}

    public CatalogResult run(List<FlareEvent> flares, IrradianceTable table, CatalogSettings settings, Path catalogFile) {
        settings.validate();
        Preconditions.checkArgument(!flares.isEmpty(), "Flare list is empty");
        Preconditions.checkArgument(!table.isEmpty(), "Irradiance table is empty");
        for (int i = 1; i < flares.size(); i++) {
            Preconditions.checkArgument(!flares.get(i).peakTime().isBefore(flares.get(i - 1).peakTime()),
                    "Flare list must be in ascending peak time order at index %s", i);
        }

        Instant start = Instant.now();
        CatalogSchema schema = new CatalogSchema(table.getChannels());
        CatalogCsvWriter writer = CatalogCsvWriter.create(catalogFile, schema);

        log.info("Building catalog for {} flares, {} channels, {} pairs",
                flares.size(), schema.getChannels().size(), schema.getPairs().size());

        BaselineState baseline = BaselineState.empty();
        int analyzed = 0;
        int skipped = 0;

        try (RunLogFile ignored = settings.verbose() ? RunLogFile.open(settings.outputPath()) : RunLogFile.disabled()) {
            for (int i = 1; i < flares.size(); i++) {
                FlareEvent flare = flares.get(i);
                LocalDateTime previousPeak = flares.get(i - 1).peakTime();
                LocalDateTime nextPeak = i + 1 < flares.size() ? flares.get(i + 1).peakTime() : null;

                FlareOutcome outcome = processFlare(flare, previousPeak, nextPeak, table, schema, settings, baseline);
                writer.append(outcome.row());
                baseline = outcome.baseline();

                if (outcome.analyzed()) {
                    analyzed++;
                } else {
                    skipped++;
                }
                if (i % LOG_INTERVAL == 0 || i == flares.size() - 1) {
                    log.info("Progress: {}/{}", i, flares.size() - 1);
                }
            }
            log.info("Catalog completed: {} rows, {} analyzed, {} skipped", writer.getRowsWritten(), analyzed, skipped);
        }

        long totalTime = Duration.between(start, Instant.now()).toMillis();
        return new CatalogResult(writer.getFile(), writer.getRowsWritten(), analyzed, skipped, totalTime);
    }

    FlareOutcome processFlare(FlareEvent flare,
                              LocalDateTime previousPeak,
                              LocalDateTime nextPeak,
                              IrradianceTable table,
                              CatalogSchema schema,
                              CatalogSettings settings,
                              BaselineState previousBaseline) {
        boolean verbose = settings.verbose();
        CatalogRow row = CatalogRow.forFlare(flare, schema);

        BaselineResolution resolution;
        try {
            resolution = baselineResolver.resolve(previousPeak, flare, table,
                    settings.thresholdTimePriorFlareMinutes(), previousBaseline);
        } catch (RuntimeException e) {
            throw new CatalogProcessingException(flare.index(), "baseline", "all channels", e);
        }
        BaselineState baseline = resolution.state();
        narrate(verbose, "Event {}: {} minutes since last flare, pre-flare irradiance {}",
                flare.index(), String.format("%.1f", resolution.minutesSinceLastFlare()),
                resolution.recomputed() ? "recomputed" : "reused");

        row.setPreflareStartTime(baseline.windowStart());
        row.setPreflareEndTime(baseline.windowEnd());
        for (String channel : schema.getChannels()) {
            row.channel(channel).setPreflareIrradiance(baseline.valueFor(channel));
        }

        AnalysisWindow window = WindowBracketer.bracket(flare.peakTime(),
                settings.dimmingWindowRelativeToFlareMinutesLeft(),
                settings.dimmingWindowRelativeToFlareMinutesRight(),
                nextPeak);
        row.setFlareInterrupt(window.interrupted());
        row.setDimmingWindowStartTime(window.left());
        row.setDimmingWindowEndTime(window.right());
        if (window.interrupted()) {
            narrate(verbose, "Event {}: dimming window interrupted by next flare at {}", flare.index(), window.right());
        }

        if (window.durationMinutes() < settings.thresholdMinimumDimmingWindowMinutes()) {
            narrate(verbose, "Event {}: dimming window of {} minutes is shorter than {}, skipping",
                    flare.index(), window.durationMinutes(), settings.thresholdMinimumDimmingWindowMinutes());
            return new FlareOutcome(row, baseline, false);
        }

        Map<String, LightCurve> working = new LinkedHashMap<>(
                UnitNormalizer.toPercent(table.slice(window.range()), baseline));

        applyCorrections(flare, schema, row, working);
        narrate(verbose, "Event {}: correction done", flare.index());

        applyFits(flare, settings, row, working);
        narrate(verbose, "Event {}: fitting done", flare.index());

        applyParameters(flare, row, working);
        narrate(verbose, "Event {}: parameterization done", flare.index());

        return new FlareOutcome(row, baseline, true);
    }

    private void applyCorrections(FlareEvent flare, CatalogSchema schema, CatalogRow row, Map<String, LightCurve> working) {
        Map<String, StageResult<CorrectionResult>> results =
                correctionStage.apply(working, schema.getPairs(), flare.peakTime());

        for (Map.Entry<String, StageResult<CorrectionResult>> entry : results.entrySet()) {
            StageResult<CorrectionResult> result = checked(flare, "correction", entry.getKey(), entry.getValue());
            if (result.isComputed()) {
                CorrectionResult correction = result.getValue();
                PairMetrics metrics = row.pair(entry.getKey());
                metrics.setCorrectionTimeShiftSeconds(correction.timeShiftSeconds());
                metrics.setCorrectionScaleFactor(correction.scaleFactor());
                working.put(entry.getKey(), correction.corrected());
            }
        }
    }

    private void applyFits(FlareEvent flare, CatalogSettings settings, CatalogRow row, Map<String, LightCurve> working) {
        Map<String, StageResult<FitResult>> results = fittingStage.apply(working, settings.fitUncertainty());

        for (Map.Entry<String, StageResult<FitResult>> entry : results.entrySet()) {
            StageResult<FitResult> result = checked(flare, "fitting", entry.getKey(), entry.getValue());
            if (result.isComputed()) {
                FitResult fit = result.getValue();
                LightCurveMetrics metrics = row.curveMetrics(entry.getKey());
                metrics.setFittingGamma(fit.gamma());
                metrics.setFittingScore(fit.score());
                working.put(entry.getKey(), fit.fitted());
            }
        }
    }

    private void applyParameters(FlareEvent flare, CatalogRow row, Map<String, LightCurve> working) {
        Map<String, StageResult<DimmingParameters>> results = parameterizationStage.apply(working, flare.peakTime());

        for (Map.Entry<String, StageResult<DimmingParameters>> entry : results.entrySet()) {
            StageResult<DimmingParameters> result = checked(flare, "parameterization", entry.getKey(), entry.getValue());
            if (result.isComputed()) {
                recordParameters(row.curveMetrics(entry.getKey()), result.getValue());
            }
        }
    }

    private static void recordParameters(LightCurveMetrics metrics, DimmingParameters parameters) {
        metrics.setDepthPercent(parameters.depth().depthPercent());
        metrics.setDepthTime(parameters.depth().depthTime());

        metrics.setSlopeStartTime(parameters.slopeStartTime());
        metrics.setSlopeEndTime(parameters.slopeEndTime());
        metrics.setSlopeMin(parameters.slope().minPercentPerSecond());
        metrics.setSlopeMax(parameters.slope().maxPercentPerSecond());
        metrics.setSlopeMean(parameters.slope().meanPercentPerSecond());

        metrics.setDurationSeconds(parameters.duration().seconds());
        metrics.setDurationStartTime(parameters.duration().startTime());
        metrics.setDurationEndTime(parameters.duration().endTime());
    }

    private static <T> StageResult<T> checked(FlareEvent flare, String stage, String target, StageResult<T> result) {
        if (result.isFailed()) {
            throw new CatalogProcessingException(flare.index(), stage, target, result.getError());
        }
        if (result.isSkipped()) {
            log.debug("Event {}: {} skipped for {}: {}", flare.index(), stage, target, result.getReason());
        }
        return result;
    }

    private static void narrate(boolean verbose, String message, Object... args) {
        if (verbose) {
            log.info(message, args);
        } else {
            log.debug(message, args);
        }
    }
}
