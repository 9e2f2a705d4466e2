package com.jedi.catalog.catalog;

import com.google.common.base.Preconditions;
import com.jedi.catalog.pipeline.ChannelPair;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Fixed column layout of the catalog table, derived once from the channel labels and all of
 * their ordered pairs. Columns are grouped by metric, then by channel (or pair).
 */
public final class CatalogSchema {

    /**
     * Whole seconds print as {@code yyyy-MM-dd HH:mm:ss}; a fractional second keeps its significant digits.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .toFormatter(Locale.ROOT);

    private static final List<Column<CatalogRow>> METADATA_COLUMNS = List.of(
            new Column<>("Event Index", CatalogRow::getEventIndex),
            new Column<>("GOES Flare Start Time", CatalogRow::getGoesFlareStartTime),
            new Column<>("GOES Flare Peak Time", CatalogRow::getGoesFlarePeakTime),
            new Column<>("GOES Flare Class", CatalogRow::getGoesFlareClass),
            new Column<>("Pre-Flare Start Time", CatalogRow::getPreflareStartTime),
            new Column<>("Pre-Flare End Time", CatalogRow::getPreflareEndTime),
            new Column<>("Flare Interrupt", CatalogRow::getFlareInterrupt),
            new Column<>("Dimming Window Start Time", CatalogRow::getDimmingWindowStartTime),
            new Column<>("Dimming Window End Time", CatalogRow::getDimmingWindowEndTime)
    );

    private static final List<Column<LightCurveMetrics>> PARAMETER_COLUMNS = List.of(
            new Column<>("Slope Start Time", LightCurveMetrics::getSlopeStartTime),
            new Column<>("Slope End Time", LightCurveMetrics::getSlopeEndTime),
            new Column<>("Slope Min [%/s]", LightCurveMetrics::getSlopeMin),
            new Column<>("Slope Max [%/s]", LightCurveMetrics::getSlopeMax),
            new Column<>("Slope Mean [%/s]", LightCurveMetrics::getSlopeMean),
            new Column<>("Depth Time", LightCurveMetrics::getDepthTime),
            new Column<>("Depth [%]", LightCurveMetrics::getDepthPercent),
            new Column<>("Duration Start Time", LightCurveMetrics::getDurationStartTime),
            new Column<>("Duration End Time", LightCurveMetrics::getDurationEndTime),
            new Column<>("Duration [s]", LightCurveMetrics::getDurationSeconds)
    );

    private static final List<Column<LightCurveMetrics>> FITTING_COLUMNS = List.of(
            new Column<>("Fitting Gamma", LightCurveMetrics::getFittingGamma),
            new Column<>("Fitting Score", LightCurveMetrics::getFittingScore)
    );

    private static final List<Column<ChannelMetrics>> CHANNEL_COLUMNS = buildChannelColumns();
    private static final List<Column<PairMetrics>> PAIR_COLUMNS = buildPairColumns();

    private final List<String> channels;
    private final List<ChannelPair> pairs;
    private final List<String> header;

    public CatalogSchema(List<String> channels) {
        Preconditions.checkArgument(!channels.isEmpty(), "Catalog schema needs at least one channel");
        Preconditions.checkArgument(channels.stream().distinct().count() == channels.size(),
                "Channel labels must be unique: %s", channels);
        this.channels = List.copyOf(channels);
        this.pairs = List.copyOf(ChannelPair.permutations(channels));
        this.header = Collections.unmodifiableList(buildHeader());
    }

    public List<String> getChannels() {
        return channels;
    }

    public List<ChannelPair> getPairs() {
        return pairs;
    }

    public List<String> getHeader() {
        return header;
    }

    public int getColumnCount() {
        return header.size();
    }

    /**
     * Flattens a row into cell strings in header order. Missing values become empty cells.
     */
    public List<String> toCells(CatalogRow row) {
        Preconditions.checkArgument(row.getChannels().keySet().equals(new LinkedHashSet<>(channels)),
                "Row channels %s do not match schema channels %s", row.getChannels().keySet(), channels);

        List<String> cells = new ArrayList<>(header.size());
        for (Column<CatalogRow> column : METADATA_COLUMNS) {
            cells.add(formatCell(column.extractor().apply(row)));
        }
        for (Column<ChannelMetrics> column : CHANNEL_COLUMNS) {
            for (String channel : channels) {
                cells.add(formatCell(column.extractor().apply(row.channel(channel))));
            }
        }
        for (Column<PairMetrics> column : PAIR_COLUMNS) {
            for (ChannelPair pair : pairs) {
                cells.add(formatCell(column.extractor().apply(row.pair(pair.label()))));
            }
        }
        return cells;
    }

    private List<String> buildHeader() {
        List<String> columns = new ArrayList<>();
        for (Column<CatalogRow> column : METADATA_COLUMNS) {
            columns.add(column.name());
        }
        for (Column<ChannelMetrics> column : CHANNEL_COLUMNS) {
            for (String channel : channels) {
                columns.add(channel + " " + column.name());
            }
        }
        for (Column<PairMetrics> column : PAIR_COLUMNS) {
            for (ChannelPair pair : pairs) {
                columns.add(pair.label() + " " + column.name());
            }
        }
        return columns;
    }

    private static List<Column<ChannelMetrics>> buildChannelColumns() {
        List<Column<ChannelMetrics>> columns = new ArrayList<>();
        columns.add(new Column<>("Pre-Flare Irradiance [W/m2]", ChannelMetrics::getPreflareIrradiance));
        for (Column<LightCurveMetrics> column : PARAMETER_COLUMNS) {
            columns.add(column.on(ChannelMetrics::getMetrics));
        }
        for (Column<LightCurveMetrics> column : FITTING_COLUMNS) {
            columns.add(column.on(ChannelMetrics::getMetrics));
        }
        return List.copyOf(columns);
    }

    private static List<Column<PairMetrics>> buildPairColumns() {
        List<Column<PairMetrics>> columns = new ArrayList<>();
        for (Column<LightCurveMetrics> column : PARAMETER_COLUMNS) {
            columns.add(column.on(PairMetrics::getMetrics));
        }
        columns.add(new Column<>("Correction Time Shift [s]", PairMetrics::getCorrectionTimeShiftSeconds));
        columns.add(new Column<>("Correction Scale Factor", PairMetrics::getCorrectionScaleFactor));
        for (Column<LightCurveMetrics> column : FITTING_COLUMNS) {
            columns.add(column.on(PairMetrics::getMetrics));
        }
        return List.copyOf(columns);
    }

    static String formatCell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            return Double.isFinite(d) ? String.format(Locale.ROOT, "%.8g", d) : "";
        }
        if (value instanceof LocalDateTime time) {
            return time.format(TIMESTAMP_FORMAT);
        }
        return value.toString();
    }

    private record Column<T>(String name, Function<T, Object> extractor) {

        <S> Column<S> on(Function<S, T> parent) {
            return new Column<>(name, parent.andThen(extractor));
        }
    }
}
