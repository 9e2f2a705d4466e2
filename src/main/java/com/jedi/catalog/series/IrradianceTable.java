package com.jedi.catalog.series;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-channel irradiance table. All channels share one strictly ascending time index;
 * channel order is insertion order and is the column order of the catalog.
 */
public final class IrradianceTable {

    private final List<LocalDateTime> times;
    private final LinkedHashMap<String, double[]> columns;

    private IrradianceTable(List<LocalDateTime> times, LinkedHashMap<String, double[]> columns) {
        this.times = Collections.unmodifiableList(times);
        this.columns = columns;
    }

    public static Builder builder(List<LocalDateTime> times) {
        return new Builder(times);
    }

    public List<LocalDateTime> getTimes() {
        return times;
    }

    public List<String> getChannels() {
        return List.copyOf(columns.keySet());
    }

    public int size() {
        return times.size();
    }

    public boolean isEmpty() {
        return times.isEmpty() || columns.isEmpty();
    }

    public LightCurve curve(String channel) {
        double[] values = columns.get(channel);
        Preconditions.checkArgument(values != null, "Unknown channel: %s", channel);
        return new LightCurve(times, values);
    }

    /**
     * Rows whose time lies inside the closed range, all channels kept.
     */
    public IrradianceTable slice(Range<LocalDateTime> range) {
        int from = 0;
        while (from < times.size() && !range.contains(times.get(from)) && !isAfterRange(range, times.get(from))) {
            from++;
        }
        int to = from;
        while (to < times.size() && range.contains(times.get(to))) {
            to++;
        }

        LinkedHashMap<String, double[]> sliced = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> column : columns.entrySet()) {
            sliced.put(column.getKey(), Arrays.copyOfRange(column.getValue(), from, to));
        }
        return new IrradianceTable(new ArrayList<>(times.subList(from, to)), sliced);
    }

    private static boolean isAfterRange(Range<LocalDateTime> range, LocalDateTime time) {
        return range.hasUpperBound() && time.isAfter(range.upperEndpoint());
    }

    public static class Builder {

        private final List<LocalDateTime> times;
        private final LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();

        private Builder(List<LocalDateTime> times) {
            Preconditions.checkNotNull(times, "times");
            for (int i = 1; i < times.size(); i++) {
                Preconditions.checkArgument(times.get(i).isAfter(times.get(i - 1)),
                        "Time index must be strictly ascending at position %s (%s after %s)",
                        i, times.get(i), times.get(i - 1));
            }
            this.times = new ArrayList<>(times);
        }

        public Builder channel(String label, double[] values) {
            Preconditions.checkNotNull(label, "label");
            Preconditions.checkArgument(values.length == times.size(),
                    "Channel %s has %s values for %s times", label, values.length, times.size());
            Preconditions.checkArgument(!columns.containsKey(label), "Duplicate channel: %s", label);
            columns.put(label, values.clone());
            return this;
        }

        public IrradianceTable build() {
            return new IrradianceTable(times, columns);
        }
    }
}
