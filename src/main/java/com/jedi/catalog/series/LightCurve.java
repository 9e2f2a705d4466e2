package com.jedi.catalog.series;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Time-indexed irradiance values of a single channel (or of a derived pair series).
 * Missing samples are {@code NaN}.
 */
public final class LightCurve {

    private final List<LocalDateTime> times;
    private final double[] values;

    public LightCurve(List<LocalDateTime> times, double[] values) {
        Preconditions.checkNotNull(times, "times");
        Preconditions.checkNotNull(values, "values");
        Preconditions.checkArgument(times.size() == values.length,
                "Time index has %s entries but %s values were given", times.size(), values.length);
        this.times = Collections.unmodifiableList(new ArrayList<>(times));
        this.values = values.clone();
    }

    public static LightCurve missing(List<LocalDateTime> times) {
        double[] values = new double[times.size()];
        Arrays.fill(values, Double.NaN);
        return new LightCurve(times, values);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public List<LocalDateTime> getTimes() {
        return times;
    }

    public LocalDateTime timeAt(int i) {
        return times.get(i);
    }

    public double valueAt(int i) {
        return values[i];
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * True when there is no finite sample at all (an empty curve counts as all missing).
     */
    public boolean isAllMissing() {
        for (double value : values) {
            if (Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    public int countFinite() {
        int count = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Samples whose time lies inside the closed range.
     */
    public LightCurve between(Range<LocalDateTime> range) {
        List<LocalDateTime> selectedTimes = new ArrayList<>();
        List<Double> selectedValues = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (range.contains(times.get(i))) {
                selectedTimes.add(times.get(i));
                selectedValues.add(values[i]);
            }
        }
        return new LightCurve(selectedTimes, selectedValues.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /**
     * Samples strictly before the given time.
     */
    public LightCurve before(LocalDateTime time) {
        int end = 0;
        while (end < values.length && times.get(end).isBefore(time)) {
            end++;
        }
        return new LightCurve(times.subList(0, end), Arrays.copyOfRange(values, 0, end));
    }

    /**
     * Same time index, new values.
     */
    public LightCurve withValues(double[] newValues) {
        return new LightCurve(times, newValues);
    }

    @Override
    public String toString() {
        return "LightCurve[" + values.length + " samples, " + countFinite() + " finite]";
    }
}
