package com.jedi.catalog.catalog;

import com.jedi.catalog.pipeline.ChannelPair;
import com.jedi.catalog.pipeline.FlareEvent;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One flare of the catalog. Every channel and pair of the schema has an entry from construction on,
 * so all rows carry the same fields whether the flare was processed or skipped.
 */
@Data
public class CatalogRow {

    // GOES flare
    private int eventIndex;
    private LocalDateTime goesFlareStartTime;
    private LocalDateTime goesFlarePeakTime;
    private String goesFlareClass;

    // Pre-flare baseline window
    private LocalDateTime preflareStartTime;
    private LocalDateTime preflareEndTime;

    // Dimming window
    private Boolean flareInterrupt;
    private LocalDateTime dimmingWindowStartTime;
    private LocalDateTime dimmingWindowEndTime;

    private final Map<String, ChannelMetrics> channels = new LinkedHashMap<>();
    private final Map<String, PairMetrics> pairs = new LinkedHashMap<>();

    public static CatalogRow forFlare(FlareEvent flare, CatalogSchema schema) {
        CatalogRow row = new CatalogRow();
        row.setEventIndex(flare.index());
        row.setGoesFlareStartTime(flare.startTime());
        row.setGoesFlarePeakTime(flare.peakTime());
        row.setGoesFlareClass(flare.goesClass());
        for (String channel : schema.getChannels()) {
            row.channels.put(channel, new ChannelMetrics());
        }
        for (ChannelPair pair : schema.getPairs()) {
            row.pairs.put(pair.label(), new PairMetrics());
        }
        return row;
    }

    public ChannelMetrics channel(String channel) {
        ChannelMetrics metrics = channels.get(channel);
        if (metrics == null) {
            throw new IllegalArgumentException("Channel not in catalog schema: " + channel);
        }
        return metrics;
    }

    public PairMetrics pair(String pairLabel) {
        PairMetrics metrics = pairs.get(pairLabel);
        if (metrics == null) {
            throw new IllegalArgumentException("Pair not in catalog schema: " + pairLabel);
        }
        return metrics;
    }

    /**
     * Curve metrics of a channel or of a derived pair series.
     */
    public LightCurveMetrics curveMetrics(String label) {
        if (channels.containsKey(label)) {
            return channels.get(label).getMetrics();
        }
        return pair(label).getMetrics();
    }
}
