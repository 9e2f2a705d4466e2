package com.jedi.catalog.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered channel pair: {@code minuend} corrected by {@code subtrahend}.
 * "A by B" and "B by A" are different pairs.
 */
public record ChannelPair(String minuend, String subtrahend) {

    public String label() {
        return minuend + " by " + subtrahend;
    }

    /**
     * All ordered pairs of distinct channels, in channel order.
     */
    public static List<ChannelPair> permutations(List<String> channels) {
        List<ChannelPair> pairs = new ArrayList<>();
        for (String minuend : channels) {
            for (String subtrahend : channels) {
                if (!minuend.equals(subtrahend)) {
                    pairs.add(new ChannelPair(minuend, subtrahend));
                }
            }
        }
        return pairs;
    }
}
