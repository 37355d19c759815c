package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Token and cost counters for one worker run. Only grows while the run is live; every run gets a
 * fresh instance.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Usage {
    private long inputTokens;
    private long outputTokens;
    private long cacheReadTokens;
    private long cacheWriteTokens;
    private double cost;
    private int turns;

    /**
     * Accounts one completed assistant turn. {@code usage} is the worker's usage object and may be
     * missing; the turn is counted either way.
     */
    public synchronized void addTurn(JsonNode usage) {
        turns++;
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return;
        }
        inputTokens += usage.path("input").asLong(0L);
        outputTokens += usage.path("output").asLong(0L);
        cacheReadTokens += usage.path("cacheRead").asLong(0L);
        cacheWriteTokens += usage.path("cacheWrite").asLong(0L);
        cost += usage.path("cost").path("total").asDouble(0.0);
    }

    public synchronized long inputTokens() {
        return inputTokens;
    }

    public synchronized long outputTokens() {
        return outputTokens;
    }

    public synchronized long cacheReadTokens() {
        return cacheReadTokens;
    }

    public synchronized long cacheWriteTokens() {
        return cacheWriteTokens;
    }

    public synchronized double cost() {
        return cost;
    }

    public synchronized int turns() {
        return turns;
    }

    /**
     * One-line summary, e.g. {@code "2 turns in:1.2k out:800 R12k $0.0150 model-x"}. Zero counters
     * are left out.
     */
    public synchronized String format(String model) {
        List<String> parts = new ArrayList<>();
        if (turns > 0) {
            parts.add(turns + " turn" + (turns > 1 ? "s" : ""));
        }
        if (inputTokens > 0) {
            parts.add("in:" + formatTokens(inputTokens));
        }
        if (outputTokens > 0) {
            parts.add("out:" + formatTokens(outputTokens));
        }
        if (cacheReadTokens > 0) {
            parts.add("R" + formatTokens(cacheReadTokens));
        }
        if (cacheWriteTokens > 0) {
            parts.add("W" + formatTokens(cacheWriteTokens));
        }
        if (cost > 0) {
            parts.add(String.format(Locale.ROOT, "$%.4f", cost));
        }
        if (model != null && !model.isBlank()) {
            parts.add(model);
        }
        return String.join(" ", parts);
    }

    static String formatTokens(long n) {
        if (n < 1_000L) {
            return Long.toString(n);
        }
        if (n < 10_000L) {
            return String.format(Locale.ROOT, "%.1fk", n / 1000.0);
        }
        return Math.round(n / 1000.0) + "k";
    }
}
