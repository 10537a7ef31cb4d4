package com.migrationpilot.orchestrator.generation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference images grouped by the screen they most likely show.
 *
 * Keys are {@code search}, {@code detail}, {@code tab:<label>} and
 * {@code general}. Buckets appear in the order they were first filled and
 * keep their files in discovery order.
 */
public final class AssetClassification {

    public static final String SEARCH     = "search";
    public static final String DETAIL     = "detail";
    public static final String GENERAL    = "general";
    public static final String TAB_PREFIX = "tab:";

    private final Map<String, List<Path>> buckets;

    private AssetClassification(Map<String, List<Path>> buckets) {
        Map<String, List<Path>> copy = new LinkedHashMap<>();
        buckets.forEach((key, files) -> copy.put(key, List.copyOf(files)));
        this.buckets = Collections.unmodifiableMap(copy);
    }

    public static AssetClassification empty() {
        return new AssetClassification(Map.of());
    }

    public static String tabKey(String label) {
        return TAB_PREFIX + label;
    }

    public Set<String> categories() {
        return buckets.keySet();
    }

    public List<Path> get(String category) {
        return buckets.getOrDefault(category, List.of());
    }

    /** Tab buckets only, keyed by tab label. */
    public Map<String, List<Path>> tabs() {
        Map<String, List<Path>> tabs = new LinkedHashMap<>();
        buckets.forEach((key, files) -> {
            if (key.startsWith(TAB_PREFIX)) {
                tabs.put(key.substring(TAB_PREFIX.length()), files);
            }
        });
        return tabs;
    }

    public Map<String, List<Path>> asMap() {
        return buckets;
    }

    public int size() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        return "AssetClassification" + buckets;
    }

    static final class Builder {
        private final Map<String, List<Path>> buckets = new LinkedHashMap<>();

        Builder add(String category, Path file) {
            buckets.computeIfAbsent(category, k -> new ArrayList<>()).add(file);
            return this;
        }

        AssetClassification build() {
            return new AssetClassification(buckets);
        }
    }
}
