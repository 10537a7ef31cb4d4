package com.migrationpilot.orchestrator.generation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Best-effort sorting of legacy screenshots into the screens they show.
 *
 * Matching is by file name only:
 *   1. name contains search / list / index   → search
 *   2. name contains detail / edit / view    → detail
 *   3. name and a tab label contain each other → tab:<label>, first tab in
 *      tabs.json order wins; a name left empty by stripping the frm/tab
 *      markers never matches a tab
 *   4. anything else                          → general
 *
 * Every file ends up in exactly one bucket.
 */
public final class AssetMatcher {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".gif", ".bmp");

    private static final List<String> SEARCH_TOKENS = List.of("search", "list", "index");
    private static final List<String> DETAIL_TOKENS = List.of("detail", "edit", "view");

    private AssetMatcher() {}

    /**
     * Image files directly inside the directory, sorted by file name so the
     * classification is the same on every platform.
     */
    public static List<Path> findReferenceImages(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(AssetMatcher::isImage)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list reference images in " + dir, e);
        }
    }

    public static boolean isImage(Path file) {
        return IMAGE_EXTENSIONS.contains(extension(file.getFileName().toString()));
    }

    /**
     * Classify files against tab labels.
     *
     * @param files     candidate images, in discovery order
     * @param tabLabels tab labels in tabs.json order
     */
    public static AssetClassification classify(List<Path> files, List<String> tabLabels) {
        AssetClassification.Builder result = new AssetClassification.Builder();
        for (Path file : files) {
            result.add(categoryOf(file, tabLabels), file);
        }
        return result.build();
    }

    static String categoryOf(Path file, List<String> tabLabels) {
        String fileName = file.getFileName().toString();
        String baseName = stripExtension(fileName).toLowerCase(Locale.ROOT);

        if (containsAny(baseName, SEARCH_TOKENS)) {
            return AssetClassification.SEARCH;
        }
        if (containsAny(baseName, DETAIL_TOKENS)) {
            return AssetClassification.DETAIL;
        }

        // Names that are only markers ("tab.png", "frm.png") stay general.
        String cleaned = clean(baseName);
        if (!cleaned.isEmpty()) {
            for (String label : tabLabels) {
                String tab = label.toLowerCase(Locale.ROOT);
                if (tab.isEmpty()) {
                    continue;
                }
                if (cleaned.contains(tab) || tab.contains(cleaned)) {
                    return AssetClassification.tabKey(label);
                }
            }
        }
        return AssetClassification.GENERAL;
    }

    /** Drop the frm/tab control-name markers the legacy screenshots carry. */
    static String clean(String baseName) {
        String name = baseName;
        if (name.startsWith("frm")) {
            name = name.substring(3);
        }
        if (name.startsWith("tab")) {
            name = name.substring(3);
        }
        if (name.endsWith("tab")) {
            name = name.substring(0, name.length() - 3);
        }
        return name;
    }

    private static boolean containsAny(String value, List<String> tokens) {
        return tokens.stream().anyMatch(value::contains);
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
