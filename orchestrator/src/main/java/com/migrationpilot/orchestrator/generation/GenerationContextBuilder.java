package com.migrationpilot.orchestrator.generation;

import com.migrationpilot.orchestrator.model.Subject;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders the system-prompt context handed to the generation worker: where
 * the analysis files live and which reference screenshots show which screen.
 */
public final class GenerationContextBuilder {

    private GenerationContextBuilder() {}

    public static String build(Subject subject, List<String> analysisFiles, AssetClassification images) {
        StringBuilder sb = new StringBuilder();
        sb.append("TASK: Generate the conversion plan and code templates for ")
          .append(subject.name()).append(".\n\n");

        sb.append("INPUT DATA:\n");
        sb.append("Analysis files in ").append(subject.directory()).append("/\n");
        analysisFiles.forEach(f -> sb.append("- ").append(f).append('\n'));

        sb.append('\n').append(imageSection(images));

        sb.append("\nOUTPUT:\n");
        sb.append("Write the templates to ").append(subject.templatesDirectory())
          .append("/ split into shared/, api/ and ui/.\n");
        return sb.toString();
    }

    /** The initial user turn that starts the interactive session. */
    public static String initialPrompt(Subject subject) {
        return "Generate conversion templates for the " + subject.name()
                + " entity based on the analysis files in " + subject.directory()
                + ". Include ViewModels for the UI layer.";
    }

    static String imageSection(AssetClassification images) {
        if (images.isEmpty()) {
            return "REFERENCE IMAGES: none found.\n";
        }
        StringBuilder sb = new StringBuilder("REFERENCE IMAGES (legacy screenshots):\n");
        appendGroup(sb, "Search screen", images.get(AssetClassification.SEARCH));
        appendGroup(sb, "Detail screen", images.get(AssetClassification.DETAIL));
        for (Map.Entry<String, List<Path>> tab : images.tabs().entrySet()) {
            appendGroup(sb, "Tab '" + tab.getKey() + "'", tab.getValue());
        }
        appendGroup(sb, "Other", images.get(AssetClassification.GENERAL));
        return sb.toString();
    }

    private static void appendGroup(StringBuilder sb, String title, List<Path> files) {
        if (files.isEmpty()) {
            return;
        }
        sb.append(title).append(":\n");
        files.forEach(f -> sb.append("  - ").append(f).append('\n'));
    }
}
