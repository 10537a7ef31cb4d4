package com.migrationpilot.orchestrator.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Everything needed to spawn one external worker process.
 *
 * The environment map holds overrides only; they are layered on top of the
 * orchestrator's own environment for this child and nowhere else.
 *
 * @param stage short label used in logs and metrics ("analysis", "generation")
 */
public record WorkerInvocation(
        String              stage,
        List<String>        command,
        List<String>        arguments,
        Path                workingDirectory,
        Map<String, String> environment) {

    public WorkerInvocation {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Worker command must not be empty");
        }
        command     = List.copyOf(command);
        arguments   = List.copyOf(arguments);
        environment = Map.copyOf(environment);
    }

    /** Executable followed by every argument, as handed to ProcessBuilder. */
    public List<String> argv() {
        List<String> argv = new ArrayList<>(command);
        argv.addAll(arguments);
        return argv;
    }

    /**
     * Shell-style rendering of {@link #argv()} that an operator can paste to
     * re-run the worker by hand.
     */
    public String commandLine() {
        return argv().stream()
                .map(WorkerInvocation::quote)
                .collect(Collectors.joining(" "));
    }

    /**
     * Command an operator can paste from any directory to repeat this run:
     * {@code cd <workingDirectory> && VAR=value ... <argv>}.
     *
     * Multi-line arguments (the generated system prompt) are left out together
     * with the flag that introduces them.
     */
    public String rerunCommandLine() {
        List<String> parts = new ArrayList<>();
        parts.add("cd");
        parts.add(quote(workingDirectory.toString()));
        parts.add("&&");
        new TreeMap<>(environment).forEach((key, value) -> parts.add(key + "=" + quote(value)));
        command.forEach(c -> parts.add(quote(c)));

        for (int i = 0; i < arguments.size(); i++) {
            String arg = arguments.get(i);
            boolean nextIsMultiLine = i + 1 < arguments.size() && arguments.get(i + 1).contains("\n");
            if (arg.startsWith("--") && nextIsMultiLine) {
                i++;
                continue;
            }
            if (arg.contains("\n")) {
                continue;
            }
            parts.add(quote(arg));
        }
        return String.join(" ", parts);
    }

    private static String quote(String arg) {
        if (!arg.isEmpty() && arg.chars().noneMatch(c -> Character.isWhitespace(c) || c == '"' || c == '\'')) {
            return arg;
        }
        return "\"" + arg.replace("\"", "\\\"") + "\"";
    }
}
