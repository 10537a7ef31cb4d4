package com.migrationpilot.orchestrator.pipeline;

import com.migrationpilot.orchestrator.config.MigrationPilotProperties;
import com.migrationpilot.orchestrator.model.AnalysisMode;
import com.migrationpilot.orchestrator.model.PipelineRun;
import com.migrationpilot.orchestrator.model.Subject;
import com.migrationpilot.orchestrator.model.WorkerInvocation;
import com.migrationpilot.orchestrator.worker.CancellationToken;
import com.migrationpilot.orchestrator.worker.WorkerExecutionException;
import com.migrationpilot.orchestrator.worker.WorkerProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Makes sure every analysis artifact a subject needs exists before the
 * generation stage starts.
 *
 * One call is one reconciliation pass:
 *  1. compute the required set for the mode and what is missing from it
 *  2. nothing missing → return straight away, no worker is started
 *  3. otherwise run the analysis worker once, telling it which steps to skip
 *  4. re-check the directory; the worker's exit code alone is never trusted
 *
 * There is no loop and no automatic retry. A caller that wants another
 * attempt calls again; the skip list is re-derived from disk each time.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String STAGE = "analysis";

    private final DependencyResolver       resolver;
    private final WorkerProcessRunner      runner;
    private final MigrationPilotProperties properties;

    public PipelineOrchestrator(DependencyResolver resolver,
                                WorkerProcessRunner runner,
                                MigrationPilotProperties properties) {
        this.resolver   = resolver;
        this.runner     = runner;
        this.properties = properties;
    }

    // ------------------------------------------------------------------
    // Reconciliation
    // ------------------------------------------------------------------

    /**
     * Bring the subject's analysis artifacts up to date.
     *
     * @param formNameHint optional form name; only forwarded in SINGLE mode
     * @return the state found before the worker ran (or the complete state on the fast path)
     * @throws WorkerExecutionException if the worker exits nonzero
     * @throws PostconditionException   if the worker exits 0 but artifacts are still missing
     */
    public PipelineRun ensureArtifacts(Subject subject,
                                       AnalysisMode mode,
                                       String formNameHint,
                                       CancellationToken token) {
        PipelineRun before = resolver.plan(subject, mode);

        if (before.isComplete()) {
            log.info("All {} analysis artifacts for '{}' are present ({} mode); nothing to run",
                    before.required().size(), subject.name(), mode);
            return before;
        }

        log.info("Missing analysis artifacts for '{}' in {}:", subject.name(), subject.directory());
        before.missing().forEach(name -> log.info("  - {}", name));
        if (!before.skipSteps().isEmpty()) {
            log.info("Steps {} already have their output and will be skipped", before.skipSteps());
        }

        createDirectory(subject.directory());

        WorkerInvocation invocation = analysisInvocation(subject, mode, formNameHint, before.skipSteps());
        int exitCode = runner.run(invocation, token);
        if (exitCode != 0) {
            log.error("Analysis worker failed for '{}' (exit {})", subject.name(), exitCode);
            throw new WorkerExecutionException(invocation, exitCode);
        }

        List<String> missingAfter = resolver.missing(subject.directory(), before.required());
        if (!missingAfter.isEmpty()) {
            String fullRun = analysisInvocation(subject, mode, formNameHint, List.of()).rerunCommandLine();
            throw new PostconditionException(subject.name(), missingAfter, fullRun);
        }

        log.info("Analysis artifacts for '{}' are complete", subject.name());
        return before;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Build the analysis worker call.
     *
     * --form-name is only sent in SINGLE mode (the worker otherwise assumes
     * frm{Subject}Search / frm{Subject}Detail); --skip-steps only when there
     * is something to skip.
     */
    WorkerInvocation analysisInvocation(Subject subject,
                                        AnalysisMode mode,
                                        String formNameHint,
                                        List<Integer> skipSteps) {
        List<String> args = new ArrayList<>(List.of(
                "--entity", subject.name(),
                "--output", subject.directory().toString()));

        if (mode == AnalysisMode.SINGLE) {
            args.add("--form-name");
            args.add(ModeDetector.singleFormName(subject.name(), formNameHint));
        }

        if (!skipSteps.isEmpty()) {
            args.add("--skip-steps");
            args.add(skipSteps.stream().sorted().map(String::valueOf).collect(Collectors.joining(",")));
        }

        Path projectDir = properties.projectDirPath();
        return new WorkerInvocation(
                STAGE,
                properties.analysis().command(),
                args,
                projectDir,
                Map.of("CLAUDE_PROJECT_DIR", projectDir.toString()));
    }

    private static void createDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create output directory " + dir, e);
        }
    }
}
