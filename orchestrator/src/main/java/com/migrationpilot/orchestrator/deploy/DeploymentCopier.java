package com.migrationpilot.orchestrator.deploy;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Mirrors a subject's generated templates into the target projects.
 *
 * All destination roots are checked up front; if any is missing nothing is
 * copied. After that a failing file is recorded and the rest still copy.
 */
@Component
public class DeploymentCopier {

    private static final Logger log = LoggerFactory.getLogger(DeploymentCopier.class);

    static final String METRIC = "migrationpilot.deploy.files";

    private final MeterRegistry meterRegistry;

    public DeploymentCopier(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param sourceRoot the subject's templates directory
     * @throws DependencyException if the source or any destination root is missing
     */
    public DeploymentResult copy(Path sourceRoot, List<DeploymentMapping> mappings, boolean dryRun) {
        checkRoots(mappings);

        int copied = 0;
        List<CopyFailure> errors = new ArrayList<>();

        for (DeploymentMapping mapping : mappings) {
            Path source = sourceRoot.resolve(mapping.source());
            if (!Files.isDirectory(source)) {
                log.warn("Skipping {}: {} does not exist", mapping.targetName(), source);
                continue;
            }
            log.info("{} {} -> {}", dryRun ? "Would copy" : "Copying", source, mapping.destination());

            for (Path file : filesUnder(source)) {
                Path target = mapping.destination().resolve(source.relativize(file).toString());
                if (dryRun) {
                    log.info("  [dry-run] {} -> {}", file, target);
                    copied++;
                    continue;
                }
                try {
                    Files.createDirectories(target.getParent());
                    Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("  {} -> {}", file, target);
                    meterRegistry.counter(METRIC, "result", "copied").increment();
                    copied++;
                } catch (IOException e) {
                    log.error("  Failed to copy {}: {}", file, e.getMessage());
                    meterRegistry.counter(METRIC, "result", "failed").increment();
                    errors.add(new CopyFailure(file, e.toString()));
                }
            }
        }

        log.info("{} {} file(s){}", dryRun ? "Would copy" : "Copied", copied,
                errors.isEmpty() ? "" : ", " + errors.size() + " failed");
        return new DeploymentResult(copied, errors, dryRun);
    }

    /** Every missing root is reported, not just the first. */
    private static void checkRoots(List<DeploymentMapping> mappings) {
        Set<Path> missing = new LinkedHashSet<>();
        for (DeploymentMapping mapping : mappings) {
            if (!Files.isDirectory(mapping.destinationRoot())) {
                missing.add(mapping.destinationRoot());
            }
        }
        if (!missing.isEmpty()) {
            throw new DependencyException(
                    "Deployment target roots do not exist",
                    List.copyOf(missing),
                    "Check out the target projects or point migrationpilot.deploy.targets[*].root at them");
        }
    }

    private static List<Path> filesUnder(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not walk " + dir, e);
        }
    }
}
