package com.migrationpilot.orchestrator.cli;

import com.migrationpilot.orchestrator.config.ConfigurationException;
import com.migrationpilot.orchestrator.service.ConversionOutcome;
import com.migrationpilot.orchestrator.service.ConversionRequest;
import com.migrationpilot.orchestrator.service.ConversionWorkflow;
import com.migrationpilot.orchestrator.worker.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Root command: reconcile a subject's analysis artifacts, then run the
 * interactive template generator and optionally deploy the result.
 */
@Component
@Command(
    name = "migration-pilot",
    description = "Analyse a legacy entity, generate conversion templates and deploy them",
    mixinStandardHelpOptions = true,
    version = "0.1.0",
    subcommands = {
        DeployCommand.class,
        AuditCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MigrationPilotCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrationPilotCommand.class);

    @Option(names = {"-e", "--entity"}, description = "Entity to convert, e.g. Facility")
    String entity;

    @Option(names = {"-o", "--output"}, description = "Subject directory (default: <output-root>/<entity>)")
    Path output;

    @Option(names = "--form-name", description = "Legacy form name; a name without Search/Detail selects single-form mode")
    String formName;

    @Option(names = "--skip-generation", description = "Stop once the analysis artifacts are complete")
    boolean skipGeneration;

    @Option(names = "--deploy", description = "Copy the generated templates into the target projects")
    boolean deploy;

    @Option(names = "--dry-run", description = "With --deploy: only report what would be copied")
    boolean dryRun;

    private final ConversionWorkflow workflow;

    public MigrationPilotCommand(ConversionWorkflow workflow) {
        this.workflow = workflow;
    }

    @Override
    public Integer call() {
        if (dryRun && !deploy) {
            throw new ConfigurationException("--dry-run only applies together with --deploy",
                    "migration-pilot --entity <name> --deploy --dry-run, or: migration-pilot deploy --entity <name> --dry-run");
        }
        ConversionRequest request = new ConversionRequest(entity, output, formName, skipGeneration, deploy, dryRun);
        ConversionOutcome outcome = workflow.run(request, CancellationToken.create());

        if (outcome.hasErrors()) {
            log.error("Deployment finished with {} copy error(s)",
                    outcome.deployment().map(d -> d.errors().size()).orElse(0));
            return ExitCodes.FAILURE;
        }
        return ExitCodes.SUCCESS;
    }
}
