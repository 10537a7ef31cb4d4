package com.migrationpilot.orchestrator.cli;

import com.migrationpilot.orchestrator.deploy.CopyFailure;
import com.migrationpilot.orchestrator.deploy.DeploymentResult;
import com.migrationpilot.orchestrator.service.ConversionWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/** Copies previously generated templates into the target projects. */
@Component
@Command(
    name = "deploy",
    description = "Deploy an entity's generated templates to the shared, API and UI projects",
    mixinStandardHelpOptions = true
)
public class DeployCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DeployCommand.class);

    @Option(names = {"-e", "--entity"}, description = "Entity whose templates are deployed")
    String entity;

    @Option(names = {"-o", "--output"}, description = "Subject directory (default: <output-root>/<entity>)")
    Path output;

    @Option(names = "--dry-run", description = "Only report what would be copied")
    boolean dryRun;

    private final ConversionWorkflow workflow;

    public DeployCommand(ConversionWorkflow workflow) {
        this.workflow = workflow;
    }

    @Override
    public Integer call() {
        DeploymentResult result = workflow.deploy(entity, output, dryRun);
        if (result.hasErrors()) {
            for (CopyFailure failure : result.errors()) {
                log.error("  {}: {}", failure.source(), failure.message());
            }
            return ExitCodes.FAILURE;
        }
        return ExitCodes.SUCCESS;
    }
}
