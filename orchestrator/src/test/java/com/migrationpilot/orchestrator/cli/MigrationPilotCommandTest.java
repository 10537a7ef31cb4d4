package com.migrationpilot.orchestrator.cli;

import com.migrationpilot.orchestrator.audit.AuditReport;
import com.migrationpilot.orchestrator.audit.OutputAuditor;
import com.migrationpilot.orchestrator.config.ConfigurationException;
import com.migrationpilot.orchestrator.config.MigrationPilotProperties;
import com.migrationpilot.orchestrator.deploy.CopyFailure;
import com.migrationpilot.orchestrator.deploy.DeploymentResult;
import com.migrationpilot.orchestrator.model.WorkerInvocation;
import com.migrationpilot.orchestrator.pipeline.PostconditionException;
import com.migrationpilot.orchestrator.service.ConversionOutcome;
import com.migrationpilot.orchestrator.service.ConversionRequest;
import com.migrationpilot.orchestrator.service.ConversionWorkflow;
import com.migrationpilot.orchestrator.worker.WorkerExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Drives the picocli tree with a plain factory; no Spring context.
 */
@ExtendWith(MockitoExtension.class)
class MigrationPilotCommandTest {

    @Mock ConversionWorkflow workflow;
    @Mock OutputAuditor      auditor;

    CommandLine  cli;
    StringWriter err;

    @BeforeEach
    void setUp() {
        MigrationPilotProperties props = new MigrationPilotProperties(null, null, null, null, null, null);
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == DeployCommand.class) return (K) new DeployCommand(workflow);
                if (cls == AuditCommand.class)  return (K) new AuditCommand(auditor, props);
                return CommandLine.defaultFactory().create(cls);
            }
        };
        PipelineExceptionHandler handler = new PipelineExceptionHandler();
        cli = new CommandLine(new MigrationPilotCommand(workflow), factory)
                .setExecutionExceptionHandler(handler)
                .setParameterExceptionHandler(handler);
        err = new StringWriter();
        cli.setErr(new PrintWriter(err));
    }

    @Test
    void run_parsesOptionsIntoRequest() {
        when(workflow.run(any(), any())).thenReturn(outcome(Optional.empty()));

        int exit = cli.execute("-e", "Acme", "-o", "/tmp/acme", "--form-name", "frmAcme", "--deploy", "--dry-run");

        ArgumentCaptor<ConversionRequest> captor = ArgumentCaptor.forClass(ConversionRequest.class);
        verify(workflow).run(captor.capture(), any());
        assertThat(captor.getValue()).isEqualTo(
                new ConversionRequest("Acme", Path.of("/tmp/acme"), "frmAcme", false, true, true));
        assertThat(exit).isZero();
    }

    @Test
    void run_missingEntity_printsUsageAndExitsOne() {
        when(workflow.run(any(), any())).thenThrow(new ConfigurationException("Missing required option --entity", "usage"));

        int exit = cli.execute();

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Usage: migration-pilot");
    }

    @Test
    void run_workerFailure_propagatesWorkerExitCode() {
        WorkerInvocation invocation = new WorkerInvocation("analysis", List.of("bun"), List.of(), Path.of("."), Map.of());
        when(workflow.run(any(), any())).thenThrow(new WorkerExecutionException(invocation, 42));

        assertThat(cli.execute("--entity", "Acme")).isEqualTo(42);
    }

    @Test
    void run_postconditionFailure_exitsOne() {
        when(workflow.run(any(), any()))
                .thenThrow(new PostconditionException("Acme", List.of("tabs.json"), "bun run agents/orchestrator.ts"));

        assertThat(cli.execute("--entity", "Acme")).isEqualTo(1);
    }

    @Test
    void run_copyErrors_exitOne() {
        DeploymentResult withErrors = new DeploymentResult(2, List.of(new CopyFailure(Path.of("a.cs"), "denied")), false);
        when(workflow.run(any(), any())).thenReturn(outcome(Optional.of(withErrors)));

        assertThat(cli.execute("--entity", "Acme", "--deploy")).isEqualTo(1);
    }

    @Test
    void run_dryRunWithoutDeploy_isUsageError() {
        int exit = cli.execute("--entity", "Acme", "--dry-run");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Usage: migration-pilot");
        verifyNoInteractions(workflow);
    }

    @Test
    void unknownOption_exitsOne() {
        assertThat(cli.execute("--no-such-flag")).isEqualTo(1);
        verifyNoInteractions(workflow);
    }

    @Test
    void deploySubcommand_delegatesToWorkflow() {
        when(workflow.deploy("Acme", null, true)).thenReturn(new DeploymentResult(5, List.of(), true));

        assertThat(cli.execute("deploy", "--entity", "Acme", "--dry-run")).isZero();
    }

    @Test
    void auditSubcommand_usesGivenRoot() {
        when(auditor.audit(any())).thenReturn(new AuditReport("now", List.of()));

        assertThat(cli.execute("audit", "--output-root", "/tmp/out")).isZero();
        verify(auditor).audit(Path.of("/tmp/out"));
    }

    private static ConversionOutcome outcome(Optional<DeploymentResult> deployment) {
        return new ConversionOutcome(null, null, true, deployment);
    }
}
