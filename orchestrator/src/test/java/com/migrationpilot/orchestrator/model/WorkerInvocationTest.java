package com.migrationpilot.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerInvocationTest {

    @Test
    void commandLine_quotesArgumentsWithSpaces() {
        WorkerInvocation invocation = new WorkerInvocation("analysis",
                List.of("bun", "run", "agents/orchestrator.ts"),
                List.of("--entity", "Boat Location", "--output", "/tmp/out"),
                Path.of("."), Map.of());

        assertThat(invocation.commandLine())
                .isEqualTo("bun run agents/orchestrator.ts --entity \"Boat Location\" --output /tmp/out");
    }

    @Test
    void argv_isCommandThenArguments() {
        WorkerInvocation invocation = new WorkerInvocation("generation",
                List.of("claude"), List.of("--entity", "Acme"), Path.of("."), Map.of("A", "1"));

        assertThat(invocation.argv()).containsExactly("claude", "--entity", "Acme");
    }

    @Test
    void rerunCommandLine_changesDirectorySetsEnvironmentAndDropsMultiLinePrompt() {
        WorkerInvocation invocation = new WorkerInvocation("generation",
                List.of("claude"),
                List.of("--settings", "s.json", "--append-system-prompt", "TASK: ...\nINPUT DATA:\n- tabs.json", "Generate it"),
                Path.of("/data/output/Acme"),
                Map.of("OUTPUT_PATH", "/data/output/Acme", "CLAUDE_PROJECT_DIR", "/data/project"));

        assertThat(invocation.rerunCommandLine()).isEqualTo(
                "cd /data/output/Acme && CLAUDE_PROJECT_DIR=/data/project OUTPUT_PATH=/data/output/Acme "
                        + "claude --settings s.json \"Generate it\"");
    }

    @Test
    void emptyCommand_isRejected() {
        assertThatThrownBy(() -> new WorkerInvocation("analysis", List.of(), List.of(), Path.of("."), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void subject_resolvesUnderOutputRootUnlessOverridden() {
        Path root = Path.of("/data/output");

        assertThat(Subject.of("Acme", root, null).directory()).isEqualTo(Path.of("/data/output/Acme"));
        assertThat(Subject.of("Acme", root, Path.of("/elsewhere")).directory()).isEqualTo(Path.of("/elsewhere"));
        assertThat(Subject.of("Acme", root, null).templatesDirectory())
                .isEqualTo(Path.of("/data/output/Acme/templates"));
    }
}
