package com.migrationpilot.orchestrator;

import com.migrationpilot.orchestrator.cli.MigrationPilotCommand;
import com.migrationpilot.orchestrator.cli.PipelineExceptionHandler;
import com.migrationpilot.orchestrator.cli.SpringCommandFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import picocli.CommandLine;

/**
 * Entry point. Spring wires the beans, picocli parses the arguments, and the
 * command's result becomes the process exit status.
 *
 * To run:
 *   java -jar orchestrator.jar --entity Facility
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MigrationPilotApplication implements CommandLineRunner, ExitCodeGenerator {

    private final MigrationPilotCommand command;
    private final SpringCommandFactory  factory;

    private int exitCode;

    public MigrationPilotApplication(MigrationPilotCommand command, SpringCommandFactory factory) {
        this.command = command;
        this.factory = factory;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MigrationPilotApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(command, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(MigrationPilotCommand command, CommandLine.IFactory factory) {
        PipelineExceptionHandler handler = new PipelineExceptionHandler();
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler(handler)
                .setParameterExceptionHandler(handler);
    }
}
