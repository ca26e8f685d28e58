package dev.agentos;

import dev.agentos.cli.AgentOsCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new AgentOsCli())
            .setExecutionExceptionHandler(AgentOsCli::handleExecutionException)
            .execute(args);
        System.exit(exitCode);
    }
}
