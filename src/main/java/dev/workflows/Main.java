package dev.workflows;

import dev.workflows.cli.WorkflowStudioCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkflowStudioCli()).execute(args);
        System.exit(exitCode);
    }
}
