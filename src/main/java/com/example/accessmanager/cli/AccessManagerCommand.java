package com.example.accessmanager.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Component
@Command(
        name = "access-manager",
        mixinStandardHelpOptions = true,
        version = "access-manager 0.0.1",
        description = {
            "Compares the declared access configuration of an organization against its actual state.",
            "Only reports the differences, it does not reconcile them."
        },
        subcommands = {GithubCommand.class, BitwardenCommand.class})
public class AccessManagerCommand implements Runnable {
    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
