package com.example.accessmanager.cli;

import com.example.accessmanager.application.github.GithubAccessReport;
import com.example.accessmanager.infrastructure.github.GithubProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@Command(
        name = "github",
        mixinStandardHelpOptions = true,
        description = {
            "Compares a GitHub organization against a TOML description of its target state.",
            "Requires GITHUB_TOKEN with the read:org permission."
        })
public class GithubCommand implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "CONFIG", description = "TOML file with the target organization")
    private Path configFile;

    private final GithubAccessReport report;
    private final GithubProperties properties;

    public GithubCommand(GithubAccessReport report, GithubProperties properties) {
        this.report = report;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        if (!properties.hasToken()) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Expected GITHUB_TOKEN environment variable to be set.");
            err.println("See also --help.");
            return ExitCodes.CONFIGURATION_ERROR;
        }
        PrintWriter out = spec.commandLine().getOut();
        report.generate(configFile).forEach(out::println);
        out.flush();
        return ExitCodes.OK;
    }
}
