package com.example.accessmanager.cli;

import com.example.accessmanager.application.bitwarden.BitwardenAccessReport;
import com.example.accessmanager.infrastructure.bitwarden.BitwardenProperties;
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
        name = "bitwarden",
        mixinStandardHelpOptions = true,
        description = {
            "Compares a Bitwarden organization against a TOML description of its target state.",
            "Requires BITWARDEN_CLIENT_ID and BITWARDEN_CLIENT_SECRET of the organization API key."
        })
public class BitwardenCommand implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "CONFIG", description = "TOML file with the target organization")
    private Path configFile;

    private final BitwardenAccessReport report;
    private final BitwardenProperties properties;

    public BitwardenCommand(BitwardenAccessReport report, BitwardenProperties properties) {
        this.report = report;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if (!properties.hasClientId()) {
            err.println("Expected BITWARDEN_CLIENT_ID environment variable to be set.");
            err.println("See also --help.");
            return ExitCodes.CONFIGURATION_ERROR;
        }
        if (!properties.hasClientSecret()) {
            err.println("Expected BITWARDEN_CLIENT_SECRET environment variable to be set.");
            err.println("See also --help.");
            return ExitCodes.CONFIGURATION_ERROR;
        }
        PrintWriter out = spec.commandLine().getOut();
        report.generate(configFile).forEach(out::println);
        out.flush();
        return ExitCodes.OK;
    }
}
