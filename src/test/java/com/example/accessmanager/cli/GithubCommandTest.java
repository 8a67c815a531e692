package com.example.accessmanager.cli;

import com.example.accessmanager.application.github.GithubAccessReport;
import com.example.accessmanager.domain.ConfigurationException;
import com.example.accessmanager.infrastructure.github.GithubProperties;
import com.example.accessmanager.infrastructure.http.RemoteStateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GithubCommandTest {
    private static final GithubProperties WITH_TOKEN =
            new GithubProperties("secret", "https://api.github.com", 100, 4);

    @Mock private GithubAccessReport report;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(GithubProperties properties, String... args) {
        CommandLine commandLine = ReportExceptionHandler.install(new CommandLine(new GithubCommand(report, properties)));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void printsReportLinesToStandardOutput() {
        when(report.generate(Path.of("github.toml"))).thenReturn(List.of("header:", "", "  alice", ""));

        int exitCode = run(WITH_TOKEN, "github.toml");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString().lines()).containsExactly("header:", "", "  alice", "");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void missingTokenFailsBeforeAnyReport() {
        int exitCode = run(new GithubProperties("", "https://api.github.com", 100, 4), "github.toml");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("Expected GITHUB_TOKEN environment variable to be set.");
        verifyNoInteractions(report);
    }

    @Test
    void configurationErrorsExitWithCodeOne() {
        when(report.generate(Path.of("broken.toml")))
                .thenThrow(new ConfigurationException("Missing key 'organization.name' in broken.toml"));

        int exitCode = run(WITH_TOKEN, "broken.toml");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("Missing key 'organization.name' in broken.toml");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void remoteErrorsExitWithCodeTwo() {
        when(report.generate(Path.of("github.toml")))
                .thenThrow(new RemoteStateException("Got 401 Unauthorized from /orgs/acme/members"));

        int exitCode = run(WITH_TOKEN, "github.toml");

        assertThat(exitCode).isEqualTo(ExitCodes.REMOTE_ERROR);
        assertThat(err.toString()).contains("Got 401 Unauthorized from /orgs/acme/members");
    }

    @Test
    void missingConfigArgumentIsAUsageError() {
        int exitCode = run(WITH_TOKEN);

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        verifyNoInteractions(report);
    }
}
