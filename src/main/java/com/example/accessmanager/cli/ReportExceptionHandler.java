package com.example.accessmanager.cli;

import com.example.accessmanager.domain.ConfigurationException;
import com.example.accessmanager.infrastructure.http.RemoteStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.IExitCodeExceptionMapper;
import picocli.CommandLine.ParseResult;

/**
 * Maps failures of a report command to a one-line message and an exit code.
 */
public class ReportExceptionHandler implements IExecutionExceptionHandler, IExitCodeExceptionMapper {
    private static final Logger log = LogManager.getLogger(ReportExceptionHandler.class);

    public static CommandLine install(CommandLine commandLine) {
        ReportExceptionHandler handler = new ReportExceptionHandler();
        return commandLine.setExecutionExceptionHandler(handler).setExitCodeExceptionMapper(handler);
    }

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult)
            throws Exception {
        if (ex instanceof ConfigurationException || ex instanceof RemoteStateException) {
            log.debug("Report failed", ex);
            commandLine.getErr().println(commandLine.getColorScheme().errorText(ex.getMessage()));
            return getExitCode(ex);
        }
        throw ex;
    }

    @Override
    public int getExitCode(Throwable exception) {
        if (exception instanceof RemoteStateException) {
            return ExitCodes.REMOTE_ERROR;
        }
        return ExitCodes.CONFIGURATION_ERROR;
    }
}
