package com.example.accessmanager;

import com.example.accessmanager.cli.AccessManagerCommand;
import com.example.accessmanager.cli.ReportExceptionHandler;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AccessManagerApplication implements CommandLineRunner, ExitCodeGenerator {
    private final IFactory factory;
    private final AccessManagerCommand command;
    private int exitCode;

    public AccessManagerApplication(IFactory factory, AccessManagerCommand command) {
        this.factory = factory;
        this.command = command;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AccessManagerApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        exitCode = ReportExceptionHandler.install(new CommandLine(command, factory)).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
