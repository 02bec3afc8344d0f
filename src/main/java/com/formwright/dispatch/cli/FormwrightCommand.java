package com.formwright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: build, validate, types.
 */
@Command(
        name = "formwright",
        mixinStandardHelpOptions = true,
        version = "Formwright 0.1.0",
        description = "Builds form-builder activities from YAML specifications, proving every step",
        subcommands = {
                BuildCommand.class,
                ValidateCommand.class,
                TypesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FormwrightCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given
        spec.commandLine().usage(System.out);
    }
}
