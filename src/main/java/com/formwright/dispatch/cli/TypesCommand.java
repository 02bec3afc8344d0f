package com.formwright.dispatch.cli;

import com.formwright.core.capability.CapabilityTable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: formwright types
 * <p>
 * Lists the field types the builder knows and the controls each one exposes.
 */
@Command(name = "types", mixinStandardHelpOptions = true, description = "List field types and their controls")
@Component
public class TypesCommand implements Runnable {

    private final CapabilityTable capabilities;

    public TypesCommand(CapabilityTable capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        capabilities.asMap().forEach((type, controls) ->
                System.out.printf("  %-18s %s%n", type, String.join(", ", controls)));
    }
}
