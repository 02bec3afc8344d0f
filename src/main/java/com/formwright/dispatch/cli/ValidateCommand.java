package com.formwright.dispatch.cli;

import com.formwright.core.capability.CapabilityTable;
import com.formwright.core.model.ActivitySpec;
import com.formwright.core.spec.SpecParseException;
import com.formwright.core.spec.SpecReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: formwright validate &lt;spec.yaml&gt;...
 * <p>
 * Parses specifications without touching a surface and reports field types or
 * properties the builder does not offer.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check specification files without building")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "SPEC", description = "YAML activity specification files")
    private List<Path> specFiles = new ArrayList<>();

    @Option(names = "--strict", description = "Treat warnings as failures")
    private boolean strict;

    private final SpecReader specReader;
    private final CapabilityTable capabilities;

    public ValidateCommand(SpecReader specReader, CapabilityTable capabilities) {
        this.specReader = specReader;
        this.capabilities = capabilities;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<ActivitySpec> specs;
        try {
            specs = specReader.read(specFiles);
        } catch (SpecParseException e) {
            ConsoleOutput.error(e.getMessage());
            return BuildCommand.EXIT_INPUT_ERROR;
        }

        var warnings = new ArrayList<String>();
        for (var spec : specs) {
            System.out.println(spec.code() + "  " + spec.title() + "  (" + spec.fieldCount() + " fields)");
            for (var section : spec.sections()) {
                System.out.println("  " + section.title());
                for (var field : section.fields()) {
                    System.out.println("    - " + field.key() + " [" + field.typeKey() + "]");
                    warnings.addAll(check(spec, field.typeKey(), field.key(), field.properties().keySet()));
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        warnings.forEach(ConsoleOutput::warn);
        if (warnings.isEmpty()) {
            ConsoleOutput.success(specs.size() + " specification(s) valid");
            return 0;
        }
        ConsoleOutput.info(warnings.size() + " warning(s)");
        return strict ? 1 : 0;
    }

    private List<String> check(ActivitySpec spec, String typeKey, String fieldKey, Iterable<String> properties) {
        var warnings = new ArrayList<String>();
        if (!capabilities.isKnownType(typeKey)) {
            warnings.add(spec.code() + "/" + fieldKey + ": unknown field type '" + typeKey + "'");
            return warnings;
        }
        for (String property : properties) {
            if (!capabilities.supports(typeKey, property)) {
                warnings.add(spec.code() + "/" + fieldKey + ": " + typeKey
                        + " has no '" + property + "' control; it will be skipped");
            }
        }
        return warnings;
    }
}
