package com.formwright.dispatch.cli;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.engine.BuildController;
import com.formwright.core.engine.MissingSpecificationException;
import com.formwright.core.engine.RunOptions;
import com.formwright.core.events.EventBus;
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
 * CLI command: formwright build &lt;spec.yaml&gt;...
 * <p>
 * Builds every activity in the given specification files, in file order.
 * Exits 0 when no activity failed, 1 when at least one did, 2 when the
 * specifications could not be read at all.
 */
@Command(name = "build", mixinStandardHelpOptions = true, description = "Build activities from specification files")
@Component
public class BuildCommand implements Callable<Integer> {

    static final int EXIT_INPUT_ERROR = 2;

    @Parameters(arity = "0..*", paramLabel = "SPEC", description = "YAML activity specification files")
    private List<Path> specFiles = new ArrayList<>();

    @Option(names = {"--watch", "-w"}, description = "Print build events as they happen")
    private boolean watch;

    @Option(names = "--no-retry", description = "Skip the retry passes for failed fields")
    private boolean noRetry;

    @Option(names = "--run-id", description = "Run id to use instead of a generated one")
    private String runId;

    private final SpecReader specReader;
    private final BuildController controller;
    private final EventBus eventBus;
    private final FormwrightProperties properties;

    public BuildCommand(SpecReader specReader, BuildController controller, EventBus eventBus,
                        FormwrightProperties properties) {
        this.specReader = specReader;
        this.controller = controller;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (specFiles.isEmpty()) {
            ConsoleOutput.error("No specification files given");
            return EXIT_INPUT_ERROR;
        }

        EventBus.Subscription subscription = null;
        try {
            var specs = specReader.read(specFiles);
            ConsoleOutput.info("Loaded " + specs.size() + " activit" + (specs.size() == 1 ? "y" : "ies")
                    + " from " + specFiles.size() + " file(s)");

            String id = runId != null && !runId.isBlank() ? runId : controller.generateRunId();
            if (watch) {
                subscription = eventBus.subscribe(id, ConsoleOutput::watchEvent);
            }
            var options = new RunOptions(properties.getRetry().isEnabled() && !noRetry);
            var summary = controller.run(id, specs, options);

            ConsoleOutput.summary(summary);
            if (summary.anyFailed()) {
                ConsoleOutput.error("One or more activities failed.");
            } else {
                ConsoleOutput.success("Run complete.");
            }
            return summary.exitCode();
        } catch (SpecParseException | MissingSpecificationException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_INPUT_ERROR;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
