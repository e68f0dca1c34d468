package org.bpmn2drawio;

import org.bpmn2drawio.bpmn.models.ValidationWarning;
import org.bpmn2drawio.layout.Direction;
import org.bpmn2drawio.layout.LayoutMode;
import org.bpmn2drawio.layout.PageSize;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * Usage:
 *   bpmn2drawio process.bpmn process.drawio
 *   bpmn2drawio process.bpmn process.drawio --theme blueprint --direction TB
 *   bpmn2drawio process.bpmn process.drawio --config theme.json --layout preserve
 *
 * Theme, layout and direction defaults can be set with the environment
 * variables BPMN2DRAWIO_THEME, BPMN2DRAWIO_LAYOUT and BPMN2DRAWIO_DIRECTION.
 */
@Command(
        name = "bpmn2drawio",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        version = "bpmn2drawio 1.0.0",
        description = "Convert a BPMN 2.0 file to a draw.io diagram"
)
public class Main implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<input>", description = "BPMN file to convert")
    private Path input;

    @Parameters(index = "1", paramLabel = "<output>", description = "draw.io file to write")
    private Path output;

    @Option(names = "--theme", paramLabel = "<name>",
            defaultValue = "${env:BPMN2DRAWIO_THEME:-default}",
            description = "default, blueprint, monochrome or high_contrast (default: ${DEFAULT-VALUE})")
    private String theme;

    @Option(names = "--config", paramLabel = "<file>", description = "JSON theme override document")
    private Path config;

    @Option(names = "--layout", paramLabel = "<mode>",
            defaultValue = "${env:BPMN2DRAWIO_LAYOUT:-auto}",
            description = "auto or preserve (default: ${DEFAULT-VALUE})")
    private String layout;

    @Option(names = "--direction", paramLabel = "<dir>",
            defaultValue = "${env:BPMN2DRAWIO_DIRECTION:-LR}",
            description = "LR, TB, RL or BT (default: ${DEFAULT-VALUE})")
    private String direction;

    @Option(names = "--page-size", paramLabel = "<size>", defaultValue = "auto",
            description = "A4, letter or auto (default: ${DEFAULT-VALUE})")
    private String pageSize;

    @Option(names = "--no-grid", description = "Hide the editor grid")
    private boolean noGrid;

    @Option(names = "--strict", description = "Also check the input against the BPMN 2.0 schema")
    private boolean strict;

    @Option(names = "-v", description = "Print a summary and debug output of the conversion")
    private boolean verbose;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            // read by slf4j-simple when the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        ConversionOptions options;
        try {
            options = ConversionOptions.builder()
                    .themeName(theme)
                    .themeOverridePath(config)
                    .layoutMode(LayoutMode.parse(layout))
                    .direction(Direction.parse(direction))
                    .pageSize(PageSize.parse(pageSize))
                    .grid(!noGrid)
                    .strictSchema(strict)
                    .build();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        ConversionResult result;
        try {
            result = new Converter(options).convertFile(input, output);
        } catch (ConversionException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        for (ValidationWarning warning : result.warnings()) {
            err.println("Warning: " + warning);
        }
        if (verbose) {
            out.printf("Converted %s -> %s: %d elements, %d flows, %d warning(s)%n",
                    input, output, result.elementCount(), result.flowCount(), result.warnings().size());
        }
        return 0;
    }
}
