package com.scenecraft.cli;

import com.scenecraft.core.example.ExampleScenes;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.output.SceneWriter;
import com.scenecraft.core.output.SceneWriters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to list the built-in example scenes or the available output formats.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * scenecraft list examples
 * scenecraft list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List example scenes or output formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: examples or formats",
        defaultValue = "examples"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "examples", "example" -> listExamples();
            case "formats", "format" -> listFormats();
            default -> {
                log.error("Unknown type: {}. Use: examples or formats", type);
                yield 1;
            }
        };
    }

    private int listExamples() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Examples:");
        out.println();
        for (Map.Entry<String, SceneContext> entry : ExampleScenes.load().all().entrySet()) {
            out.printf("  • %s%n", entry.getKey());
            out.printf("    Requirement: %s%n", entry.getValue().requirement());
            out.printf("    Era: %s%n", entry.getValue().era());
            out.println();
        }
        return 0;
    }

    private int listFormats() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Formats:");
        out.println();
        for (SceneWriter writer : SceneWriters.available()) {
            out.printf("  • %s (.%s)%n", writer.getId(), writer.getFileExtension());
        }
        return 0;
    }
}
