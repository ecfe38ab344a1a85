package com.scenecraft.cli;

import com.scenecraft.core.output.SceneDocument;
import com.scenecraft.core.output.SceneJsonReader;
import com.scenecraft.core.output.SceneWriter;
import com.scenecraft.core.output.SceneWriters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to convert a saved JSON scene into another format.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * scenecraft convert scene.json --format text
 * scenecraft convert scene.json --format markdown --output scene.md
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert a saved JSON scene to markdown or text",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Scene JSON file")
    private Path input;

    @Option(names = {"-f", "--format"}, description = "Target format: json, markdown or text (default: ${DEFAULT-VALUE})")
    private String format = "text";

    @Option(names = {"-o", "--output"}, description = "Output file (default: input file with the format's extension)")
    private Path output;

    @Override
    public Integer call() {
        SceneWriter writer = SceneWriters.find(format).orElseThrow(() ->
            new ParameterException(spec.commandLine(), "Unknown output format: " + format));

        SceneDocument document;
        try {
            document = new SceneJsonReader().read(input);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: cannot read scene " + input + ": " + e.getMessage());
            return 1;
        }

        Path target = output != null ? output : defaultTarget(input, writer);
        try {
            writer.write(document, target);
        } catch (IllegalStateException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
        log.debug("Converted {} to {}", input, target);
        spec.commandLine().getOut().println("Converted " + input + " -> " + target);
        return 0;
    }

    static Path defaultTarget(Path input, SceneWriter writer) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return input.resolveSibling(base + "." + writer.getFileExtension());
    }
}
