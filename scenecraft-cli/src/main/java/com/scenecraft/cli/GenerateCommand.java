package com.scenecraft.cli;

import com.scenecraft.core.config.ConfigLoader;
import com.scenecraft.core.config.SceneCraftConfig;
import com.scenecraft.core.engine.GenerationResult;
import com.scenecraft.core.engine.GeneratorConfig;
import com.scenecraft.core.engine.SceneGenerator;
import com.scenecraft.core.event.CompositeEventSink;
import com.scenecraft.core.event.GenerationEventSink;
import com.scenecraft.core.event.JsonLinesEventSink;
import com.scenecraft.core.event.Slf4jEventSink;
import com.scenecraft.core.example.ExampleScenes;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.output.SceneDocument;
import com.scenecraft.core.output.SceneWriter;
import com.scenecraft.core.output.SceneWriters;
import com.scenecraft.core.output.TreePrinter;
import com.scenecraft.core.service.SceneService;
import com.scenecraft.core.service.impl.AiClientConfig;
import com.scenecraft.core.service.impl.DeepSeekSceneService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command to generate a scene.
 *
 * <p>Without {@code --rounds} every container is expanded down to the depth limit;
 * with it, the analyze/optimize/prune/expand loop runs until the scene is judged
 * complete or a limit is hit. Command-line options override {@code scenecraft.yaml}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * scenecraft generate --example crime_scene --rounds --max-rounds 3
 * scenecraft generate --script "..." --requirement "..." --era "Ming dynasty" --output study.md --format markdown
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate a scene tree for a script",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--example", description = "Built-in example scene to generate")
    private String example;

    @Option(names = "--script", description = "Script or story excerpt")
    private String script;

    @Option(names = "--requirement", description = "What the scene must contain or convey")
    private String requirement;

    @Option(names = "--era", description = "Era of the scene (default: ${DEFAULT-VALUE})", defaultValue = SceneContext.DEFAULT_ERA)
    private String era;

    @Option(names = "--location", description = "Where the scene takes place")
    private String location;

    @Option(names = "--atmosphere", description = "Mood of the scene")
    private String atmosphere;

    @Option(names = "--style", description = "Visual or narrative style")
    private String style;

    @Option(names = "--rounds", description = "Use the round-based refinement loop")
    private boolean rounds;

    @Option(names = "--max-depth", description = "Maximum expansion depth")
    private Integer maxDepth;

    @Option(names = "--max-rounds", description = "Maximum number of rounds")
    private Integer maxRounds;

    @Option(names = "--threshold", description = "Completeness score (0-100) that ends the loop")
    private Integer threshold;

    @Option(names = "--min-nodes", description = "Minimum net new nodes per round")
    private Integer minNodes;

    @Option(names = "--concurrent", description = "Maximum concurrent model calls")
    private Integer concurrent;

    @Option(names = "--max-nodes", description = "Total node budget")
    private Integer maxNodes;

    @Option(names = "--no-cost-control", description = "Accept every generated node")
    private boolean noCostControl;

    @Option(names = "--no-parallel", description = "Expand containers one at a time")
    private boolean noParallel;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "File to save the scene to")
    private Path output;

    @Option(names = {"-f", "--format"}, description = "Output format: json, markdown or text")
    private String format;

    @Option(names = "--event-log", description = "Append structured generation events (JSON lines) to this file")
    private Path eventLog;

    private final Function<AiClientConfig, SceneService> serviceFactory;

    public GenerateCommand() {
        this(DeepSeekSceneService::create);
    }

    GenerateCommand(Function<AiClientConfig, SceneService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SceneContext context = resolveContext();
        SceneCraftConfig config = ConfigLoader.load(configPath);
        GeneratorConfig generatorConfig = generatorConfig(config);

        SceneWriter writer = null;
        if (output != null) {
            String formatId = format != null ? format : config.output().format();
            writer = SceneWriters.find(formatId).orElseThrow(() ->
                new ParameterException(spec.commandLine(), "Unknown output format: " + formatId));
        }

        SceneService service;
        try {
            service = serviceFactory.apply(config.ai().toClientConfig());
        } catch (IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        GenerationResult result;
        try (JsonLinesEventSink fileSink = eventLog == null ? null : JsonLinesEventSink.open(eventLog);
             SceneGenerator generator = new SceneGenerator(service, generatorConfig, eventSink(fileSink))) {
            log.info("Generating scene ({} mode)", rounds ? "rounds" : "exhaustive");
            result = rounds ? generator.generateWithRounds(context) : generator.generate(context);
        } catch (IOException e) {
            err.println("Error: cannot use event log " + eventLog + ": " + e.getMessage());
            return 1;
        }

        out.println(TreePrinter.render(result.scene()));
        out.println(result.stats().getSummary());
        out.println("Stopped: " + result.stopReason());

        if (writer != null) {
            try {
                writer.write(SceneDocument.of(result), output);
                out.println("Scene saved to: " + output);
            } catch (IllegalStateException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private SceneContext resolveContext() {
        if (example != null) {
            ExampleScenes examples = ExampleScenes.load();
            return examples.find(example).orElseThrow(() -> new ParameterException(spec.commandLine(),
                "Unknown example: " + example + ". Available: " + String.join(", ", examples.all().keySet())));
        }
        if (script == null || script.isBlank() || requirement == null || requirement.isBlank()) {
            throw new ParameterException(spec.commandLine(), "Either --example or both --script and --requirement are required");
        }
        return new SceneContext(script, requirement, era, location, atmosphere, style, Map.of());
    }

    GeneratorConfig generatorConfig(SceneCraftConfig config) {
        GeneratorConfig.Builder builder = config.generator().applyTo(GeneratorConfig.builder());
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (maxRounds != null) {
            builder.maxRounds(maxRounds);
        }
        if (threshold != null) {
            builder.completenessThreshold(threshold);
        }
        if (minNodes != null) {
            builder.minNewNodesPerRound(minNodes);
        }
        if (concurrent != null) {
            builder.maxConcurrent(concurrent);
        }
        if (maxNodes != null) {
            builder.maxTotalNodes(maxNodes);
        }
        if (noCostControl) {
            builder.costControl(false);
        }
        if (noParallel) {
            builder.parallelExpansion(false);
        }
        return builder.build();
    }

    private static GenerationEventSink eventSink(JsonLinesEventSink fileSink) {
        Slf4jEventSink logSink = new Slf4jEventSink();
        return fileSink == null ? logSink : CompositeEventSink.of(logSink, fileSink);
    }
}
