package com.scenecraft.cli;

import com.scenecraft.core.config.ConfigLoader;
import com.scenecraft.core.config.SceneCraftConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to write a starter {@code scenecraft.yaml} with every default spelled out.
 */
@Command(
    name = "init",
    description = "Write a default scenecraft.yaml",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    static final String HEADER = """
        # SceneCraft configuration
        # The API key is read from the environment variable named by ai.apiKeyEnv.
        """;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-o", "--output"}, description = "Configuration file to write (default: ${DEFAULT-VALUE})")
    private Path target = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = "--force", description = "Overwrite an existing file")
    private boolean force;

    @Override
    public Integer call() {
        if (Files.exists(target) && !force) {
            spec.commandLine().getErr().println("Error: " + target + " already exists (use --force to overwrite)");
            return 1;
        }
        try {
            String yaml = HEADER + ConfigLoader.toYaml(SceneCraftConfig.template());
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, yaml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: cannot write " + target + ": " + e.getMessage());
            return 1;
        }
        log.info("Wrote configuration to {}", target);
        spec.commandLine().getOut().println("Created " + target);
        return 0;
    }
}
