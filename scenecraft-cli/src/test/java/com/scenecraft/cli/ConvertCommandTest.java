package com.scenecraft.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConvertCommand}.
 */
class ConvertCommandTest {

    private static final String SCENE = """
        {"scene_id": "s1", "scene_name": "scene_20240301_083000",
         "context": {"script": "A scholar writes", "scene_requirement": "A study", "era": "Ming dynasty"},
         "root_nodes": [
           {"name": "desk", "node_type": "container", "container_type": "physical",
            "description": "A rosewood writing desk", "is_expanded": true,
            "children": [{"name": "brush", "node_type": "item", "description": "A wolf-hair brush"}]}
         ]}""";

    @TempDir
    Path tempDir;

    private Path input;

    @BeforeEach
    void setUp() throws Exception {
        input = tempDir.resolve("study.json");
        Files.writeString(input, SCENE);
    }

    @Test
    void call_defaultFormat_writesTextNextToInput() throws Exception {
        CommandRunner runner = new CommandRunner(new ConvertCommand());

        int exitCode = runner.run(input.toString());

        assertThat(exitCode).isZero();
        Path target = tempDir.resolve("study.txt");
        assertThat(Files.readString(target)).contains("【desk】").contains("  【brush】");
        assertThat(runner.out.toString()).contains("study.txt");
    }

    @Test
    void call_markdownToExplicitOutput_writesFile() throws Exception {
        Path target = tempDir.resolve("docs/study.md");

        int exitCode = new CommandRunner(new ConvertCommand())
            .run(input.toString(), "--format", "markdown", "--output", target.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(target)).startsWith("# Scene: scene_20240301_083000");
    }

    @Test
    void call_missingInput_returnsError() {
        CommandRunner runner = new CommandRunner(new ConvertCommand());

        int exitCode = runner.run(tempDir.resolve("nope.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(runner.err.toString()).contains("cannot read scene");
    }

    @Test
    void defaultTarget_replacesExtension() {
        Path target = ConvertCommand.defaultTarget(Path.of("scenes", "study.json"),
            com.scenecraft.core.output.SceneWriters.find("md").orElseThrow());

        assertThat(target).isEqualTo(Path.of("scenes", "study.md"));
    }
}
