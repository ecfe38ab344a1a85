package com.scenecraft.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void call_default_listsExamples() {
        CommandRunner runner = new CommandRunner(new ListCommand());

        assertThat(runner.run()).isZero();
        assertThat(runner.out.toString())
            .contains("Available Examples:")
            .contains("ancient_study")
            .contains("Era: Ming dynasty");
    }

    @Test
    void call_formats_listsWriters() {
        CommandRunner runner = new CommandRunner(new ListCommand());

        assertThat(runner.run("formats")).isZero();
        assertThat(runner.out.toString()).contains("json (.json)").contains("markdown (.md)").contains("text (.txt)");
    }

    @Test
    void call_unknownType_returnsError() {
        assertThat(new CommandRunner(new ListCommand()).run("plugins")).isEqualTo(1);
    }
}
