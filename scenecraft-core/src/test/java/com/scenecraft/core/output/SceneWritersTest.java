package com.scenecraft.core.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SceneWriters}.
 */
class SceneWritersTest {

    @Test
    void available_discoversAllWriters() {
        assertThat(SceneWriters.available()).extracting(SceneWriter::getId)
            .containsExactly("json", "markdown", "text");
    }

    @ParameterizedTest
    @CsvSource({"json,json", "markdown,md", "MD,md", "txt,txt", "text,txt"})
    void find_idOrAlias_returnsWriter(String id, String extension) {
        assertThat(SceneWriters.find(id).orElseThrow().getFileExtension()).isEqualTo(extension);
    }

    @Test
    void find_unknownId_returnsEmpty() {
        assertThat(SceneWriters.find("pdf")).isEmpty();
    }
}
