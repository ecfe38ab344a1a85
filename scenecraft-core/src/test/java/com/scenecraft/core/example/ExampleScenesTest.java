package com.scenecraft.core.example;

import com.scenecraft.core.model.SceneContext;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExampleScenes}.
 */
class ExampleScenesTest {

    private final ExampleScenes examples = ExampleScenes.load();

    @Test
    void load_readsBundledScenesInFileOrder() {
        assertThat(examples.all().keySet())
            .containsExactly("ancient_study", "modern_office", "fantasy_tavern", "crime_scene");
    }

    @Test
    void find_knownName_returnsContext() {
        SceneContext study = examples.find("ancient_study").orElseThrow();

        assertThat(study.era()).isEqualTo("Ming dynasty");
        assertThat(study.requirement()).contains("ancient study");
    }

    @Test
    void find_unknownName_returnsEmpty() {
        assertThat(examples.find("space_station")).isEmpty();
    }
}
