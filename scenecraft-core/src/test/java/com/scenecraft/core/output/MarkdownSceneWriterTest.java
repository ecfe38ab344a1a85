package com.scenecraft.core.output;

import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.tree.Scene;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MarkdownSceneWriter}.
 */
class MarkdownSceneWriterTest {

    private final MarkdownSceneWriter writer = new MarkdownSceneWriter();

    @Test
    void render_listsStructureWithTypes() {
        String md = writer.render(SceneDocument.of(SceneFixtures.study()));

        assertThat(md).startsWith("# Scene: scene_20240301_083000");
        assertThat(md).contains("- **Era**: Ming dynasty");
        assertThat(md).doesNotContain("**Style**");
        assertThat(md).contains("- **desk** [container-physical]\n  - Description: A rosewood writing desk\n");
        assertThat(md).contains("  - **brush** [item]\n");
        assertThat(md).contains("- **scholar** [container-character]");
        assertThat(md).contains("- Items: 2").doesNotContain("## Rounds");
    }

    @Test
    void render_withRounds_addsTable() {
        Scene scene = SceneFixtures.study();
        SceneDocument document = new SceneDocument(scene,
            new GenerationStats(3, 4, 1, Duration.ZERO, scene.calculateStatistics()),
            List.of(new RoundInfo(0, List.of(), 2, 2, "", 0, List.of(), List.of()),
                new RoundInfo(1, List.of("desk"), 2, 2, "", 80, List.of(), List.of())),
            StopReason.COMPLETENESS_REACHED);

        String md = writer.render(document);

        assertThat(md).contains("- AI calls: 3").contains("- Stop reason: COMPLETENESS_REACHED");
        assertThat(md).contains("## Rounds").contains("| 1 | 1 | 2 | 2 | 80 |");
    }
}
