package com.scenecraft.core.output;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TreePrinter}.
 */
class TreePrinterTest {

    @Test
    void render_drawsBranches() {
        String tree = TreePrinter.render(SceneFixtures.study());

        assertThat(tree).contains("Scene: scene_20240301_083000");
        assertThat(tree).contains("├── desk [physical]\n");
        assertThat(tree).contains("│   ├── brush [item]\n");
        assertThat(tree).contains("│   └── inkstone [item]\n");
        assertThat(tree).contains("└── scholar [character]\n");
        assertThat(tree).contains("  Containers: 2");
    }
}
