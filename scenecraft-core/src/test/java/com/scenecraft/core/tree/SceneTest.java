package com.scenecraft.core.tree;

import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.TreeStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Scene}.
 */
class SceneTest {

    private final AtomicInteger ids = new AtomicInteger();
    private final NodeFactory factory = new NodeFactory(5, () -> "id" + ids.incrementAndGet(), Clock.systemUTC(), null);
    private final TreeMutator mutator = new TreeMutator(factory, UpdatePolicy.defaults());
    private final Scene scene = new Scene("s1", "scene_test", SceneContext.of("script", "requirement"));

    @BeforeEach
    void setUp() {
        ContainerNode room = add(null, NodeSpec.container("room", ContainerType.PHYSICAL, "A study")).asContainer();
        ContainerNode desk = add(room, NodeSpec.container("desk", ContainerType.PHYSICAL, "A desk")).asContainer();
        add(desk, NodeSpec.item("pen", "A pen"));
        add(room, NodeSpec.item("pen", "Another pen"));
        add(null, NodeSpec.container("mood", ContainerType.ABSTRACT, "Loneliness"));
        desk.markExpanded();
    }

    private SceneNode add(ContainerNode parent, NodeSpec spec) {
        SceneNode node = factory.create(spec);
        mutator.insert(scene, parent, node);
        return node;
    }

    @Test
    void flatten_returnsPreorder() {
        assertThat(scene.flatten()).extracting(SceneNode::fullPath)
            .containsExactly("room", "room/desk", "room/desk/pen", "room/pen", "mood");
    }

    @Test
    void calculateStatistics_countsFromFullWalk() {
        assertThat(scene.statistics()).isEqualTo(TreeStatistics.empty());

        TreeStatistics stats = scene.calculateStatistics();

        assertThat(stats).isEqualTo(new TreeStatistics(2, 3, 2));
        assertThat(stats.totalNodes()).isEqualTo(scene.nodeCount());
        assertThat(scene.statistics()).isEqualTo(stats);
    }

    @Test
    void findFirstByName_returnsPreorderFirstMatch() {
        assertThat(scene.findFirstByName("pen").orElseThrow().fullPath()).isEqualTo("room/desk/pen");
        assertThat(scene.findFirstByName("lamp")).isEmpty();
    }

    @Test
    void unexpandedContainers_excludesExpandedOnes() {
        assertThat(scene.unexpandedContainers()).extracting(SceneNode::name).containsExactly("room", "mood");
    }

    @Test
    void contains_checksIdentity() {
        SceneNode lookalike = factory.create(NodeSpec.item("pen", "A pen"));

        assertThat(scene.contains(lookalike)).isFalse();
        assertThat(scene.contains(scene.roots().get(0))).isTrue();
    }
}
