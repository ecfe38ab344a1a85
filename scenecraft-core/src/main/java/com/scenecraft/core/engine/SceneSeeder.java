package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.service.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Creates the root nodes of a scene with a single service call.
 *
 * <p>Seed nodes bypass the admission filter but count towards the node budget.
 */
final class SceneSeeder {

    private static final Logger log = LoggerFactory.getLogger(SceneSeeder.class);

    /**
     * Seeds the scene of the given run.
     *
     * @param run current run
     * @return number of root nodes inserted
     */
    int seed(GenerationRun run) {
        List<NodeSpec> specs;
        try {
            run.counters().recordAiCall();
            specs = run.service().generateInitialNodes(run.context());
        } catch (ServiceException | RuntimeException e) {
            log.error("Failed to generate initial nodes: {}", e.getMessage());
            run.emit(GenerationEventType.EXPANSION_FAILED, "Seed call failed", Map.of("error", String.valueOf(e.getMessage())));
            return 0;
        }

        int inserted = 0;
        for (NodeSpec spec : specs == null ? List.<NodeSpec>of() : specs) {
            if (run.insertRoot(spec) != null) {
                run.counters().recordNode();
                inserted++;
            }
        }
        log.info("Seeded scene '{}' with {} root node(s)", run.scene().name(), inserted);
        run.emit(GenerationEventType.SEEDED, "Seeded " + inserted + " root node(s)", Map.of("roots", inserted));
        return inserted;
    }
}
