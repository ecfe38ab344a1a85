package com.scenecraft.core.engine;

import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.NodeType;

/**
 * Decides whether a candidate node may enter the tree.
 *
 * <p>Checks run cheapest first, and the budget reservation runs last so that a
 * rejected candidate never consumes a slot. With cost control disabled every
 * candidate is accepted and merely counted.
 */
public final class AdmissionFilter {

    private final GeneratorConfig config;
    private final GenerationCounters counters;

    public AdmissionFilter(GeneratorConfig config, GenerationCounters counters) {
        this.config = config;
        this.counters = counters;
    }

    /**
     * Evaluates a candidate, reserving a budget slot when it is accepted.
     *
     * @param spec candidate node
     * @return verdict
     */
    public Admission evaluate(NodeSpec spec) {
        if (!config.costControl()) {
            counters.recordNode();
            return Admission.ACCEPTED;
        }
        int length = spec.descriptionLength();
        if (length < config.minDescriptionLength()) {
            return Admission.DESCRIPTION_TOO_SHORT;
        }
        if (isGenericItem(spec, length)) {
            return Admission.GENERIC_ITEM;
        }
        if (!counters.tryReserveNode(config.maxTotalNodes())) {
            return Admission.BUDGET_EXHAUSTED;
        }
        return Admission.ACCEPTED;
    }

    private boolean isGenericItem(NodeSpec spec, int descriptionLength) {
        boolean item = NodeType.parse(spec.nodeType()).orElse(NodeType.ITEM) == NodeType.ITEM;
        return item && config.isGenericItemName(spec.name()) && descriptionLength < config.genericDescriptionLength();
    }
}
