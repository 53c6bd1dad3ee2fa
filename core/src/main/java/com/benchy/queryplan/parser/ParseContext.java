package com.benchy.queryplan.parser;

import com.benchy.queryplan.plan.PlanNode;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * State of a single parse call: the shared-pipeline table, the ids of shared
 * pipelines already attached, the number of references left for the attachment
 * pass, and the counter used to synthesize operator ids.
 *
 * <p>Created by {@link AbstractPlanParser#parse} and dropped when it returns.
 */
final class ParseContext {

    private final Map<Integer, PlanNode> sharedPipelines = new HashMap<>();
    private final Map<String, Integer> namedSharedPipelines = new HashMap<>();
    private final Set<Integer> attached = new HashSet<>();
    private int deferredReferences;
    private int attachments;
    private int nextOperatorId;

    int nextOperatorId() {
        return nextOperatorId++;
    }

    void registerSharedPipeline(int id, PlanNode subtree) {
        sharedPipelines.put(id, subtree);
    }

    void registerSharedPipeline(String name, int id, PlanNode subtree) {
        namedSharedPipelines.put(name, id);
        sharedPipelines.put(id, subtree);
    }

    PlanNode sharedPipeline(Integer id) {
        return id == null ? null : sharedPipelines.get(id);
    }

    Integer sharedPipelineId(String name) {
        return namedSharedPipelines.get(name);
    }

    int sharedPipelineCount() {
        return sharedPipelines.size();
    }

    /**
     * Records that the subtree with the given id is attached below a scan.
     *
     * @return true if this is its first attachment
     */
    boolean markAttached(int id) {
        attachments++;
        return attached.add(id);
    }

    boolean isAttached(int id) {
        return attached.contains(id);
    }

    void deferReference() {
        deferredReferences++;
    }

    boolean hasDeferredReferences() {
        return deferredReferences > 0;
    }

    int deferredReferences() {
        return deferredReferences;
    }

    int attachments() {
        return attachments;
    }
}
