package com.benchy.queryplan.encoder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of an encoded plan read back from an interchange document.
 *
 * @param label the operator type name
 * @param attrs the node attributes, in document order
 * @param children the encoded children, in order
 */
public record EncodedPlanNode(String label, Map<String, Object> attrs, List<EncodedPlanNode> children) {

    public EncodedPlanNode {
        attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
        children = List.copyOf(children);
    }

    public int nodeCount() {
        int count = 1;
        for (EncodedPlanNode child : children) {
            count += child.nodeCount();
        }
        return count;
    }
}
