package com.benchy.queryplan.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered vendor-native fragments retained on a plan node (its "system
 * representation").
 *
 * <p>Fragments are opaque to the engine; they are kept for debugging and
 * display. Instances are immutable: fragments are copied on the way in and
 * {@link #fragments()} hands out copies, so nodes sharing a provenance never
 * observe each other's changes.
 */
public final class Provenance {

    /** Fragment of nodes the engine adds itself. */
    public static final JsonNode SYNTHETIC_MARKER = TextNode.valueOf("// added by benchy");

    private static final Provenance EMPTY = new Provenance(Collections.emptyList());
    private static final Provenance SYNTHETIC = new Provenance(List.of(SYNTHETIC_MARKER));

    private final List<JsonNode> fragments;

    private Provenance(List<JsonNode> fragments) {
        this.fragments = fragments;
    }

    public static Provenance empty() {
        return EMPTY;
    }

    public static Provenance synthetic() {
        return SYNTHETIC;
    }

    /**
     * Creates a provenance holding one fragment.
     *
     * @param fragment the vendor fragment, null yields an empty provenance
     */
    public static Provenance of(JsonNode fragment) {
        return fragment == null ? EMPTY : new Provenance(List.of(fragment.deepCopy()));
    }

    /**
     * Returns copies of the fragments, in order.
     */
    public List<JsonNode> fragments() {
        List<JsonNode> copies = new ArrayList<>(fragments.size());
        for (JsonNode fragment : fragments) {
            copies.add(fragment.deepCopy());
        }
        return Collections.unmodifiableList(copies);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    /**
     * Returns the provenance of a node that absorbed {@code removed}: the removed
     * node's fragments followed by this one's.
     *
     * @param removed the provenance of the node folded away
     * @return the combined provenance
     */
    public Provenance prependedWith(Provenance removed) {
        if (removed.isEmpty()) {
            return this;
        }
        List<JsonNode> combined = new ArrayList<>(removed.fragments.size() + fragments.size());
        combined.addAll(removed.fragments);
        combined.addAll(fragments);
        return new Provenance(Collections.unmodifiableList(combined));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Provenance other)) return false;
        return fragments.equals(other.fragments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fragments);
    }

    @Override
    public String toString() {
        return fragments.toString();
    }
}
