package com.benchy.queryplan.test;

import com.benchy.queryplan.plan.InnerNode;
import com.benchy.queryplan.plan.PlanNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for plan translation tests.
 *
 * <p>Loads captured explain outputs from {@code plans/<vendor>/} on the test
 * classpath and offers helpers for inspecting canonical trees.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected static final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUpBase(TestInfo testInfo) {
        logger.debug("Running {}", testInfo.getDisplayName());
        doSetUp();
    }

    /**
     * Per-test setup hook for subclasses.
     */
    protected void doSetUp() {
    }

    /**
     * Reads a fixture from {@code plans/<path>}.
     *
     * @param path the fixture path, e.g. {@code "umbra/tablescan.json"}
     * @return the file content
     */
    protected static String loadPlan(String path) {
        String resource = "/plans/" + path;
        try (InputStream in = TestBase.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test fixture " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read test fixture " + resource, e);
        }
    }

    protected static JsonNode json(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid JSON in test: " + text, e);
        }
    }

    /**
     * Returns the nodes of a tree in pre-order.
     */
    protected static List<PlanNode> preOrder(PlanNode root) {
        List<PlanNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(PlanNode node, List<PlanNode> nodes) {
        nodes.add(node);
        for (PlanNode child : node.children()) {
            collect(child, nodes);
        }
    }

    /**
     * Returns the nodes of a tree matching a condition, in pre-order.
     */
    protected static List<PlanNode> find(PlanNode root, Predicate<PlanNode> condition) {
        List<PlanNode> matches = new ArrayList<>();
        for (PlanNode node : preOrder(root)) {
            if (condition.test(node)) {
                matches.add(node);
            }
        }
        return matches;
    }

    protected static InnerNode inner(PlanNode node) {
        if (!(node instanceof InnerNode inner)) {
            throw new AssertionError("Expected an inner node but was " + node);
        }
        return inner;
    }
}
