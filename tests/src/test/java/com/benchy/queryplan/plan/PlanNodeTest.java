package com.benchy.queryplan.plan;

import com.benchy.queryplan.operator.CustomOperator;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.operator.EarlyProbe;
import com.benchy.queryplan.operator.Result;
import com.benchy.queryplan.operator.Select;
import com.benchy.queryplan.operator.TableScan;
import com.benchy.queryplan.test.TestBase;
import com.benchy.queryplan.test.TestCategories;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Plan node model")
public class PlanNodeTest extends TestBase {

    private static LeafNode scan(int id, long rows) {
        return new LeafNode(new TableScan(id), new Cardinality(rows, rows), Provenance.of(TextNode.valueOf("scan" + id)));
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        void leafHasNoChildren() {
            assertThat(scan(1, 10).children()).isEmpty();
            assertThat(scan(1, 10).nodeCount()).isEqualTo(1);
        }

        @Test
        void childrenAreReadOnly() {
            InnerNode select = new InnerNode(new Select(2), Cardinality.UNKNOWN, List.of(scan(1, 10)), Provenance.empty());

            assertThatThrownBy(() -> select.children().add(scan(3, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void onlyChildRequiresExactlyOne() {
            InnerNode empty = new InnerNode(new CustomOperator("Hash", 1), Cardinality.ZERO, List.of(), Provenance.empty());

            assertThatThrownBy(empty::onlyChild).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void nodeCountIncludesAllDescendants() {
            InnerNode root = new InnerNode(new Result(), Cardinality.ZERO,
                List.of(new InnerNode(new Select(1), Cardinality.ZERO, List.of(scan(2, 1), scan(3, 1)), Provenance.empty())),
                Provenance.synthetic());

            assertThat(root.nodeCount()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Copies and equality")
    class Copies {

        @Test
        @DisplayName("Deep copies are equal but share no node")
        void deepCopy() {
            InnerNode original = new InnerNode(new Select(1), new Cardinality(5L, 4L),
                List.of(scan(2, 10)), Provenance.empty());

            InnerNode copy = original.deepCopy();

            assertThat(copy).isEqualTo(original).isNotSameAs(original);
            assertThat(copy.onlyChild()).isEqualTo(original.onlyChild()).isNotSameAs(original.onlyChild());
            assertThat(copy.hashCode()).isEqualTo(original.hashCode());
        }

        @Test
        void cardinalityTakesPartInEquality() {
            assertThat(scan(1, 10)).isNotEqualTo(scan(1, 11));
        }

        @Test
        void withMethodsReturnNewNodes() {
            LeafNode node = scan(1, 10);

            PlanNode changed = node.withCardinality(Cardinality.ZERO);

            assertThat(changed).isNotSameAs(node);
            assertThat(node.exactCardinality()).isEqualTo(10L);
            assertThat(changed.exactCardinality()).isEqualTo(0L);
            assertThat(changed.provenance()).isSameAs(node.provenance());
        }
    }

    @Nested
    @DisplayName("Provenance")
    class ProvenanceTests {

        @Test
        @DisplayName("Removed fragments come first and nothing is dropped")
        void prependedWith() {
            Provenance removed = Provenance.of(TextNode.valueOf("a"));
            Provenance survivor = Provenance.of(TextNode.valueOf("b"));

            Provenance combined = survivor.prependedWith(removed);

            assertThat(combined.fragments()).containsExactly(TextNode.valueOf("a"), TextNode.valueOf("b"));
            assertThat(survivor.fragments()).containsExactly(TextNode.valueOf("b"));
        }

        @Test
        void emptyAndSynthetic() {
            assertThat(Provenance.of(null).isEmpty()).isTrue();
            assertThat(Provenance.synthetic().fragments()).containsExactly(Provenance.SYNTHETIC_MARKER);
            assertThat(Provenance.empty().prependedWith(Provenance.synthetic())).isEqualTo(Provenance.synthetic());
        }
    }

    @Nested
    @DisplayName("Cardinality")
    class CardinalityTests {

        @Test
        void positive() {
            assertThat(new Cardinality(0L, 3L).isPositive()).isTrue();
            assertThat(Cardinality.ZERO.isPositive()).isFalse();
            assertThat(Cardinality.UNKNOWN.isPositive()).isFalse();
        }

        @Test
        void withers() {
            assertThat(Cardinality.ZERO.withExact(7L)).isEqualTo(new Cardinality(0L, 7L));
            assertThat(Cardinality.ZERO.withEstimated(2.5)).isEqualTo(new Cardinality(2.5, 0L));
        }
    }

    @Test
    @DisplayName("QueryPlan exposes the vendor root below the synthetic Result")
    void realRoot() {
        LeafNode scan = scan(1, 3);
        QueryPlan plan = new QueryPlan("select 1", new InnerNode(new Result(), scan.cardinality(), List.of(scan), Provenance.synthetic()));

        assertThat(plan.realRoot()).isSameAs(scan);
        assertThatThrownBy(() -> new QueryPlan(null, scan)).isInstanceOf(NullPointerException.class);
    }

    @Nested
    @DisplayName("Copies are independent")
    class Independence {

        @Test
        @DisplayName("Mutating handed-out fragments leaves the nodes unchanged")
        void fragmentsAreCopies() {
            LeafNode original = new LeafNode(new TableScan(1), new Cardinality(5L, 5L),
                Provenance.of(json("{\"tablename\": \"nation\"}")));
            LeafNode copy = original.deepCopy();

            ((ObjectNode) copy.provenance().fragments().get(0)).put("tablename", "region");

            assertThat(original.provenance().fragments().get(0).get("tablename").asText()).isEqualTo("nation");
            assertThat(copy.provenance().fragments().get(0).get("tablename").asText()).isEqualTo("nation");
            assertThat(copy).isEqualTo(original);
        }

        @Test
        void fragmentListIsReadOnly() {
            assertThatThrownBy(() -> scan(1, 10).provenance().fragments().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Early probe source is handed out as a copy")
        void earlyProbeSourceIsCopy() {
            EarlyProbe probe = new EarlyProbe(3);
            probe.fill(json("{\"source\": {\"operatorId\": 7}}"), DBMSType.UMBRA);

            ((ObjectNode) probe.source()).put("operatorId", 8);

            assertThat(probe.source().get("operatorId").asInt()).isEqualTo(7);
        }
    }
}
