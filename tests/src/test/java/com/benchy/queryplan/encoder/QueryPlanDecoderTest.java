package com.benchy.queryplan.encoder;

import com.benchy.queryplan.clean.Cleaners;
import com.benchy.queryplan.config.PlanFormat;
import com.benchy.queryplan.exception.PlanEncodingException;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.parser.PlanParsers;
import com.benchy.queryplan.plan.PlanNode;
import com.benchy.queryplan.plan.QueryPlan;
import com.benchy.queryplan.test.TestBase;
import com.benchy.queryplan.test.TestCategories;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Encoder
@DisplayName("Query plan decoder")
public class QueryPlanDecoderTest extends TestBase {

    private final QueryPlanEncoder encoder = new QueryPlanEncoder();
    private final QueryPlanDecoder decoder = new QueryPlanDecoder();

    private static List<String> labels(EncodedPlanNode node) {
        List<String> labels = new ArrayList<>();
        labels.add(node.label());
        for (EncodedPlanNode child : node.children()) {
            labels.addAll(labels(child));
        }
        return labels;
    }

    private static List<String> labels(PlanNode root) {
        return preOrder(root).stream().map(n -> n.operator().operatorType().name()).toList();
    }

    @ParameterizedTest(name = "{0} {1} as {2}")
    @CsvSource({
        "UMBRA, umbra/magic.json, JSON",
        "UMBRA, umbra/magic.json, XML",
        "HYPER, hyper/shared_pipeline.json, JSON",
        "POSTGRES, postgres/cte.json, XML",
        "DUCKDB, duckdb/top_n_join.json, JSON",
        "DUCKDB, duckdb/top_n_join.json, XML"
    })
    @DisplayName("Decoding keeps node count, labels and child order")
    void structurePreserved(DBMSType dbms, String fixture, PlanFormat format) {
        QueryPlan plan = Cleaners.forDbms(dbms).clean(PlanParsers.forDbms(dbms).parse("select\n  1", loadPlan(fixture)));

        EncodedQueryPlan decoded = decoder.decode(encoder.encode(plan, format));

        assertThat(decoded.queryText()).isEqualTo("select 1");
        assertThat(decoded.plan().nodeCount()).isEqualTo(plan.plan().nodeCount());
        assertThat(labels(decoded.plan())).isEqualTo(labels(plan.plan()));
    }

    @Test
    @DisplayName("JSON attributes keep their scalar types")
    void jsonAttributeTypes() {
        QueryPlan plan = PlanParsers.forDbms(DBMSType.UMBRA).parse("q", loadPlan("umbra/tablescan.json"));

        EncodedPlanNode scan = decoder.decode(encoder.encode(plan, PlanFormat.JSON)).plan().children().get(0);

        assertThat(scan.attrs())
            .containsEntry("operator_id", 1L)
            .containsEntry("table_name", "customer")
            .containsEntry("exact_cardinality", 150000L);
        assertThat(scan.attrs().keySet().iterator().next()).isEqualTo("operator_id");
    }

    @Test
    @DisplayName("XML attributes are read as strings")
    void xmlAttributesAreStrings() {
        QueryPlan plan = PlanParsers.forDbms(DBMSType.UMBRA).parse("q", loadPlan("umbra/tablescan.json"));

        EncodedPlanNode scan = decoder.decode(encoder.encode(plan, PlanFormat.XML)).plan().children().get(0);

        assertThat(scan.label()).isEqualTo("TableScan");
        assertThat(scan.attrs())
            .containsEntry("operator_id", "1")
            .containsEntry("table_name", "customer");
    }

    @Test
    void decodedTreeIsImmutable() {
        QueryPlan plan = PlanParsers.forDbms(DBMSType.HYPER).parse("q", loadPlan("hyper/tablescan.json"));

        EncodedPlanNode root = decoder.decode(encoder.encode(plan, PlanFormat.JSON)).plan();

        assertThatThrownBy(() -> root.attrs().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> root.children().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Malformed documents are rejected")
    void malformedDocuments() {
        assertThatThrownBy(() -> decoder.decode("{not json"))
            .isInstanceOf(PlanEncodingException.class);
        assertThatThrownBy(() -> decoder.decode("{\"queryText\": \"q\"}"))
            .isInstanceOf(PlanEncodingException.class)
            .hasMessageContaining("queryPlan");
        assertThatThrownBy(() -> decoder.decode("{\"queryText\": \"q\", \"queryPlan\": {\"_attrs\": {}}}"))
            .isInstanceOf(PlanEncodingException.class)
            .hasMessageContaining("_label");
        assertThatThrownBy(() -> decoder.decode("{\"queryText\": \"q\", \"queryPlan\": \"<Result>\"}"))
            .isInstanceOf(PlanEncodingException.class);
    }
}
