package com.benchy.queryplan.clean;

import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.operator.CustomOperator;
import com.benchy.queryplan.operator.DBMSType;
import com.benchy.queryplan.operator.Join;
import com.benchy.queryplan.operator.OperatorType;
import com.benchy.queryplan.operator.Sort;
import com.benchy.queryplan.operator.TableScan;
import com.benchy.queryplan.parser.PlanParsers;
import com.benchy.queryplan.plan.Cardinality;
import com.benchy.queryplan.plan.PlanNode;
import com.benchy.queryplan.plan.QueryPlan;
import com.benchy.queryplan.test.TestBase;
import com.benchy.queryplan.test.TestCategories;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Cleaner
@DisplayName("Vendor cleaners")
public class VendorCleanerTest extends TestBase {

    private static final Set<OperatorType> SEMANTIC_TYPES =
        EnumSet.of(OperatorType.Join, OperatorType.TableScan, OperatorType.GroupBy, OperatorType.GroupJoin);

    private static QueryPlan parse(DBMSType dbms, String fixture) {
        return PlanParsers.forDbms(dbms).parse("q", loadPlan(fixture));
    }

    private static QueryPlan parse(DBMSType dbms, String fixture, boolean duplicate) {
        ParserOptions options = ParserOptions.builder().duplicateSharedPipelines(duplicate).build();
        return PlanParsers.forDbms(dbms, options).parse("q", loadPlan(fixture));
    }

    private static List<Integer> fragmentIds(PlanNode node, String field) {
        return node.provenance().fragments().stream()
            .map((JsonNode fragment) -> fragment.get(field).asInt())
            .toList();
    }

    private static long count(PlanNode root, OperatorType type) {
        return find(root, n -> n.operator().operatorType() == type).size();
    }

    @Nested
    @DisplayName("Umbra")
    class Umbra {

        @Test
        @DisplayName("Maps and filters fold into the join and the scan")
        void foldsMapAndFilters() {
            QueryPlan plan = parse(DBMSType.UMBRA, "umbra/cleanup.json");
            assertThat(plan.plan().nodeCount()).isEqualTo(7);

            QueryPlan cleaned = Cleaners.forDbms(DBMSType.UMBRA).clean(plan);

            assertThat(cleaned.plan().nodeCount()).isEqualTo(4);
            assertThat(cleaned.text()).isEqualTo(plan.text());
            PlanNode join = cleaned.realRoot();
            assertThat(join.operator()).isInstanceOf(Join.class);
            assertThat(join.cardinality()).isEqualTo(new Cardinality(40L, 42L));
            assertThat(fragmentIds(join, "operatorId")).containsExactly(1, 2, 3);

            PlanNode nation = join.children().get(1);
            assertThat(nation.operator()).isInstanceOfSatisfying(TableScan.class,
                t -> assertThat(t.tableName()).isEqualTo("nation"));
            assertThat(nation.cardinality()).isEqualTo(new Cardinality(12L, 10L));
            assertThat(fragmentIds(nation, "operatorId")).containsExactly(5, 6);
        }

        @Test
        @DisplayName("The parsed plan is left untouched")
        void inputUnchanged() {
            QueryPlan plan = parse(DBMSType.UMBRA, "umbra/cleanup.json");
            QueryPlan copy = new QueryPlan(plan.text(), plan.plan().deepCopy());

            Cleaners.forDbms(DBMSType.UMBRA).clean(plan);

            assertThat(plan).isEqualTo(copy);
        }

        @ParameterizedTest(name = "duplicate={0}")
        @CsvSource({"false, 1", "true, 2"})
        @DisplayName("Shared pipelines below their scans are zeroed")
        void sharedPipelineZeroed(boolean duplicate, int attached) {
            QueryPlan cleaned = Cleaners.forDbms(DBMSType.UMBRA)
                .clean(parse(DBMSType.UMBRA, "umbra/shared_pipeline.json", duplicate));

            List<PlanNode> scans = find(cleaned.plan(),
                n -> n.operator().operatorType() == OperatorType.PipelineBreakerScan && !n.children().isEmpty());
            assertThat(scans).hasSize(attached);
            for (PlanNode scan : scans) {
                assertThat(scan.cardinality()).isEqualTo(new Cardinality(50L, 50L));
                PlanNode groupBy = scan.children().get(0);
                assertThat(groupBy.operator().operatorType()).isEqualTo(OperatorType.GroupBy);
                assertThat(groupBy.cardinality()).isEqualTo(Cardinality.ZERO);
                assertThat(groupBy.children().get(0).exactCardinality()).isEqualTo(25L);
            }
        }
    }

    @Nested
    @DisplayName("Hyper")
    class Hyper {

        @Test
        @DisplayName("A map inside a shared pipeline folds before the pipeline is zeroed")
        void mapFoldedThenZeroed() {
            QueryPlan cleaned = Cleaners.forDbms(DBMSType.HYPER)
                .clean(parse(DBMSType.HYPER, "hyper/shared_pipeline.json"));

            PlanNode join = cleaned.realRoot();
            PlanNode scan = join.children().get(0);
            assertThat(scan.operator().operatorType()).isEqualTo(OperatorType.PipelineBreakerScan);
            PlanNode table = scan.children().get(0);
            assertThat(table.operator()).isInstanceOf(TableScan.class);
            assertThat(table.cardinality()).isEqualTo(Cardinality.ZERO);
            assertThat(fragmentIds(table, "operatorId")).containsExactly(10, 11);
            assertThat(cleaned.plan().nodeCount()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("DuckDB")
    class DuckDB {

        @Test
        @DisplayName("Joins are normalized, projections and filters folded, TopN renamed")
        void topNJoin() {
            QueryPlan plan = parse(DBMSType.DUCKDB, "duckdb/top_n_join.json");

            QueryPlan cleaned = Cleaners.forDbms(DBMSType.DUCKDB).clean(plan);

            assertThat(cleaned.plan().nodeCount()).isEqualTo(5);
            PlanNode sort = cleaned.realRoot();
            assertThat(sort.operator()).isEqualTo(new Sort(0, 10L));

            PlanNode join = sort.children().get(0);
            assertThat(join.operator()).isInstanceOfSatisfying(Join.class,
                j -> assertThat(j.childOrder()).isEqualTo(Join.ChildOrder.CANONICAL));
            assertThat(join.cardinality()).isEqualTo(new Cardinality(650L, 600L));
            assertThat(join.provenance().fragments())
                .extracting(f -> f.get("operator_type").asText())
                .containsExactly("PROJECTION", "HASH_JOIN");

            PlanNode orders = join.children().get(0);
            assertThat(((TableScan) orders.operator()).tableName()).isEqualTo("orders");
            assertThat(orders.cardinality()).isEqualTo(new Cardinality(300L, 150L));
            assertThat(orders.provenance().fragments())
                .extracting(f -> f.get("operator_type").asText())
                .containsExactly("FILTER", "TABLE_SCAN");
            assertThat(((TableScan) join.children().get(1).operator()).tableName()).isEqualTo("lineitem");
        }
    }

    @Nested
    @DisplayName("DuckDB without system representation")
    class DuckDBWithoutProvenance {

        @Test
        @DisplayName("TopN keeps its limit when provenance is not retained")
        void topNLimitKept() {
            ParserOptions options = ParserOptions.builder().includeSystemRepresentation(false).build();
            QueryPlan plan = PlanParsers.forDbms(DBMSType.DUCKDB, options).parse("q", loadPlan("duckdb/top_n_join.json"));

            QueryPlan cleaned = Cleaners.forDbms(DBMSType.DUCKDB).clean(plan);

            PlanNode sort = cleaned.realRoot();
            assertThat(sort.provenance().isEmpty()).isTrue();
            assertThat(sort.operator()).isEqualTo(new Sort(0, 10L));
        }
    }

    @Nested
    @DisplayName("Postgres")
    class Postgres {

        @Test
        @DisplayName("Gather folds into the sort and Limit becomes a Sort")
        void limitAndGather() {
            QueryPlan plan = parse(DBMSType.POSTGRES, "postgres/limit.json");
            assertThat(plan.plan().nodeCount()).isEqualTo(7);

            QueryPlan cleaned = Cleaners.forDbms(DBMSType.POSTGRES).clean(plan);

            assertThat(cleaned.plan().nodeCount()).isEqualTo(6);
            PlanNode limit = cleaned.realRoot();
            assertThat(limit.operator()).isEqualTo(new Sort(0));
            assertThat(limit.cardinality()).isEqualTo(new Cardinality(10L, 10L));

            PlanNode sort = limit.children().get(0);
            assertThat(sort.operator().operatorType()).isEqualTo(OperatorType.Sort);
            assertThat(sort.operator().operatorId()).isEqualTo(2);
            assertThat(sort.cardinality()).isEqualTo(new Cardinality(58L, 30L));
            assertThat(sort.provenance().fragments())
                .extracting(f -> f.get("Node Type").asText())
                .containsExactly("Gather Merge", "Incremental Sort");
            assertThat(sort.children().get(0).operator()).isInstanceOf(Join.class);
        }

        @Test
        @DisplayName("Hash nodes fold into the CTE scan they wrap")
        void hashFolded() {
            QueryPlan cleaned = Cleaners.forDbms(DBMSType.POSTGRES)
                .clean(parse(DBMSType.POSTGRES, "postgres/cte.json"));

            assertThat(find(cleaned.plan(), n -> CustomOperator.isNamed(n.operator(), "Hash"))).isEmpty();
            assertThat(count(cleaned.plan(), OperatorType.PipelineBreakerScan)).isEqualTo(2);
            assertThat(cleaned.realRoot().children()).hasSize(2);
        }
    }

    @ParameterizedTest(name = "{0} {1}")
    @CsvSource({
        "UMBRA, umbra/cleanup.json",
        "UMBRA, umbra/shared_pipeline.json",
        "UMBRA, umbra/magic.json",
        "HYPER, hyper/shared_pipeline.json",
        "HYPER, hyper/index_nl_join.json",
        "DUCKDB, duckdb/top_n_join.json",
        "POSTGRES, postgres/limit.json",
        "POSTGRES, postgres/cte.json"
    })
    @DisplayName("Cleaning twice equals cleaning once")
    void idempotent(DBMSType dbms, String fixture) {
        Cleaner cleaner = Cleaners.forDbms(dbms);
        QueryPlan once = cleaner.clean(parse(dbms, fixture));

        assertThat(cleaner.clean(once)).isEqualTo(once);
    }

    @ParameterizedTest(name = "{0} {1}")
    @CsvSource({
        "UMBRA, umbra/cleanup.json",
        "UMBRA, umbra/magic.json",
        "HYPER, hyper/shared_pipeline.json",
        "DUCKDB, duckdb/top_n_join.json",
        "POSTGRES, postgres/limit.json",
        "POSTGRES, postgres/cte.json"
    })
    @DisplayName("Joins, scans and aggregations survive cleaning")
    void semanticOperatorsKept(DBMSType dbms, String fixture) {
        QueryPlan plan = parse(dbms, fixture);
        QueryPlan cleaned = Cleaners.forDbms(dbms).clean(plan);

        for (OperatorType type : SEMANTIC_TYPES) {
            assertThat(count(cleaned.plan(), type)).as(type.name()).isEqualTo(count(plan.plan(), type));
        }
        assertThat(cleaned.plan().operator().operatorType()).isEqualTo(OperatorType.Result);
    }
}
