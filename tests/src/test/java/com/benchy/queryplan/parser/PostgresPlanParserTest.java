package com.benchy.queryplan.parser;

import com.benchy.queryplan.exception.MalformedPlanException;
import com.benchy.queryplan.exception.UnrecognizedOperatorException;
import com.benchy.queryplan.operator.CustomOperator;
import com.benchy.queryplan.operator.GroupBy;
import com.benchy.queryplan.operator.Join;
import com.benchy.queryplan.operator.JoinType;
import com.benchy.queryplan.operator.OperatorType;
import com.benchy.queryplan.operator.PipelineBreakerScan;
import com.benchy.queryplan.operator.TableScan;
import com.benchy.queryplan.plan.PlanNode;
import com.benchy.queryplan.plan.Provenance;
import com.benchy.queryplan.plan.QueryPlan;
import com.benchy.queryplan.test.TestBase;
import com.benchy.queryplan.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Parser
@DisplayName("PostgreSQL parser")
public class PostgresPlanParserTest extends TestBase {

    private PostgresPlanParser parser;

    @Override
    protected void doSetUp() {
        parser = new PostgresPlanParser();
    }

    @Test
    void seqScan() {
        QueryPlan plan = parser.parse("select n_nationkey from nation", loadPlan("postgres/seqscan.json"));

        assertThat(plan.plan().nodeCount()).isEqualTo(2);
        PlanNode scan = plan.realRoot();
        assertThat(scan.operator()).isInstanceOfSatisfying(TableScan.class, t -> {
            assertThat(t.tableName()).isEqualTo("nation");
            assertThat(t.type()).isEqualTo("sequential");
            assertThat(t.operatorId()).isZero();
        });
        assertThat(scan.estimatedCardinality()).isEqualTo(25L);
        assertThat(scan.exactCardinality()).isEqualTo(25L);
    }

    @Test
    @DisplayName("Operator ids are assigned in pre-order")
    void preOrderIds() {
        PlanNode root = parser.parse("q", loadPlan("postgres/limit.json")).realRoot();

        assertThat(preOrder(root)).extracting(n -> n.operator().operatorId())
            .containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(preOrder(root)).extracting(n -> n.operator().operatorType())
            .containsExactly(OperatorType.CustomOperator, OperatorType.CustomOperator, OperatorType.Sort,
                OperatorType.Join, OperatorType.TableScan, OperatorType.TableScan);
    }

    @Test
    void nodeTypeVariants() {
        PlanNode limit = parser.parse("q", loadPlan("postgres/limit.json")).realRoot();
        PlanNode gather = limit.children().get(0);
        PlanNode join = gather.children().get(0).children().get(0);

        assertThat(CustomOperator.isNamed(limit.operator(), "Limit")).isTrue();
        assertThat(CustomOperator.isNamed(gather.operator(), "Gather")).isTrue();
        assertThat(join.operator()).isInstanceOfSatisfying(Join.class, j -> {
            assertThat(j.type()).isEqualTo(JoinType.LEFT_SEMI);
            assertThat(j.method()).isEqualTo("nl");
        });
        assertThat(join.children()).extracting(c -> ((TableScan) c.operator()).type())
            .containsExactly("index", "index");
    }

    @Test
    @DisplayName("CTE is wrapped in a Temp node below its first scan")
    void commonTableExpression() {
        PlanNode join = parser.parse("q", loadPlan("postgres/cte.json")).realRoot();

        assertThat(join.children()).hasSize(2);
        PlanNode firstScan = join.children().get(0);
        assertThat(firstScan.operator()).isInstanceOf(PipelineBreakerScan.class);

        PlanNode temp = firstScan.children().get(0);
        assertThat(temp.operator().operatorType()).isEqualTo(OperatorType.Temp);
        assertThat(temp.provenance()).isEqualTo(Provenance.synthetic());
        assertThat(temp.cardinality()).isEqualTo(temp.children().get(0).cardinality());
        assertThat(temp.children().get(0).operator()).isInstanceOfSatisfying(GroupBy.class,
            g -> assertThat(g.attributes()).containsEntry("method", "Hashed"));

        PlanNode secondScan = join.children().get(1).children().get(0);
        assertThat(secondScan.children()).isEmpty();
        assertThat(((PipelineBreakerScan) secondScan.operator()).scannedId())
            .isEqualTo(((PipelineBreakerScan) firstScan.operator()).scannedId())
            .isEqualTo(temp.operator().operatorId());
    }

    @Test
    void unknownNodeType() {
        String json = "{\"Plan\": {\"Node Type\": \"Foreign Scan\", \"Plan Rows\": 1, \"Actual Rows\": 1}}";

        assertThatThrownBy(() -> parser.parse("q", json))
            .isInstanceOf(UnrecognizedOperatorException.class)
            .hasMessageContaining("Foreign Scan");
    }

    @Test
    void unknownCteName() {
        String json = "{\"Plan\": {\"Node Type\": \"CTE Scan\", \"CTE Name\": \"missing\", \"Plan Rows\": 1, \"Actual Rows\": 1}}";

        assertThatThrownBy(() -> parser.parse("q", json))
            .isInstanceOf(MalformedPlanException.class)
            .satisfies(e -> assertThat(((MalformedPlanException) e).getFieldName()).isEqualTo("CTE Name"));
    }

    @Test
    void missingActualRows() {
        String json = "{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"t\", \"Plan Rows\": 1}}";

        assertThatThrownBy(() -> parser.parse("q", json))
            .isInstanceOf(MalformedPlanException.class)
            .satisfies(e -> assertThat(((MalformedPlanException) e).getFieldName()).isEqualTo("Actual Rows"));
    }
}
