package com.semanticduck.compiler;

import com.semanticduck.exception.UnknownFilterFieldException;
import com.semanticduck.model.FilterPredicate;
import com.semanticduck.test.TestBase;
import com.semanticduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PredicateClassifier Tests")
public class PredicateClassifierTest extends TestBase {

    private static final Set<String> DIMENSIONS = new LinkedHashSet<>(List.of("status", "gender"));
    private static final Set<String> METRICS = Set.of("total_revenue");

    @Test
    @DisplayName("Dimension fields go before aggregation, everything else after")
    void testSplitPreservesOrder() {
        FilterPredicate status = filter("status", "=", "Complete");
        FilterPredicate revenue = filter("total_revenue", ">", 100);
        FilterPredicate gender = filter("gender", "=", "F");
        FilterPredicate unknown = filter("margin", "<", 3);

        PredicateClassifier.Classification split = new PredicateClassifier(false)
            .classify(List.of(status, revenue, gender, unknown), DIMENSIONS, METRICS);

        assertThat(split.preAggregation()).containsExactly(status, gender);
        assertThat(split.postAggregation()).containsExactly(revenue, unknown);
    }

    @Test
    @DisplayName("No filters gives two empty groups")
    void testNoFilters() {
        PredicateClassifier.Classification split = new PredicateClassifier(true)
            .classify(Collections.emptyList(), DIMENSIONS, METRICS);

        assertThat(split.preAggregation()).isEmpty();
        assertThat(split.postAggregation()).isEmpty();
    }

    @Test
    @DisplayName("Metric names are not consulted outside strict mode")
    void testLenientIgnoresMetricNames() {
        PredicateClassifier.Classification split = new PredicateClassifier(false)
            .classify(List.of(filter("anything", "=", 1)), DIMENSIONS, Collections.emptySet());

        assertThat(split.postAggregation()).extracting(FilterPredicate::field).containsExactly("anything");
    }

    @Test
    @DisplayName("Strict mode fails on the first unknown field")
    void testStrictUnknownField() {
        PredicateClassifier strict = new PredicateClassifier(true);

        assertThatThrownBy(() -> strict.classify(
                List.of(filter("total_revenue", ">", 1), filter("margin", "<", 3)), DIMENSIONS, METRICS))
            .isInstanceOf(UnknownFilterFieldException.class)
            .hasMessageContaining("'margin'");
    }

    @Test
    @DisplayName("Returned groups are read-only")
    void testGroupsUnmodifiable() {
        PredicateClassifier.Classification split = new PredicateClassifier(false)
            .classify(List.of(filter("status", "=", "Complete")), DIMENSIONS, METRICS);

        assertThatThrownBy(() -> split.preAggregation().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
