package com.semanticduck.compiler;

import com.semanticduck.exception.UnknownFilterFieldException;
import com.semanticduck.model.FilterPredicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Splits request filters into pre-aggregation (WHERE) and post-aggregation
 * (HAVING) groups.
 *
 * <p>A filter whose field is a resolved dimension alias filters rows and goes
 * to WHERE. Every other filter goes to HAVING on the assumption that it names
 * a metric alias. That assumption is not checked unless strict mode is on: a
 * misspelled field lands in HAVING and fails only when the warehouse runs the
 * statement.
 */
public final class PredicateClassifier {

    private final boolean strict;

    /**
     * Creates a classifier.
     *
     * @param strict whether to reject fields that are neither dimension aliases
     *        nor metric names
     */
    public PredicateClassifier(boolean strict) {
        this.strict = strict;
    }

    /**
     * Classifies the filters.
     *
     * @param filters the request filters, in order
     * @param dimensionAliases the resolved dimension aliases
     * @param metricNames the resolved metric names (consulted only in strict mode)
     * @return the split, each side in request order
     * @throws UnknownFilterFieldException in strict mode, for an unknown field
     */
    public Classification classify(List<FilterPredicate> filters,
                                   Set<String> dimensionAliases,
                                   Set<String> metricNames) {
        Objects.requireNonNull(filters, "filters must not be null");
        Objects.requireNonNull(dimensionAliases, "dimensionAliases must not be null");
        Objects.requireNonNull(metricNames, "metricNames must not be null");

        List<FilterPredicate> pre = new ArrayList<>();
        List<FilterPredicate> post = new ArrayList<>();

        for (FilterPredicate filter : filters) {
            if (dimensionAliases.contains(filter.field())) {
                pre.add(filter);
                continue;
            }
            if (strict && !metricNames.contains(filter.field())) {
                Set<String> known = new LinkedHashSet<>(metricNames);
                known.addAll(dimensionAliases);
                throw new UnknownFilterFieldException(filter.field(), known);
            }
            post.add(filter);
        }

        return new Classification(pre, post);
    }

    /**
     * Result of {@link #classify}.
     */
    public static final class Classification {
        private final List<FilterPredicate> preAggregation;
        private final List<FilterPredicate> postAggregation;

        Classification(List<FilterPredicate> preAggregation, List<FilterPredicate> postAggregation) {
            this.preAggregation = Collections.unmodifiableList(preAggregation);
            this.postAggregation = Collections.unmodifiableList(postAggregation);
        }

        public List<FilterPredicate> preAggregation() {
            return preAggregation;
        }

        public List<FilterPredicate> postAggregation() {
            return postAggregation;
        }
    }
}
