package com.dgw.resolver.ranking;

import com.dgw.resolver.model.Candidate;
import java.util.Collection;
import java.util.Comparator;

/**
 * One sort rule. Numbers compare numerically, booleans as true above false, lists by size, text lexically;
 * a missing value sorts below everything.
 */
public record SortKey(ReleaseExpression expression) {

    public Comparator<Candidate> descending() {
        return Comparator.comparing(this::keyOf, SortKey::compareKeys).reversed();
    }

    Object keyOf(Candidate candidate) {
        Object value = expression.evaluate(candidate);
        if (value instanceof Collection<?> collection) {
            return (double) collection.size();
        }
        return Operator.normalize(value);
    }

    static int compareKeys(Object left, Object right) {
        int leftRank = typeRank(left);
        int rightRank = typeRank(right);
        if (leftRank != rightRank) {
            return Integer.compare(leftRank, rightRank);
        }
        if (left instanceof Double leftNumber && right instanceof Double rightNumber) {
            return Double.compare(leftNumber, rightNumber);
        }
        if (left instanceof String leftText && right instanceof String rightText) {
            return leftText.compareTo(rightText);
        }
        return 0;
    }

    private static int typeRank(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Double) {
            return 1;
        }
        return 2;
    }

    public String describe() {
        return expression.describe();
    }
}
