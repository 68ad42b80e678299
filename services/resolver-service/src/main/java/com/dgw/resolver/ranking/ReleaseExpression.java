package com.dgw.resolver.ranking;

import com.dgw.resolver.model.Candidate;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

public interface ReleaseExpression {

    Object evaluate(Candidate candidate);

    default boolean test(Candidate candidate) {
        return truthy(evaluate(candidate));
    }

    String describe();

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return !value.toString().isEmpty();
    }

    record FieldRef(ReleaseField field) implements ReleaseExpression {
        @Override
        public Object evaluate(Candidate candidate) {
            return field.read(candidate);
        }

        @Override
        public String describe() {
            return field.key();
        }
    }

    record Comparison(ReleaseField field, Operator operator, Object operand, Pattern pattern)
        implements ReleaseExpression {

        public static Comparison of(ReleaseField field, Operator operator, Object operand) {
            Pattern pattern = operator == Operator.MATCHES && operand != null
                ? Pattern.compile(operand.toString())
                : null;
            return new Comparison(field, operator, operand, pattern);
        }

        @Override
        public Object evaluate(Candidate candidate) {
            return operator.test(field.read(candidate), operand, pattern);
        }

        @Override
        public String describe() {
            return field.key() + " " + operator.key() + " " + operand;
        }
    }

    record AllOf(List<ReleaseExpression> terms) implements ReleaseExpression {
        public AllOf {
            terms = List.copyOf(terms);
        }

        @Override
        public Object evaluate(Candidate candidate) {
            for (ReleaseExpression term : terms) {
                if (!term.test(candidate)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String describe() {
            return "all" + terms.stream().map(ReleaseExpression::describe).toList();
        }
    }

    record AnyOf(List<ReleaseExpression> terms) implements ReleaseExpression {
        public AnyOf {
            terms = List.copyOf(terms);
        }

        @Override
        public Object evaluate(Candidate candidate) {
            for (ReleaseExpression term : terms) {
                if (term.test(candidate)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String describe() {
            return "any" + terms.stream().map(ReleaseExpression::describe).toList();
        }
    }

    record Not(ReleaseExpression term) implements ReleaseExpression {
        @Override
        public Object evaluate(Candidate candidate) {
            return !term.test(candidate);
        }

        @Override
        public String describe() {
            return "not(" + term.describe() + ")";
        }
    }
}
