package com.dgw.resolver.ranking;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public enum Operator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    MATCHES("matches");

    private final String key;

    Operator(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Operator fromKey(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Operator operator : values()) {
            if (operator.key.equals(normalized)) {
                return operator;
            }
        }
        return null;
    }

    public boolean test(Object actual, Object operand, Pattern pattern) {
        switch (this) {
            case EQ:
                return sameValue(actual, operand);
            case NE:
                return !sameValue(actual, operand);
            case GT:
                return compare(actual, operand) > 0;
            case GTE:
                return compare(actual, operand) >= 0 && comparable(actual, operand);
            case LT:
                return compare(actual, operand) < 0 && comparable(actual, operand);
            case LTE:
                return compare(actual, operand) <= 0 && comparable(actual, operand);
            case CONTAINS:
                return contains(actual, operand);
            case MATCHES:
                return matches(actual, pattern);
            default:
                return false;
        }
    }

    private static boolean sameValue(Object actual, Object operand) {
        Object left = normalize(actual);
        Object right = normalize(operand);
        return Objects.equals(left, right);
    }

    private static boolean comparable(Object actual, Object operand) {
        Object left = normalize(sizeOf(actual));
        Object right = normalize(operand);
        return (left instanceof Double && right instanceof Double)
            || (left instanceof String && right instanceof String);
    }

    // not comparable yields 0, guarded by comparable() where 0 would pass
    private static int compare(Object actual, Object operand) {
        Object left = normalize(sizeOf(actual));
        Object right = normalize(operand);
        if (left instanceof Double leftNumber && right instanceof Double rightNumber) {
            return Double.compare(leftNumber, rightNumber);
        }
        if (left instanceof String leftText && right instanceof String rightText) {
            return leftText.compareTo(rightText);
        }
        return 0;
    }

    private static boolean contains(Object actual, Object operand) {
        if (actual instanceof Collection<?> collection) {
            Object wanted = normalize(operand);
            for (Object element : collection) {
                if (Objects.equals(normalize(element), wanted)) {
                    return true;
                }
            }
            return false;
        }
        if (actual instanceof String text && operand != null) {
            return text.contains(operand.toString());
        }
        return false;
    }

    private static boolean matches(Object actual, Pattern pattern) {
        if (pattern == null || actual == null) {
            return false;
        }
        if (actual instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null && pattern.matcher(element.toString()).find()) {
                    return true;
                }
            }
            return false;
        }
        return pattern.matcher(actual.toString()).find();
    }

    private static Object sizeOf(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        return value;
    }

    static Object normalize(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1.0 : 0.0;
        }
        return value;
    }
}
