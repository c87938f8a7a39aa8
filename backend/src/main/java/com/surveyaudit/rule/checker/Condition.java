package com.surveyaudit.rule.checker;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.SurveyRecord;

import java.util.*;
import java.util.function.IntPredicate;

/**
 * 声明式字段条件 {field, op, value}，用于交叉字段逻辑校验。不执行任何表达式。
 */
public record Condition(String field, Operator op, Object value) {

    public enum Operator {
        EQ, NE, GT, GE, LT, LE, IN, NOT_IN, PRESENT, ABSENT
    }

    public static Condition parse(Object spec) {
        if (!(spec instanceof Map<?, ?> map)) {
            throw new MisconfiguredCheckException("条件必须是 {field, op, value} 结构: " + spec);
        }
        Object field = map.get("field");
        Object op = map.get("op");
        if (field == null || op == null) {
            throw new MisconfiguredCheckException("条件缺少 field 或 op: " + spec);
        }
        Operator operator;
        try {
            operator = Operator.valueOf(op.toString().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MisconfiguredCheckException("不支持的操作符: " + op);
        }
        Object value = map.get("value");
        if ((operator == Operator.IN || operator == Operator.NOT_IN) && !(value instanceof Collection<?>)) {
            throw new MisconfiguredCheckException(operator + " 操作符需要列表值: " + spec);
        }
        if (value == null && operator != Operator.PRESENT && operator != Operator.ABSENT) {
            throw new MisconfiguredCheckException(operator + " 操作符缺少 value: " + spec);
        }
        return new Condition(field.toString(), operator, value);
    }

    /**
     * 缺失值只满足 ABSENT、NE、NOT_IN
     */
    public boolean test(SurveyRecord record) {
        boolean missing = record.isMissing(field);
        if (op == Operator.PRESENT) {
            return !missing;
        }
        if (op == Operator.ABSENT) {
            return missing;
        }
        if (missing) {
            return op == Operator.NE || op == Operator.NOT_IN;
        }
        Object actual = record.raw(field);
        return switch (op) {
            case EQ -> equalsValue(actual, value);
            case NE -> !equalsValue(actual, value);
            case GT -> compare(actual, value, c -> c > 0);
            case GE -> compare(actual, value, c -> c >= 0);
            case LT -> compare(actual, value, c -> c < 0);
            case LE -> compare(actual, value, c -> c <= 0);
            case IN -> ((Collection<?>) value).stream().anyMatch(v -> equalsValue(actual, v));
            case NOT_IN -> ((Collection<?>) value).stream().noneMatch(v -> equalsValue(actual, v));
            default -> false;
        };
    }

    public String describe() {
        return switch (op) {
            case PRESENT -> field + " 已作答";
            case ABSENT -> field + " 未作答";
            default -> field + " " + op + " " + value;
        };
    }

    /**
     * 数值两侧都可解释时按数值比较，否则按忽略大小写的字符串比较
     */
    static boolean matches(Object actual, Object expected) {
        return equalsValue(actual, expected);
    }

    private static boolean equalsValue(Object actual, Object expected) {
        Double a = toNumber(actual);
        Double b = toNumber(expected);
        if (a != null && b != null) {
            return a.doubleValue() == b.doubleValue();
        }
        return String.valueOf(actual).trim().equalsIgnoreCase(String.valueOf(expected).trim());
    }

    /**
     * 任一方不是数值时条件不成立
     */
    private static boolean compare(Object actual, Object expected, IntPredicate accept) {
        Double a = toNumber(actual);
        Double b = toNumber(expected);
        if (a == null || b == null) {
            return false;
        }
        return accept.test(Double.compare(a, b));
    }

    private static Double toNumber(Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
