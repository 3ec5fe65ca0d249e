package kr.courtside.sync.api.realtime;

import kr.courtside.sync.api.Preconditions;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row filter in {@code column=operator.value} form, e.g. {@code play_date_id=eq.42} or
 * {@code status=in.(scheduled,in_progress)}.
 * <p>
 * Supported operators: {@code eq}, {@code neq}, {@code lt}, {@code lte}, {@code gt}, {@code gte}, {@code in}.
 * Values that both parse as numbers are compared numerically, everything else as strings.
 */
public final class ChangeFilter {

    public enum Operator {
        EQ("eq"),
        NEQ("neq"),
        LT("lt"),
        LTE("lte"),
        GT("gt"),
        GTE("gte"),
        IN("in");

        private final String wireName;

        Operator(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        static Operator fromWireName(String name) {
            for (Operator operator : values()) {
                if (operator.wireName.equals(name)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("unsupported filter operator: " + name);
        }
    }

    private final String expression;
    private final String column;
    private final Operator operator;
    private final List<String> values;

    private ChangeFilter(String expression, String column, Operator operator, List<String> values) {
        this.expression = expression;
        this.column = column;
        this.operator = operator;
        this.values = values;
    }

    public static ChangeFilter parse(String expression) {
        Preconditions.checkNotBlank(expression, "expression");
        String trimmed = expression.trim();
        int eq = trimmed.indexOf('=');
        int dot = trimmed.indexOf('.', eq + 1);
        if (eq <= 0 || dot < 0) {
            throw new IllegalArgumentException("filter must look like column=op.value: " + expression);
        }
        String column = trimmed.substring(0, eq).trim();
        Operator operator = Operator.fromWireName(trimmed.substring(eq + 1, dot).trim());
        String raw = trimmed.substring(dot + 1);
        List<String> values = new ArrayList<>();
        if (operator == Operator.IN) {
            if (!raw.startsWith("(") || !raw.endsWith(")")) {
                throw new IllegalArgumentException("in filter needs a parenthesised list: " + expression);
            }
            for (String part : raw.substring(1, raw.length() - 1).split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
        } else {
            values.add(raw);
        }
        return new ChangeFilter(trimmed, column, operator, List.copyOf(values));
    }

    public String expression() {
        return expression;
    }

    public String column() {
        return column;
    }

    public Operator operator() {
        return operator;
    }

    public boolean matches(Map<String, Object> row) {
        if (row == null || !row.containsKey(column)) {
            return false;
        }
        Object actual = row.get(column);
        if (actual == null) {
            return operator == Operator.NEQ;
        }
        String text = actual.toString();
        return switch (operator) {
            case EQ -> compare(text, values.get(0)) == 0;
            case NEQ -> compare(text, values.get(0)) != 0;
            case LT -> compare(text, values.get(0)) < 0;
            case LTE -> compare(text, values.get(0)) <= 0;
            case GT -> compare(text, values.get(0)) > 0;
            case GTE -> compare(text, values.get(0)) >= 0;
            case IN -> values.stream().anyMatch(candidate -> compare(text, candidate) == 0);
        };
    }

    /**
     * DELETE 이벤트는 새 레코드가 없으므로 이전 레코드로 판정한다.
     */
    public boolean matches(ChangeEvent event) {
        Map<String, Object> row = event.eventType() == EventType.DELETE ? event.oldRecord() : event.newRecord();
        return matches(row);
    }

    private static int compare(String left, String right) {
        BigDecimal l = toNumber(left);
        BigDecimal r = toNumber(right);
        if (l != null && r != null) {
            return l.compareTo(r);
        }
        return left.compareTo(right);
    }

    private static BigDecimal toNumber(String value) {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeFilter that)) return false;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }

    @Override
    public String toString() {
        return expression;
    }
}
