package com.arbiter.rules;

import com.arbiter.contract.ContractViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled rule condition.
 *
 * Grammar: {@code disjunction := conjunction ('||' conjunction)*},
 * {@code conjunction := clause ('&&' clause)*},
 * {@code clause := ['!'] path | path op literal}. Paths are dotted keys into
 * the action parameters. Evaluation is three-valued: a clause over an absent
 * path is unknown, and unknown propagates unless the other operands decide.
 */
public final class RuleCondition {

    private static final Pattern COMPARISON = Pattern.compile(
        "^([A-Za-z_][\\w.]*)\\s*(===|!==|==|!=|>=|<=|>|<)\\s*(.+)$");
    private static final Pattern BARE_PATH = Pattern.compile("^(!?)\\s*([A-Za-z_][\\w.]*)$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    private static final RuleCondition EMPTY = new RuleCondition("", List.of());

    private final String expression;
    private final List<List<Clause>> disjuncts;

    private RuleCondition(String expression, List<List<Clause>> disjuncts) {
        this.expression = expression;
        this.disjuncts = disjuncts;
    }

    public static RuleCondition compile(String expression) {
        if (expression == null || expression.isBlank()) {
            return EMPTY;
        }
        List<List<Clause>> disjuncts = new ArrayList<>();
        for (String disjunct : splitOutsideQuotes(expression, "||", expression)) {
            List<Clause> clauses = new ArrayList<>();
            for (String raw : splitOutsideQuotes(disjunct, "&&", expression)) {
                clauses.add(parseClause(raw.trim(), expression));
            }
            disjuncts.add(List.copyOf(clauses));
        }
        return new RuleCondition(expression.trim(), List.copyOf(disjuncts));
    }

    public boolean isEmpty() {
        return disjuncts.isEmpty();
    }

    public String expression() {
        return expression;
    }

    public Set<String> referencedPaths() {
        Set<String> paths = new LinkedHashSet<>();
        disjuncts.forEach(d -> d.forEach(c -> paths.add(c.path())));
        return Collections.unmodifiableSet(paths);
    }

    /**
     * Evaluates the condition. An empty condition is always indeterminate.
     *
     * @return SATISFIED when true, VIOLATED when false, INDETERMINATE when unknown
     */
    public RuleConditionStatus evaluate(Map<String, Object> parameters, Map<String, Object> environment) {
        if (isEmpty()) {
            return RuleConditionStatus.INDETERMINATE;
        }
        Truth result = Truth.FALSE;
        for (List<Clause> conjunction : disjuncts) {
            Truth conj = Truth.TRUE;
            for (Clause clause : conjunction) {
                conj = conj.and(clause.evaluate(parameters, environment));
            }
            result = result.or(conj);
        }
        return switch (result) {
            case TRUE -> RuleConditionStatus.SATISFIED;
            case FALSE -> RuleConditionStatus.VIOLATED;
            case UNKNOWN -> RuleConditionStatus.INDETERMINATE;
        };
    }

    /** Splits on {@code operator} where it occurs outside quoted literals. */
    private static List<String> splitOutsideQuotes(String text, String operator, String expression) {
        List<String> parts = new ArrayList<>();
        char quote = 0;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == ')') {
                throw new ContractViolationException("parentheses are not supported in rule conditions: " + expression);
            } else if (text.startsWith(operator, i)) {
                parts.add(text.substring(start, i));
                start = i + operator.length();
                i = start;
                continue;
            }
            i++;
        }
        if (quote != 0) {
            throw new ContractViolationException("unterminated string literal in rule condition: " + expression);
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static Clause parseClause(String raw, String expression) {
        Matcher comparison = COMPARISON.matcher(raw);
        if (comparison.matches()) {
            return new Clause(comparison.group(1), comparison.group(2), parseLiteral(comparison.group(3).trim()), false);
        }
        Matcher bare = BARE_PATH.matcher(raw);
        if (bare.matches()) {
            return new Clause(bare.group(2), null, null, !bare.group(1).isEmpty());
        }
        throw new ContractViolationException("cannot parse rule condition clause '" + raw + "' in: " + expression);
    }

    private static Object parseLiteral(String raw) {
        if ("true".equals(raw) || "false".equals(raw)) {
            return Boolean.valueOf(raw);
        }
        if ("null".equals(raw)) {
            return null;
        }
        if (NUMBER.matcher(raw).matches()) {
            return Double.valueOf(raw);
        }
        if (raw.length() >= 2
                && ((raw.startsWith("'") && raw.endsWith("'")) || (raw.startsWith("\"") && raw.endsWith("\"")))) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }

    @Override
    public String toString() {
        return expression;
    }

    private enum Truth {
        TRUE, FALSE, UNKNOWN;

        Truth and(Truth other) {
            if (this == FALSE || other == FALSE) {
                return FALSE;
            }
            return this == UNKNOWN || other == UNKNOWN ? UNKNOWN : TRUE;
        }

        Truth or(Truth other) {
            if (this == TRUE || other == TRUE) {
                return TRUE;
            }
            return this == UNKNOWN || other == UNKNOWN ? UNKNOWN : FALSE;
        }

        static Truth of(boolean value) {
            return value ? TRUE : FALSE;
        }
    }

    private record Clause(String path, String operator, Object literal, boolean negated) {

        Truth evaluate(Map<String, Object> parameters, Map<String, Object> environment) {
            Lookup lookup = resolve(parameters, path);
            if (!lookup.found()) {
                lookup = resolve(environment, path);
            }
            if (!lookup.found()) {
                return Truth.UNKNOWN;
            }
            Object actual = lookup.value();
            if (operator == null) {
                boolean truthy = isTruthy(actual);
                return Truth.of(negated != truthy);
            }
            return switch (operator) {
                case "===", "==" -> Truth.of(looselyEquals(actual, literal));
                case "!==", "!=" -> Truth.of(!looselyEquals(actual, literal));
                default -> compareOrdered(actual);
            };
        }

        private Truth compareOrdered(Object actual) {
            Double left = asNumber(actual);
            Double right = asNumber(literal);
            if (left == null || right == null) {
                return Truth.UNKNOWN;
            }
            int cmp = Double.compare(left, right);
            return Truth.of(switch (operator) {
                case ">" -> cmp > 0;
                case ">=" -> cmp >= 0;
                case "<" -> cmp < 0;
                case "<=" -> cmp <= 0;
                default -> throw new IllegalStateException("Unexpected operator " + operator);
            });
        }

        private static boolean looselyEquals(Object actual, Object expected) {
            if (actual == null || expected == null) {
                return actual == expected;
            }
            Double a = asNumber(actual);
            Double b = asNumber(expected);
            if (a != null && b != null) {
                return a.doubleValue() == b.doubleValue();
            }
            return Objects.equals(String.valueOf(actual), String.valueOf(expected));
        }

        private static Double asNumber(Object value) {
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            if (value instanceof String text && NUMBER.matcher(text.trim()).matches()) {
                return Double.valueOf(text.trim());
            }
            return null;
        }

        private static boolean isTruthy(Object value) {
            if (value == null) {
                return false;
            }
            if (value instanceof Boolean bool) {
                return bool;
            }
            if (value instanceof Number number) {
                return number.doubleValue() != 0.0;
            }
            if (value instanceof String text) {
                return !text.isEmpty() && !"false".equalsIgnoreCase(text);
            }
            return true;
        }

        @SuppressWarnings("unchecked")
        private static Lookup resolve(Map<String, Object> root, String path) {
            Object current = root;
            for (String segment : path.split("\\.")) {
                if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                    return Lookup.MISSING;
                }
                current = ((Map<String, Object>) map).get(segment);
            }
            return new Lookup(true, current);
        }
    }

    private record Lookup(boolean found, Object value) {
        static final Lookup MISSING = new Lookup(false, null);
    }
}
