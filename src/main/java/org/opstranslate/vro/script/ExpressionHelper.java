package org.opstranslate.vro.script;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Conversions from vRO JavaScript expressions to Jinja2 expressions and templates.
 */
public class ExpressionHelper {
    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final String[] COMPARISON_OPERATORS = {"===", "!==", ">=", "<=", "==", "!=", ">", "<"};

    /**
     * Converts a JavaScript expression to a template value.
     * <ul>
     *     <li>{@code "text"} becomes {@code text}</li>
     *     <li>{@code "Hello " + name} becomes {@code Hello {{ name }}}</li>
     *     <li>{@code a === b && c} becomes {@code {{ a == b and c }}}</li>
     *     <li>{@code true}/{@code false} become booleans, numbers stay literal text</li>
     *     <li>anything else becomes {@code {{ expr }}}</li>
     * </ul>
     *
     * @param jsExpr expression source
     * @return a String, or a Boolean for boolean literals
     */
    public static Object toTemplate(String jsExpr) {
        String expr = jsExpr.strip();

        if (isStringLiteral(expr)) {
            return stripQuotes(expr);
        }

        List<String> concatParts = splitTopLevel(expr, '+');
        if (concatParts.size() > 1 && concatParts.stream().anyMatch(ExpressionHelper::isStringLiteral)) {
            return convertStringConcat(expr);
        }

        if (expr.equals("true") || expr.equals("false")) {
            return Boolean.valueOf(expr);
        }
        if (NUMBER_PATTERN.matcher(expr).matches()) {
            return expr;
        }

        return "{{ " + toJinjaExpression(expr) + " }}";
    }

    /**
     * Same as {@link #toTemplate(String)} with boolean literals rendered as text.
     */
    public static String toTemplateString(String jsExpr) {
        return String.valueOf(toTemplate(jsExpr));
    }

    /**
     * Converts {@code "text" + var + "more"} to {@code text{{ var }}more}.
     * Literal parts are copied verbatim, every other operand becomes a placeholder; no spacing is added.
     */
    public static String convertStringConcat(String jsExpr) {
        StringBuilder result = new StringBuilder();
        for (String part : splitTopLevel(jsExpr.strip(), '+')) {
            if (isStringLiteral(part)) {
                result.append(stripQuotes(part));
            } else if (!part.isEmpty()) {
                result.append("{{ ").append(toJinjaExpression(part)).append(" }}");
            }
        }
        return result.toString();
    }

    /**
     * Rewrites JavaScript operators to their Jinja2 equivalents.
     */
    public static String toJinjaExpression(String jsExpr) {
        String expr = jsExpr.strip()
                .replace("===", "==")
                .replace("!==", "!=")
                .replace("&&", "and")
                .replace("||", "or");
        if (expr.startsWith("!") && !expr.startsWith("!=")) {
            expr = "not " + expr.substring(1).strip();
        }
        return expr;
    }

    /**
     * Negates the condition of {@code if (cond) { throw ... }} so it can be asserted.
     * <p>
     * {@code x > 16} becomes {@code x <= 16}, {@code env === "prod"} becomes {@code env != "prod"} and
     * {@code !ok} becomes {@code ok}. The leftmost comparison outside string literals and brackets is
     * negated. Compound conditions and conditions without a comparison are wrapped as {@code not (cond)}.
     */
    public static String negateCondition(String condition) {
        String cond = condition.strip();
        String masked = CallScanner.maskLiterals(cond);

        if (masked.contains("&&") || masked.contains("||")) {
            return "not (" + toJinjaExpression(cond) + ")";
        }

        if (cond.startsWith("!") && !cond.startsWith("!=")) {
            return cond.substring(1).strip();
        }

        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0) {
                String op = operatorAt(masked, i);
                if (op != null) {
                    String left = cond.substring(0, i).strip();
                    String right = cond.substring(i + op.length()).strip();
                    return left + " " + negatedOperator(op) + " " + right;
                }
            }
        }

        return "not (" + cond + ")";
    }

    // longest operator starting at index, or null
    private static String operatorAt(String masked, int index) {
        for (String op : COMPARISON_OPERATORS) {
            if (masked.startsWith(op, index)) {
                return op;
            }
        }
        return null;
    }

    private static String negatedOperator(String op) {
        return switch (op) {
            case ">" -> "<=";
            case "<" -> ">=";
            case ">=" -> "<";
            case "<=" -> ">";
            case "===", "==" -> "!=";
            case "!==", "!=" -> "==";
            default -> throw new IllegalArgumentException("Unsupported operator: " + op);
        };
    }

    /**
     * Splits on {@code separator} outside of string literals and brackets. Parts are trimmed.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int partStart = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'', '`' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                default -> {
                    if (c == separator && depth == 0) {
                        parts.add(text.substring(partStart, i).strip());
                        partStart = i + 1;
                    }
                }
            }
        }
        parts.add(text.substring(partStart).strip());
        return parts;
    }

    public static boolean isStringLiteral(String expr) {
        String s = expr.strip();
        if (s.length() < 2) {
            return false;
        }
        char q = s.charAt(0);
        if ((q != '"' && q != '\'') || s.charAt(s.length() - 1) != q) {
            return false;
        }
        // reject "a" + "b", which starts and ends with a quote but is not one literal
        for (int i = 1; i < s.length() - 1; i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == q) {
                return false;
            }
        }
        return true;
    }

    public static String stripQuotes(String expr) {
        String s = expr.strip();
        if (isStringLiteral(s)) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    /**
     * Lower-case identifier safe for role, file and variable names.
     */
    public static String sanitizeName(String name) {
        String sanitized = name.strip().toLowerCase()
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return sanitized.isEmpty() ? "unnamed" : sanitized;
    }
}
