package org.opstranslate.vro.script;

import org.opstranslate.vro.script.models.CallSite;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds statement-level call expressions in a vRO script.
 * Calls nested inside another call's arguments are not reported separately, and calls inside
 * string literals or comments are ignored.
 */
public class CallScanner {
    private static final Pattern CALL_PATTERN =
            Pattern.compile("(?<![\\w$.])([A-Za-z_$][\\w$]*(?:\\s*\\.\\s*[A-Za-z_$][\\w$]*)*)\\s*\\(");
    private static final Pattern CHAINED_PATTERN =
            Pattern.compile("\\G\\s*\\.\\s*([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern BOUND_VARIABLE_PATTERN =
            Pattern.compile("(?:(?:var|let|const)\\s+)?([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)\\s*=\\s*$");
    private static final Pattern NEW_KEYWORD_PATTERN = Pattern.compile("\\bnew\\s+$");

    private static final Set<String> KEYWORDS =
            Set.of("if", "for", "while", "switch", "catch", "function", "return", "typeof", "with");

    /**
     * @param script script text, may be null
     * @return call sites in source order
     */
    public static List<CallSite> scan(String script) {
        List<CallSite> sites = new ArrayList<>();
        if (script == null || script.isEmpty()) {
            return sites;
        }

        String masked = maskLiterals(script);
        Matcher matcher = CALL_PATTERN.matcher(masked);
        int lastEnd = 0;

        while (matcher.find()) {
            if (matcher.start() < lastEnd) {
                continue;
            }

            String callee = matcher.group(1).replaceAll("\\s+", "");
            if (KEYWORDS.contains(callee.split("\\.")[0])) {
                continue;
            }

            int start = matcher.start();
            boolean constructor = false;
            Matcher newMatcher = NEW_KEYWORD_PATTERN.matcher(masked.substring(lineStart(masked, start), start));
            if (newMatcher.find()) {
                constructor = true;
                start = lineStart(masked, start) + newMatcher.start();
            }

            if (!isStatementPosition(masked, start)) {
                continue;
            }

            int open = matcher.end() - 1;
            int close = findClosingParen(masked, open);
            if (close < 0) {
                continue;
            }
            int end = close + 1;
            List<String> arguments = splitArguments(script.substring(open + 1, close));

            String chainedMethod = null;
            List<String> chainedArguments = null;
            Matcher chained = CHAINED_PATTERN.matcher(masked);
            chained.region(end, masked.length());
            if (!constructor && chained.find()) {
                int chainedOpen = chained.end() - 1;
                int chainedClose = findClosingParen(masked, chainedOpen);
                if (chainedClose >= 0) {
                    chainedMethod = chained.group(1);
                    chainedArguments = splitArguments(script.substring(chainedOpen + 1, chainedClose));
                    end = chainedClose + 1;
                }
            }

            int dot = callee.lastIndexOf('.');
            sites.add(CallSite.builder()
                    .start(start)
                    .end(end)
                    .callee(callee)
                    .object(dot >= 0 ? callee.substring(0, dot) : null)
                    .method(dot >= 0 ? callee.substring(dot + 1) : callee)
                    .arguments(arguments)
                    .text(script.substring(start, end))
                    .boundVariable(boundVariable(masked, start))
                    .constructor(constructor)
                    .chainedMethod(chainedMethod)
                    .chainedArguments(chainedArguments)
                    .build());
            lastEnd = end;
        }
        return sites;
    }

    /**
     * Replaces the contents of string literals and comments with spaces, keeping every offset intact.
     * Quote characters themselves are preserved.
     */
    public static String maskLiterals(String script) {
        StringBuilder out = new StringBuilder(script);
        int i = 0;
        int n = script.length();
        while (i < n) {
            char c = script.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                int j = i + 1;
                while (j < n && script.charAt(j) != c) {
                    if (script.charAt(j) == '\\' && j + 1 < n) {
                        blank(out, j);
                        j++;
                    }
                    blank(out, j);
                    j++;
                }
                i = j + 1;
            } else if (c == '/' && i + 1 < n && script.charAt(i + 1) == '/') {
                int j = i;
                while (j < n && script.charAt(j) != '\n') {
                    blank(out, j);
                    j++;
                }
                i = j;
            } else if (c == '/' && i + 1 < n && script.charAt(i + 1) == '*') {
                int j = i;
                while (j < n && !(script.charAt(j) == '*' && j + 1 < n && script.charAt(j + 1) == '/')) {
                    blank(out, j);
                    j++;
                }
                if (j < n) {
                    blank(out, j);
                    blank(out, j + 1);
                }
                i = j + 2;
            } else {
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Offset of the parenthesis closing the one at {@code open}, or -1 when unbalanced.
     * Expects text already passed through {@link #maskLiterals(String)}.
     */
    static int findClosingParen(String masked, int open) {
        int depth = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<String> splitArguments(String argumentText) {
        if (argumentText.isBlank()) {
            return List.of();
        }
        return ExpressionHelper.splitTopLevel(argumentText, ',');
    }

    // a call starts a statement, or is the right-hand side of an assignment
    private static boolean isStatementPosition(String masked, int start) {
        int i = start - 1;
        while (i >= 0 && Character.isWhitespace(masked.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return true;
        }
        char c = masked.charAt(i);
        if (c == '=') {
            char before = i > 0 ? masked.charAt(i - 1) : ' ';
            return before != '=' && before != '!' && before != '<' && before != '>';
        }
        return c == ';' || c == '{' || c == '}' || c == ')';
    }

    private static String boundVariable(String masked, int start) {
        Matcher matcher = BOUND_VARIABLE_PATTERN.matcher(masked.substring(lineStart(masked, start), start));
        return matcher.find() ? matcher.group(1) : null;
    }

    // offset just after the last statement boundary before pos
    private static int lineStart(String masked, int pos) {
        int i = pos - 1;
        while (i >= 0) {
            char c = masked.charAt(i);
            if (c == ';' || c == '{' || c == '}' || c == '\n') {
                return i + 1;
            }
            i--;
        }
        return 0;
    }

    private static void blank(StringBuilder out, int index) {
        if (out.charAt(index) != '\n') {
            out.setCharAt(index, ' ');
        }
    }
}
