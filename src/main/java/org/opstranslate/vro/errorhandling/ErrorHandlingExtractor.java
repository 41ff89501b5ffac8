package org.opstranslate.vro.errorhandling;

import org.opstranslate.vro.errorhandling.models.ErrorHandlingBlock;
import org.opstranslate.vro.script.CallScanner;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ErrorHandlingExtractor {
    private static final Pattern TRY_PATTERN = Pattern.compile("\\btry\\s*\\{");
    private static final Pattern CATCH_PATTERN =
            Pattern.compile("\\G\\s*catch\\s*(?:\\(\\s*([A-Za-z_$][\\w$]*)\\s*\\))?\\s*\\{");
    private static final Pattern FINALLY_PATTERN = Pattern.compile("\\G\\s*finally\\s*\\{");

    /**
     * Finds the first try/catch/finally construct in a script.
     * Braces inside string literals and comments are ignored while matching blocks.
     *
     * @param script script text
     * @return the construct, or empty when there is no try block, it has neither catch nor finally,
     * or its braces are unbalanced
     */
    public static Optional<ErrorHandlingBlock> extract(String script) {
        if (script == null) {
            return Optional.empty();
        }
        String masked = CallScanner.maskLiterals(script);

        Matcher tryMatcher = TRY_PATTERN.matcher(masked);
        if (!tryMatcher.find()) {
            return Optional.empty();
        }
        int tryOpen = tryMatcher.end() - 1;
        int tryClose = findClosingBrace(masked, tryOpen);
        if (tryClose < 0) {
            return Optional.empty();
        }
        String tryBody = script.substring(tryOpen + 1, tryClose).strip();
        int end = tryClose + 1;

        String catchVar = null;
        String catchBody = null;
        Matcher catchMatcher = CATCH_PATTERN.matcher(masked);
        catchMatcher.region(end, masked.length());
        if (catchMatcher.find()) {
            int catchOpen = catchMatcher.end() - 1;
            int catchClose = findClosingBrace(masked, catchOpen);
            if (catchClose < 0) {
                return Optional.empty();
            }
            catchVar = catchMatcher.group(1);
            catchBody = script.substring(catchOpen + 1, catchClose).strip();
            end = catchClose + 1;
        }

        String finallyBody = null;
        Matcher finallyMatcher = FINALLY_PATTERN.matcher(masked);
        finallyMatcher.region(end, masked.length());
        if (finallyMatcher.find()) {
            int finallyOpen = finallyMatcher.end() - 1;
            int finallyClose = findClosingBrace(masked, finallyOpen);
            if (finallyClose < 0) {
                return Optional.empty();
            }
            finallyBody = script.substring(finallyOpen + 1, finallyClose).strip();
            end = finallyClose + 1;
        }

        if (catchBody == null && finallyBody == null) {
            return Optional.empty();
        }
        return Optional.of(new ErrorHandlingBlock(
                tryMatcher.start(), end, tryBody, catchVar, catchBody, finallyBody));
    }

    private static int findClosingBrace(String masked, int open) {
        int depth = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
