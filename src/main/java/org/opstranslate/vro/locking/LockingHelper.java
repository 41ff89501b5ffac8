package org.opstranslate.vro.locking;

import org.opstranslate.vro.locking.models.LockPattern;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LockingHelper {
    private static final Pattern LOCK_PATTERN = Pattern.compile(
            "LockingSystem\\.(lock\\w*)\\s*\\(\\s*[\"']([^\"']+)[\"']\\s*(?:,\\s*([^)]*))?\\)\\s*;?");
    private static final Pattern UNLOCK_PATTERN = Pattern.compile(
            "LockingSystem\\.(unlock\\w*)\\s*\\(\\s*[\"']([^\"']+)[\"']\\s*(?:,\\s*[^)]*)?\\)\\s*;?");
    private static final Pattern FINALLY_PATTERN = Pattern.compile("\\bfinally\\s*\\{");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("\\d+");
    private static final BigInteger MAX_TIMEOUT = BigInteger.valueOf(Integer.MAX_VALUE);

    /**
     * Detects lock/unlock pairs in a script.
     * Each lock is paired with the nearest following unlock of the same resource that is not already
     * paired. A non-integer timeout argument (a variable, an expression) falls back to the default, a
     * timeout beyond the int range is clamped to it.
     *
     * @param script script text, may be null
     * @return patterns ordered by lock position
     */
    public static List<LockPattern> detectLockingPatterns(String script) {
        List<LockPattern> patterns = new ArrayList<>();
        if (script == null || !script.contains("LockingSystem")) {
            return patterns;
        }

        List<UnlockCall> unlocks = new ArrayList<>();
        Matcher unlockMatcher = UNLOCK_PATTERN.matcher(script);
        while (unlockMatcher.find()) {
            unlocks.add(new UnlockCall(unlockMatcher.group(2), unlockMatcher.start(), unlockMatcher.end()));
        }

        Set<UnlockCall> paired = new HashSet<>();
        Matcher lockMatcher = LOCK_PATTERN.matcher(script);
        while (lockMatcher.find()) {
            String resource = lockMatcher.group(2);
            int timeout = parseTimeout(lockMatcher.group(3));

            UnlockCall unlock = unlocks.stream()
                    .filter(u -> u.resource().equals(resource))
                    .filter(u -> u.start() > lockMatcher.start())
                    .filter(u -> !paired.contains(u))
                    .findFirst()
                    .orElse(null);

            boolean hasTryFinally = false;
            if (unlock != null) {
                paired.add(unlock);
                hasTryFinally = FINALLY_PATTERN.matcher(script.substring(lockMatcher.end(), unlock.start())).find();
            } else {
                System.err.println("Lock on '" + resource + "' is never released");
            }

            patterns.add(new LockPattern(
                    resource,
                    timeout,
                    lockMatcher.start(),
                    lockMatcher.end(),
                    unlock == null ? null : unlock.start(),
                    unlock == null ? null : unlock.end(),
                    hasTryFinally));
        }

        patterns.sort(Comparator.comparingInt(LockPattern::lockPosition));
        return patterns;
    }

    /**
     * Turns a lock key into a variable-safe name: every non-word character becomes an underscore and a
     * leading digit gets a {@code lock_} prefix.
     */
    public static String sanitizeResourceName(String resource) {
        String sanitized = resource.replaceAll("\\W", "_");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.charAt(0))) {
            sanitized = "lock_" + sanitized;
        }
        return sanitized;
    }

    private static int parseTimeout(String argument) {
        if (argument == null) {
            return LockPattern.DEFAULT_TIMEOUT_SECONDS;
        }
        String trimmed = argument.strip();
        if (!INTEGER_PATTERN.matcher(trimmed).matches()) {
            return LockPattern.DEFAULT_TIMEOUT_SECONDS;
        }
        BigInteger timeout = new BigInteger(trimmed);
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            System.err.println("Lock timeout " + trimmed + "s is out of range, using " + MAX_TIMEOUT + "s");
            return MAX_TIMEOUT.intValue();
        }
        return timeout.intValue();
    }

    private record UnlockCall(String resource, int start, int end) {
    }
}
