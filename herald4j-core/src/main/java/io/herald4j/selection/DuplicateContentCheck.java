package io.herald4j.selection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Advisory check that a text is not (nearly) the same as something published recently.
 * Never blocks anything; findings are logged at WARN.
 */
public class DuplicateContentCheck {
    private static final Logger log = LoggerFactory.getLogger(DuplicateContentCheck.class);

    public static final double DEFAULT_THRESHOLD = 0.9;

    private final double threshold;

    public DuplicateContentCheck() {
        this(DEFAULT_THRESHOLD);
    }

    public DuplicateContentCheck(double threshold) {
        if (threshold <= 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be within (0, 1]");
        }
        this.threshold = threshold;
    }

    /**
     * First recent text that equals the candidate ignoring case or whose similarity exceeds the threshold.
     */
    public Optional<String> findSimilar(String candidate, List<String> recentTexts) {
        if (candidate == null || recentTexts == null) {
            return Optional.empty();
        }
        String normalized = normalize(candidate);
        for (String recent : recentTexts) {
            if (recent == null) {
                continue;
            }
            String other = normalize(recent);
            if (normalized.equals(other) || similarity(normalized, other) > threshold) {
                return Optional.of(recent);
            }
        }
        return Optional.empty();
    }

    /**
     * Runs {@link #findSimilar} and logs a warning on a hit. Failures to load history are logged and ignored.
     *
     * @return true if a similar recent text was found
     */
    public boolean warnIfDuplicate(String scheduleId, String candidate, Supplier<List<String>> recentTexts) {
        List<String> recent;
        try {
            recent = recentTexts.get();
        } catch (RuntimeException e) {
            log.warn("herald duplicate check skipped scheduleId={} msg={}", scheduleId, e.getMessage());
            return false;
        }
        Optional<String> hit = findSimilar(candidate, recent);
        hit.ifPresent(match -> log.warn("herald similar content recently published scheduleId={} text={} match={}",
                scheduleId, abbreviate(candidate), abbreviate(match)));
        return hit.isPresent();
    }

    /**
     * 1 - levenshtein(a, b) / max(len(a), len(b)), on lower-cased trimmed text.
     */
    public static double similarity(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        int max = Math.max(x.length(), y.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(x, y) / max;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String abbreviate(String s) {
        return s.length() <= 40 ? s : s.substring(0, 40) + "...";
    }
}
