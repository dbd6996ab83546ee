package com.arbiter.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches required-evidence labels ({@code linter_report}) against evidence
 * references ({@code reports/linter-report.txt}) after normalising both to
 * lower-case words.
 */
public final class EvidenceMatcher {

    private EvidenceMatcher() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", " ")
            .trim();
    }

    public static boolean isPresent(String required, List<String> evidence) {
        String needle = normalize(required);
        if (needle.isEmpty()) {
            return true;
        }
        for (String ref : evidence) {
            if ((" " + normalize(ref) + " ").contains(" " + needle + " ")) {
                return true;
            }
        }
        return false;
    }

    public static List<String> missing(List<String> required, List<String> evidence) {
        List<String> missing = new ArrayList<>();
        for (String item : required) {
            if (!isPresent(item, evidence)) {
                missing.add(item);
            }
        }
        return missing;
    }

    /**
     * Fraction of {@code required} found in {@code evidence}. With nothing
     * required, any evidence counts as complete and no evidence as empty.
     */
    public static double coverage(List<String> required, List<String> evidence) {
        if (required.isEmpty()) {
            return evidence.isEmpty() ? 0.0 : 1.0;
        }
        int found = required.size() - missing(required, evidence).size();
        return (double) found / required.size();
    }
}
