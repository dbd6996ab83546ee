package com.arbiter.precedent;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** Lower-case word tokens of three or more characters, minus stop words. */
final class KeywordExtractor {

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "with", "that", "this", "from", "was", "were", "are", "not",
        "has", "have", "had", "but", "its", "into", "onto", "than", "then", "all", "any");

    private KeywordExtractor() {
    }

    static Set<String> keywords(Collection<String> texts) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String text : texts) {
            if (text == null) {
                continue;
            }
            for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
                if (token.length() >= 3 && !STOP_WORDS.contains(token)) {
                    tokens.add(token);
                }
            }
        }
        return tokens;
    }
}
