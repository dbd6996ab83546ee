package com.arbiter.precedent;

import java.util.List;

/**
 * @param similarity weighted similarity in [0, 1]
 * @param matchReasons which similarity components contributed
 */
public record PrecedentMatch(
    Precedent precedent,
    double similarity,
    List<String> matchReasons
) {

    public PrecedentMatch {
        matchReasons = matchReasons == null ? List.of() : List.copyOf(matchReasons);
    }
}
