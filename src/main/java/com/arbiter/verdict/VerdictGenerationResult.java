package com.arbiter.verdict;

public record VerdictGenerationResult(Verdict verdict, long generationTimeMs) {
}
