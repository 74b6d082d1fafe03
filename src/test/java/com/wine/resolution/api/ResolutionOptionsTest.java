package com.wine.resolution.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionOptionsTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        ResolutionOptions options = ResolutionOptions.defaults();

        assertEquals(100, options.getCandidateLimit());
        assertEquals(30_000, options.getAsyncTimeoutMs());
        assertTrue(options.getAsyncThreads() > 0);
    }

    @Test
    @DisplayName("Candidate limit must stay within 1..1000")
    void candidateLimitBounds() {
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().candidateLimit(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().candidateLimit(1_001));
        assertEquals(1_000, ResolutionOptions.builder().candidateLimit(1_000).build().getCandidateLimit());
    }

    @Test
    @DisplayName("Async settings must be positive")
    void asyncSettings() {
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().asyncThreads(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().asyncTimeoutMs(0));
    }
}
