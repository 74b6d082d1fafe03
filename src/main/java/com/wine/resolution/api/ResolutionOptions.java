package com.wine.resolution.api;

/**
 * Options for the query path. The scoring points and the acceptance threshold are not
 * options: they are fixed by {@link com.wine.resolution.core.model.MatchCriterion} and
 * {@link com.wine.resolution.core.model.MatchResult#ACCEPTANCE_THRESHOLD}.
 */
public class ResolutionOptions {

    private static final int DEFAULT_CANDIDATE_LIMIT = 100;
    private static final int MAX_CANDIDATE_LIMIT = 1_000;
    private static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;

    private final int candidateLimit;
    private final long asyncTimeoutMs;
    private final int asyncThreads;

    private ResolutionOptions(Builder builder) {
        this.candidateLimit = builder.candidateLimit;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
        this.asyncThreads = builder.asyncThreads;
    }

    /**
     * Maximum number of catalog records scored per resolution.
     */
    public int getCandidateLimit() {
        return candidateLimit;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public int getAsyncThreads() {
        return asyncThreads;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int candidateLimit = DEFAULT_CANDIDATE_LIMIT;
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;
        private int asyncThreads = Runtime.getRuntime().availableProcessors();

        public Builder candidateLimit(int candidateLimit) {
            if (candidateLimit <= 0 || candidateLimit > MAX_CANDIDATE_LIMIT) {
                throw new IllegalArgumentException(
                        "candidateLimit must be between 1 and " + MAX_CANDIDATE_LIMIT + ", got " + candidateLimit);
            }
            this.candidateLimit = candidateLimit;
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be > 0");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public Builder asyncThreads(int asyncThreads) {
            if (asyncThreads <= 0) {
                throw new IllegalArgumentException("asyncThreads must be > 0");
            }
            this.asyncThreads = asyncThreads;
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{candidateLimit=" + candidateLimit +
                ", asyncTimeoutMs=" + asyncTimeoutMs +
                ", asyncThreads=" + asyncThreads + '}';
    }
}
