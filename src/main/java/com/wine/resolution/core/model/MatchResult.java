package com.wine.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Score of one catalog candidate against an unresolved record.
 * Transient: lives only for the duration of a resolution call.
 *
 * @param candidate the catalog record that was scored
 * @param score     sum of the points of every matched criterion
 * @param criteria  matched criteria, at most one per {@link MatchCriterion.Field}
 */
public record MatchResult(CanonicalWineRecord candidate, int score, List<MatchCriterion> criteria) {

    /**
     * Minimum score for a candidate to be accepted as the resolution target.
     */
    public static final int ACCEPTANCE_THRESHOLD = 50;

    public MatchResult {
        Objects.requireNonNull(candidate, "candidate is required");
        if (score < 0) {
            throw new IllegalArgumentException("Score must not be negative");
        }
        criteria = criteria != null ? List.copyOf(criteria) : List.of();
    }

    public boolean isAccepted() {
        return score >= ACCEPTANCE_THRESHOLD;
    }

    /**
     * Explanation tags of the matched criteria, in scoring order.
     */
    public List<String> tags() {
        return criteria.stream().map(MatchCriterion::tag).toList();
    }

    @Override
    public String toString() {
        return "MatchResult{candidate=" + candidate.getId() +
                ", name='" + candidate.getName() + '\'' +
                ", score=" + score +
                ", tags=" + tags() + '}';
    }
}
