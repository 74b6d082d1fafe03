package com.wine.resolution.api;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.MatchResult;
import com.wine.resolution.core.model.ResolutionOutcome;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detailed outcome of resolving one unresolved record.
 * No confident match is a regular result, not an error.
 *
 * @param outcome    how the call ended
 * @param match      the accepted catalog record, null unless {@link ResolutionOutcome#isMatch()}
 * @param ranked     scored candidates with a positive score, best first; empty for code matches
 * @param candidates number of candidates the catalog returned
 */
public record ResolutionResult(ResolutionOutcome outcome,
                               CanonicalWineRecord match,
                               List<MatchResult> ranked,
                               int candidates) {

    public ResolutionResult {
        Objects.requireNonNull(outcome, "outcome is required");
        ranked = ranked != null ? List.copyOf(ranked) : List.of();
        if (outcome.isMatch() != (match != null)) {
            throw new IllegalArgumentException("A match record is required exactly for matching outcomes");
        }
    }

    public static ResolutionResult codeMatch(CanonicalWineRecord record) {
        return new ResolutionResult(ResolutionOutcome.CODE_MATCH, record, List.of(), 0);
    }

    public static ResolutionResult noCandidates(int candidates) {
        return new ResolutionResult(ResolutionOutcome.NO_CANDIDATES, null, List.of(), candidates);
    }

    /**
     * Accepts the top of {@code ranked} if it reaches the threshold.
     */
    public static ResolutionResult fromRanking(List<MatchResult> ranked, int candidates) {
        if (ranked.isEmpty()) {
            return noCandidates(candidates);
        }
        MatchResult best = ranked.get(0);
        if (best.isAccepted()) {
            return new ResolutionResult(ResolutionOutcome.SCORED_MATCH, best.candidate(), ranked, candidates);
        }
        return new ResolutionResult(ResolutionOutcome.BELOW_THRESHOLD, null, ranked, candidates);
    }

    /**
     * Copy holding its own copies of every catalog record, so callers cannot alter a result
     * another caller sees.
     */
    public ResolutionResult copy() {
        List<MatchResult> copiedRanked = ranked.stream()
                .map(m -> new MatchResult(m.candidate().copy(), m.score(), m.criteria()))
                .toList();
        CanonicalWineRecord copiedMatch;
        if (match == null) {
            copiedMatch = null;
        } else if (outcome == ResolutionOutcome.SCORED_MATCH) {
            copiedMatch = copiedRanked.get(0).candidate();
        } else {
            copiedMatch = match.copy();
        }
        return new ResolutionResult(outcome, copiedMatch, copiedRanked, candidates);
    }

    public boolean isMatched() {
        return match != null;
    }

    public Optional<CanonicalWineRecord> getMatch() {
        return Optional.ofNullable(match);
    }

    public Optional<MatchResult> getBestCandidate() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    @Override
    public String toString() {
        return "ResolutionResult{outcome=" + outcome +
                ", match=" + (match != null ? match.getId() : null) +
                ", bestScore=" + getBestCandidate().map(MatchResult::score).orElse(null) +
                ", candidates=" + candidates + '}';
    }
}
