package com.wine.resolution.matching;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.MatchCriterion;
import com.wine.resolution.core.model.MatchResult;
import com.wine.resolution.core.model.UnresolvedWineRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Additive scorer of an unresolved record against one catalog candidate.
 *
 * <p>Each field contributes at most one tier of {@link MatchCriterion}; text comparisons are
 * trimmed and case-insensitive. A field absent on either side contributes nothing. Stateless
 * and thread-safe.</p>
 */
public class WineMatchScorer {

    private static final int MIN_SHARED_WORD_LENGTH = 4;

    public MatchResult score(UnresolvedWineRecord unresolved, CanonicalWineRecord candidate) {
        List<MatchCriterion> matched = new ArrayList<>(6);

        addIfPresent(matched, scoreName(unresolved.getName(), candidate.getName()));
        addIfPresent(matched, scoreProducer(unresolved.getProducer(), candidate.getProducer()));
        addIfPresent(matched, scoreVintage(unresolved.getVintage(), candidate.getVintage()));
        addIfPresent(matched, scoreContained(unresolved.getRegion(),
                candidate.getRegion(), MatchCriterion.REGION,
                candidate.getSubRegion(), MatchCriterion.SUB_REGION));
        addIfPresent(matched, scoreContained(unresolved.getAppellation(),
                candidate.getAppellation(), MatchCriterion.APPELLATION,
                candidate.getDesignation(), MatchCriterion.DESIGNATION));
        addIfPresent(matched, scoreCountry(unresolved.getCountry(), candidate.getCountry()));

        int total = matched.stream().mapToInt(MatchCriterion::points).sum();
        return new MatchResult(candidate, total, matched);
    }

    private static MatchCriterion scoreName(String unresolved, String candidate) {
        String a = fold(unresolved);
        String b = fold(candidate);
        if (a == null || b == null) {
            return null;
        }
        if (a.equals(b)) {
            return MatchCriterion.NAME_EXACT;
        }
        if (a.contains(b) || b.contains(a)) {
            return MatchCriterion.NAME_CONTAINS;
        }
        Set<String> wordsA = significantWords(a);
        for (String word : significantWords(b)) {
            if (wordsA.contains(word)) {
                return MatchCriterion.NAME_SHARED_WORD;
            }
        }
        return null;
    }

    private static MatchCriterion scoreProducer(String unresolved, String candidate) {
        String a = fold(unresolved);
        String b = fold(candidate);
        if (a == null || b == null) {
            return null;
        }
        if (a.equals(b)) {
            return MatchCriterion.PRODUCER_EXACT;
        }
        if (a.contains(b) || b.contains(a)) {
            return MatchCriterion.PRODUCER_CONTAINS;
        }
        return null;
    }

    private static MatchCriterion scoreVintage(Integer unresolved, Integer candidate) {
        if (unresolved == null || candidate == null) {
            return null;
        }
        int diff = Math.abs(unresolved - candidate);
        if (diff == 0) {
            return MatchCriterion.VINTAGE_EXACT;
        }
        return diff == 1 ? MatchCriterion.VINTAGE_ADJACENT : null;
    }

    /**
     * The unresolved value must be a substring of the primary candidate field, or failing that
     * of the secondary one. Containment is one-directional here, unlike names.
     */
    private static MatchCriterion scoreContained(String unresolved,
                                                 String primary, MatchCriterion primaryCriterion,
                                                 String secondary, MatchCriterion secondaryCriterion) {
        String needle = fold(unresolved);
        if (needle == null) {
            return null;
        }
        String first = fold(primary);
        if (first != null && first.contains(needle)) {
            return primaryCriterion;
        }
        String second = fold(secondary);
        if (second != null && second.contains(needle)) {
            return secondaryCriterion;
        }
        return null;
    }

    private static MatchCriterion scoreCountry(String unresolved, String candidate) {
        String a = fold(unresolved);
        return a != null && a.equals(fold(candidate)) ? MatchCriterion.COUNTRY : null;
    }

    private static Set<String> significantWords(String text) {
        return Arrays.stream(text.split("\\s+"))
                .filter(w -> w.length() >= MIN_SHARED_WORD_LENGTH)
                .collect(Collectors.toSet());
    }

    private static String fold(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static void addIfPresent(List<MatchCriterion> matched, MatchCriterion criterion) {
        if (criterion != null) {
            matched.add(criterion);
        }
    }
}
