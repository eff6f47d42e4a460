/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.ScoredCandidateType;
import villagecompute.recommendations.config.SelectionRules;

/**
 * Selects the final ordered top-K from a list of scored (and boosted) candidates.
 *
 * <p>
 * <b>Rules, in order:</b>
 * <ol>
 * <li>Rank by final score descending, then candidate id ascending</li>
 * <li>Keep only the best-ranked candidate per non-null business id</li>
 * <li>Fill greedily; once {@code floor(0.4 * k)} sponsored candidates are in, skip further sponsored ones</li>
 * <li>If fewer than 3 categories made it in and more exist, substitute the best candidate of a missing category for the
 * lowest-ranked candidate of an over-represented one</li>
 * <li>Return at most {@code k} candidates in rank order</li>
 * </ol>
 *
 * <p>
 * Output depends only on the set of inputs, not on their order. Fewer than {@code k} results are returned when the
 * rules leave fewer eligible candidates; the list is never padded.
 */
@ApplicationScoped
public class BusinessRuleFilter {

    private static final Logger LOG = Logger.getLogger(BusinessRuleFilter.class);

    @Inject
    SelectionRules rules;

    /**
     * Selects using the configured default list size.
     */
    public List<ScoredCandidateType> select(List<ScoredCandidateType> scoredCandidates) {
        return select(scoredCandidates, rules.defaultK());
    }

    /**
     * Selects the top {@code k} candidates that satisfy the business rules.
     *
     * @param scoredCandidates
     *            boosted candidates in any order
     * @param k
     *            requested list size; values below the minimum are raised to it
     * @return selected candidates in rank order, possibly empty
     */
    public List<ScoredCandidateType> select(List<ScoredCandidateType> scoredCandidates, int k) {
        if (scoredCandidates == null) {
            throw new IllegalArgumentException("scoredCandidates is required");
        }
        if (scoredCandidates.isEmpty()) {
            return List.of();
        }

        int effectiveK = rules.effectiveK(k);
        if (effectiveK != k) {
            LOG.debugf("Adjusted requested list size %d to %d", k, effectiveK);
        }
        int maxSponsored = rules.maxSponsored(effectiveK);

        List<ScoredCandidateType> survivors = distinctBusinesses(rank(scoredCandidates));

        List<ScoredCandidateType> selected = new ArrayList<>();
        int sponsoredCount = 0;
        for (ScoredCandidateType candidate : survivors) {
            if (selected.size() >= effectiveK) {
                break;
            }
            if (candidate.isSponsored()) {
                if (sponsoredCount >= maxSponsored) {
                    continue;
                }
                sponsoredCount++;
            }
            selected.add(candidate);
        }

        enforceDiversity(survivors, selected, effectiveK, maxSponsored);

        selected.sort(ScoredCandidateType.RANK_ORDER);
        LOG.debugf("Selected %d of %d candidates (%d after business dedupe), k=%d", selected.size(),
                scoredCandidates.size(), survivors.size(), effectiveK);
        return List.copyOf(selected);
    }

    private List<ScoredCandidateType> rank(List<ScoredCandidateType> scoredCandidates) {
        List<ScoredCandidateType> ranked = new ArrayList<>(scoredCandidates.size());
        for (ScoredCandidateType candidate : scoredCandidates) {
            if (candidate != null) {
                ranked.add(candidate);
            }
        }
        ranked.sort(ScoredCandidateType.RANK_ORDER);
        return ranked;
    }

    private List<ScoredCandidateType> distinctBusinesses(List<ScoredCandidateType> ranked) {
        Set<String> seenBusinesses = new HashSet<>();
        List<ScoredCandidateType> survivors = new ArrayList<>(ranked.size());
        for (ScoredCandidateType candidate : ranked) {
            String businessId = candidate.candidate().businessId();
            if (businessId != null && !seenBusinesses.add(businessId)) {
                LOG.tracef("Dropped %s, business %s already represented", candidate.candidate().id(), businessId);
                continue;
            }
            survivors.add(candidate);
        }
        return survivors;
    }

    /**
     * Bounded substitution: each round brings in one missing category, so the loop runs at most {@code target} times.
     */
    private void enforceDiversity(List<ScoredCandidateType> survivors, List<ScoredCandidateType> selected,
            int effectiveK, int maxSponsored) {
        Set<String> available = new LinkedHashSet<>();
        for (ScoredCandidateType candidate : survivors) {
            if (!candidate.category().isEmpty()) {
                available.add(candidate.category());
            }
        }
        int target = Math.min(rules.minDistinctCategories(), Math.min(available.size(), effectiveK));

        for (int round = 0; round < target; round++) {
            Map<String, Integer> counts = categoryCounts(selected);
            if (counts.size() >= target) {
                return;
            }
            if (!substituteMissingCategory(survivors, selected, counts, effectiveK, maxSponsored)) {
                LOG.debugf("Category floor not reachable: %d of %d categories selected", counts.size(), target);
                return;
            }
        }
    }

    private boolean substituteMissingCategory(List<ScoredCandidateType> survivors, List<ScoredCandidateType> selected,
            Map<String, Integer> counts, int effectiveK, int maxSponsored) {
        long sponsoredCount = selected.stream().filter(ScoredCandidateType::isSponsored).count();

        for (ScoredCandidateType substitute : survivors) {
            if (substitute.category().isEmpty() || counts.containsKey(substitute.category())
                    || selected.contains(substitute)) {
                continue;
            }
            boolean needsSlot = selected.size() >= effectiveK;
            boolean needsSponsoredSlot = substitute.isSponsored() && sponsoredCount >= maxSponsored;
            if (!needsSlot && !needsSponsoredSlot) {
                selected.add(substitute);
                return true;
            }

            int victimIndex = lowestRankedReplaceable(selected, counts, needsSponsoredSlot);
            if (victimIndex >= 0) {
                ScoredCandidateType victim = selected.set(victimIndex, substitute);
                LOG.debugf("Replaced %s (%s) with %s (%s) for category diversity", victim.candidate().id(),
                        victim.category(), substitute.candidate().id(), substitute.category());
                return true;
            }
        }
        return false;
    }

    private int lowestRankedReplaceable(List<ScoredCandidateType> selected, Map<String, Integer> counts,
            boolean sponsoredOnly) {
        int victimIndex = -1;
        for (int i = 0; i < selected.size(); i++) {
            ScoredCandidateType candidate = selected.get(i);
            Integer count = counts.get(candidate.category());
            if (count != null && count <= 1) {
                continue;
            }
            if (sponsoredOnly && !candidate.isSponsored()) {
                continue;
            }
            if (victimIndex < 0 || ScoredCandidateType.RANK_ORDER.compare(candidate, selected.get(victimIndex)) > 0) {
                victimIndex = i;
            }
        }
        return victimIndex;
    }

    /**
     * Per-category counts of the selection. Uncategorized candidates are left out and never count toward the floor.
     */
    private static Map<String, Integer> categoryCounts(List<ScoredCandidateType> selected) {
        Map<String, Integer> counts = new HashMap<>();
        for (ScoredCandidateType candidate : selected) {
            if (!candidate.category().isEmpty()) {
                counts.merge(candidate.category(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
