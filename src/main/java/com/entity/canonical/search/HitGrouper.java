package com.entity.canonical.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups scored hits by canonical name.
 *
 * <p>Hits are visited best first (ties keep their input order). A group is
 * opened by its best hit; at most {@code maxGroups} groups are opened and at
 * most {@code sampleSize} hits are counted per group.</p>
 */
public final class HitGrouper {

    private HitGrouper() {
    }

    public static List<CandidateGroup> group(List<ScoredHit> hits, int sampleSize, int maxGroups) {
        List<ScoredHit> ordered = new ArrayList<>(hits);
        ordered.sort(Comparator.comparingDouble(ScoredHit::score).reversed());

        Map<String, GroupAccumulator> groups = new LinkedHashMap<>();
        for (ScoredHit hit : ordered) {
            String cname = hit.document().cname();
            GroupAccumulator group = groups.get(cname);
            if (group == null) {
                if (groups.size() >= maxGroups) {
                    continue;
                }
                group = new GroupAccumulator(hit);
                groups.put(cname, group);
            }
            if (group.count < sampleSize) {
                group.count++;
            }
        }

        return groups.values().stream()
                .map(GroupAccumulator::toGroup)
                .toList();
    }

    private static final class GroupAccumulator {
        private final ScoredHit best;
        private long count;

        private GroupAccumulator(ScoredHit best) {
            this.best = best;
        }

        private CandidateGroup toGroup() {
            return new CandidateGroup(best.document().cname(), best.score(), count, best.document());
        }
    }
}
