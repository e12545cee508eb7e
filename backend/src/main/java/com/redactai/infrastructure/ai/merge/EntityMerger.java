package com.redactai.infrastructure.ai.merge;

import com.redactai.domain.redaction.model.DetectedEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Confidence-weighted, order-stable interval merge shared by every detection stage.
 *
 * Candidates are stably sorted by start offset and compared only against the most recently
 * accepted entity. On overlap the candidate replaces it in place only when the preference
 * comparator ranks it strictly higher; ties keep the earlier entity.
 */
@Component
public class EntityMerger {

    public static final Comparator<DetectedEntity> BY_CONFIDENCE =
            Comparator.comparingDouble(DetectedEntity::getConfidence);

    private final Comparator<DetectedEntity> preference;

    public EntityMerger() {
        this(BY_CONFIDENCE);
    }

    public EntityMerger(Comparator<DetectedEntity> preference) {
        this.preference = preference;
    }

    /**
     * @return pairwise non-overlapping entities sorted by start offset
     */
    public List<DetectedEntity> merge(Collection<DetectedEntity> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        // List.sort is stable: equal starts keep their input order
        List<DetectedEntity> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(DetectedEntity::start));

        List<DetectedEntity> accepted = new ArrayList<>();
        for (DetectedEntity candidate : sorted) {
            if (accepted.isEmpty()) {
                accepted.add(candidate);
                continue;
            }

            int lastIndex = accepted.size() - 1;
            DetectedEntity last = accepted.get(lastIndex);
            if (candidate.start() < last.end() && last.start() < candidate.end()) {
                if (preference.compare(candidate, last) > 0) {
                    accepted.set(lastIndex, candidate);
                }
            } else {
                accepted.add(candidate);
            }
        }

        return accepted;
    }

    /**
     * Convenience for merging several pass outputs into one set.
     */
    @SafeVarargs
    public final List<DetectedEntity> mergeAll(Collection<DetectedEntity>... sets) {
        List<DetectedEntity> combined = new ArrayList<>();
        for (Collection<DetectedEntity> set : sets) {
            if (set != null) {
                combined.addAll(set);
            }
        }
        return merge(combined);
    }
}
