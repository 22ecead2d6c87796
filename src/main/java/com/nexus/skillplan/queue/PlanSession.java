package com.nexus.skillplan.queue;

import com.nexus.skillplan.domain.DomainModels.TrainingStep;

import java.util.*;

/**
 * Bookkeeping for one planning session: which skills were touched, the highest level
 * planned per skill, and every step already handed out.
 */
public class PlanSession {
    private final Set<Integer> addedSkills = new HashSet<>();
    private final Map<Integer, Integer> sessionLevels = new HashMap<>();
    private final Set<TrainingStep> emittedSteps = new HashSet<>();

    public boolean isAdded(int skillId) {
        return addedSkills.contains(skillId);
    }

    public int sessionLevel(int skillId) {
        return sessionLevels.getOrDefault(skillId, 0);
    }

    /** Marks the skill as touched and raises its planned level; never lowers it. */
    public void record(int skillId, int level) {
        addedSkills.add(skillId);
        sessionLevels.merge(skillId, level, Math::max);
    }

    /** @return false when the step was already emitted in this session */
    public boolean emit(TrainingStep step) {
        return emittedSteps.add(step);
    }

    public int emittedCount() {
        return emittedSteps.size();
    }
}
