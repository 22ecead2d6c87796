package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import com.nexus.skillplan.domain.DomainModels.TrainingStep;

import java.util.*;

public class PrerequisiteExpander {
    private final RequirementLookup lookup;

    public PrerequisiteExpander(RequirementLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * Every step needed to train {@code skillId} to {@code targetLevel}: each transitive
     * prerequisite laddered from level 1 to the highest level any path requires, plus the
     * target's own ladder from level 1. The result is unordered.
     */
    public Set<TrainingStep> expand(int skillId, int targetLevel) {
        Set<TrainingStep> steps = new HashSet<>();
        requiredLevels(skillId).forEach((id, maxLevel) -> ladder(id, 1, maxLevel, steps));
        ladder(skillId, 1, targetLevel, steps);
        return steps;
    }

    /**
     * Transitive prerequisites of a skill mapped to the highest level required of each.
     * The skill itself is not included. Each ancestor is visited once; the required
     * levels of its own prerequisites do not depend on how far it is trained.
     */
    public Map<Integer, Integer> requiredLevels(int skillId) {
        Map<Integer, Integer> maxLevels = new TreeMap<>();
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> pending = new ArrayDeque<>();
        visited.add(skillId);
        pending.push(skillId);

        while (!pending.isEmpty()) {
            int current = pending.pop();
            for (SkillRequirement requirement : lookup.requirementsOf(current)) {
                if (requirement.skillId() != skillId) {
                    maxLevels.merge(requirement.skillId(), requirement.level(), Math::max);
                }
                if (visited.add(requirement.skillId())) {
                    pending.push(requirement.skillId());
                }
            }
        }
        return maxLevels;
    }

    private static void ladder(int skillId, int from, int to, Set<TrainingStep> steps) {
        for (int level = from; level <= to; level++) {
            steps.add(new TrainingStep(skillId, level));
        }
    }
}
