package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.CyclicDependencyException;
import com.nexus.skillplan.domain.DomainModels.SkillRequirement;

import java.util.*;

/**
 * Structural depth of a skill: 0 without prerequisites, otherwise one more than the
 * deepest direct prerequisite. Results are memoized for the lifetime of the instance.
 */
public class DepthCalculator {
    private final RequirementLookup lookup;
    private final Map<Integer, Integer> depths = new HashMap<>();

    public DepthCalculator(RequirementLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * @throws CyclicDependencyException when the skill reaches itself through its prerequisites
     */
    public int depth(int skillId) {
        return depth(skillId, new LinkedHashSet<>());
    }

    private int depth(int skillId, LinkedHashSet<Integer> onStack) {
        Integer cached = depths.get(skillId);
        if (cached != null) return cached;

        if (!onStack.add(skillId)) {
            throw new CyclicDependencyException(cycleThrough(onStack, skillId));
        }
        int deepest = -1;
        for (SkillRequirement requirement : lookup.requirementsOf(skillId)) {
            deepest = Math.max(deepest, depth(requirement.skillId(), onStack));
        }
        onStack.remove(skillId);

        int depth = deepest + 1;
        depths.put(skillId, depth);
        return depth;
    }

    private List<Integer> cycleThrough(LinkedHashSet<Integer> onStack, int repeated) {
        List<Integer> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (Integer id : onStack) {
            if (id == repeated) inCycle = true;
            if (inCycle) cycle.add(id);
        }
        cycle.add(repeated);
        return cycle;
    }

    public int memoizedCount() {
        return depths.size();
    }
}
