package com.nexus.skillplan.validation;

import com.nexus.skillplan.domain.DomainModels.Skill;
import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import com.nexus.skillplan.domain.SkillLevels;
import com.nexus.skillplan.graph.SkillGraphModels.GraphValidationIssue;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class SkillGraphValidator {
    public List<GraphValidationIssue> validate(List<Skill> input) {
        List<GraphValidationIssue> issues = new ArrayList<>();

        List<Skill> skills = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            if (input.get(i) == null) {
                issues.add(new GraphValidationIssue("INVALID_SKILL", "Skill entry " + (i + 1) + " is empty", null));
            } else {
                skills.add(input.get(i));
            }
        }

        Map<Integer, Long> counts = skills.stream().collect(Collectors.groupingBy(Skill::id, Collectors.counting()));
        counts.forEach((id, count) -> {
            if (count > 1) {
                issues.add(new GraphValidationIssue("DUPLICATE_SKILL", "Skill id appears " + count + " times", id));
            }
        });

        Set<Integer> known = counts.keySet();
        for (Skill skill : skills) {
            if (skill.name() == null || skill.name().isBlank()) {
                issues.add(new GraphValidationIssue("MISSING_NAME", "Skill has no name", skill.id()));
            }
            for (SkillRequirement r : skill.requirements()) {
                if (!known.contains(r.skillId())) {
                    issues.add(new GraphValidationIssue("SKILL_REF_NOT_FOUND",
                            "Requirement references missing skill " + r.skillId(), skill.id()));
                }
                if (r.level() < 1 || r.level() > SkillLevels.MAX) {
                    issues.add(new GraphValidationIssue("INVALID_REQUIRED_LEVEL",
                            "Required level " + r.level() + " of skill " + r.skillId() + " is outside [1," + SkillLevels.MAX + "]", skill.id()));
                }
            }
        }

        Map<Integer, List<Integer>> adj = new HashMap<>();
        skills.forEach(s -> adj.computeIfAbsent(s.id(), k -> new ArrayList<>())
                .addAll(s.requirements().stream().map(SkillRequirement::skillId).toList()));

        Set<Integer> visiting = new HashSet<>();
        Set<Integer> visited = new HashSet<>();
        for (Integer node : new TreeSet<>(adj.keySet())) {
            if (hasCycle(node, adj, visiting, visited)) {
                issues.add(new GraphValidationIssue("CYCLE_DETECTED", "Cycle detected in prerequisite graph", node));
                break;
            }
        }
        return issues;
    }

    private boolean hasCycle(Integer node, Map<Integer, List<Integer>> adj, Set<Integer> visiting, Set<Integer> visited) {
        if (visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        for (Integer next : adj.getOrDefault(node, List.of())) {
            if (hasCycle(next, adj, visiting, visited)) return true;
        }
        visiting.remove(node);
        visited.add(node);
        return false;
    }
}
