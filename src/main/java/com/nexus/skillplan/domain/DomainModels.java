package com.nexus.skillplan.domain;

import java.util.List;

public class DomainModels {
    public record Skill(int id, String name, String enName, List<SkillRequirement> requirements) {
        public Skill {
            requirements = requirements == null ? List.of() : List.copyOf(requirements);
        }
    }

    /** A prerequisite edge: the owning skill needs {@code skillId} trained to at least {@code level}. */
    public record SkillRequirement(int skillId, int level) {}

    /** Train {@code skillId} to exactly {@code level} next. */
    public record TrainingStep(int skillId, int level) {}

    public record SkillRequest(int skillId, int level) {}
}
