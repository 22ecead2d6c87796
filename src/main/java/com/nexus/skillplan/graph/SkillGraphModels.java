package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.DomainModels.SkillRequirement;

import java.util.List;

public class SkillGraphModels {
    public record GraphValidationIssue(String code, String message, Integer skillId) {}

    public record GraphLoadResult(boolean valid,
                                  int skillCount,
                                  int requirementCount,
                                  long graphVersion,
                                  List<GraphValidationIssue> issues) {}

    public record SkillRequirementView(int skillId, String name, int depth,
                                       List<SkillRequirement> requirements,
                                       List<SkillRequirement> transitiveRequirements) {}
}
