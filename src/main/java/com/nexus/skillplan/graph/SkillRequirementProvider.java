package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import com.nexus.skillplan.domain.UnknownSkillException;

import java.util.Set;

/**
 * Source of direct prerequisites for a skill.
 */
public interface SkillRequirementProvider {
    /**
     * Returns the direct prerequisites of a skill, one entry per prerequisite skill
     * at the highest level any raw requirement asks for.
     *
     * @throws UnknownSkillException when there is no data for the skill
     */
    Set<SkillRequirement> requirementsOf(int skillId);
}
