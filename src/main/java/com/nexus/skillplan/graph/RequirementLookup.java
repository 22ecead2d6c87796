package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import com.nexus.skillplan.domain.UnknownSkillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Caching front for a {@link SkillRequirementProvider}. A skill the provider has no
 * data for is answered with an empty requirement set and remembered as unknown, so
 * the caller can report it instead of aborting the resolution.
 */
public class RequirementLookup {
    private static final Logger LOG = LoggerFactory.getLogger(RequirementLookup.class);

    private final SkillRequirementProvider provider;
    private final Map<Integer, Set<SkillRequirement>> cache = new HashMap<>();
    private final Set<Integer> unknownSkills = new HashSet<>();

    public RequirementLookup(SkillRequirementProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public Set<SkillRequirement> requirementsOf(int skillId) {
        Set<SkillRequirement> cached = cache.get(skillId);
        if (cached != null) return cached;

        Set<SkillRequirement> loaded;
        try {
            loaded = provider.requirementsOf(skillId);
            if (loaded == null) loaded = Set.of();
        } catch (UnknownSkillException e) {
            LOG.warn("No requirement data for skill {}, treating it as having no prerequisites", skillId);
            unknownSkills.add(skillId);
            loaded = Set.of();
        }
        cache.put(skillId, loaded);
        return loaded;
    }

    public boolean isUnknown(int skillId) {
        requirementsOf(skillId);
        return unknownSkills.contains(skillId);
    }
}
