package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.DomainModels.Skill;
import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import com.nexus.skillplan.domain.UnknownSkillException;

import java.util.*;

/**
 * Immutable snapshot of the skill data. A resolver is always bound to a single
 * snapshot, so its memoized depths stay valid for its whole lifetime.
 */
public final class SkillGraph implements SkillRequirementProvider {
    private final long version;
    private final Map<Integer, Skill> skills;
    private final Map<Integer, Set<SkillRequirement>> requirements;
    private final Map<String, Integer> idsByName;

    private SkillGraph(long version, Map<Integer, Skill> skills,
                       Map<Integer, Set<SkillRequirement>> requirements,
                       Map<String, Integer> idsByName) {
        this.version = version;
        this.skills = skills;
        this.requirements = requirements;
        this.idsByName = idsByName;
    }

    public static SkillGraph empty() {
        return new SkillGraph(0, Map.of(), Map.of(), Map.of());
    }

    public static SkillGraph of(long version, Collection<Skill> skills) {
        Map<Integer, Skill> byId = new LinkedHashMap<>();
        Map<Integer, Set<SkillRequirement>> reqs = new HashMap<>();
        Map<String, Integer> names = new HashMap<>();

        for (Skill skill : skills) {
            byId.put(skill.id(), skill);
            reqs.put(skill.id(), deduplicate(skill.requirements()));
            if (skill.enName() != null && !skill.enName().isBlank()) names.putIfAbsent(skill.enName(), skill.id());
            if (skill.name() != null && !skill.name().isBlank()) names.putIfAbsent(skill.name(), skill.id());
        }
        return new SkillGraph(version,
                Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(reqs),
                Collections.unmodifiableMap(names));
    }

    // Max required level per prerequisite skill, ordered by prerequisite id.
    private static Set<SkillRequirement> deduplicate(List<SkillRequirement> raw) {
        Map<Integer, Integer> maxLevels = new TreeMap<>();
        for (SkillRequirement r : raw) {
            maxLevels.merge(r.skillId(), r.level(), Math::max);
        }
        Set<SkillRequirement> result = new LinkedHashSet<>();
        maxLevels.forEach((id, level) -> result.add(new SkillRequirement(id, level)));
        return Collections.unmodifiableSet(result);
    }

    @Override
    public Set<SkillRequirement> requirementsOf(int skillId) {
        Set<SkillRequirement> found = requirements.get(skillId);
        if (found == null) throw new UnknownSkillException(skillId);
        return found;
    }

    public boolean contains(int skillId) {
        return skills.containsKey(skillId);
    }

    public Optional<Skill> skill(int skillId) {
        return Optional.ofNullable(skills.get(skillId));
    }

    public Optional<String> nameOf(int skillId) {
        return skill(skillId).map(Skill::name);
    }

    /** Resolves a skill by its display name or its English name, exact match. */
    public Optional<Integer> findByName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(idsByName.get(name.trim()));
    }

    public Collection<Skill> skills() {
        return skills.values();
    }

    public int skillCount() {
        return skills.size();
    }

    public int requirementCount() {
        return requirements.values().stream().mapToInt(Set::size).sum();
    }

    public long version() {
        return version;
    }
}
