package com.nexus.skillplan.repository;

import com.nexus.skillplan.domain.DomainModels.Skill;
import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.stream.Collectors;

@Repository
public class SkillJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SkillJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void replaceAll(List<Skill> skills) {
        jdbcTemplate.update("DELETE FROM skill_requirements");
        jdbcTemplate.update("DELETE FROM skills");

        skills.forEach(s -> jdbcTemplate.update(
                "INSERT INTO skills(skill_id, name, en_name) VALUES (?,?,?)",
                s.id(), s.name(), s.enName()));

        skills.forEach(s -> s.requirements().forEach(r -> jdbcTemplate.update(
                "INSERT INTO skill_requirements(skill_id, required_skill_id, required_level) VALUES (?,?,?)",
                s.id(), r.skillId(), r.level())));
    }

    public List<Skill> loadSkills() {
        Map<Integer, List<SkillRequirement>> requirements = loadRequirements().stream()
                .collect(Collectors.groupingBy(RequirementRow::skillId,
                        Collectors.mapping(r -> new SkillRequirement(r.requiredSkillId(), r.requiredLevel()), Collectors.toList())));

        return jdbcTemplate.query(
                "SELECT skill_id, name, en_name FROM skills ORDER BY skill_id",
                (rs, rowNum) -> {
                    int id = rs.getInt(1);
                    return new Skill(id, rs.getString(2), rs.getString(3), requirements.getOrDefault(id, List.of()));
                });
    }

    public List<RequirementRow> loadRequirements() {
        return jdbcTemplate.query(
                "SELECT skill_id, required_skill_id, required_level FROM skill_requirements",
                (rs, rowNum) -> new RequirementRow(rs.getInt(1), rs.getInt(2), rs.getInt(3)));
    }

    public record RequirementRow(int skillId, int requiredSkillId, int requiredLevel) {}
}
