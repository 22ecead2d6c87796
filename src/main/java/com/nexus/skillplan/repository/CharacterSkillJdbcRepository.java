package com.nexus.skillplan.repository;

import com.nexus.skillplan.domain.InvalidLevelException;
import com.nexus.skillplan.domain.SkillLevels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.*;

@Repository
public class CharacterSkillJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CharacterSkillJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void replaceLevels(String characterId, Map<Integer, Integer> levels) {
        levels.forEach((skillId, level) -> {
            if (level == null) throw new InvalidLevelException(skillId, "trained level is missing");
            SkillLevels.requireTrained(skillId, level);
        });

        jdbcTemplate.update("DELETE FROM character_skills WHERE character_id = ?", characterId);
        new TreeMap<>(levels).forEach((skillId, level) -> jdbcTemplate.update(
                "INSERT INTO character_skills(character_id, skill_id, trained_level) VALUES (?,?,?)",
                characterId, skillId, level));
    }

    public Map<Integer, Integer> loadLevels(String characterId) {
        Map<Integer, Integer> levels = new TreeMap<>();
        jdbcTemplate.query(
                "SELECT skill_id, trained_level FROM character_skills WHERE character_id = ?",
                (rs, n) -> new LevelRow(rs.getInt(1), rs.getInt(2)),
                characterId).forEach(r -> levels.put(r.skillId(), r.trainedLevel()));
        return levels;
    }

    public int loadLevel(String characterId, int skillId) {
        List<Integer> rows = jdbcTemplate.query(
                "SELECT trained_level FROM character_skills WHERE character_id = ? AND skill_id = ?",
                (rs, n) -> rs.getInt(1),
                characterId, skillId);
        return rows.isEmpty() ? SkillLevels.UNTRAINED : rows.get(0);
    }

    public record LevelRow(int skillId, int trainedLevel) {}
}
