package com.nexus.skillplan.api;

import com.nexus.skillplan.domain.DomainModels;
import com.nexus.skillplan.graph.SkillGraph;
import com.nexus.skillplan.graph.SkillGraphModels;
import com.nexus.skillplan.graph.SkillGraphService;
import com.nexus.skillplan.repository.CharacterSkillJdbcRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class SkillDataController {
    private final SkillGraphService graphService;
    private final CharacterSkillJdbcRepository characterSkills;

    public SkillDataController(SkillGraphService graphService, CharacterSkillJdbcRepository characterSkills) {
        this.graphService = graphService;
        this.characterSkills = characterSkills;
    }

    @PostMapping("/skills/import")
    public ResponseEntity<SkillGraphModels.GraphLoadResult> importSkills(@RequestBody SkillImportRequest request) {
        return ResponseEntity.ok(graphService.loadAndPersist(request.skills()));
    }

    @PostMapping("/skills/reload")
    public ResponseEntity<SkillGraphModels.GraphLoadResult> reloadSkills() {
        SkillGraph graph = graphService.reload();
        return ResponseEntity.ok(new SkillGraphModels.GraphLoadResult(true, graph.skillCount(), graph.requirementCount(), graph.version(), List.of()));
    }

    @GetMapping("/skills/{skillId}/requirements")
    public ResponseEntity<SkillGraphModels.SkillRequirementView> requirements(@PathVariable int skillId) {
        return ResponseEntity.ok(graphService.describe(skillId));
    }

    @GetMapping("/characters/{characterId}/skills")
    public ResponseEntity<Map<Integer, Integer>> characterSkills(@PathVariable String characterId) {
        return ResponseEntity.ok(characterSkills.loadLevels(characterId));
    }

    @PutMapping("/characters/{characterId}/skills")
    public ResponseEntity<Void> replaceCharacterSkills(@PathVariable String characterId, @RequestBody CharacterSkillsRequest request) {
        characterSkills.replaceLevels(characterId, request.levels() == null ? Map.of() : request.levels());
        return ResponseEntity.noContent().build();
    }

    public record SkillImportRequest(List<DomainModels.Skill> skills) {}

    public record CharacterSkillsRequest(Map<Integer, Integer> levels) {}
}
