package com.nexus.skillplan.api;

import com.nexus.skillplan.domain.DomainModels.SkillRequest;
import com.nexus.skillplan.queue.QueueModels;
import com.nexus.skillplan.queue.SkillQueueService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/plans")
public class SkillPlanController {
    private final SkillQueueService queueService;

    public SkillPlanController(SkillQueueService queueService) {
        this.queueService = queueService;
    }

    @PostMapping("/sessions")
    public ResponseEntity<QueueModels.SessionInfo> startSession(@RequestBody(required = false) StartSessionRequest request) {
        return ResponseEntity.ok(queueService.startSession(request == null ? null : request.characterId()));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<QueueModels.SessionInfo> session(@PathVariable String sessionId) {
        return ResponseEntity.ok(queueService.describeSession(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/skills")
    public ResponseEntity<QueueModels.Resolution> addSkill(@PathVariable String sessionId, @RequestBody SkillRequest request) {
        return ResponseEntity.ok(queueService.addSkill(sessionId, request.skillId(), request.level()));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        queueService.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/correct")
    public ResponseEntity<QueueModels.Resolution> correct(@RequestBody CorrectRequest request) {
        return ResponseEntity.ok(queueService.correctQueue(request.requests()));
    }

    @PostMapping("/import")
    public ResponseEntity<QueueModels.PlanImportResult> importPlan(@RequestBody ImportPlanRequest request) {
        return ResponseEntity.ok(queueService.importPlan(request.content()));
    }

    public record StartSessionRequest(String characterId) {}

    public record CorrectRequest(List<SkillRequest> requests) {}

    public record ImportPlanRequest(String content) {}
}
