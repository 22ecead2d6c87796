package com.nexus.skillplan.queue;

import com.nexus.skillplan.domain.DomainModels.TrainingStep;
import com.nexus.skillplan.parser.ParserDtos.ParseError;

import java.time.Instant;
import java.util.List;

public class QueueModels {
    public record ResolutionIssue(String code, String message, int skillId) {}

    public record Resolution(List<TrainingStep> steps,
                             List<ResolutionIssue> warnings,
                             List<ResolutionIssue> failures) {
        public static Resolution empty() {
            return new Resolution(List.of(), List.of(), List.of());
        }
    }

    public record SessionInfo(String sessionId, String characterId, Instant startedAt, long graphVersion) {}

    public record PlanImportResult(Resolution resolution, List<ParseError> parseErrors, List<String> notFoundSkills) {}
}
