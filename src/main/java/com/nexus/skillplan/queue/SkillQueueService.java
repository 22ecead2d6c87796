package com.nexus.skillplan.queue;

import com.nexus.skillplan.domain.DomainModels.SkillRequest;
import com.nexus.skillplan.domain.SessionNotFoundException;
import com.nexus.skillplan.domain.SkillLevels;
import com.nexus.skillplan.graph.SkillGraph;
import com.nexus.skillplan.graph.SkillGraphService;
import com.nexus.skillplan.parser.ParserDtos.ParseResult;
import com.nexus.skillplan.parser.SkillPlanParser;
import com.nexus.skillplan.queue.QueueModels.*;
import com.nexus.skillplan.repository.CharacterSkillJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class SkillQueueService {
    private static final Logger LOG = LoggerFactory.getLogger(SkillQueueService.class);

    private final SkillGraphService graphService;
    private final CharacterSkillJdbcRepository characterSkills;
    private final SkillPlanParser parser;
    private final Duration maxIdle;

    private final Map<String, PlanSessionHolder> sessions = new ConcurrentHashMap<>();

    public SkillQueueService(SkillGraphService graphService,
                             CharacterSkillJdbcRepository characterSkills,
                             SkillPlanParser parser,
                             @Value("${skillplan.sessions.max-idle-minutes:60}") long maxIdleMinutes) {
        this.graphService = graphService;
        this.characterSkills = characterSkills;
        this.parser = parser;
        this.maxIdle = Duration.ofMinutes(maxIdleMinutes);
    }

    public SessionInfo startSession(String characterId) {
        SkillGraph graph = graphService.currentGraph();
        String sessionId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        sessions.put(sessionId, new PlanSessionHolder(characterId, new QueueResolver(graph), graph.version(), now));
        LOG.info("Started plan session {} for character {} on skill graph v{}", sessionId, characterId, graph.version());
        return new SessionInfo(sessionId, characterId, now, graph.version());
    }

    public Resolution addSkill(String sessionId, int skillId, int targetLevel) {
        PlanSessionHolder holder = requireSession(sessionId);
        synchronized (holder) {
            try {
                int baseline = holder.characterId == null
                        ? SkillLevels.UNTRAINED
                        : characterSkills.loadLevel(holder.characterId, skillId);
                return holder.resolver.addSkillRequest(skillId, targetLevel, baseline);
            } finally {
                holder.lastAccess = Instant.now();
            }
        }
    }

    public SessionInfo describeSession(String sessionId) {
        PlanSessionHolder holder = requireSession(sessionId);
        return new SessionInfo(sessionId, holder.characterId, holder.startedAt, holder.graphVersion);
    }

    public void endSession(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        LOG.info("Ended plan session {}", sessionId);
    }

    public Resolution correctQueue(List<SkillRequest> requests) {
        return new QueueResolver(graphService.currentGraph()).correctQueue(requests == null ? List.of() : requests);
    }

    public PlanImportResult importPlan(String content) {
        SkillGraph graph = graphService.currentGraph();
        ParseResult parsed = parser.parse(content, graph);
        if (parsed.hasErrors()) {
            LOG.warn("Plan import: {} unparseable lines, {} unknown skill names", parsed.errors().size(), parsed.notFoundSkills().size());
        }
        Resolution resolution = new QueueResolver(graph).correctQueue(parsed.requests());
        return new PlanImportResult(resolution, parsed.errors(), parsed.notFoundSkills());
    }

    @Scheduled(fixedDelayString = "${skillplan.sessions.sweep-delay-ms:300000}")
    public void scheduledSweep() {
        evictIdleSessions(Instant.now());
    }

    public int evictIdleSessions(Instant now) {
        Instant cutoff = now.minus(maxIdle);
        int before = sessions.size();
        sessions.values().removeIf(h -> h.lastAccess.isBefore(cutoff));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            LOG.info("Evicted {} idle plan sessions", evicted);
        }
        return evicted;
    }

    private PlanSessionHolder requireSession(String sessionId) {
        PlanSessionHolder holder = sessionId == null ? null : sessions.get(sessionId);
        if (holder == null) throw new SessionNotFoundException(sessionId);
        return holder;
    }

    private static final class PlanSessionHolder {
        private final String characterId;
        private final QueueResolver resolver;
        private final long graphVersion;
        private final Instant startedAt;
        private volatile Instant lastAccess;

        private PlanSessionHolder(String characterId, QueueResolver resolver, long graphVersion, Instant startedAt) {
            this.characterId = characterId;
            this.resolver = resolver;
            this.graphVersion = graphVersion;
            this.startedAt = startedAt;
            this.lastAccess = startedAt;
        }
    }
}
