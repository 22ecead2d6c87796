package com.nexus.skillplan.queue;

import com.nexus.skillplan.domain.DomainModels.SkillRequest;
import com.nexus.skillplan.domain.DomainModels.TrainingStep;
import com.nexus.skillplan.domain.SkillLevels;
import com.nexus.skillplan.domain.SkillPlanException;
import com.nexus.skillplan.graph.*;
import com.nexus.skillplan.queue.QueueModels.Resolution;
import com.nexus.skillplan.queue.QueueModels.ResolutionIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns skill training requests into ordered, deduplicated training steps.
 *
 * <p>{@link #addSkillRequest} is the interactive mode and accumulates state across
 * calls; {@link #correctQueue} rebuilds a whole list in one call and keeps its
 * bookkeeping local to that call. Both share the depth cache of this instance, so a
 * resolver must only be used with the provider data it was created for.
 *
 * <p>Not thread-safe.
 */
public class QueueResolver {
    private static final Logger LOG = LoggerFactory.getLogger(QueueResolver.class);

    private final RequirementLookup lookup;
    private final DepthCalculator depths;
    private final PrerequisiteExpander expander;
    private final StepOrderer orderer;
    private final PlanSession session;

    public QueueResolver(SkillRequirementProvider provider) {
        this(provider, new PlanSession());
    }

    public QueueResolver(SkillRequirementProvider provider, PlanSession session) {
        this.lookup = new RequirementLookup(provider);
        this.depths = new DepthCalculator(lookup);
        this.expander = new PrerequisiteExpander(lookup);
        this.orderer = new StepOrderer(depths);
        this.session = Objects.requireNonNull(session, "session");
    }

    /**
     * Adds one request to the session and returns only the steps it newly requires.
     *
     * <p>The first time a skill is touched its full prerequisite closure is planned and
     * its own ladder starts at level 1, whatever {@code baselineLevel} says. Later
     * requests for a higher level only add the ladder above {@code baselineLevel}.
     */
    public Resolution addSkillRequest(int skillId, int targetLevel, int baselineLevel) {
        SkillLevels.requireTarget(skillId, targetLevel);
        SkillLevels.requireTrained(skillId, baselineLevel);

        List<TrainingStep> candidates;
        if (!session.isAdded(skillId)) {
            candidates = closure(skillId, targetLevel);
            candidates.forEach(step -> session.record(step.skillId(), step.level()));
        } else if (targetLevel > session.sessionLevel(skillId)) {
            candidates = new ArrayList<>();
            for (int level = baselineLevel + 1; level <= targetLevel; level++) {
                candidates.add(new TrainingStep(skillId, level));
            }
            session.record(skillId, targetLevel);
        } else {
            LOG.debug("Skill {} already planned to level {}, nothing to add for level {}",
                    skillId, session.sessionLevel(skillId), targetLevel);
            return Resolution.empty();
        }

        List<TrainingStep> emitted = emitNew(candidates, session);
        LOG.debug("Skill {} to level {}: {} new steps of {} candidates", skillId, targetLevel, emitted.size(), candidates.size());
        return new Resolution(emitted, unknownSkillWarnings(candidates), List.of());
    }

    /**
     * Rebuilds a queue from requests in input order. Each request contributes its ordered
     * closure minus anything an earlier request already produced. A request that fails
     * is reported in {@link Resolution#failures()} and the rest of the batch still runs.
     */
    public Resolution correctQueue(List<SkillRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        PlanSession batch = new PlanSession();
        List<TrainingStep> queue = new ArrayList<>();
        Set<TrainingStep> touched = new LinkedHashSet<>();
        List<ResolutionIssue> failures = new ArrayList<>();

        LOG.debug("Correcting queue of {} requests", requests.size());
        for (int i = 0; i < requests.size(); i++) {
            SkillRequest request = requests.get(i);
            if (request == null) {
                failures.add(new ResolutionIssue("INVALID_REQUEST", "Queue entry " + (i + 1) + " is empty", 0));
                continue;
            }
            try {
                SkillLevels.requireTarget(request.skillId(), request.level());
                List<TrainingStep> candidates = closure(request.skillId(), request.level());
                List<TrainingStep> added = emitNew(candidates, batch);
                queue.addAll(added);
                touched.addAll(candidates);
                LOG.debug("Entry {} (skill {} level {}): {} added, {} duplicates",
                        i + 1, request.skillId(), request.level(), added.size(), candidates.size() - added.size());
            } catch (SkillPlanException e) {
                LOG.warn("Skipping queue entry {} for skill {}: {}", i + 1, request.skillId(), e.getMessage());
                failures.add(new ResolutionIssue(e.code(), e.getMessage(), request.skillId()));
            }
        }
        LOG.debug("Corrected queue has {} steps, {} failed entries", queue.size(), failures.size());
        return new Resolution(List.copyOf(queue), unknownSkillWarnings(touched), List.copyOf(failures));
    }

    public PlanSession session() {
        return session;
    }

    private List<TrainingStep> closure(int skillId, int targetLevel) {
        depths.depth(skillId);
        return orderer.order(expander.expand(skillId, targetLevel));
    }

    private static List<TrainingStep> emitNew(List<TrainingStep> candidates, PlanSession into) {
        List<TrainingStep> emitted = new ArrayList<>();
        for (TrainingStep step : candidates) {
            if (into.emit(step)) emitted.add(step);
        }
        return List.copyOf(emitted);
    }

    private List<ResolutionIssue> unknownSkillWarnings(Collection<TrainingStep> steps) {
        return steps.stream()
                .map(TrainingStep::skillId)
                .distinct()
                .sorted()
                .filter(lookup::isUnknown)
                .map(id -> new ResolutionIssue("UNKNOWN_SKILL", "No data for skill " + id + ", planned without prerequisites", id))
                .toList();
    }
}
