package com.nexus.skillplan;

import com.nexus.skillplan.domain.CyclicDependencyException;
import com.nexus.skillplan.domain.DomainModels.Skill;
import com.nexus.skillplan.domain.DomainModels.SkillRequest;
import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import com.nexus.skillplan.domain.DomainModels.TrainingStep;
import com.nexus.skillplan.domain.InvalidLevelException;
import com.nexus.skillplan.graph.SkillGraph;
import com.nexus.skillplan.queue.QueueResolver;
import org.junit.jupiter.api.Test;

import java.util.*;

import static com.nexus.skillplan.SkillFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class QueueResolverTest {
    private static final int B = 100;
    private static final int A = 200;

    private final SkillGraph aNeedsB3 = graph(skill(B, "B"), skill(A, "A", req(B, 3)));

    @Test
    void plansPrerequisiteLadderBeforeRequestedSkill() {
        var resolver = new QueueResolver(aNeedsB3);

        var result = resolver.addSkillRequest(A, 2, 0);

        assertEquals(List.of(step(B, 1), step(B, 2), step(B, 3), step(A, 1), step(A, 2)), result.steps());
        assertTrue(result.warnings().isEmpty());
        assertTrue(result.failures().isEmpty());
    }

    @Test
    void sharedPrerequisiteIsTrainedToHighestLevelBeforeDependents() {
        int e = 10, d = 20, c = 30;
        var resolver = new QueueResolver(graph(
                skill(e, "E"),
                skill(d, "D", req(e, 2)),
                skill(c, "C", req(d, 2), req(e, 1))));

        var result = resolver.addSkillRequest(c, 1, 0);

        assertEquals(List.of(step(e, 1), step(e, 2), step(d, 1), step(d, 2), step(c, 1)), result.steps());
    }

    @Test
    void repeatingSameRequestEmitsNothing() {
        var resolver = new QueueResolver(aNeedsB3);

        assertFalse(resolver.addSkillRequest(A, 3, 0).steps().isEmpty());
        assertTrue(resolver.addSkillRequest(A, 3, 0).steps().isEmpty());
    }

    @Test
    void raisingTargetOnlyAddsMissingLevels() {
        var resolver = new QueueResolver(aNeedsB3);
        resolver.addSkillRequest(A, 2, 0);

        var result = resolver.addSkillRequest(A, 4, 0);

        assertEquals(List.of(step(A, 3), step(A, 4)), result.steps());
    }

    @Test
    void lowerTargetThanPlannedIsNoOp() {
        var resolver = new QueueResolver(aNeedsB3);
        resolver.addSkillRequest(A, 4, 0);

        assertTrue(resolver.addSkillRequest(A, 2, 0).steps().isEmpty());
        assertTrue(resolver.addSkillRequest(A, 4, 0).steps().isEmpty());
    }

    @Test
    void firstTouchLaddersFromLevelOneEvenWhenAlreadyTrained() {
        var resolver = new QueueResolver(aNeedsB3);

        var result = resolver.addSkillRequest(B, 4, 3);

        assertEquals(List.of(step(B, 1), step(B, 2), step(B, 3), step(B, 4)), result.steps());
    }

    @Test
    void laterTouchStartsAboveTrainedLevel() {
        var resolver = new QueueResolver(aNeedsB3);
        resolver.addSkillRequest(A, 1, 0);

        var result = resolver.addSkillRequest(A, 5, 3);

        assertEquals(List.of(step(A, 4), step(A, 5)), result.steps());
        assertEquals(5, resolver.session().sessionLevel(A));
    }

    @Test
    void prerequisitesCountAsPlannedForLaterRequests() {
        var resolver = new QueueResolver(aNeedsB3);
        resolver.addSkillRequest(A, 1, 0);

        assertTrue(resolver.session().isAdded(B));
        assertEquals(3, resolver.session().sessionLevel(B));
        assertTrue(resolver.addSkillRequest(B, 2, 0).steps().isEmpty());
        assertEquals(List.of(step(B, 4), step(B, 5)), resolver.addSkillRequest(B, 5, 0).steps());
    }

    @Test
    void secondDependentOnlyAddsHigherPrerequisiteLevels() {
        int c = 300;
        var resolver = new QueueResolver(graph(skill(B, "B"), skill(A, "A", req(B, 3)), skill(c, "C", req(B, 5))));
        resolver.addSkillRequest(A, 1, 0);

        var result = resolver.addSkillRequest(c, 1, 0);

        assertEquals(List.of(step(B, 4), step(B, 5), step(c, 1)), result.steps());
        assertEquals(5, resolver.session().sessionLevel(B));
    }

    @Test
    void rejectsLevelsOutsideRange() {
        var resolver = new QueueResolver(aNeedsB3);

        var ex = assertThrows(InvalidLevelException.class, () -> resolver.addSkillRequest(A, 0, 0));
        assertEquals("INVALID_LEVEL", ex.code());
        assertEquals(A, ex.skillId());
        assertThrows(InvalidLevelException.class, () -> resolver.addSkillRequest(A, 6, 0));
        assertThrows(InvalidLevelException.class, () -> resolver.addSkillRequest(A, 3, -1));
        assertThrows(InvalidLevelException.class, () -> resolver.addSkillRequest(A, 3, 6));
        assertEquals(0, resolver.session().emittedCount());
    }

    @Test
    void cyclicRequestFailsWithoutTouchingSession() {
        var resolver = new QueueResolver(graph(skill(1, "X", req(2, 1)), skill(2, "Y", req(1, 1))));

        assertThrows(CyclicDependencyException.class, () -> resolver.addSkillRequest(1, 1, 0));
        assertEquals(0, resolver.session().emittedCount());
        assertFalse(resolver.session().isAdded(1));
    }

    @Test
    void unknownSkillIsPlannedWithWarning() {
        var resolver = new QueueResolver(graph(skill(300, "P", req(777, 2))));

        var result = resolver.addSkillRequest(300, 1, 0);

        assertEquals(List.of(step(777, 1), step(777, 2), step(300, 1)), result.steps());
        assertEquals(1, result.warnings().size());
        assertEquals("UNKNOWN_SKILL", result.warnings().get(0).code());
        assertEquals(777, result.warnings().get(0).skillId());

        var direct = new QueueResolver(aNeedsB3).addSkillRequest(999, 2, 0);
        assertEquals(List.of(step(999, 1), step(999, 2)), direct.steps());
        assertEquals(999, direct.warnings().get(0).skillId());
    }

    @Test
    void correctQueueDeduplicatesAcrossRequests() {
        var resolver = new QueueResolver(graph(skill(B, "B"), skill(A, "A", req(B, 1))));

        var result = resolver.correctQueue(List.of(new SkillRequest(A, 2), new SkillRequest(B, 1)));

        assertEquals(List.of(step(B, 1), step(A, 1), step(A, 2)), result.steps());
    }

    @Test
    void correctQueueKeepsInputOrderBetweenRequests() {
        var resolver = new QueueResolver(graph(skill(B, "B"), skill(A, "A", req(B, 1))));

        var result = resolver.correctQueue(List.of(new SkillRequest(A, 2), new SkillRequest(B, 3)));

        assertEquals(List.of(step(B, 1), step(A, 1), step(A, 2), step(B, 2), step(B, 3)), result.steps());
    }

    @Test
    void correctQueueContinuesPastFailedEntries() {
        var resolver = new QueueResolver(graph(
                skill(1, "X", req(2, 1)), skill(2, "Y", req(1, 1)),
                skill(B, "B"), skill(A, "A", req(B, 1))));

        var result = resolver.correctQueue(Arrays.asList(
                new SkillRequest(1, 1),
                new SkillRequest(A, 7),
                null,
                new SkillRequest(A, 1)));

        assertEquals(List.of(step(B, 1), step(A, 1)), result.steps());
        assertEquals(List.of("CYCLIC_DEPENDENCY", "INVALID_LEVEL", "INVALID_REQUEST"),
                result.failures().stream().map(f -> f.code()).toList());
    }

    @Test
    void correctQueueDoesNotTouchInteractiveSession() {
        var resolver = new QueueResolver(aNeedsB3);
        resolver.correctQueue(List.of(new SkillRequest(A, 2)));

        assertEquals(0, resolver.session().emittedCount());
        assertEquals(5, resolver.addSkillRequest(A, 2, 0).steps().size());
        assertEquals(5, resolver.correctQueue(List.of(new SkillRequest(A, 2))).steps().size());
    }

    @Test
    void generatedGraphsProduceTrainableDeterministicQueues() {
        Random random = new Random(42);
        SkillGraph generated = randomGraph(random, 40);
        List<SkillRequest> requests = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            Skill target = new ArrayList<>(generated.skills()).get(random.nextInt(generated.skillCount()));
            requests.add(new SkillRequest(target.id(), 1 + random.nextInt(5)));
        }

        var batch = new QueueResolver(generated).correctQueue(requests);
        assertTrue(batch.failures().isEmpty());
        assertTrainable(batch.steps(), generated);
        assertEquals(batch.steps(), new QueueResolver(generated).correctQueue(requests).steps());

        var interactive = new QueueResolver(generated);
        List<TrainingStep> planned = new ArrayList<>();
        for (SkillRequest request : requests) {
            planned.addAll(interactive.addSkillRequest(request.skillId(), request.level(), 0).steps());
        }
        assertTrainable(planned, generated);
        assertEquals(planned.size(), interactive.session().emittedCount());
    }

    // Ids are shuffled so that id order and prerequisite order disagree.
    private static SkillGraph randomGraph(Random random, int size) {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < size; i++) ids.add(1000 + i * 7);
        Collections.shuffle(ids, random);

        List<Skill> skills = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            List<SkillRequirement> reqs = new ArrayList<>();
            int count = i == 0 ? 0 : random.nextInt(Math.min(i, 3) + 1);
            for (int r = 0; r < count; r++) {
                reqs.add(req(ids.get(random.nextInt(i)), 1 + random.nextInt(5)));
            }
            skills.add(new Skill(ids.get(i), "Skill " + i, null, reqs));
        }
        return SkillGraph.of(1, skills);
    }
}
