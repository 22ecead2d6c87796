package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.DomainModels.Skill;
import com.nexus.skillplan.domain.DomainModels.SkillRequirement;
import com.nexus.skillplan.domain.UnknownSkillException;
import com.nexus.skillplan.graph.SkillGraphModels.*;
import com.nexus.skillplan.repository.SkillJdbcRepository;
import com.nexus.skillplan.validation.SkillGraphValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class SkillGraphService {
    private static final Logger LOG = LoggerFactory.getLogger(SkillGraphService.class);

    private final SkillJdbcRepository repository;
    private final SkillGraphValidator validator;
    private final AtomicReference<SkillGraph> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public SkillGraphService(SkillJdbcRepository repository, SkillGraphValidator validator) {
        this.repository = repository;
        this.validator = validator;
    }

    public GraphLoadResult loadAndPersist(List<Skill> skills) {
        List<Skill> input = skills == null ? List.of() : skills;
        List<GraphValidationIssue> issues = validator.validate(input);
        int requirementCount = input.stream().filter(Objects::nonNull).mapToInt(s -> s.requirements().size()).sum();

        if (!issues.isEmpty()) {
            LOG.warn("Rejected skill data: {} skills, {} issues, first: {}", input.size(), issues.size(), issues.get(0));
            return new GraphLoadResult(false, input.size(), requirementCount, currentVersion(), issues);
        }

        repository.replaceAll(input);
        SkillGraph graph = SkillGraph.of(versions.incrementAndGet(), input);
        current.set(graph);
        LOG.info("Loaded skill graph v{}: {} skills, {} requirements", graph.version(), graph.skillCount(), graph.requirementCount());
        return new GraphLoadResult(true, input.size(), requirementCount, graph.version(), List.of());
    }

    /** The published snapshot, read from the store on first use. */
    public SkillGraph currentGraph() {
        SkillGraph cached = current.get();
        if (cached != null) return cached;

        List<Skill> stored = repository.loadSkills();
        SkillGraph loaded = stored.isEmpty() ? SkillGraph.empty() : SkillGraph.of(versions.incrementAndGet(), stored);
        if (current.compareAndSet(null, loaded)) {
            LOG.info("Read skill graph v{} from store: {} skills", loaded.version(), loaded.skillCount());
        }
        return current.get();
    }

    /** Drops the cached snapshot and reads the store again. */
    public SkillGraph reload() {
        current.set(null);
        return currentGraph();
    }

    public SkillRequirementView describe(int skillId) {
        SkillGraph graph = currentGraph();
        Skill skill = graph.skill(skillId).orElseThrow(() -> new UnknownSkillException(skillId));

        RequirementLookup lookup = new RequirementLookup(graph);
        int depth = new DepthCalculator(lookup).depth(skillId);
        List<SkillRequirement> transitive = new ArrayList<>();
        new PrerequisiteExpander(lookup).requiredLevels(skillId)
                .forEach((id, level) -> transitive.add(new SkillRequirement(id, level)));

        return new SkillRequirementView(skillId, skill.name(), depth, List.copyOf(graph.requirementsOf(skillId)), transitive);
    }

    private long currentVersion() {
        SkillGraph graph = current.get();
        return graph == null ? 0 : graph.version();
    }
}
