package com.nexus.skillplan.graph;

import com.nexus.skillplan.domain.DomainModels.TrainingStep;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public class StepOrderer {
    private final Comparator<TrainingStep> order;

    public StepOrderer(DepthCalculator depths) {
        this.order = Comparator.<TrainingStep>comparingInt(s -> depths.depth(s.skillId()))
                .thenComparingInt(TrainingStep::skillId)
                .thenComparingInt(TrainingStep::level);
    }

    /** Sorts by depth, then skill id, then level, all ascending. Prerequisites always sort first. */
    public List<TrainingStep> order(Collection<TrainingStep> steps) {
        return steps.stream().sorted(order).toList();
    }
}
