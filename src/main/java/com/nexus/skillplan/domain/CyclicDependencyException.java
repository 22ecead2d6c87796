package com.nexus.skillplan.domain;

import java.util.List;
import java.util.stream.Collectors;

public class CyclicDependencyException extends SkillPlanException {
    private static final long serialVersionUID = 1L;

    private final List<Integer> cycle;

    public CyclicDependencyException(List<Integer> cycle) {
        super("CYCLIC_DEPENDENCY", "Prerequisite cycle: "
                + cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    /** Skill ids along the cycle; the first and last entries are the same skill. */
    public List<Integer> cycle() {
        return cycle;
    }
}
