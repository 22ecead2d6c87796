package com.nexus.skillplan.domain;

public class UnknownSkillException extends SkillPlanException {
    private static final long serialVersionUID = 1L;

    private final int skillId;

    public UnknownSkillException(int skillId) {
        super("UNKNOWN_SKILL", "No data for skill " + skillId);
        this.skillId = skillId;
    }

    public int skillId() {
        return skillId;
    }
}
