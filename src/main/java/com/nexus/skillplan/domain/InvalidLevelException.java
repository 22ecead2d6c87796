package com.nexus.skillplan.domain;

public class InvalidLevelException extends SkillPlanException {
    private static final long serialVersionUID = 1L;

    private final int skillId;

    public InvalidLevelException(int skillId, String reason) {
        super("INVALID_LEVEL", "Invalid level for skill " + skillId + ": " + reason);
        this.skillId = skillId;
    }

    public int skillId() {
        return skillId;
    }
}
