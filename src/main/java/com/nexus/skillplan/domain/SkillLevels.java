package com.nexus.skillplan.domain;

public final class SkillLevels {
    public static final int UNTRAINED = 0;
    public static final int MAX = 5;

    private SkillLevels() {}

    public static int requireTarget(int skillId, int level) {
        if (level < 1 || level > MAX) {
            throw new InvalidLevelException(skillId, "target level " + level + " must be in [1," + MAX + "]");
        }
        return level;
    }

    public static int requireTrained(int skillId, int level) {
        if (level < UNTRAINED || level > MAX) {
            throw new InvalidLevelException(skillId, "trained level " + level + " must be in [0," + MAX + "]");
        }
        return level;
    }
}
