package com.nexus.skillplan.domain;

public class SessionNotFoundException extends SkillPlanException {
    private static final long serialVersionUID = 1L;

    public SessionNotFoundException(String sessionId) {
        super("SESSION_NOT_FOUND", "Plan session not found: " + sessionId);
    }
}
