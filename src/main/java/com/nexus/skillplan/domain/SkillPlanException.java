package com.nexus.skillplan.domain;

/**
 * Base class for skill planning errors. Each subclass carries a stable error code
 * that is reported to API callers and in per-item batch failures.
 */
public class SkillPlanException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String code;

    public SkillPlanException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
