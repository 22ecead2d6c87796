package com.nexus.skillplan.parser;

import com.nexus.skillplan.domain.DomainModels.SkillRequest;

import java.util.List;

public class ParserDtos {
    public record ParseError(String code, String message, int line, String text) {}

    public record ParseResult(List<SkillRequest> requests, List<ParseError> errors, List<String> notFoundSkills) {
        public boolean hasErrors() {
            return !errors.isEmpty() || !notFoundSkills.isEmpty();
        }
    }
}
