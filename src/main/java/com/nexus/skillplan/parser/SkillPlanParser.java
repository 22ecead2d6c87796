package com.nexus.skillplan.parser;

import com.nexus.skillplan.domain.DomainModels.SkillRequest;
import com.nexus.skillplan.domain.SkillLevels;
import com.nexus.skillplan.graph.SkillGraph;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.nexus.skillplan.parser.ParserDtos.*;

/**
 * Reads plain-text skill plans, one "Skill Name level" entry per line, as exported by
 * the game client and common planning tools.
 */
@Component
public class SkillPlanParser {
    private static final Pattern ENTRY_PATTERN = Pattern.compile("^(.+?)\\s+([1-5])$");

    public ParseResult parse(String content, SkillGraph graph) {
        List<SkillRequest> requests = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        LinkedHashSet<String> notFound = new LinkedHashSet<>();
        if (content == null || content.isBlank()) {
            return new ParseResult(requests, errors, List.of());
        }

        List<String> lines = Arrays.asList(content.split("\\R", -1));
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).strip();
            int lineNo = i + 1;
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

            Matcher matcher = ENTRY_PATTERN.matcher(trimmed);
            if (!matcher.matches()) {
                errors.add(new ParseError("INVALID_LINE", "Expected '<skill name> <level 1-" + SkillLevels.MAX + ">'", lineNo, trimmed));
                continue;
            }

            String name = matcher.group(1).strip();
            int level = Integer.parseInt(matcher.group(2));

            Optional<Integer> skillId = graph.findByName(name);
            if (skillId.isPresent()) {
                requests.add(new SkillRequest(skillId.get(), level));
            } else {
                notFound.add(name);
            }
        }
        return new ParseResult(requests, errors, List.copyOf(notFound));
    }
}
