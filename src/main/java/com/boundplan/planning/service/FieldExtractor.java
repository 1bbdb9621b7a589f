package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.IDENTIFIER_FIELDS;
import static com.boundplan.planning.PlanningConstants.SHORT_MESSAGE_MAX_WORDS;

import com.boundplan.planning.model.NextInputRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls answers for the previously requested fields out of a free-text user message.
 */
@Service
@Slf4j
public class FieldExtractor {

    public Map<String, String> extract(String message, @Nullable NextInputRequest lastRequest) {
        Map<String, String> extracted = new LinkedHashMap<>();
        if (lastRequest == null || message == null) {
            return extracted;
        }
        String lowered = message.toLowerCase(Locale.ROOT);
        for (String field : lastRequest.writesTo()) {
            if (!StringUtils.hasText(field) || !lowered.contains(field.toLowerCase(Locale.ROOT))) {
                continue;
            }
            Matcher matcher = Pattern.compile(Pattern.quote(field) + "[:=]\\s*([^\\n,]+)", Pattern.CASE_INSENSITIVE)
                    .matcher(message);
            String value = matcher.find() ? matcher.group(1).trim() : message.trim();
            extracted.put(field, value);
            log.debug("Extracted field {}", field);
        }
        return extracted;
    }

    /**
     * Picks the identifier to look a person up by: the value of a freshly extracted
     * identifying field, else the whole message when it is short enough to be a name.
     */
    public Optional<String> enrichmentIdentifier(Map<String, String> extracted, String message) {
        for (String field : IDENTIFIER_FIELDS) {
            String value = extracted.get(field);
            if (StringUtils.hasText(value)) {
                return Optional.of(value.trim());
            }
        }
        if (StringUtils.hasText(message) && message.trim().split("\\s+").length <= SHORT_MESSAGE_MAX_WORDS) {
            return Optional.of(message.trim());
        }
        return Optional.empty();
    }
}
