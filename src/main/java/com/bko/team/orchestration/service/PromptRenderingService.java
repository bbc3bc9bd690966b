package com.bko.team.orchestration.service;

import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fills named {@code {placeholder}} slots of a prompt template. A placeholder without a value
 * is rejected by the template engine.
 */
@Service
public class PromptRenderingService {

    public String render(String template, Map<String, ?> variables) {
        Map<String, Object> values = new HashMap<>();
        variables.forEach((name, value) -> values.put(name, Objects.toString(value, "")));
        return new PromptTemplate(template).render(values);
    }
}
