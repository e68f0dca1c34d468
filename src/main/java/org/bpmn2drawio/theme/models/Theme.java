package org.bpmn2drawio.theme.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved, read-only set of style values plus the lane rules, first match wins.
 * Values may include keys the generator does not know; they are carried along
 * and never read.
 */
public record Theme(String name, Map<String, String> values, List<LaneStyleRule> laneRules) {

    public Theme {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        laneRules = List.copyOf(laneRules);
    }

    public String get(String key) {
        return values.get(key);
    }

    public String getOrDefault(String key, String fallback) {
        return values.getOrDefault(key, fallback);
    }

    public Optional<LaneStyleRule> laneRuleFor(String laneName) {
        return laneRules.stream().filter(rule -> rule.matches(laneName)).findFirst();
    }
}
