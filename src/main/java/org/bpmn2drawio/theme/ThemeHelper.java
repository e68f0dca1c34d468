package org.bpmn2drawio.theme;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.bpmn2drawio.ThemeConfigurationException;
import org.bpmn2drawio.theme.models.LaneStyleRule;
import org.bpmn2drawio.theme.models.Theme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import static org.bpmn2drawio.theme.ThemeKeys.*;

/**
 * Resolves the theme of a conversion: a built-in base theme, optionally
 * merged with a JSON override document. A new {@link Theme} is built on every
 * call, nothing is cached between conversions.
 */
public class ThemeHelper {
    private static final Logger log = LoggerFactory.getLogger(ThemeHelper.class);

    public static final String DEFAULT_THEME = "default";
    public static final List<String> BUILT_IN_THEMES = List.of("default", "blueprint", "monochrome", "high_contrast");

    private static final String OVERRIDE_SCHEMA = "schemas/theme_override_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Resolves the theme for one conversion.
     *
     * @param themeName    built-in theme name, null for {@value #DEFAULT_THEME}
     * @param overridePath optional JSON override document
     * @throws ThemeConfigurationException on an unknown theme or an unusable override document
     */
    public static Theme resolve(String themeName, Path overridePath) {
        if (overridePath == null) {
            return builtIn(themeName == null ? DEFAULT_THEME : themeName);
        }
        JsonNode override = loadOverride(overridePath);
        String baseName = override.hasNonNull("base_theme")
                ? override.get("base_theme").asText()
                : (themeName == null ? DEFAULT_THEME : themeName);
        return merge(builtIn(baseName), override);
    }

    /**
     * @throws ThemeConfigurationException if the name is not a built-in theme
     */
    public static Theme builtIn(String name) {
        Map<String, String> values = defaultValues();
        List<LaneStyleRule> laneRules;
        switch (name) {
            case "default" -> laneRules = List.of(
                    new LaneStyleRule("customer|client", "#d5e8d4", "#82b366"),
                    new LaneStyleRule("system|service", "#dae8fc", "#6c8ebf"),
                    new LaneStyleRule("manager|approv", "#fff2cc", "#d6b656"));
            case "blueprint" -> {
                putAll(values, "#e3f2fd", "#1976d2", START_EVENT_FILL, START_EVENT_STROKE);
                putAll(values, "#e3f2fd", "#1976d2", END_EVENT_FILL, END_EVENT_STROKE);
                putAll(values, "#e3f2fd", "#1976d2", INTERMEDIATE_EVENT_FILL, INTERMEDIATE_EVENT_STROKE);
                putAll(values, "#bbdefb", "#1976d2", TASK_FILL, TASK_STROKE);
                putAll(values, "#bbdefb", "#1976d2", SCRIPT_TASK_FILL, SCRIPT_TASK_STROKE);
                putAll(values, "#bbdefb", "#1976d2", BUSINESS_RULE_TASK_FILL, BUSINESS_RULE_TASK_STROKE);
                putAll(values, "#e3f2fd", "#1976d2", MANUAL_TASK_FILL, MANUAL_TASK_STROKE);
                putAll(values, "#e3f2fd", "#1976d2", GATEWAY_FILL, GATEWAY_STROKE);
                putAll(values, "#e3f2fd", "#1976d2", POOL_FILL, POOL_STROKE);
                values.put(SEQUENCE_FLOW_STROKE, "#1976d2");
                laneRules = List.of(
                        new LaneStyleRule("customer|client", "#e1f5fe", "#0288d1"),
                        new LaneStyleRule("system|service", "#bbdefb", "#1565c0"),
                        new LaneStyleRule("manager|approv", "#e8eaf6", "#283593"));
            }
            case "monochrome" -> {
                putAll(values, "#ffffff", "#333333", START_EVENT_FILL, START_EVENT_STROKE);
                putAll(values, "#f5f5f5", "#333333", END_EVENT_FILL, END_EVENT_STROKE);
                putAll(values, "#ffffff", "#333333", INTERMEDIATE_EVENT_FILL, INTERMEDIATE_EVENT_STROKE);
                putAll(values, "#ffffff", "#333333", TASK_FILL, TASK_STROKE);
                putAll(values, "#ffffff", "#333333", SCRIPT_TASK_FILL, SCRIPT_TASK_STROKE);
                putAll(values, "#ffffff", "#333333", BUSINESS_RULE_TASK_FILL, BUSINESS_RULE_TASK_STROKE);
                putAll(values, "#ffffff", "#333333", MANUAL_TASK_FILL, MANUAL_TASK_STROKE);
                putAll(values, "#ffffff", "#333333", GATEWAY_FILL, GATEWAY_STROKE);
                putAll(values, "#ffffff", "#333333", POOL_FILL, POOL_STROKE);
                putAll(values, "#ffffff", "#333333", LANE_FILL, LANE_STROKE);
                values.put(SEQUENCE_FLOW_STROKE, "#333333");
                values.put(MESSAGE_FLOW_STROKE, "#333333");
                laneRules = List.of(
                        new LaneStyleRule("customer|client", "#f5f5f5", "#333333"),
                        new LaneStyleRule("system|service", "#eeeeee", "#333333"),
                        new LaneStyleRule("manager|approv", "#e0e0e0", "#333333"));
            }
            case "high_contrast" -> {
                putAll(values, "#c8e6c9", "#2e7d32", START_EVENT_FILL, START_EVENT_STROKE);
                putAll(values, "#ffcdd2", "#c62828", END_EVENT_FILL, END_EVENT_STROKE);
                putAll(values, "#fff9c4", "#f57f17", INTERMEDIATE_EVENT_FILL, INTERMEDIATE_EVENT_STROKE);
                putAll(values, "#e3f2fd", "#0d47a1", TASK_FILL, TASK_STROKE);
                putAll(values, "#f3e5f5", "#6a1b9a", SCRIPT_TASK_FILL, SCRIPT_TASK_STROKE);
                putAll(values, "#fff3e0", "#e65100", BUSINESS_RULE_TASK_FILL, BUSINESS_RULE_TASK_STROKE);
                putAll(values, "#eceff1", "#37474f", MANUAL_TASK_FILL, MANUAL_TASK_STROKE);
                putAll(values, "#fff9c4", "#f57f17", GATEWAY_FILL, GATEWAY_STROKE);
                putAll(values, "#eceff1", "#37474f", POOL_FILL, POOL_STROKE);
                laneRules = List.of(
                        new LaneStyleRule("customer|client", "#c8e6c9", "#2e7d32"),
                        new LaneStyleRule("system|service", "#bbdefb", "#0d47a1"),
                        new LaneStyleRule("manager|approv", "#fff9c4", "#f57f17"));
            }
            default -> throw new ThemeConfigurationException(
                    "Unknown theme '" + name + "', expected one of " + String.join(", ", BUILT_IN_THEMES));
        }
        return new Theme(name, values, laneRules);
    }

    private static Map<String, String> defaultValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(START_EVENT_FILL, "#d5e8d4");
        values.put(START_EVENT_STROKE, "#82b366");
        values.put(END_EVENT_FILL, "#f8cecc");
        values.put(END_EVENT_STROKE, "#b85450");
        values.put(INTERMEDIATE_EVENT_FILL, "#fff2cc");
        values.put(INTERMEDIATE_EVENT_STROKE, "#d6b656");
        values.put(TASK_FILL, "#dae8fc");
        values.put(TASK_STROKE, "#6c8ebf");
        values.put(SCRIPT_TASK_FILL, "#e1d5e7");
        values.put(SCRIPT_TASK_STROKE, "#9673a6");
        values.put(BUSINESS_RULE_TASK_FILL, "#ffe6cc");
        values.put(BUSINESS_RULE_TASK_STROKE, "#d79b00");
        values.put(MANUAL_TASK_FILL, "#f5f5f5");
        values.put(MANUAL_TASK_STROKE, "#666666");
        values.put(GATEWAY_FILL, "#fff2cc");
        values.put(GATEWAY_STROKE, "#d6b656");
        values.put(POOL_FILL, "#f5f5f5");
        values.put(POOL_STROKE, "#666666");
        values.put(LANE_FILL, "#ffffff");
        values.put(LANE_STROKE, "#666666");
        values.put(SEQUENCE_FLOW_STROKE, "#666666");
        values.put(MESSAGE_FLOW_STROKE, "#666666");
        values.put(FONT_FAMILY, "Helvetica");
        values.put(FONT_SIZE, "12");
        values.put(FONT_COLOR, "#333333");
        return values;
    }

    private static void putAll(Map<String, String> values, String fill, String stroke, String fillKey, String strokeKey) {
        values.put(fillKey, fill);
        values.put(strokeKey, stroke);
    }

    /**
     * Reads an override document and checks it against the override schema.
     *
     * @throws ThemeConfigurationException if the file is missing, not JSON or rejected by the schema
     */
    public static JsonNode loadOverride(Path overridePath) {
        if (!Files.isRegularFile(overridePath)) {
            throw new ThemeConfigurationException("Configuration file not found: " + overridePath);
        }
        JsonNode override;
        try {
            override = mapper.readTree(overridePath.toFile());
        } catch (IOException e) {
            throw new ThemeConfigurationException("Invalid JSON in configuration " + overridePath + ": " + e.getMessage(), e);
        }
        if (override == null || override.isMissingNode()) {
            override = mapper.createObjectNode();
        }

        Set<ValidationMessage> errors = validateOverride(override);
        if (!errors.isEmpty()) {
            String details = errors.stream().map(ValidationMessage::getMessage).sorted()
                    .collect(Collectors.joining("; "));
            throw new ThemeConfigurationException("Invalid theme configuration " + overridePath + ": " + details);
        }
        return override;
    }

    public static Set<ValidationMessage> validateOverride(JsonNode override) {
        try (InputStream schemaStream = ThemeHelper.class.getClassLoader().getResourceAsStream(OVERRIDE_SCHEMA)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + OVERRIDE_SCHEMA);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(override);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read schema resource " + OVERRIDE_SCHEMA, e);
        }
    }

    /**
     * Applies an override document to a base theme. Values replace base values
     * key by key; lane rules of the override go in front of the base rules.
     */
    public static Theme merge(Theme base, JsonNode override) {
        Map<String, String> values = new LinkedHashMap<>(base.values());

        JsonNode colors = override.path("colors");
        Iterator<Map.Entry<String, JsonNode>> fields = colors.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isValueNode()) {
                if (!ThemeKeys.ALL.contains(field.getKey())) {
                    log.debug("Theme key '{}' is not used by the generator", field.getKey());
                }
                values.put(field.getKey(), field.getValue().asText());
            }
        }

        JsonNode events = colors.path("events");
        copy(events, "start_fill", values, START_EVENT_FILL);
        copy(events, "start_stroke", values, START_EVENT_STROKE);
        copy(events, "end_fill", values, END_EVENT_FILL);
        copy(events, "end_stroke", values, END_EVENT_STROKE);
        copy(events, "intermediate_fill", values, INTERMEDIATE_EVENT_FILL);
        copy(events, "intermediate_stroke", values, INTERMEDIATE_EVENT_STROKE);

        JsonNode tasks = colors.path("tasks");
        copy(tasks, "fill", values, TASK_FILL);
        copy(tasks, "stroke", values, TASK_STROKE);

        JsonNode gateways = colors.path("gateways");
        copy(gateways, "fill", values, GATEWAY_FILL);
        copy(gateways, "stroke", values, GATEWAY_STROKE);

        JsonNode fonts = override.path("fonts");
        copy(fonts, "family", values, FONT_FAMILY);
        copy(fonts, "size", values, FONT_SIZE);
        copy(fonts, "color", values, FONT_COLOR);

        List<LaneStyleRule> laneRules = new ArrayList<>();
        for (JsonNode rule : override.path("lane_styles")) {
            try {
                laneRules.add(new LaneStyleRule(rule.path("pattern").asText(),
                        textOrNull(rule, "fill"), textOrNull(rule, "stroke")));
            } catch (PatternSyntaxException e) {
                throw new ThemeConfigurationException("Invalid lane pattern '" + rule.path("pattern").asText() + "'", e);
            }
        }
        laneRules.addAll(base.laneRules());

        return new Theme(base.name(), values, laneRules);
    }

    private static void copy(JsonNode section, String field, Map<String, String> values, String key) {
        if (section.hasNonNull(field)) {
            values.put(key, section.get(field).asText());
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
