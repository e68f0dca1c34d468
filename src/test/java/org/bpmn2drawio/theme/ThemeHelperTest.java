package org.bpmn2drawio.theme;

import org.bpmn2drawio.ThemeConfigurationException;
import org.bpmn2drawio.theme.models.Theme;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ThemeHelperTest {
    private static final Path START_FILL_ONLY = Path.of("src/test/resources/themes/start_fill_only.json");
    private static final Path LANE_STYLES = Path.of("src/test/resources/themes/lane_styles.json");
    private static final Path INVALID_COLORS = Path.of("src/test/resources/themes/invalid_colors.json");
    private static final Path NOT_JSON = Path.of("src/test/resources/themes/not_json.json");

    @Test
    void shouldOverrideSingleKeyAndKeepTheRest() {
        Theme base = ThemeHelper.builtIn("default");

        Theme theme = ThemeHelper.resolve("default", START_FILL_ONLY);

        assertEquals("#123456", theme.get(ThemeKeys.START_EVENT_FILL));
        for (String key : ThemeKeys.ALL) {
            if (!key.equals(ThemeKeys.START_EVENT_FILL)) {
                assertEquals(base.get(key), theme.get(key), key);
            }
        }
    }

    @Test
    void shouldUseBaseThemeFromOverride() {
        Theme theme = ThemeHelper.resolve("default", LANE_STYLES);

        assertEquals("blueprint", theme.name());
        assertEquals("#abcdef", theme.get(ThemeKeys.TASK_FILL));
        assertEquals("#123abc", theme.get(ThemeKeys.TASK_STROKE));
        assertEquals("Arial", theme.get(ThemeKeys.FONT_FAMILY));
        assertEquals("14", theme.get(ThemeKeys.FONT_SIZE));
        assertEquals("#1976d2", theme.get(ThemeKeys.GATEWAY_STROKE));
        assertEquals("#111111", theme.get("custom_accent"));
    }

    @Test
    void shouldPutOverrideLaneRulesFirst() {
        Theme theme = ThemeHelper.resolve(null, LANE_STYLES);

        assertEquals("#ff0000", theme.laneRuleFor("Order System").orElseThrow().fill());
        assertEquals("#e1f5fe", theme.laneRuleFor("Customer").orElseThrow().fill());
        assertTrue(theme.laneRuleFor("Warehouse").isEmpty());
    }

    @Test
    void shouldProvideEveryKeyInBuiltInThemes() {
        for (String name : ThemeHelper.BUILT_IN_THEMES) {
            Theme theme = ThemeHelper.builtIn(name);
            assertEquals(name, theme.name());
            for (String key : ThemeKeys.ALL) {
                assertNotNull(theme.get(key), name + ": " + key);
            }
        }
    }

    @Test
    void shouldReturnFreshThemeOnEveryCall() {
        Theme first = ThemeHelper.resolve("monochrome", null);
        Theme second = ThemeHelper.resolve("monochrome", null);

        assertNotSame(first, second);
        assertEquals(first, second);
        assertThrows(UnsupportedOperationException.class, () -> first.values().put(ThemeKeys.TASK_FILL, "#000000"));
    }

    @Test
    void shouldThrowWhenThemeUnknown() {
        ThemeConfigurationException e = assertThrows(ThemeConfigurationException.class,
                () -> ThemeHelper.resolve("neon", null));
        assertTrue(e.getMessage().contains("neon"));
    }

    @Test
    void shouldThrowWhenOverrideViolatesSchema() {
        ThemeConfigurationException e = assertThrows(ThemeConfigurationException.class,
                () -> ThemeHelper.resolve(null, INVALID_COLORS));
        assertTrue(e.getMessage().contains("Invalid theme configuration"));
    }

    @Test
    void shouldThrowWhenOverrideIsNotJson() {
        assertThrows(ThemeConfigurationException.class, () -> ThemeHelper.resolve(null, NOT_JSON));
    }

    @Test
    void shouldThrowWhenOverrideMissing() {
        assertThrows(ThemeConfigurationException.class,
                () -> ThemeHelper.resolve(null, Path.of("src/test/resources/themes/missing.json")));
    }

    @Test
    void shouldThrowWhenLanePatternIsNotARegex(@TempDir Path dir) throws IOException {
        Path override = dir.resolve("bad_pattern.json");
        Files.writeString(override, "{\"lane_styles\": [{\"pattern\": \"([\", \"fill\": \"#ffffff\"}]}");

        assertThrows(ThemeConfigurationException.class, () -> ThemeHelper.resolve(null, override));
    }
}
