package org.bpmn2drawio;

import lombok.Builder;
import org.bpmn2drawio.layout.Direction;
import org.bpmn2drawio.layout.LayoutMode;
import org.bpmn2drawio.layout.PageSize;
import org.bpmn2drawio.theme.ThemeHelper;

import java.nio.file.Path;

/**
 * Settings of one conversion. Components left null by the builder take
 * their defaults: default theme, auto layout, left to right, no page
 * wrapping, grid on, no schema check.
 */
@Builder
public record ConversionOptions(
        String themeName,
        Path themeOverridePath, // optional JSON override document
        LayoutMode layoutMode,
        Direction direction,
        PageSize pageSize,
        Boolean grid,
        Boolean strictSchema
) {
    public ConversionOptions {
        if (themeName == null) {
            themeName = ThemeHelper.DEFAULT_THEME;
        }
        if (layoutMode == null) {
            layoutMode = LayoutMode.AUTO;
        }
        if (direction == null) {
            direction = Direction.LR;
        }
        if (pageSize == null) {
            pageSize = PageSize.AUTO;
        }
        if (grid == null) {
            grid = true;
        }
        if (strictSchema == null) {
            strictSchema = false;
        }
    }

    public static ConversionOptions defaults() {
        return ConversionOptions.builder().build();
    }
}
