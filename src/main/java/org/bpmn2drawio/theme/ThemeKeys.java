package org.bpmn2drawio.theme;

import java.util.List;

/**
 * Style keys understood by the diagram generator.
 */
public final class ThemeKeys {
    public static final String START_EVENT_FILL = "start_event_fill";
    public static final String START_EVENT_STROKE = "start_event_stroke";
    public static final String END_EVENT_FILL = "end_event_fill";
    public static final String END_EVENT_STROKE = "end_event_stroke";
    public static final String INTERMEDIATE_EVENT_FILL = "intermediate_event_fill";
    public static final String INTERMEDIATE_EVENT_STROKE = "intermediate_event_stroke";

    public static final String TASK_FILL = "task_fill";
    public static final String TASK_STROKE = "task_stroke";
    public static final String SCRIPT_TASK_FILL = "script_task_fill";
    public static final String SCRIPT_TASK_STROKE = "script_task_stroke";
    public static final String BUSINESS_RULE_TASK_FILL = "business_rule_task_fill";
    public static final String BUSINESS_RULE_TASK_STROKE = "business_rule_task_stroke";
    public static final String MANUAL_TASK_FILL = "manual_task_fill";
    public static final String MANUAL_TASK_STROKE = "manual_task_stroke";

    public static final String GATEWAY_FILL = "gateway_fill";
    public static final String GATEWAY_STROKE = "gateway_stroke";

    public static final String POOL_FILL = "pool_fill";
    public static final String POOL_STROKE = "pool_stroke";
    public static final String LANE_FILL = "lane_fill";
    public static final String LANE_STROKE = "lane_stroke";

    public static final String SEQUENCE_FLOW_STROKE = "sequence_flow_stroke";
    public static final String MESSAGE_FLOW_STROKE = "message_flow_stroke";

    public static final String FONT_FAMILY = "font_family";
    public static final String FONT_SIZE = "font_size";
    public static final String FONT_COLOR = "font_color";

    public static final List<String> ALL = List.of(
            START_EVENT_FILL, START_EVENT_STROKE, END_EVENT_FILL, END_EVENT_STROKE,
            INTERMEDIATE_EVENT_FILL, INTERMEDIATE_EVENT_STROKE,
            TASK_FILL, TASK_STROKE, SCRIPT_TASK_FILL, SCRIPT_TASK_STROKE,
            BUSINESS_RULE_TASK_FILL, BUSINESS_RULE_TASK_STROKE, MANUAL_TASK_FILL, MANUAL_TASK_STROKE,
            GATEWAY_FILL, GATEWAY_STROKE,
            POOL_FILL, POOL_STROKE, LANE_FILL, LANE_STROKE,
            SEQUENCE_FLOW_STROKE, MESSAGE_FLOW_STROKE,
            FONT_FAMILY, FONT_SIZE, FONT_COLOR);

    private ThemeKeys() {
    }
}
