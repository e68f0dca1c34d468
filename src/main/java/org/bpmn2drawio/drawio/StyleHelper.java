package org.bpmn2drawio.drawio;

import org.bpmn2drawio.bpmn.models.ActivityType;
import org.bpmn2drawio.bpmn.models.Element;
import org.bpmn2drawio.bpmn.models.ElementKind;
import org.bpmn2drawio.bpmn.models.EventPosition;
import org.bpmn2drawio.bpmn.models.FlowKind;
import org.bpmn2drawio.bpmn.models.Lane;
import org.bpmn2drawio.bpmn.models.Pool;
import org.bpmn2drawio.theme.models.LaneStyleRule;
import org.bpmn2drawio.theme.models.Theme;

import java.util.Optional;

import static org.bpmn2drawio.theme.ThemeKeys.*;

/**
 * Builds the mxGraph style strings of vertices, swimlanes and edges from a
 * resolved {@link Theme}. A key missing from the theme falls back to a plain
 * black on white style.
 */
public class StyleHelper {
    static final String FALLBACK_FILL = "#ffffff";
    static final String FALLBACK_STROKE = "#000000";

    private static final String EDGE_BASE = "edgeStyle=orthogonalEdgeStyle;rounded=1;orthogonalLoop=1;jettySize=auto;html=1;";

    public static String elementStyle(Element element, Theme theme) {
        ElementKind kind = element.getKind();
        String style = switch (kind.category()) {
            case EVENT -> eventStyle((ElementKind.EventKind) kind, theme);
            case ACTIVITY -> activityStyle((ElementKind.ActivityKind) kind, theme);
            case GATEWAY -> "rhombus;whiteSpace=wrap;html=1;"
                    + colors(theme, GATEWAY_FILL, GATEWAY_STROKE)
                    + "perimeter=rhombusPerimeter;";
            case ARTIFACT -> artifactStyle((ElementKind.ArtifactKind) kind);
            case GENERIC -> "rounded=1;whiteSpace=wrap;html=1;dashed=1;"
                    + colors(theme, TASK_FILL, TASK_STROKE);
        };
        return style + fontStyle(theme);
    }

    private static String eventStyle(ElementKind.EventKind event, Theme theme) {
        String fillKey;
        String strokeKey;
        String width;
        switch (event.position()) {
            case START -> {
                fillKey = START_EVENT_FILL;
                strokeKey = START_EVENT_STROKE;
                width = "";
            }
            case END -> {
                fillKey = END_EVENT_FILL;
                strokeKey = END_EVENT_STROKE;
                width = "strokeWidth=3;";
            }
            default -> {
                fillKey = INTERMEDIATE_EVENT_FILL;
                strokeKey = INTERMEDIATE_EVENT_STROKE;
                width = "strokeWidth=2;";
            }
        }
        // non-interrupting boundary events are not modeled, every boundary is drawn solid
        return "ellipse;whiteSpace=wrap;html=1;aspect=fixed;"
                + colors(theme, fillKey, strokeKey)
                + width
                + "perimeter=ellipsePerimeter;";
    }

    private static String activityStyle(ElementKind.ActivityKind activity, Theme theme) {
        String fillKey = TASK_FILL;
        String strokeKey = TASK_STROKE;
        if (activity.type() == ActivityType.SCRIPT) {
            fillKey = SCRIPT_TASK_FILL;
            strokeKey = SCRIPT_TASK_STROKE;
        } else if (activity.type() == ActivityType.BUSINESS_RULE) {
            fillKey = BUSINESS_RULE_TASK_FILL;
            strokeKey = BUSINESS_RULE_TASK_STROKE;
        } else if (activity.type() == ActivityType.MANUAL) {
            fillKey = MANUAL_TASK_FILL;
            strokeKey = MANUAL_TASK_STROKE;
        }
        String style = "rounded=1;whiteSpace=wrap;html=1;" + colors(theme, fillKey, strokeKey) + "arcSize=10;";
        if (activity.type() == ActivityType.CALL_ACTIVITY) {
            style += "strokeWidth=3;";
        } else if (activity.type() == ActivityType.SUB_PROCESS) {
            style += "verticalAlign=top;";
        }
        return style;
    }

    private static String artifactStyle(ElementKind.ArtifactKind artifact) {
        return switch (artifact.type()) {
            case DATA_OBJECT -> "shape=document;whiteSpace=wrap;html=1;fillColor=#f5f5f5;strokeColor=#666666;";
            case DATA_STORE -> "shape=cylinder3;whiteSpace=wrap;html=1;boundedLbl=1;size=10;fillColor=#f5f5f5;strokeColor=#666666;";
            case TEXT_ANNOTATION -> "shape=note;whiteSpace=wrap;html=1;fillColor=#fff2cc;strokeColor=#d6b656;";
            case GROUP -> "rounded=1;whiteSpace=wrap;html=1;fillColor=none;strokeColor=#666666;strokeWidth=2;dashed=1;";
        };
    }

    public static String edgeStyle(FlowKind kind, Theme theme) {
        String strokeKey = kind == FlowKind.MESSAGE ? MESSAGE_FLOW_STROKE : SEQUENCE_FLOW_STROKE;
        String style = EDGE_BASE + "strokeColor=" + theme.getOrDefault(strokeKey, FALLBACK_STROKE) + ";strokeWidth=1;";
        return style + switch (kind) {
            case SEQUENCE -> "endArrow=block;endFill=1;";
            case DEFAULT -> "startArrow=dash;startFill=0;startSize=14;endArrow=block;endFill=1;";
            case CONDITIONAL -> "startArrow=diamond;startFill=0;startSize=14;endArrow=block;endFill=1;";
            case MESSAGE -> "dashed=1;dashPattern=8 8;endArrow=open;endFill=0;startArrow=oval;startFill=0;startSize=8;";
            case ASSOCIATION -> "dashed=1;dashPattern=1 2;endArrow=none;";
        };
    }

    public static String poolStyle(Pool pool, Theme theme) {
        return "swimlane;whiteSpace=wrap;html=1;"
                + (pool.isHorizontal() ? "horizontal=0;" : "")
                + "startSize=40;"
                + colors(theme, POOL_FILL, POOL_STROKE)
                + "collapsible=0;"
                + fontStyle(theme);
    }

    /**
     * Lane colors come from the first lane rule matching the lane name, then
     * from the theme's lane keys. Implicit lanes have no header.
     */
    public static String laneStyle(Lane lane, boolean horizontal, Theme theme) {
        Optional<LaneStyleRule> rule = lane.isImplicit() ? Optional.empty() : theme.laneRuleFor(lane.getName());
        String fill = rule.map(LaneStyleRule::fill).orElse(null);
        String stroke = rule.map(LaneStyleRule::stroke).orElse(null);
        if (fill == null) {
            fill = theme.getOrDefault(LANE_FILL, FALLBACK_FILL);
        }
        if (stroke == null) {
            stroke = theme.getOrDefault(LANE_STROKE, FALLBACK_STROKE);
        }
        return "swimlane;whiteSpace=wrap;html=1;"
                + (horizontal ? "horizontal=0;" : "")
                + (lane.isImplicit() ? "startSize=0;" : "startSize=30;")
                + "fillColor=" + fill + ";strokeColor=" + stroke + ";"
                + "collapsible=0;"
                + fontStyle(theme);
    }

    static String strokeOf(Element element, Theme theme) {
        ElementKind kind = element.getKind();
        if (kind instanceof ElementKind.EventKind event) {
            return theme.getOrDefault(switch (event.position()) {
                case START -> START_EVENT_STROKE;
                case END -> END_EVENT_STROKE;
                default -> INTERMEDIATE_EVENT_STROKE;
            }, FALLBACK_STROKE);
        }
        if (kind instanceof ElementKind.GatewayKind) {
            return theme.getOrDefault(GATEWAY_STROKE, FALLBACK_STROKE);
        }
        if (kind instanceof ElementKind.ActivityKind activity) {
            return theme.getOrDefault(switch (activity.type()) {
                case SCRIPT -> SCRIPT_TASK_STROKE;
                case BUSINESS_RULE -> BUSINESS_RULE_TASK_STROKE;
                case MANUAL -> MANUAL_TASK_STROKE;
                default -> TASK_STROKE;
            }, FALLBACK_STROKE);
        }
        return FALLBACK_STROKE;
    }

    static boolean isThrowing(EventPosition position) {
        return position == EventPosition.END || position == EventPosition.INTERMEDIATE_THROW;
    }

    private static String colors(Theme theme, String fillKey, String strokeKey) {
        return "fillColor=" + theme.getOrDefault(fillKey, FALLBACK_FILL)
                + ";strokeColor=" + theme.getOrDefault(strokeKey, FALLBACK_STROKE) + ";";
    }

    private static String fontStyle(Theme theme) {
        StringBuilder style = new StringBuilder();
        appendIfSet(style, "fontFamily", theme.get(FONT_FAMILY));
        appendIfSet(style, "fontSize", theme.get(FONT_SIZE));
        appendIfSet(style, "fontColor", theme.get(FONT_COLOR));
        return style.toString();
    }

    private static void appendIfSet(StringBuilder style, String name, String value) {
        if (value != null && !value.isEmpty()) {
            style.append(name).append('=').append(value).append(';');
        }
    }
}
