package org.bpmn2drawio.drawio;

import org.bpmn2drawio.bpmn.models.ActivityType;
import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Element;
import org.bpmn2drawio.bpmn.models.ElementKind;
import org.bpmn2drawio.bpmn.models.EventPosition;
import org.bpmn2drawio.bpmn.models.EventTrigger;
import org.bpmn2drawio.bpmn.models.GatewayType;
import org.bpmn2drawio.drawio.models.Decoration;
import org.bpmn2drawio.theme.models.Theme;

import java.util.ArrayList;
import java.util.List;

/**
 * Child cells that mark the sub-kind of an element: the symbol inside a
 * gateway, the type icon in the corner of a task, the trigger icon inside an
 * event and the loop / multi-instance marker at the bottom of an activity.
 */
public class DecorationHelper {
    private static final double ICON_OFFSET = 5;
    private static final double MARKER_SIZE = 14;

    public static List<Decoration> decorationsFor(Element element, Bounds bounds, Theme theme) {
        List<Decoration> decorations = new ArrayList<>();
        String stroke = StyleHelper.strokeOf(element, theme);
        ElementKind kind = element.getKind();
        if (kind instanceof ElementKind.GatewayKind gateway) {
            decorations.add(gatewayMarker(gateway.type(), stroke, bounds));
        } else if (kind instanceof ElementKind.ActivityKind activity) {
            Decoration icon = taskIcon(activity.type(), stroke);
            if (icon != null) {
                decorations.add(icon);
            }
            decorations.addAll(bottomMarkers(activity, stroke, bounds));
        } else if (kind instanceof ElementKind.EventKind event) {
            Decoration icon = eventIcon(event.position(), event.trigger(), stroke, bounds);
            if (icon != null) {
                decorations.add(icon);
            }
        }
        return decorations;
    }

    static Decoration gatewayMarker(GatewayType type, String stroke, Bounds bounds) {
        String base = "whiteSpace=wrap;html=1;strokeColor=" + stroke + ";";
        return switch (type) {
            case EXCLUSIVE -> centered("shape=cross;" + base + "fillColor=none;size=0.35;strokeWidth=2;", 20, 20, bounds);
            case PARALLEL -> centered("shape=cross;" + base + "fillColor=" + stroke + ";size=0.35;strokeWidth=3;", 22, 22, bounds);
            case INCLUSIVE -> centered("ellipse;" + base + "fillColor=none;strokeWidth=2;", 20, 20, bounds);
            case EVENT_BASED -> centered("ellipse;" + base + "fillColor=none;strokeWidth=2;dashed=1;", 26, 26, bounds);
            case COMPLEX -> centered("shape=cross;" + base + "fillColor=" + stroke + ";size=0.35;rotation=45;strokeWidth=2;", 16, 16, bounds);
        };
    }

    static Decoration taskIcon(ActivityType type, String stroke) {
        String filled = "fillColor=" + stroke + ";strokeColor=" + stroke + ";";
        return switch (type) {
            case USER -> corner("shape=mxgraph.bpmn.user_task;" + filled, 16, 16);
            case SERVICE -> corner("shape=mxgraph.bpmn.service_task;" + filled, 16, 16);
            case SCRIPT -> corner("shape=mxgraph.bpmn.script_task;" + filled, 16, 16);
            case SEND -> corner("shape=mxgraph.bpmn.message;" + filled, 16, 12);
            case RECEIVE -> corner("shape=mxgraph.bpmn.message;fillColor=none;strokeColor=" + stroke + ";strokeWidth=2;", 16, 12);
            case BUSINESS_RULE -> corner("shape=mxgraph.bpmn.business_rule_task;" + filled, 16, 16);
            case MANUAL -> corner("shape=mxgraph.bpmn.manual_task;" + filled, 16, 16);
            case TASK, CALL_ACTIVITY, SUB_PROCESS -> null;
        };
    }

    /**
     * Collapsed sub-process "+" and the loop marker, side by side at the
     * bottom center of the activity.
     */
    static List<Decoration> bottomMarkers(ElementKind.ActivityKind activity, String stroke, Bounds bounds) {
        List<String> styles = new ArrayList<>();
        switch (activity.loop()) {
            case STANDARD -> styles.add("shape=mxgraph.bpmn.loop;fillColor=none;strokeColor=" + stroke + ";");
            case PARALLEL_MULTI_INSTANCE -> styles.add("shape=parallelMarker;fillColor=" + stroke + ";strokeColor=" + stroke + ";");
            case SEQUENTIAL_MULTI_INSTANCE -> styles.add("shape=parallelMarker;direction=south;fillColor=" + stroke + ";strokeColor=" + stroke + ";");
            case NONE -> {
            }
        }
        if (activity.type() == ActivityType.SUB_PROCESS) {
            styles.add("shape=plus;html=1;fillColor=none;strokeColor=" + stroke + ";");
        }

        List<Decoration> markers = new ArrayList<>();
        double total = styles.size() * MARKER_SIZE + Math.max(0, styles.size() - 1) * 2;
        double x = (bounds.width() - total) / 2;
        for (String style : styles) {
            markers.add(new Decoration(style, x, bounds.height() - MARKER_SIZE - 4, MARKER_SIZE, MARKER_SIZE));
            x += MARKER_SIZE + 2;
        }
        return markers;
    }

    /**
     * Trigger icon of an event, null for a plain event. Throwing events get a
     * filled icon, catching events an outlined one.
     */
    static Decoration eventIcon(EventPosition position, EventTrigger trigger, String stroke, Bounds bounds) {
        boolean boundary = position == EventPosition.BOUNDARY;
        String paint = StyleHelper.isThrowing(position)
                ? "fillColor=" + stroke + ";strokeColor=" + stroke + ";"
                : "fillColor=none;strokeColor=" + stroke + ";strokeWidth=1;";
        double small = boundary ? 14 : 16;
        return switch (trigger) {
            case NONE -> null;
            case MESSAGE -> centered("shape=mxgraph.bpmn.message;" + paint,
                    boundary ? 16 : 18, boundary ? 12 : 14, bounds);
            case TIMER -> centered("shape=mxgraph.bpmn.timer;fillColor=none;strokeColor=" + stroke + ";strokeWidth=1;",
                    boundary ? 18 : 20, boundary ? 18 : 20, bounds);
            case SIGNAL, ESCALATION -> centered("shape=triangle;direction=north;" + paint, small, small, bounds);
            case CONDITIONAL -> centered("shape=mxgraph.bpmn.conditional;fillColor=none;strokeColor=" + stroke + ";strokeWidth=1;",
                    boundary ? 14 : 18, boundary ? 14 : 18, bounds);
            case ERROR -> centered("shape=mxgraph.bpmn.error;" + paint, small, small, bounds);
            case LINK -> centered("shape=mxgraph.bpmn.link;" + paint, small, small, bounds);
            case TERMINATE -> centered("ellipse;fillColor=" + stroke + ";strokeColor=" + stroke + ";", 20, 20, bounds);
            case CANCEL -> centered("shape=cross;size=0.4;" + paint, small, small, bounds);
            case COMPENSATION -> centered("shape=mxgraph.bpmn.compensation;" + paint, small, small, bounds);
        };
    }

    private static Decoration centered(String style, double width, double height, Bounds bounds) {
        return new Decoration(style, (bounds.width() - width) / 2, (bounds.height() - height) / 2, width, height);
    }

    private static Decoration corner(String style, double width, double height) {
        return new Decoration(style, ICON_OFFSET, ICON_OFFSET, width, height);
    }
}
