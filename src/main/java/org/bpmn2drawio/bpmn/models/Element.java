package org.bpmn2drawio.bpmn.models;

import lombok.Getter;
import lombok.Setter;

/**
 * A node of the process graph. Identity and kind are fixed at parse time; lane
 * membership, bounds and the orphan flag are filled in by later stages.
 * Bounds are always canvas-absolute.
 */
@Getter
public class Element {
    private final String id;
    private final String name;
    private final ElementKind kind;
    private final String processId;
    private final String attachedToRef; // boundary events only
    private final double defaultWidth;
    private final double defaultHeight;

    @Setter
    private String laneId;
    @Setter
    private Bounds bounds;
    @Setter
    private boolean orphan;

    public Element(String id, String name, ElementKind kind, String processId, String attachedToRef) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.kind = kind;
        this.processId = processId;
        this.attachedToRef = attachedToRef;
        double[] size = defaultSize(kind);
        this.defaultWidth = size[0];
        this.defaultHeight = size[1];
    }

    public Category category() {
        return kind.category();
    }

    public boolean isEvent(EventPosition position) {
        return kind instanceof ElementKind.EventKind event && event.position() == position;
    }

    public boolean isBoundaryEvent() {
        return isEvent(EventPosition.BOUNDARY);
    }

    public boolean hasBounds() {
        return bounds != null;
    }

    /** Width from DI when present, otherwise the kind's default. */
    public double width() {
        return bounds != null ? bounds.width() : defaultWidth;
    }

    public double height() {
        return bounds != null ? bounds.height() : defaultHeight;
    }

    static double[] defaultSize(ElementKind kind) {
        if (kind instanceof ElementKind.ActivityKind activity) {
            return activity.type() == ActivityType.SUB_PROCESS
                    ? new double[]{200, 150}
                    : new double[]{120, 80};
        }
        if (kind instanceof ElementKind.ArtifactKind artifact) {
            return switch (artifact.type()) {
                case DATA_OBJECT -> new double[]{40, 50};
                case DATA_STORE -> new double[]{50, 50};
                case TEXT_ANNOTATION -> new double[]{100, 40};
                case GROUP -> new double[]{200, 150};
            };
        }
        return switch (kind.category()) {
            case EVENT -> new double[]{36, 36};
            case GATEWAY -> new double[]{50, 50};
            default -> new double[]{120, 80};
        };
    }

    @Override
    public String toString() {
        return kind.tag() + "[" + id + "]";
    }
}
