package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Element;

/**
 * @param containerId lane the element is drawn in, null when it sits on the canvas
 * @param relative    bounds relative to the container, equal to {@code absolute} on the canvas
 */
public record PlacedElement(Element element, String containerId, Bounds absolute, Bounds relative) {

    public boolean onCanvas() {
        return containerId == null;
    }
}
