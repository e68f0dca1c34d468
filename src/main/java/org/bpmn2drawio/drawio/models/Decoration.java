package org.bpmn2drawio.drawio.models;

/**
 * A small child cell drawn inside an element (gateway marker, task type icon,
 * event trigger icon, loop marker). Geometry is relative to the element.
 */
public record Decoration(String style, double x, double y, double width, double height) {
}
