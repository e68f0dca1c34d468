package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Pool;

/**
 * Pools sit directly on the canvas, so their bounds are absolute.
 */
public record PlacedPool(Pool pool, Bounds absolute) {
}
