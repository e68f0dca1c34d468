package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Lane;

/**
 * @param relative bounds relative to the owning pool's origin
 */
public record PlacedLane(Lane lane, String poolId, Bounds absolute, Bounds relative) {
}
