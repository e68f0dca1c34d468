package org.bpmn2drawio.bpmn.models;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * A participant. Lane order is the visual stacking order.
 */
@Getter
public class Pool {
    private final String id;
    private final String name;
    private final String processRef;
    private final List<Lane> lanes = new ArrayList<>();

    @Setter
    private Bounds bounds;
    @Setter
    private boolean horizontal = true;

    public Pool(String id, String name, String processRef) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.processRef = processRef;
    }

    public Lane addLane(String laneId, String laneName, boolean implicit) {
        Lane lane = new Lane(laneId, laneName, id, implicit);
        lanes.add(lane);
        return lane;
    }
}
