package org.bpmn2drawio.bpmn.models;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Subdivision of a pool. Holds element ids only; the elements themselves are
 * owned by {@link ProcessModel}.
 */
@Getter
public class Lane {
    private final String id;
    private final String name;
    private final String poolId;
    private final boolean implicit;
    private final Set<String> elementIds = new LinkedHashSet<>();

    @Setter
    private Bounds bounds;

    public Lane(String id, String name, String poolId, boolean implicit) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.poolId = poolId;
        this.implicit = implicit;
    }

    public static String implicitId(String poolId) {
        return poolId + "_implicit_lane";
    }
}
