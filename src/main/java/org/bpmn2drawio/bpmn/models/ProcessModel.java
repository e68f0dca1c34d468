package org.bpmn2drawio.bpmn.models;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root aggregate of a parsed BPMN document. Element order is declaration order
 * and every stage relies on it for deterministic output.
 */
@Getter
public class ProcessModel {
    private final Map<String, Element> elementsById = new LinkedHashMap<>();
    private final List<Flow> flows = new ArrayList<>();
    private final List<Pool> pools = new ArrayList<>();
    private final List<ValidationWarning> warnings = new ArrayList<>();

    @Setter
    private boolean hasExplicitCoordinates;
    @Setter
    private String name; // first named process, used as the diagram title

    public void addElement(Element element) {
        elementsById.put(element.getId(), element);
    }

    public Collection<Element> elements() {
        return elementsById.values();
    }

    public Element element(String id) {
        return id == null ? null : elementsById.get(id);
    }

    public boolean contains(String elementId) {
        return elementId != null && elementsById.containsKey(elementId);
    }

    public Optional<Pool> pool(String poolId) {
        return pools.stream().filter(p -> p.getId().equals(poolId)).findFirst();
    }

    public Optional<Lane> lane(String laneId) {
        if (laneId == null) {
            return Optional.empty();
        }
        return pools.stream()
                .flatMap(p -> p.getLanes().stream())
                .filter(l -> l.getId().equals(laneId))
                .findFirst();
    }

    /** Pool owning the element through its lane, or null for pool-less elements. */
    public Pool poolOf(Element element) {
        return lane(element.getLaneId())
                .flatMap(l -> pool(l.getPoolId()))
                .orElse(null);
    }

    public void warn(String elementId, WarningKind kind, String message) {
        warnings.add(new ValidationWarning(elementId, kind, message));
    }

    public int elementCount() {
        return elementsById.size();
    }
}
