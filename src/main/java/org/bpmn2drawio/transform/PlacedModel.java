package org.bpmn2drawio.transform;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Output of {@link CoordinateTransformer}: the model in the coordinate
 * contract of the target format, in emission order.
 */
public record PlacedModel(
        List<PlacedPool> pools,
        List<PlacedLane> lanes,
        List<PlacedElement> elements,
        List<RoutedEdge> edges
) {
    public PlacedModel {
        pools = List.copyOf(pools);
        lanes = List.copyOf(lanes);
        elements = List.copyOf(elements);
        edges = List.copyOf(edges);
    }

    public Map<String, PlacedElement> elementsById() {
        return elements.stream().collect(Collectors.toMap(e -> e.element().getId(), Function.identity()));
    }

    public Map<String, PlacedLane> lanesById() {
        return lanes.stream().collect(Collectors.toMap(l -> l.lane().getId(), Function.identity()));
    }
}
