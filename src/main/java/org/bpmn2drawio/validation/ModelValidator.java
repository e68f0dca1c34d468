package org.bpmn2drawio.validation;

import org.bpmn2drawio.bpmn.models.ActivityType;
import org.bpmn2drawio.bpmn.models.ArtifactType;
import org.bpmn2drawio.bpmn.models.Category;
import org.bpmn2drawio.bpmn.models.Element;
import org.bpmn2drawio.bpmn.models.ElementKind;
import org.bpmn2drawio.bpmn.models.EventPosition;
import org.bpmn2drawio.bpmn.models.Flow;
import org.bpmn2drawio.bpmn.models.FlowKind;
import org.bpmn2drawio.bpmn.models.Lane;
import org.bpmn2drawio.bpmn.models.Pool;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.bpmn2drawio.bpmn.models.ValidationWarning;
import org.bpmn2drawio.bpmn.models.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks graph integrity and repairs what can be repaired. Never throws on a
 * parsed model: every problem ends up as a {@link ValidationWarning}.
 */
public class ModelValidator {
    private static final Logger log = LoggerFactory.getLogger(ModelValidator.class);

    /**
     * Runs all checks in order, mutating the model where a repair applies.
     * The warnings are also appended to {@link ProcessModel#getWarnings()}.
     *
     * @return the warnings produced by this run
     */
    public static List<ValidationWarning> validate(ProcessModel model) {
        int before = model.getWarnings().size();

        checkStartEvents(model);
        dropDanglingFlows(model);
        dropInvalidLaneReferences(model);
        flagOrphans(model);
        checkFlowTypes(model);
        checkTerminalEvents(model);
        checkOverlaps(model);
        checkLabels(model);

        List<ValidationWarning> produced = new ArrayList<>(
                model.getWarnings().subList(before, model.getWarnings().size()));
        log.debug("Validation produced {} warnings", produced.size());
        return produced;
    }

    static void checkStartEvents(ProcessModel model) {
        boolean hasStart = model.elements().stream().anyMatch(e -> e.isEvent(EventPosition.START));
        if (!hasStart && model.elementCount() > 0) {
            model.warn(null, WarningKind.MISSING_START_EVENT, "Process has no start event");
        }
    }

    /**
     * Removes flows whose source or target does not resolve, one warning per flow.
     */
    static void dropDanglingFlows(ProcessModel model) {
        Iterator<Flow> it = model.getFlows().iterator();
        while (it.hasNext()) {
            Flow flow = it.next();
            List<String> problems = new ArrayList<>();
            if (!model.contains(flow.sourceRef())) {
                problems.add("invalid source reference '" + flow.sourceRef() + "'");
            }
            if (!model.contains(flow.targetRef())) {
                problems.add("invalid target reference '" + flow.targetRef() + "'");
            }
            if (!problems.isEmpty()) {
                it.remove();
                String message = "Flow dropped: " + String.join(", ", problems);
                log.warn("Flow {}: {}", flow.id(), message);
                model.warn(flow.id(), WarningKind.DANGLING_FLOW, message);
            }
        }
    }

    static void dropInvalidLaneReferences(ProcessModel model) {
        for (Pool pool : model.getPools()) {
            for (Lane lane : pool.getLanes()) {
                Iterator<String> it = lane.getElementIds().iterator();
                while (it.hasNext()) {
                    String ref = it.next();
                    if (!model.contains(ref)) {
                        it.remove();
                        log.warn("Lane {} references unknown element {}", lane.getId(), ref);
                        model.warn(ref, WarningKind.INVALID_LANE_REFERENCE,
                                "Lane '" + lane.getId() + "' references an unknown element, reference dropped");
                    }
                }
            }
        }
    }

    /**
     * Flags elements with no incident flow. A boundary event and its host count
     * as connected to each other. Groups only frame other shapes and are skipped.
     */
    static void flagOrphans(ProcessModel model) {
        Set<String> connected = new HashSet<>();
        for (Flow flow : model.getFlows()) {
            connected.add(flow.sourceRef());
            connected.add(flow.targetRef());
        }
        for (Element element : model.elements()) {
            if (element.isBoundaryEvent() && connected.contains(element.getId())
                    && element.getAttachedToRef() != null) {
                connected.add(element.getAttachedToRef());
            }
        }
        for (Element element : model.elements()) {
            if (element.isBoundaryEvent() && connected.contains(element.getAttachedToRef())) {
                connected.add(element.getId());
            }
        }

        for (Element element : model.elements()) {
            if (isGroup(element) || connected.contains(element.getId())) {
                continue;
            }
            element.setOrphan(true);
            model.warn(element.getId(), WarningKind.ORPHAN_ELEMENT,
                    "Element '" + element.getId() + "' has no incoming or outgoing flow");
        }
    }

    static void checkFlowTypes(ProcessModel model) {
        for (Flow flow : model.getFlows()) {
            Pool sourcePool = model.poolOf(model.element(flow.sourceRef()));
            Pool targetPool = model.poolOf(model.element(flow.targetRef()));
            if (sourcePool == null || targetPool == null) {
                continue;
            }
            boolean samePool = Objects.equals(sourcePool.getId(), targetPool.getId());
            if (flow.kind() == FlowKind.MESSAGE && samePool) {
                model.warn(flow.id(), WarningKind.FLOW_TYPE_MISMATCH,
                        "Message flow connects two elements of pool '" + sourcePool.getId() + "'");
            } else if (flow.kind().isSequenceLike() && !samePool) {
                model.warn(flow.id(), WarningKind.FLOW_TYPE_MISMATCH,
                        "Sequence flow crosses from pool '" + sourcePool.getId()
                                + "' to pool '" + targetPool.getId() + "'");
            }
        }
    }

    /**
     * Warns for every pool (and for the pool-less content as a whole) in which
     * no end event can be reached from a start event.
     */
    static void checkTerminalEvents(ProcessModel model) {
        Map<String, List<String>> successors = successorsOf(model);

        for (Pool pool : model.getPools()) {
            Set<String> members = new LinkedHashSet<>();
            pool.getLanes().forEach(l -> members.addAll(l.getElementIds()));
            if (hasFlowNodes(model, members) && !reachesEnd(model, members, successors)) {
                model.warn(pool.getId(), WarningKind.MISSING_TERMINAL_EVENT,
                        "No end event is reachable from a start event in pool '" + pool.getId() + "'");
            }
        }

        Set<String> poolless = new LinkedHashSet<>();
        for (Element element : model.elements()) {
            if (element.getLaneId() == null) {
                poolless.add(element.getId());
            }
        }
        if (hasFlowNodes(model, poolless) && !reachesEnd(model, poolless, successors)) {
            model.warn(null, WarningKind.MISSING_TERMINAL_EVENT,
                    "No end event is reachable from a start event");
        }
    }

    /**
     * Warns once per pair of elements whose input coordinates overlap. A
     * boundary event and its host are expected to overlap, and groups frame
     * other shapes.
     */
    static void checkOverlaps(ProcessModel model) {
        List<Element> placed = model.elements().stream()
                .filter(e -> e.hasBounds() && !isGroup(e))
                .toList();
        for (int i = 0; i < placed.size(); i++) {
            Element first = placed.get(i);
            for (int j = i + 1; j < placed.size(); j++) {
                Element second = placed.get(j);
                if (isAttachedTo(first, second) || isAttachedTo(second, first)) {
                    continue;
                }
                if (first.getBounds().overlaps(second.getBounds())) {
                    log.warn("Element {} overlaps {}", first.getId(), second.getId());
                    model.warn(first.getId(), WarningKind.OVERLAPPING_ELEMENTS,
                            "Element '" + first.getId() + "' overlaps '" + second.getId() + "'");
                }
            }
        }
    }

    /**
     * Warns for tasks and call activities without a name. Events, gateways and
     * sub-processes are commonly left unnamed.
     */
    static void checkLabels(ProcessModel model) {
        for (Element element : model.elements()) {
            if (element.getKind() instanceof ElementKind.ActivityKind activity
                    && activity.type() != ActivityType.SUB_PROCESS
                    && element.getName().isBlank()) {
                model.warn(element.getId(), WarningKind.MISSING_LABEL,
                        "Element '" + element.getId() + "' has no label");
            }
        }
    }

    private static boolean isAttachedTo(Element event, Element host) {
        return event.isBoundaryEvent() && host.getId().equals(event.getAttachedToRef());
    }

    private static Map<String, List<String>> successorsOf(ProcessModel model) {
        Map<String, List<String>> successors = new HashMap<>();
        for (Flow flow : model.getFlows()) {
            if (flow.kind().isSequenceLike()) {
                successors.computeIfAbsent(flow.sourceRef(), k -> new ArrayList<>()).add(flow.targetRef());
            }
        }
        // Exception paths leave through boundary events
        for (Element element : model.elements()) {
            if (element.isBoundaryEvent() && element.getAttachedToRef() != null) {
                successors.computeIfAbsent(element.getAttachedToRef(), k -> new ArrayList<>()).add(element.getId());
            }
        }
        return successors;
    }

    private static boolean reachesEnd(ProcessModel model, Set<String> members, Map<String, List<String>> successors) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        for (String id : members) {
            if (model.element(id).isEvent(EventPosition.START)) {
                queue.add(id);
                visited.add(id);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (model.element(current).isEvent(EventPosition.END)) {
                return true;
            }
            for (String next : successors.getOrDefault(current, List.of())) {
                if (members.contains(next) && visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    private static boolean hasFlowNodes(ProcessModel model, Set<String> ids) {
        return ids.stream()
                .map(model::element)
                .anyMatch(e -> e.category() != Category.ARTIFACT);
    }

    private static boolean isGroup(Element element) {
        return element.getKind() instanceof ElementKind.ArtifactKind artifact
                && artifact.type() == ArtifactType.GROUP;
    }
}
