package org.bpmn2drawio.bpmn;

import org.bpmn2drawio.MalformedInputException;
import org.bpmn2drawio.bpmn.models.ActivityType;
import org.bpmn2drawio.bpmn.models.ArtifactType;
import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Element;
import org.bpmn2drawio.bpmn.models.ElementKind;
import org.bpmn2drawio.bpmn.models.EventPosition;
import org.bpmn2drawio.bpmn.models.EventTrigger;
import org.bpmn2drawio.bpmn.models.Flow;
import org.bpmn2drawio.bpmn.models.FlowKind;
import org.bpmn2drawio.bpmn.models.GatewayType;
import org.bpmn2drawio.bpmn.models.Lane;
import org.bpmn2drawio.bpmn.models.LoopMarker;
import org.bpmn2drawio.bpmn.models.Point;
import org.bpmn2drawio.bpmn.models.Pool;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.bpmn2drawio.bpmn.models.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ProcessModel} from BPMN 2.0 XML. Matching is done on local
 * names, so documents using a default namespace or any prefix parse the same.
 */
public class BpmnHelper {
    private static final Logger log = LoggerFactory.getLogger(BpmnHelper.class);

    private static final Set<String> FLOW_NODE_CONTAINERS = Set.of("process", "subProcess");

    // Process children that carry no visual content
    private static final Set<String> IGNORED_TAGS = Set.of(
            "laneSet", "dataObject", "property", "ioSpecification", "ioBinding",
            "extensionElements", "documentation", "monitoring", "auditing",
            "supports", "correlationSubscription", "resourceRole", "performer",
            "potentialOwner", "humanPerformer");

    private static final Set<String> ASSOCIATION_TAGS = Set.of(
            "association", "dataInputAssociation", "dataOutputAssociation");

    /**
     * Parses a BPMN file.
     *
     * @param bpmnFile path to the BPMN file
     * @return the parsed model
     * @throws MalformedInputException if the file cannot be read or holds no process content
     */
    public static ProcessModel parseBpmnFile(Path bpmnFile) {
        String xml;
        try {
            xml = Files.readString(bpmnFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedInputException("Cannot read BPMN file: " + bpmnFile, e);
        }
        return parseBpmnString(xml);
    }

    /**
     * Parses BPMN XML text.
     *
     * @param xml BPMN 2.0 document
     * @return the parsed model; parse-time recoveries are already recorded in its warnings
     * @throws MalformedInputException if the text is not well-formed XML or holds no process content
     */
    public static ProcessModel parseBpmnString(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new MalformedInputException("Input is empty");
        }
        Document doc = readDocument(xml);

        org.w3c.dom.Element definitionsEl = doc.getDocumentElement();
        if (!"definitions".equals(localName(definitionsEl))) {
            throw new MalformedInputException(
                    "Root element is not 'definitions' but '" + localName(definitionsEl) + "'");
        }

        List<org.w3c.dom.Element> processEls = children(definitionsEl, "process");
        List<org.w3c.dom.Element> collaborationEls = children(definitionsEl, "collaboration");
        if (processEls.isEmpty() && collaborationEls.isEmpty()) {
            throw new MalformedInputException("Document contains no process or collaboration");
        }

        ProcessModel model = new ProcessModel();
        DiagramInterchange di = parseDiagramInterchange(doc);

        // Default flows are declared on their source, collect them up front
        Set<String> defaultFlowIds = new HashSet<>();
        collectDefaultFlowIds(definitionsEl, defaultFlowIds);

        Map<String, org.w3c.dom.Element> processesById = new LinkedHashMap<>();
        for (org.w3c.dom.Element processEl : processEls) {
            String processId = attr(processEl, "id");
            if (processId == null || processesById.containsKey(processId)) {
                processId = "Process_" + (processesById.size() + 1);
            }
            processesById.put(processId, processEl);
        }

        List<Flow> flows = new ArrayList<>();
        for (Map.Entry<String, org.w3c.dom.Element> entry : processesById.entrySet()) {
            if (model.getName() == null) {
                model.setName(attr(entry.getValue(), "name"));
            }
            parseProcessContents(entry.getValue(), entry.getKey(), model, flows, defaultFlowIds);
        }

        for (org.w3c.dom.Element collaborationEl : collaborationEls) {
            parseCollaboration(collaborationEl, model, flows);
        }

        for (Flow flow : flows) {
            List<Point> waypoints = di.edges().get(flow.id());
            if (waypoints != null) {
                flow.waypoints().addAll(waypoints);
            }
            model.getFlows().add(flow);
        }

        assignLanes(model, processesById);
        applyShapeBounds(model, di);

        log.debug("Parsed {} elements, {} flows, {} pools (DI: {})",
                model.elementCount(), model.getFlows().size(), model.getPools().size(),
                model.isHasExplicitCoordinates());
        return model;
    }

    private static Document readDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new MalformedInputException("Invalid XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new MalformedInputException("Failed to parse BPMN: " + e.getMessage(), e);
        }
    }

    /**
     * Shape bounds and edge waypoints from the diagram block, keyed by the
     * referenced BPMN element id.
     */
    record DiagramInterchange(Map<String, Bounds> shapes, Map<String, List<Point>> edges) {
    }

    static DiagramInterchange parseDiagramInterchange(Document doc) {
        Map<String, Bounds> shapes = new LinkedHashMap<>();
        Map<String, List<Point>> edges = new LinkedHashMap<>();

        NodeList shapeNodes = doc.getElementsByTagNameNS("*", "BPMNShape");
        for (int i = 0; i < shapeNodes.getLength(); i++) {
            org.w3c.dom.Element shapeEl = (org.w3c.dom.Element) shapeNodes.item(i);
            String ref = attr(shapeEl, "bpmnElement");
            org.w3c.dom.Element boundsEl = firstDescendant(shapeEl, "Bounds");
            if (ref == null || boundsEl == null) {
                continue;
            }
            shapes.put(ref, new Bounds(
                    number(boundsEl, "x"), number(boundsEl, "y"),
                    number(boundsEl, "width"), number(boundsEl, "height")));
        }

        NodeList edgeNodes = doc.getElementsByTagNameNS("*", "BPMNEdge");
        for (int i = 0; i < edgeNodes.getLength(); i++) {
            org.w3c.dom.Element edgeEl = (org.w3c.dom.Element) edgeNodes.item(i);
            String ref = attr(edgeEl, "bpmnElement");
            if (ref == null) {
                continue;
            }
            List<Point> points = new ArrayList<>();
            NodeList waypointNodes = edgeEl.getElementsByTagNameNS("*", "waypoint");
            for (int j = 0; j < waypointNodes.getLength(); j++) {
                org.w3c.dom.Element wp = (org.w3c.dom.Element) waypointNodes.item(j);
                points.add(new Point(number(wp, "x"), number(wp, "y")));
            }
            if (!points.isEmpty()) {
                edges.put(ref, points);
            }
        }
        return new DiagramInterchange(shapes, edges);
    }

    private static void collectDefaultFlowIds(org.w3c.dom.Element root, Set<String> defaultFlowIds) {
        NodeList all = root.getElementsByTagNameNS("*", "*");
        for (int i = 0; i < all.getLength(); i++) {
            String defaultFlow = attr((org.w3c.dom.Element) all.item(i), "default");
            if (defaultFlow != null) {
                defaultFlowIds.add(defaultFlow);
            }
        }
    }

    /**
     * Parses the direct children of a process into elements and flows.
     */
    private static void parseProcessContents(org.w3c.dom.Element processEl,
                                             String processId,
                                             ProcessModel model,
                                             List<Flow> flows,
                                             Set<String> defaultFlowIds) {
        int anonymous = 0;
        for (org.w3c.dom.Element child : children(processEl, null)) {
            String tag = localName(child);
            if (IGNORED_TAGS.contains(tag)) {
                continue;
            }

            if ("sequenceFlow".equals(tag)) {
                flows.add(parseSequenceFlow(child, defaultFlowIds));
                continue;
            }
            if (ASSOCIATION_TAGS.contains(tag)) {
                flows.add(parseAssociation(child, null));
                continue;
            }

            String id = attr(child, "id");
            if (id == null) {
                id = processId + "_" + tag + "_" + (++anonymous);
            }

            ElementKind kind = resolveKind(child, tag);
            if (kind == null) {
                if (hasAttr(child, "sourceRef") && hasAttr(child, "targetRef")) {
                    log.warn("Unknown flow kind '{}' ({}), treated as association", tag, id);
                    model.warn(id, WarningKind.UNKNOWN_KIND,
                            "Unknown flow kind '" + tag + "' rendered as association");
                    flows.add(new Flow(id, attr(child, "name"), FlowKind.ASSOCIATION,
                            attr(child, "sourceRef"), attr(child, "targetRef")));
                    continue;
                }
                log.warn("Unknown element kind '{}' ({}), using generic shape", tag, id);
                model.warn(id, WarningKind.UNKNOWN_KIND,
                        "Unknown element kind '" + tag + "' rendered with a generic shape");
                kind = new ElementKind.GenericKind(tag);
            }

            id = uniqueElementId(model, id);
            Element element = new Element(id, labelOf(child), kind, processId, attr(child, "attachedToRef"));
            model.addElement(element);

            if (kind instanceof ElementKind.ActivityKind activity) {
                // Data associations are nested in the activity they belong to
                for (org.w3c.dom.Element nested : children(child, null)) {
                    if (ASSOCIATION_TAGS.contains(localName(nested))) {
                        flows.add(parseAssociation(nested, id));
                    }
                }
                if (activity.type() == ActivityType.SUB_PROCESS) {
                    int folded = countFlowNodes(child);
                    if (folded > 0) {
                        log.warn("Sub-process {} collapsed, {} inner nodes not expanded", id, folded);
                        model.warn(id, WarningKind.COLLAPSED_SUBPROCESS,
                                "Sub-process rendered collapsed, " + folded + " inner nodes not shown");
                    }
                }
            }
        }
    }

    /**
     * Returns the id unchanged when it is free. A taken id gets the first free
     * numeric suffix and a {@link WarningKind#DUPLICATE_ID} warning, so the
     * earlier element keeps the id and neither is lost.
     */
    static String uniqueElementId(ProcessModel model, String id) {
        if (!model.contains(id)) {
            return id;
        }
        int suffix = 2;
        while (model.contains(id + "_" + suffix)) {
            suffix++;
        }
        String renamed = id + "_" + suffix;
        log.warn("Duplicate element id '{}', renamed to {}", id, renamed);
        model.warn(renamed, WarningKind.DUPLICATE_ID,
                "Id '" + id + "' is already used by another element, renamed to '" + renamed + "'");
        return renamed;
    }

    /**
     * Maps a tag to its element kind, or null when the tag is not a known
     * flow node or artifact.
     */
    static ElementKind resolveKind(org.w3c.dom.Element el, String tag) {
        EventPosition position = EventPosition.fromTag(tag);
        if (position != null) {
            return new ElementKind.EventKind(position, resolveTrigger(el));
        }
        ActivityType activityType = ActivityType.fromTag(tag);
        if (activityType != null) {
            return new ElementKind.ActivityKind(activityType, resolveLoop(el));
        }
        GatewayType gatewayType = GatewayType.fromTag(tag);
        if (gatewayType != null) {
            return new ElementKind.GatewayKind(gatewayType);
        }
        ArtifactType artifactType = ArtifactType.fromTag(tag);
        if (artifactType != null) {
            return new ElementKind.ArtifactKind(artifactType);
        }
        return null;
    }

    private static EventTrigger resolveTrigger(org.w3c.dom.Element eventEl) {
        for (org.w3c.dom.Element child : children(eventEl, null)) {
            String tag = localName(child);
            if (tag.endsWith("EventDefinition")) {
                EventTrigger trigger = EventTrigger.fromDefinitionTag(tag);
                if (trigger != null) {
                    return trigger;
                }
            }
        }
        return EventTrigger.NONE;
    }

    private static LoopMarker resolveLoop(org.w3c.dom.Element activityEl) {
        for (org.w3c.dom.Element child : children(activityEl, null)) {
            String tag = localName(child);
            if ("multiInstanceLoopCharacteristics".equals(tag)) {
                return "true".equals(attr(child, "isSequential"))
                        ? LoopMarker.SEQUENTIAL_MULTI_INSTANCE
                        : LoopMarker.PARALLEL_MULTI_INSTANCE;
            }
            if ("standardLoopCharacteristics".equals(tag)) {
                return LoopMarker.STANDARD;
            }
        }
        return LoopMarker.NONE;
    }

    private static int countFlowNodes(org.w3c.dom.Element container) {
        int count = 0;
        for (org.w3c.dom.Element child : children(container, null)) {
            String tag = localName(child);
            if (EventPosition.fromTag(tag) != null || ActivityType.fromTag(tag) != null
                    || GatewayType.fromTag(tag) != null) {
                count++;
                if (FLOW_NODE_CONTAINERS.contains(tag)) {
                    count += countFlowNodes(child);
                }
            }
        }
        return count;
    }

    private static Flow parseSequenceFlow(org.w3c.dom.Element flowEl, Set<String> defaultFlowIds) {
        String id = attr(flowEl, "id");
        FlowKind kind = FlowKind.SEQUENCE;
        if (defaultFlowIds.contains(id)) {
            kind = FlowKind.DEFAULT;
        } else if (firstChild(flowEl, "conditionExpression") != null) {
            kind = FlowKind.CONDITIONAL;
        }
        return new Flow(id, attr(flowEl, "name"), kind, attr(flowEl, "sourceRef"), attr(flowEl, "targetRef"));
    }

    /**
     * Parses an association. Data associations nested in an activity carry their
     * refs as child elements and leave the activity side implicit.
     *
     * @param ownerId id of the enclosing activity, or null for top-level associations
     */
    private static Flow parseAssociation(org.w3c.dom.Element assocEl, String ownerId) {
        String tag = localName(assocEl);
        String source = refOf(assocEl, "sourceRef");
        String target = refOf(assocEl, "targetRef");
        if (ownerId != null) {
            if ("dataOutputAssociation".equals(tag)) {
                source = ownerId;
            } else if ("dataInputAssociation".equals(tag)) {
                target = ownerId;
            }
        }
        String id = attr(assocEl, "id");
        if (id == null) {
            id = tag + "_" + source + "_" + target;
        }
        return new Flow(id, attr(assocEl, "name"), FlowKind.ASSOCIATION, source, target);
    }

    // Text annotations keep their label in a text child instead of a name attribute
    private static String labelOf(org.w3c.dom.Element el) {
        String name = attr(el, "name");
        if (name == null && "textAnnotation".equals(localName(el))) {
            org.w3c.dom.Element textEl = firstChild(el, "text");
            return textEl == null ? null : textEl.getTextContent().trim();
        }
        return name;
    }

    private static String refOf(org.w3c.dom.Element el, String name) {
        String value = attr(el, name);
        if (value != null) {
            return value;
        }
        org.w3c.dom.Element refEl = firstChild(el, name);
        if (refEl == null) {
            return null;
        }
        String text = refEl.getTextContent().trim();
        return text.isEmpty() ? null : text;
    }

    private static void parseCollaboration(org.w3c.dom.Element collaborationEl, ProcessModel model, List<Flow> flows) {
        String collaborationId = attr(collaborationEl, "id");
        String prefix = collaborationId != null ? collaborationId : "Collaboration";
        int anonymous = 0;
        for (org.w3c.dom.Element child : children(collaborationEl, null)) {
            String tag = localName(child);
            String id = attr(child, "id");
            switch (tag) {
                case "participant" -> {
                    if (id == null) {
                        id = "Participant_" + (model.getPools().size() + 1);
                    }
                    model.getPools().add(new Pool(id, attr(child, "name"), attr(child, "processRef")));
                }
                case "messageFlow" -> flows.add(new Flow(id, attr(child, "name"),
                        FlowKind.MESSAGE, attr(child, "sourceRef"), attr(child, "targetRef")));
                case "association" -> flows.add(parseAssociation(child, null));
                case "textAnnotation", "group" -> {
                    if (id == null) {
                        id = prefix + "_" + tag + "_" + (++anonymous);
                    }
                    ElementKind kind = new ElementKind.ArtifactKind(ArtifactType.fromTag(tag));
                    model.addElement(new Element(uniqueElementId(model, id), labelOf(child), kind, null, null));
                }
                default -> {
                    // conversations, correlation keys and the like have no shape
                }
            }
        }
    }

    /**
     * Attaches lanes to pools and elements to lanes. Processes with lanes but
     * no participant get a pool of their own; laneless pools get one implicit
     * lane holding the whole process.
     */
    private static void assignLanes(ProcessModel model, Map<String, org.w3c.dom.Element> processesById) {
        Set<String> pooledProcesses = new HashSet<>();
        for (Pool pool : model.getPools()) {
            if (pool.getProcessRef() != null) {
                pooledProcesses.add(pool.getProcessRef());
            }
        }
        for (Map.Entry<String, org.w3c.dom.Element> entry : processesById.entrySet()) {
            if (!pooledProcesses.contains(entry.getKey())
                    && firstChild(entry.getValue(), "laneSet") != null) {
                log.debug("Process {} has lanes but no participant, adding a pool for it", entry.getKey());
                model.getPools().add(new Pool(entry.getKey(), attr(entry.getValue(), "name"), entry.getKey()));
            }
        }

        for (Pool pool : model.getPools()) {
            org.w3c.dom.Element processEl = processesById.get(pool.getProcessRef());
            org.w3c.dom.Element laneSetEl = processEl == null ? null : firstChild(processEl, "laneSet");
            if (laneSetEl != null) {
                flattenLanes(laneSetEl, pool, model, null);
            }
            if (pool.getLanes().isEmpty()) {
                pool.addLane(Lane.implicitId(pool.getId()), "", true);
            }

            // Process content no lane claims goes to the first lane
            Lane fallback = pool.getLanes().get(0);
            for (Element element : model.elements()) {
                if (element.getLaneId() == null && pool.getProcessRef() != null
                        && pool.getProcessRef().equals(element.getProcessId())) {
                    element.setLaneId(fallback.getId());
                    fallback.getElementIds().add(element.getId());
                }
            }
        }
    }

    /**
     * Adds the leaf lanes below a lane set to the pool in document order.
     * References held by a parent lane go to its first leaf.
     */
    private static void flattenLanes(org.w3c.dom.Element laneSetEl, Pool pool, ProcessModel model, List<String> inherited) {
        boolean first = true;
        for (org.w3c.dom.Element laneEl : children(laneSetEl, "lane")) {
            List<String> refs = new ArrayList<>();
            if (first && inherited != null) {
                refs.addAll(inherited);
            }
            first = false;
            for (org.w3c.dom.Element refEl : children(laneEl, "flowNodeRef")) {
                String ref = refEl.getTextContent().trim();
                if (!ref.isEmpty() && !refs.contains(ref)) {
                    refs.add(ref);
                }
            }

            org.w3c.dom.Element childLaneSet = firstChild(laneEl, "childLaneSet");
            if (childLaneSet != null && !children(childLaneSet, "lane").isEmpty()) {
                flattenLanes(childLaneSet, pool, model, refs);
                continue;
            }

            String laneId = attr(laneEl, "id");
            if (laneId == null) {
                laneId = pool.getId() + "_lane_" + (pool.getLanes().size() + 1);
            }
            Lane lane = pool.addLane(laneId, attr(laneEl, "name"), false);
            for (String ref : refs) {
                Element element = model.element(ref);
                if (element != null && element.getLaneId() != null) {
                    continue; // claimed by an earlier lane
                }
                lane.getElementIds().add(ref);
                if (element != null) {
                    element.setLaneId(lane.getId());
                }
            }
        }
    }

    private static void applyShapeBounds(ProcessModel model, DiagramInterchange di) {
        for (Element element : model.elements()) {
            Bounds bounds = di.shapes().get(element.getId());
            if (bounds != null) {
                element.setBounds(bounds);
            }
        }
        for (Pool pool : model.getPools()) {
            pool.setBounds(di.shapes().get(pool.getId()));
            for (Lane lane : pool.getLanes()) {
                lane.setBounds(di.shapes().get(lane.getId()));
            }
        }
        model.setHasExplicitCoordinates(!di.shapes().isEmpty());
    }

    // --- DOM utilities ---

    static String localName(Node node) {
        String name = node.getLocalName();
        if (name != null) {
            return name;
        }
        String nodeName = node.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    /**
     * Direct element children, optionally restricted to one local name.
     */
    static List<org.w3c.dom.Element> children(org.w3c.dom.Element parent, String name) {
        List<org.w3c.dom.Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && (name == null || name.equals(localName(node)))) {
                result.add((org.w3c.dom.Element) node);
            }
        }
        return result;
    }

    private static org.w3c.dom.Element firstChild(org.w3c.dom.Element parent, String name) {
        List<org.w3c.dom.Element> matches = children(parent, name);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static org.w3c.dom.Element firstDescendant(org.w3c.dom.Element parent, String name) {
        NodeList nodes = parent.getElementsByTagNameNS("*", name);
        return nodes.getLength() == 0 ? null : (org.w3c.dom.Element) nodes.item(0);
    }

    private static String attr(org.w3c.dom.Element el, String name) {
        String value = el.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    private static boolean hasAttr(org.w3c.dom.Element el, String name) {
        return attr(el, name) != null;
    }

    private static double number(org.w3c.dom.Element el, String name) {
        String value = attr(el, name);
        if (value == null) {
            return 0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(
                    "Invalid number '" + value + "' in attribute " + name + " of " + localName(el), e);
        }
    }
}
