package org.bpmn2drawio.layout;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Element;
import org.bpmn2drawio.bpmn.models.EventPosition;
import org.bpmn2drawio.bpmn.models.Flow;
import org.bpmn2drawio.bpmn.models.Lane;
import org.bpmn2drawio.bpmn.models.Point;
import org.bpmn2drawio.bpmn.models.Pool;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.bpmn2drawio.layout.LayoutConstants.LANE_HEADER;
import static org.bpmn2drawio.layout.LayoutConstants.LANE_PADDING;
import static org.bpmn2drawio.layout.LayoutConstants.MARGIN;
import static org.bpmn2drawio.layout.LayoutConstants.MIN_LANE_EXTENT;
import static org.bpmn2drawio.layout.LayoutConstants.POOL_GAP;
import static org.bpmn2drawio.layout.LayoutConstants.POOL_HEADER;
import static org.bpmn2drawio.layout.LayoutConstants.RANK_SEPARATION;
import static org.bpmn2drawio.layout.LayoutConstants.SLOT_GAP;

/**
 * Layered layout. Everything is computed left to right (rank on x, slot on y)
 * and turned to the requested direction at the end.
 *
 * <p>Each lane is a band; pool-less elements share one free band below the
 * pools. Elements without an ordering flow get no rank and go on a trailing
 * row at the bottom of their band.</p>
 */
class AutoLayout {
    private static final Logger log = LoggerFactory.getLogger(AutoLayout.class);

    private final ProcessModel model;
    private final Direction direction;
    private final PageSize pageSize;

    private final List<Band> bands = new ArrayList<>();
    private final Map<String, Band> bandByLane = new HashMap<>();
    private Band freeBand;

    private LayeredGraph graph;
    private List<List<Integer>> layers;

    /** A lane, or the free band when lane is null. */
    private static final class Band {
        final Pool pool;
        final Lane lane;
        final List<Element> unranked = new ArrayList<>();
        int slotCount;
        double slotExtent;
        double y;
        double height;
        double contentOffset;
        double contentHeight;

        Band(Pool pool, Lane lane) {
            this.pool = pool;
            this.lane = lane;
        }
    }

    AutoLayout(ProcessModel model, Direction direction, PageSize pageSize) {
        this.model = model;
        this.direction = direction;
        this.pageSize = pageSize;
    }

    void run() {
        buildBands();
        buildGraph();
        orderLayers();

        double contentX = model.getPools().isEmpty() ? MARGIN : MARGIN + POOL_HEADER + LANE_HEADER + LANE_PADDING;
        double[] columnX = placeColumns(contentX);
        double rankedEnd = contentX;
        for (int r = 0; r < layers.size(); r++) {
            rankedEnd = Math.max(rankedEnd, columnX[r] + columnWidth(r));
        }

        sizeSlots();
        Map<Element, Point> trailing = placeTrailingRows(contentX, rankedEnd);
        double contentEnd = rankedEnd;
        for (Map.Entry<Element, Point> entry : trailing.entrySet()) {
            contentEnd = Math.max(contentEnd, entry.getValue().x() + entry.getKey().width());
        }

        stackBands();
        placeRanked(columnX);
        placeUnranked(trailing);
        placeContainers(contentEnd);

        if (direction.isReversed()) {
            for (Element element : model.elements()) {
                if (element.hasBounds()) {
                    element.setBounds(DirectionTransform.mirrorX(element.getBounds(), contentX, contentEnd));
                }
            }
        }
        if (direction.isVertical()) {
            Point origin = new Point(MARGIN, MARGIN);
            for (Element element : model.elements()) {
                if (element.hasBounds()) {
                    element.setBounds(DirectionTransform.transpose(element.getBounds(), origin));
                }
            }
            for (Pool pool : model.getPools()) {
                pool.setBounds(DirectionTransform.transpose(pool.getBounds(), origin));
                for (Lane lane : pool.getLanes()) {
                    lane.setBounds(DirectionTransform.transpose(lane.getBounds(), origin));
                }
            }
        }
        log.debug("Auto layout: {} ranks, {} back edges, {} bands",
                layers.size(), graph.backEdgeCount(), bands.size());
    }

    private void buildBands() {
        for (Pool pool : model.getPools()) {
            for (Lane lane : pool.getLanes()) {
                Band band = new Band(pool, lane);
                bands.add(band);
                bandByLane.put(lane.getId(), band);
            }
        }
        boolean hasPoolless = model.elements().stream()
                .anyMatch(e -> e.getLaneId() == null && !isPlacedOnHost(e));
        if (hasPoolless) {
            freeBand = new Band(null, null);
            bands.add(freeBand);
        }
    }

    private Band bandOf(Element element) {
        Band band = bandByLane.get(element.getLaneId());
        return band != null ? band : freeBand;
    }

    private boolean isPlacedOnHost(Element element) {
        return LayoutEngine.hasHost(model, element);
    }

    // Flows from or to a boundary event are ranked as flows of its host
    private String rankedEndpoint(String elementId) {
        Element element = model.element(elementId);
        if (element != null && isPlacedOnHost(element)) {
            return element.getAttachedToRef();
        }
        return elementId;
    }

    private void buildGraph() {
        List<String[]> edges = new ArrayList<>();
        Set<String> connected = new LinkedHashSet<>();
        for (Flow flow : model.getFlows()) {
            if (!flow.kind().isOrdering()) {
                continue;
            }
            String source = rankedEndpoint(flow.sourceRef());
            String target = rankedEndpoint(flow.targetRef());
            if (source.equals(target)) {
                continue;
            }
            edges.add(new String[]{source, target});
            connected.add(source);
            connected.add(target);
        }

        List<String> nodeIds = new ArrayList<>();
        for (Element element : model.elements()) {
            if (isPlacedOnHost(element)) {
                continue;
            }
            if (connected.contains(element.getId())) {
                nodeIds.add(element.getId());
            } else {
                bandOf(element).unranked.add(element);
            }
        }

        graph = new LayeredGraph(nodeIds);
        for (String[] edge : edges) {
            graph.addEdge(edge[0], edge[1]);
        }

        List<Integer> roots = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) {
            if (model.element(graph.id(i)).isEvent(EventPosition.START)) {
                roots.add(i);
            }
        }
        for (int i = 0; i < graph.size(); i++) {
            if (graph.predecessors(i).isEmpty() && !roots.contains(i)) {
                roots.add(i);
            }
        }
        graph.detectBackEdges(roots);
        graph.assignRanks();
    }

    private void orderLayers() {
        layers = new ArrayList<>();
        if (graph.size() == 0) {
            return;
        }
        for (int r = 0; r <= graph.maxRank(); r++) {
            layers.add(new ArrayList<>());
        }
        int[] bandIndex = new int[graph.size()];
        for (int i = 0; i < graph.size(); i++) {
            layers.get(graph.rank(i)).add(i);
            bandIndex[i] = bands.indexOf(bandOf(model.element(graph.id(i))));
        }
        new CrossingMinimizer(graph, bandIndex).minimize(layers);
    }

    private double columnWidth(int rank) {
        double width = 0;
        for (int node : layers.get(rank)) {
            width = Math.max(width, model.element(graph.id(node)).width());
        }
        return width;
    }

    private double[] placeColumns(double contentX) {
        double[] columnX = new double[layers.size()];
        double x = contentX;
        for (int r = 0; r < layers.size(); r++) {
            columnX[r] = x;
            x += columnWidth(r) + RANK_SEPARATION;
        }
        return columnX;
    }

    private void sizeSlots() {
        for (List<Integer> layer : layers) {
            Map<Band, Integer> perBand = new HashMap<>();
            for (int node : layer) {
                Element element = model.element(graph.id(node));
                Band band = bandOf(element);
                perBand.merge(band, 1, Integer::sum);
                band.slotExtent = Math.max(band.slotExtent, element.height());
            }
            perBand.forEach((band, count) -> band.slotCount = Math.max(band.slotCount, count));
        }
        for (Band band : bands) {
            band.contentHeight = band.slotCount == 0
                    ? 0
                    : band.slotCount * band.slotExtent + (band.slotCount - 1) * SLOT_GAP;
        }
    }

    /**
     * Lays the unranked elements of each band out in rows, relative to the
     * band's content top. Rows wrap at the page width when one is set.
     */
    private Map<Element, Point> placeTrailingRows(double contentX, double rankedEnd) {
        Map<Element, Point> offsets = new HashMap<>();
        double wrap = pageSize.wrapWidth();
        double limit = wrap > 0 ? Math.max(MARGIN + wrap, rankedEnd) : Double.MAX_VALUE;

        for (Band band : bands) {
            if (band.unranked.isEmpty()) {
                continue;
            }
            double rowTop = band.slotCount > 0 ? band.contentHeight + SLOT_GAP : 0;
            double x = contentX;
            double rowHeight = 0;
            for (Element element : band.unranked) {
                if (x > contentX && x + element.width() > limit) {
                    rowTop += rowHeight + SLOT_GAP;
                    x = contentX;
                    rowHeight = 0;
                }
                offsets.put(element, new Point(x, rowTop));
                x += element.width() + SLOT_GAP;
                rowHeight = Math.max(rowHeight, element.height());
            }
            band.contentHeight = rowTop + rowHeight;
        }
        return offsets;
    }

    private void stackBands() {
        double y = MARGIN;
        Pool current = null;
        for (Band band : bands) {
            if (band.pool != current && current != null) {
                y += POOL_GAP;
            }
            current = band.pool;
            double content = band.contentHeight;
            band.height = band.lane == null
                    ? content + 2 * LANE_PADDING
                    : Math.max(MIN_LANE_EXTENT, content + 2 * LANE_PADDING);
            band.contentOffset = (band.height - content) / 2;
            band.y = y;
            y += band.height;
        }
    }

    private void placeRanked(double[] columnX) {
        for (int r = 0; r < layers.size(); r++) {
            double width = columnWidth(r);
            Map<Band, Integer> nextSlot = new HashMap<>();
            for (int node : layers.get(r)) {
                Element element = model.element(graph.id(node));
                Band band = bandOf(element);
                int slot = nextSlot.merge(band, 1, Integer::sum) - 1;
                double slotTop = band.y + band.contentOffset + slot * (band.slotExtent + SLOT_GAP);
                element.setBounds(new Bounds(
                        columnX[r] + (width - element.width()) / 2,
                        slotTop + (band.slotExtent - element.height()) / 2,
                        element.width(), element.height()));
            }
        }
    }

    private void placeUnranked(Map<Element, Point> trailing) {
        for (Band band : bands) {
            for (Element element : band.unranked) {
                Point offset = trailing.get(element);
                element.setBounds(new Bounds(offset.x(), band.y + band.contentOffset + offset.y(),
                        element.width(), element.height()));
            }
        }
    }

    private void placeContainers(double contentEnd) {
        double poolWidth = contentEnd + LANE_PADDING - MARGIN;
        for (Pool pool : model.getPools()) {
            Bounds poolBounds = null;
            for (Lane lane : pool.getLanes()) {
                Band band = bandByLane.get(lane.getId());
                Bounds laneBounds = new Bounds(MARGIN + POOL_HEADER, band.y, poolWidth - POOL_HEADER, band.height);
                lane.setBounds(laneBounds);
                poolBounds = Bounds.union(poolBounds, laneBounds);
            }
            pool.setBounds(new Bounds(MARGIN, poolBounds.y(), poolWidth, poolBounds.height()));
            pool.setHorizontal(!direction.isVertical());
        }
    }
}
