package org.bpmn2drawio.drawio;

import org.bpmn2drawio.bpmn.BpmnHelper;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.bpmn2drawio.layout.Direction;
import org.bpmn2drawio.layout.LayoutEngine;
import org.bpmn2drawio.layout.LayoutMode;
import org.bpmn2drawio.layout.PageSize;
import org.bpmn2drawio.theme.ThemeHelper;
import org.bpmn2drawio.transform.CoordinateTransformer;
import org.bpmn2drawio.validation.ModelValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DrawioGeneratorTest {
    private static final Path LANES_BPMN = Path.of("src/test/resources/bpmn/lanes.bpmn");
    private static final Path TWO_POOLS_BPMN = Path.of("src/test/resources/bpmn/two_pools.bpmn");
    private static final Path ALL_KINDS_BPMN = Path.of("src/test/resources/bpmn/all_kinds.bpmn");
    private static final List<Path> ALL_FIXTURES = List.of(
            Path.of("src/test/resources/bpmn/linear.bpmn"),
            Path.of("src/test/resources/bpmn/cycle.bpmn"),
            LANES_BPMN,
            TWO_POOLS_BPMN,
            Path.of("src/test/resources/bpmn/with_di.bpmn"),
            ALL_KINDS_BPMN,
            Path.of("src/test/resources/bpmn/dangling_flow.bpmn"));

    @Test
    void shouldWriteGraphModelSkeleton() throws Exception {
        Document doc = parse(generate(LANES_BPMN, "Order Handling", PageSize.A4, true));

        Element mxfile = doc.getDocumentElement();
        assertEquals("mxfile", mxfile.getTagName());
        Element diagram = (Element) mxfile.getElementsByTagName("diagram").item(0);
        assertEquals("Order Handling", diagram.getAttribute("name"));
        Element graphModel = (Element) doc.getElementsByTagName("mxGraphModel").item(0);
        assertEquals("1", graphModel.getAttribute("grid"));
        assertEquals("827", graphModel.getAttribute("pageWidth"));
        assertEquals("1169", graphModel.getAttribute("pageHeight"));

        List<Element> cells = cells(doc);
        assertEquals("0", cells.get(0).getAttribute("id"));
        assertEquals("1", cells.get(1).getAttribute("id"));
        assertEquals("0", cells.get(1).getAttribute("parent"));
    }

    @Test
    void shouldUseDefaultNameAndHideGrid() throws Exception {
        Document doc = parse(generate(LANES_BPMN, " ", PageSize.AUTO, false));

        Element diagram = (Element) doc.getElementsByTagName("diagram").item(0);
        assertEquals(DrawioGenerator.DEFAULT_DIAGRAM_NAME, diagram.getAttribute("name"));
        assertEquals("0", ((Element) doc.getElementsByTagName("mxGraphModel").item(0)).getAttribute("grid"));
    }

    @Test
    void shouldNumberCellsSequentially() throws Exception {
        List<Element> cells = cells(parse(generate(ALL_KINDS_BPMN, null, PageSize.AUTO, true)));

        for (int i = 0; i < cells.size(); i++) {
            assertEquals(String.valueOf(i), cells.get(i).getAttribute("id"));
        }
    }

    @Test
    void shouldEmitParentsBeforeChildren() throws Exception {
        List<Element> cells = cells(parse(generate(TWO_POOLS_BPMN, null, PageSize.AUTO, true)));

        Set<String> seen = new HashSet<>();
        Set<String> vertices = new HashSet<>();
        for (Element cell : cells) {
            if (cell.hasAttribute("parent")) {
                assertTrue(seen.contains(cell.getAttribute("parent")), "parent of " + cell.getAttribute("id"));
            }
            if (cell.hasAttribute("edge")) {
                assertTrue(vertices.contains(cell.getAttribute("source")));
                assertTrue(vertices.contains(cell.getAttribute("target")));
            }
            if (cell.hasAttribute("vertex")) {
                vertices.add(cell.getAttribute("id"));
            }
            seen.add(cell.getAttribute("id"));
        }
    }

    @Test
    void shouldEmitPoolsThenLanesThenElements() throws Exception {
        List<Element> cells = cells(parse(generate(LANES_BPMN, null, PageSize.AUTO, true)));

        Element pool = cells.get(2);
        assertEquals("Company", pool.getAttribute("value"));
        assertEquals(DrawioGenerator.CANVAS_CELL_ID, pool.getAttribute("parent"));
        assertTrue(pool.getAttribute("style").startsWith("swimlane;"));
        assertEquals("Customer", cells.get(3).getAttribute("value"));
        assertEquals("2", cells.get(3).getAttribute("parent"));
        assertEquals("Order System", cells.get(4).getAttribute("value"));
        assertEquals("Start", cells.get(5).getAttribute("value"));
        assertEquals("3", cells.get(5).getAttribute("parent"));
    }

    @Test
    void shouldAttachEdgesToLaneOrCanvas() throws Exception {
        List<Element> cells = cells(parse(generate(LANES_BPMN, null, PageSize.AUTO, true)));

        Element customerLane = byValue(cells, "Customer");
        Element intraLane = edgeFrom(cells, byValue(cells, "Start"));
        assertEquals(customerLane.getAttribute("id"), intraLane.getAttribute("parent"));
        Element crossLane = edgeFrom(cells, byValue(cells, "Place order"));
        assertEquals(DrawioGenerator.CANVAS_CELL_ID, crossLane.getAttribute("parent"));
        assertEquals(byValue(cells, "Process order").getAttribute("id"), crossLane.getAttribute("target"));
    }

    @Test
    void shouldParentEveryEdgeToSharedLaneOrCanvas() throws Exception {
        for (Path fixture : ALL_FIXTURES) {
            for (Direction direction : Direction.values()) {
                List<Element> cells = cells(parse(generate(fixture, direction)));
                Map<String, Element> byId = new HashMap<>();
                cells.forEach(c -> byId.put(c.getAttribute("id"), c));

                for (Element edge : cells) {
                    if (!edge.hasAttribute("edge")) {
                        continue;
                    }
                    String where = fixture.getFileName() + " " + direction + " cell " + edge.getAttribute("id");
                    String sourceParent = byId.get(edge.getAttribute("source")).getAttribute("parent");
                    String targetParent = byId.get(edge.getAttribute("target")).getAttribute("parent");
                    if (sourceParent.equals(targetParent) && !sourceParent.equals(DrawioGenerator.CANVAS_CELL_ID)) {
                        assertEquals(sourceParent, edge.getAttribute("parent"), where);
                        // the shared parent is a lane, so it sits inside a pool
                        String pool = byId.get(sourceParent).getAttribute("parent");
                        assertEquals(DrawioGenerator.CANVAS_CELL_ID, byId.get(pool).getAttribute("parent"), where);
                    } else {
                        assertEquals(DrawioGenerator.CANVAS_CELL_ID, edge.getAttribute("parent"), where);
                    }
                }
            }
        }
    }

    @Test
    void shouldWriteMessageFlowOnCanvas() throws Exception {
        List<Element> cells = cells(parse(generate(TWO_POOLS_BPMN, null, PageSize.AUTO, true)));

        Element message = byValue(cells, "order");
        assertEquals("1", message.getAttribute("edge"));
        assertEquals(DrawioGenerator.CANVAS_CELL_ID, message.getAttribute("parent"));
        assertTrue(message.getAttribute("style").contains("dashed=1"));
        Element geometry = (Element) message.getElementsByTagName("mxGeometry").item(0);
        assertEquals("1", geometry.getAttribute("relative"));
        NodeList points = geometry.getElementsByTagName("mxPoint");
        assertEquals("sourcePoint", ((Element) points.item(0)).getAttribute("as"));
        assertEquals("targetPoint", ((Element) points.item(1)).getAttribute("as"));
    }

    @Test
    void shouldAddDecorationsAsChildrenOfTheirElement() throws Exception {
        List<Element> cells = cells(parse(generate(ALL_KINDS_BPMN, null, PageSize.AUTO, true)));

        Element gateway = byStylePrefix(cells, "rhombus;");
        Element marker = cells.get(cells.indexOf(gateway) + 1);
        assertEquals(gateway.getAttribute("id"), marker.getAttribute("parent"));
        assertEquals("", marker.getAttribute("value"));
        assertTrue(marker.getAttribute("style").startsWith("shape=cross;"));
    }

    @Test
    void shouldFormatNumbersLikeDrawio() {
        assertEquals("120", DrawioGenerator.number(120.0));
        assertEquals("12.5", DrawioGenerator.number(12.50));
        assertEquals("0.33", DrawioGenerator.number(1.0 / 3));
        assertEquals("0", DrawioGenerator.number(-0.0));
        assertEquals("-15", DrawioGenerator.number(-15));
        assertEquals("1000", DrawioGenerator.number(1000));
    }

    @Test
    void shouldWriteFileAndParentDirectories(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("nested/out.drawio");

        DrawioGenerator.writeDrawioFile("<mxfile/>", out);

        assertEquals("<mxfile/>", Files.readString(out));
    }

    private static String generate(Path bpmn, String name, PageSize pageSize, boolean grid) {
        return generate(bpmn, Direction.LR, name, pageSize, grid);
    }

    private static String generate(Path bpmn, Direction direction) {
        return generate(bpmn, direction, null, PageSize.AUTO, true);
    }

    private static String generate(Path bpmn, Direction direction, String name, PageSize pageSize, boolean grid) {
        ProcessModel model = BpmnHelper.parseBpmnFile(bpmn);
        ModelValidator.validate(model);
        LayoutEngine.layout(model, LayoutMode.AUTO, direction, pageSize);
        return DrawioGenerator.generate(CoordinateTransformer.transform(model),
                ThemeHelper.builtIn("default"), name, pageSize, grid);
    }

    private static Document parse(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    }

    private static List<Element> cells(Document doc) {
        NodeList nodes = doc.getElementsByTagName("mxCell");
        List<Element> cells = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            cells.add((Element) nodes.item(i));
        }
        return cells;
    }

    private static Element byValue(List<Element> cells, String value) {
        return cells.stream().filter(c -> value.equals(c.getAttribute("value"))).findFirst()
                .orElseThrow(() -> new AssertionError("No cell " + value));
    }

    private static Element byStylePrefix(List<Element> cells, String prefix) {
        return cells.stream().filter(c -> c.getAttribute("style").startsWith(prefix)).findFirst()
                .orElseThrow(() -> new AssertionError("No cell styled " + prefix));
    }

    private static Element edgeFrom(List<Element> cells, Element source) {
        return cells.stream()
                .filter(c -> c.hasAttribute("edge") && c.getAttribute("source").equals(source.getAttribute("id")))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No edge from " + source.getAttribute("value")));
    }
}
