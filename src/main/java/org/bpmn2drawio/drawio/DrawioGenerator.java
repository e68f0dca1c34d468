package org.bpmn2drawio.drawio;

import org.bpmn2drawio.ConversionException;
import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Point;
import org.bpmn2drawio.drawio.models.Decoration;
import org.bpmn2drawio.layout.PageSize;
import org.bpmn2drawio.theme.models.Theme;
import org.bpmn2drawio.transform.PlacedElement;
import org.bpmn2drawio.transform.PlacedLane;
import org.bpmn2drawio.transform.PlacedModel;
import org.bpmn2drawio.transform.PlacedPool;
import org.bpmn2drawio.transform.RoutedEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link PlacedModel} as a draw.io (mxGraph) document.
 *
 * <p>Cells are emitted pools first, then lanes, then elements with their
 * decorations, then edges, so every parent precedes its children. Cell ids
 * are sequential in that order, which makes the output depend on the model
 * only.</p>
 */
public class DrawioGenerator {
    private static final Logger log = LoggerFactory.getLogger(DrawioGenerator.class);

    public static final String CANVAS_CELL_ID = "1";
    public static final String DEFAULT_DIAGRAM_NAME = "BPMN Diagram";

    // Fixed so that identical input gives identical output
    private static final String MODIFIED = "2024-01-01T00:00:00.000Z";
    private static final String VERSION = "1.0.0";

    /**
     * Builds the document text.
     *
     * @param placed      transformed model
     * @param theme       resolved theme
     * @param diagramName page title, {@value #DEFAULT_DIAGRAM_NAME} when null or blank
     * @param pageSize    page format of the graph model
     * @param grid        show the editor grid
     */
    public static String generate(PlacedModel placed, Theme theme, String diagramName, PageSize pageSize, boolean grid) {
        Document doc = newDocument();

        Element mxfile = doc.createElement("mxfile");
        mxfile.setAttribute("host", "bpmn2drawio");
        mxfile.setAttribute("modified", MODIFIED);
        mxfile.setAttribute("agent", "bpmn2drawio converter");
        mxfile.setAttribute("version", VERSION);
        mxfile.setAttribute("type", "device");
        doc.appendChild(mxfile);

        Element diagram = doc.createElement("diagram");
        diagram.setAttribute("id", "diagram_1");
        diagram.setAttribute("name", diagramName == null || diagramName.isBlank() ? DEFAULT_DIAGRAM_NAME : diagramName);
        mxfile.appendChild(diagram);

        Element graphModel = doc.createElement("mxGraphModel");
        graphModel.setAttribute("dx", "0");
        graphModel.setAttribute("dy", "0");
        graphModel.setAttribute("grid", grid ? "1" : "0");
        graphModel.setAttribute("gridSize", "10");
        graphModel.setAttribute("guides", "1");
        graphModel.setAttribute("tooltips", "1");
        graphModel.setAttribute("connect", "1");
        graphModel.setAttribute("arrows", "1");
        graphModel.setAttribute("fold", "1");
        graphModel.setAttribute("page", "1");
        graphModel.setAttribute("pageScale", "1");
        graphModel.setAttribute("pageWidth", String.valueOf(pageSize.pageWidth()));
        graphModel.setAttribute("pageHeight", String.valueOf(pageSize.pageHeight()));
        graphModel.setAttribute("math", "0");
        graphModel.setAttribute("shadow", "0");
        diagram.appendChild(graphModel);

        Element root = doc.createElement("root");
        graphModel.appendChild(root);

        Element baseCell = doc.createElement("mxCell");
        baseCell.setAttribute("id", "0");
        root.appendChild(baseCell);
        Element canvasCell = doc.createElement("mxCell");
        canvasCell.setAttribute("id", CANVAS_CELL_ID);
        canvasCell.setAttribute("parent", "0");
        root.appendChild(canvasCell);

        CellWriter cells = new CellWriter(doc, root);
        Map<String, String> cellIds = new HashMap<>();
        Map<String, Boolean> poolHorizontal = new HashMap<>();

        for (PlacedPool pool : placed.pools()) {
            String cellId = cells.vertex(pool.pool().getName(), StyleHelper.poolStyle(pool.pool(), theme),
                    CANVAS_CELL_ID, pool.absolute());
            cellIds.put(pool.pool().getId(), cellId);
            poolHorizontal.put(pool.pool().getId(), pool.pool().isHorizontal());
        }

        for (PlacedLane lane : placed.lanes()) {
            boolean horizontal = poolHorizontal.getOrDefault(lane.poolId(), true);
            String value = lane.lane().isImplicit() ? "" : lane.lane().getName();
            String cellId = cells.vertex(value, StyleHelper.laneStyle(lane.lane(), horizontal, theme),
                    cellIds.get(lane.poolId()), lane.relative());
            cellIds.put(lane.lane().getId(), cellId);
        }

        for (PlacedElement element : placed.elements()) {
            String parent = element.onCanvas() ? CANVAS_CELL_ID : cellIds.get(element.containerId());
            String cellId = cells.vertex(element.element().getName(),
                    StyleHelper.elementStyle(element.element(), theme), parent, element.relative());
            cellIds.put(element.element().getId(), cellId);

            for (Decoration decoration : DecorationHelper.decorationsFor(element.element(), element.relative(), theme)) {
                cells.vertex("", decoration.style(), cellId, new Bounds(
                        decoration.x(), decoration.y(), decoration.width(), decoration.height()));
            }
        }

        for (RoutedEdge edge : placed.edges()) {
            String parent = edge.containerId() == null ? CANVAS_CELL_ID : cellIds.get(edge.containerId());
            cells.edge(edge, StyleHelper.edgeStyle(edge.flow().kind(), theme), parent,
                    cellIds.get(edge.flow().sourceRef()), cellIds.get(edge.flow().targetRef()));
        }

        log.debug("Generated {} cells ({} edges)", cells.count(), placed.edges().size());
        return toXml(doc);
    }

    public static void writeDrawioFile(String xml, Path outputFile) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionException("Failed to write draw.io file: " + outputFile, e);
        }
    }

    /**
     * Numbers as draw.io writes them: at most two decimals, no trailing zeros,
     * never a negative zero.
     */
    static String number(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        return rounded.signum() == 0 ? "0" : rounded.toPlainString();
    }

    /** Appends cells to the root and hands out sequential ids starting at 2. */
    private static final class CellWriter {
        private final Document doc;
        private final Element root;
        private int nextId = 2;

        CellWriter(Document doc, Element root) {
            this.doc = doc;
            this.root = root;
        }

        String vertex(String value, String style, String parent, Bounds geometry) {
            Element cell = cell(value, style, parent);
            cell.setAttribute("vertex", "1");

            Element geo = doc.createElement("mxGeometry");
            geo.setAttribute("x", number(geometry.x()));
            geo.setAttribute("y", number(geometry.y()));
            geo.setAttribute("width", number(geometry.width()));
            geo.setAttribute("height", number(geometry.height()));
            geo.setAttribute("as", "geometry");
            cell.appendChild(geo);
            return cell.getAttribute("id");
        }

        void edge(RoutedEdge edge, String style, String parent, String source, String target) {
            Element cell = cell(edge.flow().name(), style, parent);
            cell.setAttribute("edge", "1");
            cell.setAttribute("source", source);
            cell.setAttribute("target", target);

            Element geo = doc.createElement("mxGeometry");
            geo.setAttribute("relative", "1");
            geo.setAttribute("as", "geometry");
            geo.appendChild(point(edge.source(), "sourcePoint"));
            geo.appendChild(point(edge.target(), "targetPoint"));
            List<Point> waypoints = edge.waypoints();
            if (!waypoints.isEmpty()) {
                Element array = doc.createElement("Array");
                array.setAttribute("as", "points");
                for (Point waypoint : waypoints) {
                    array.appendChild(point(waypoint, null));
                }
                geo.appendChild(array);
            }
            cell.appendChild(geo);
        }

        int count() {
            return nextId - 2;
        }

        private Element cell(String value, String style, String parent) {
            Element cell = doc.createElement("mxCell");
            cell.setAttribute("id", String.valueOf(nextId++));
            cell.setAttribute("value", value == null ? "" : value);
            cell.setAttribute("style", style);
            cell.setAttribute("parent", parent);
            root.appendChild(cell);
            return cell;
        }

        private Element point(Point point, String as) {
            Element mxPoint = doc.createElement("mxPoint");
            mxPoint.setAttribute("x", number(point.x()));
            mxPoint.setAttribute("y", number(point.y()));
            if (as != null) {
                mxPoint.setAttribute("as", as);
            }
            return mxPoint;
        }
    }

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new ConversionException("Cannot create XML document", e);
        }
    }

    private static String toXml(Document doc) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new ConversionException("Failed to serialize draw.io document", e);
        }
    }
}
