package org.bpmn2drawio;

import org.bpmn2drawio.bpmn.models.WarningKind;
import org.bpmn2drawio.layout.Direction;
import org.bpmn2drawio.layout.LayoutMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConverterTest {
    private static final Path LANES_BPMN = Path.of("src/test/resources/bpmn/lanes.bpmn");
    private static final Path ALL_KINDS_BPMN = Path.of("src/test/resources/bpmn/all_kinds.bpmn");
    private static final Path DANGLING_BPMN = Path.of("src/test/resources/bpmn/dangling_flow.bpmn");
    private static final Path WITH_DI_BPMN = Path.of("src/test/resources/bpmn/with_di.bpmn");
    private static final Path LANE_STYLES = Path.of("src/test/resources/themes/lane_styles.json");

    private static final String NS = "xmlns:bpmn=\"http://www.omg.org/spec/BPMN/20100524/MODEL\"";

    @Test
    void shouldConvertLanedProcess() throws IOException {
        ConversionResult result = new Converter().convert(Files.readString(LANES_BPMN));

        assertEquals(PipelineStage.SERIALIZED, result.stage());
        assertEquals(4, result.elementCount());
        assertEquals(3, result.flowCount());
        assertTrue(result.xml().contains("<mxfile"));
        assertTrue(result.xml().contains("name=\"Order Handling\""));
        assertEquals(1, result.warnings().size());
        assertEquals(WarningKind.INVALID_LANE_REFERENCE, result.warnings().get(0).kind());
    }

    @Test
    void shouldProduceIdenticalOutputForIdenticalInput() throws IOException {
        String bpmn = Files.readString(ALL_KINDS_BPMN);
        ConversionOptions options = ConversionOptions.builder().direction(Direction.TB).themeName("blueprint").build();

        String first = new Converter(options).convert(bpmn).xml();
        String second = new Converter(options).convert(bpmn).xml();

        assertEquals(first, second);
    }

    @Test
    void shouldDropDanglingFlowAndStillConvert() throws IOException {
        ConversionResult result = new Converter().convert(Files.readString(DANGLING_BPMN));

        assertEquals(PipelineStage.SERIALIZED, result.stage());
        assertEquals(2, result.flowCount());
        assertTrue(result.hasWarnings());
        assertEquals(1, result.warnings().stream().filter(w -> w.kind() == WarningKind.DANGLING_FLOW).count());
    }

    @Test
    void shouldAddSchemaWarningInStrictMode() throws IOException {
        String bpmn = Files.readString(ALL_KINDS_BPMN);

        ConversionResult lenient = new Converter().convert(bpmn);
        ConversionResult strict = new Converter(ConversionOptions.builder().strictSchema(true).build()).convert(bpmn);

        assertTrue(lenient.warnings().stream().noneMatch(w -> w.kind() == WarningKind.SCHEMA_VIOLATION));
        assertTrue(strict.warnings().stream().anyMatch(w -> w.kind() == WarningKind.SCHEMA_VIOLATION));
        assertEquals(lenient.xml(), strict.xml());
    }

    @Test
    void shouldKeepInputGeometryInPreserveMode() throws IOException {
        ConversionOptions options = ConversionOptions.builder().layoutMode(LayoutMode.PRESERVE).build();

        ConversionResult result = new Converter(options).convert(Files.readString(WITH_DI_BPMN));

        assertTrue(hasGeometry(result.xml(), "240", "80", "100", "80"), "task geometry should be kept");
        assertFalse(result.hasWarnings());
    }

    @Test
    void shouldApplyThemeOverride() throws IOException {
        ConversionOptions options = ConversionOptions.builder().themeOverridePath(LANE_STYLES).build();

        ConversionResult result = new Converter(options).convert(Files.readString(LANES_BPMN));

        assertTrue(result.xml().contains("fillColor=#ff0000;strokeColor=#00ff00;"));
        assertTrue(result.xml().contains("fontFamily=Arial;"));
    }

    @Test
    void shouldWriteOutputFile(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("out/lanes.drawio");

        ConversionResult result = new Converter().convertFile(LANES_BPMN, out);

        assertTrue(Files.exists(out));
        assertEquals(result.xml(), Files.readString(out));
    }

    @Test
    void shouldThrowWhenInputFileMissing(@TempDir Path dir) {
        assertThrows(MalformedInputException.class,
                () -> new Converter().convertFile(dir.resolve("missing.bpmn"), dir.resolve("out.drawio")));
    }

    @Test
    void shouldThrowWhenProcessIsEmpty() {
        String bpmn = "<bpmn:definitions " + NS + "><bpmn:process id=\"P\"/></bpmn:definitions>";

        assertThrows(EmptyProcessException.class, () -> new Converter().convert(bpmn));
    }

    @Test
    void shouldThrowWhenThemeUnknown() throws IOException {
        String bpmn = Files.readString(LANES_BPMN);
        Converter converter = new Converter(ConversionOptions.builder().themeName("neon").build());

        assertThrows(ThemeConfigurationException.class, () -> converter.convert(bpmn));
    }

    @Test
    void shouldRefuseToSkipStages() {
        assertEquals(PipelineStage.VALIDATED, PipelineStage.PARSED.advanceTo(PipelineStage.VALIDATED));
        assertThrows(IllegalStateException.class, () -> PipelineStage.PARSED.advanceTo(PipelineStage.LAID_OUT));
        assertThrows(IllegalStateException.class, () -> PipelineStage.STYLED.advanceTo(PipelineStage.VALIDATED));
    }

    @Test
    void shouldDefaultOptions() {
        ConversionOptions options = ConversionOptions.defaults();

        assertEquals("default", options.themeName());
        assertEquals(LayoutMode.AUTO, options.layoutMode());
        assertEquals(Direction.LR, options.direction());
        assertTrue(options.grid());
        assertFalse(options.strictSchema());
    }

    private static boolean hasGeometry(String xml, String x, String y, String width, String height) throws IOException {
        NodeList geometries;
        try {
            geometries = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                    .parse(new InputSource(new StringReader(xml))).getElementsByTagName("mxGeometry");
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException(e);
        }
        for (int i = 0; i < geometries.getLength(); i++) {
            Element geometry = (Element) geometries.item(i);
            if (x.equals(geometry.getAttribute("x")) && y.equals(geometry.getAttribute("y"))
                    && width.equals(geometry.getAttribute("width")) && height.equals(geometry.getAttribute("height"))) {
                return true;
            }
        }
        return false;
    }
}
