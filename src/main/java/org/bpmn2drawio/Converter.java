package org.bpmn2drawio;

import org.bpmn2drawio.bpmn.BpmnHelper;
import org.bpmn2drawio.bpmn.BpmnValidator;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.bpmn2drawio.drawio.DrawioGenerator;
import org.bpmn2drawio.layout.LayoutEngine;
import org.bpmn2drawio.theme.ThemeHelper;
import org.bpmn2drawio.theme.models.Theme;
import org.bpmn2drawio.transform.CoordinateTransformer;
import org.bpmn2drawio.transform.PlacedModel;
import org.bpmn2drawio.validation.ModelValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs a BPMN document through parse, validation, layout, theming,
 * coordinate transform and serialization.
 *
 * <p>Every call builds its own model and theme, so one instance can be used
 * from several threads.</p>
 */
public class Converter {
    private static final Logger log = LoggerFactory.getLogger(Converter.class);

    private final ConversionOptions options;

    public Converter() {
        this(ConversionOptions.defaults());
    }

    public Converter(ConversionOptions options) {
        this.options = options;
    }

    /**
     * Converts BPMN XML text to draw.io XML text.
     *
     * @throws MalformedInputException     if the input is not usable BPMN
     * @throws EmptyProcessException       if the input has no elements to draw
     * @throws ThemeConfigurationException if the theme cannot be resolved
     */
    public ConversionResult convert(String bpmnXml) {
        ProcessModel model = BpmnHelper.parseBpmnString(bpmnXml);
        PipelineStage stage = PipelineStage.PARSED;
        if (options.strictSchema()) {
            model.getWarnings().addAll(BpmnValidator.checkSchema(bpmnXml));
        }

        ModelValidator.validate(model);
        stage = stage.advanceTo(PipelineStage.VALIDATED);

        LayoutEngine.layout(model, options.layoutMode(), options.direction(), options.pageSize());
        stage = stage.advanceTo(PipelineStage.LAID_OUT);

        Theme theme = ThemeHelper.resolve(options.themeName(), options.themeOverridePath());
        stage = stage.advanceTo(PipelineStage.STYLED);

        PlacedModel placed = CoordinateTransformer.transform(model);
        stage = stage.advanceTo(PipelineStage.TRANSFORMED);

        String xml = DrawioGenerator.generate(placed, theme, model.getName(), options.pageSize(), options.grid());
        stage = stage.advanceTo(PipelineStage.SERIALIZED);

        log.info("Converted {} elements and {} flows with {} warning(s)",
                placed.elements().size(), placed.edges().size(), model.getWarnings().size());
        return new ConversionResult(xml, placed.elements().size(), placed.edges().size(), model.getWarnings(), stage);
    }

    /**
     * Converts a BPMN file and writes the draw.io document.
     *
     * @throws MalformedInputException if the input file cannot be read
     * @throws ConversionException     if the output file cannot be written
     */
    public ConversionResult convertFile(Path inputFile, Path outputFile) {
        String bpmnXml;
        try {
            bpmnXml = Files.readString(inputFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedInputException("Cannot read BPMN file: " + inputFile, e);
        }
        ConversionResult result = convert(bpmnXml);
        DrawioGenerator.writeDrawioFile(result.xml(), outputFile);
        log.debug("Wrote {}", outputFile);
        return result;
    }
}
