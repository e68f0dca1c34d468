package org.bpmn2drawio.bpmn;

import org.bpmn2drawio.bpmn.models.ValidationWarning;
import org.bpmn2drawio.bpmn.models.WarningKind;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Schema conformance check backed by the Camunda BPMN model API. The
 * converter itself is lenient, so violations are reported, not thrown.
 */
public class BpmnValidator {
    private static final Logger log = LoggerFactory.getLogger(BpmnValidator.class);

    /**
     * Validates BPMN XML text against the BPMN 2.0 schema.
     * Throws {@link ModelException} if invalid.
     */
    public static void validate(String xml) {
        InputStream is = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(is);
        Bpmn.validateModel(modelInstance);  // throws exception if invalid
    }

    /**
     * Runs {@link #validate(String)} and turns a rejection into warnings.
     *
     * @return empty when the document conforms
     */
    public static List<ValidationWarning> checkSchema(String xml) {
        List<ValidationWarning> warnings = new ArrayList<>();
        try {
            validate(xml);
        } catch (ModelException e) {
            log.warn("BPMN schema check failed: {}", e.getMessage());
            warnings.add(new ValidationWarning(null, WarningKind.SCHEMA_VIOLATION, describe(e)));
        }
        return warnings;
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(String xml) {
        return checkSchema(xml).isEmpty();
    }

    // The interesting part is usually the innermost SAX message
    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
