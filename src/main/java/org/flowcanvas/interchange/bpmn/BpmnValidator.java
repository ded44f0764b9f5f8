package org.flowcanvas.interchange.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

/**
 * Schema and reference check of a BPMN document through the Camunda model API.
 */
public class BpmnValidator {

    /**
     * Validates a BPMN file from disk.
     * Throws an exception if invalid.
     */
    public static void validate(File bpmnFile) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
        Bpmn.validateModel(modelInstance);  // throws exception if invalid
    }

    /**
     * Validates BPMN text, e.g. the output of {@link BpmnEncoder}.
     */
    public static BpmnModelInstance validate(String xml) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        Bpmn.validateModel(modelInstance);
        return modelInstance;
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(String xml) {
        try {
            validate(xml);
            return true;
        } catch (Exception e) {
            return false;
        }
    }
}
