package org.flowcanvas.interchange.bpmn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Namespace URIs of BPMN 2.0 and of the diagram colour extensions, with the prefixes the
 * encoder writes them under.
 */
public final class BpmnNamespaces {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String BIOC_NS = "http://bpmn.io/schema/bpmn/biocolor/1.0";
    public static final String COLOR_NS = "http://www.omg.org/spec/BPMN/non-normative/color/1.0";
    public static final String CAMUNDA_NS = "http://camunda.org/schema/1.0/bpmn";

    public static final String BPMN_PREFIX = "bpmn";
    public static final String BPMNDI_PREFIX = "bpmndi";
    public static final String DC_PREFIX = "dc";
    public static final String DI_PREFIX = "di";
    public static final String BIOC_PREFIX = "bioc";
    public static final String COLOR_PREFIX = "color";

    /**
     * Declarations every encoded document carries on its root.
     */
    public static final Map<String, String> STANDARD_DECLARATIONS;

    static {
        Map<String, String> declarations = new LinkedHashMap<>();
        declarations.put(BPMN_PREFIX, BPMN_NS);
        declarations.put(BPMNDI_PREFIX, BPMNDI_NS);
        declarations.put(DC_PREFIX, DC_NS);
        declarations.put(DI_PREFIX, DI_NS);
        declarations.put("xsi", XSI_NS);
        declarations.put(BIOC_PREFIX, BIOC_NS);
        declarations.put(COLOR_PREFIX, COLOR_NS);
        declarations.put("camunda", CAMUNDA_NS);
        STANDARD_DECLARATIONS = Collections.unmodifiableMap(declarations);
    }

    private BpmnNamespaces() {
    }
}
