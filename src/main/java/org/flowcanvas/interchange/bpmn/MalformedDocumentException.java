package org.flowcanvas.interchange.bpmn;

/**
 * The input is not well-formed XML. Carries the parser's diagnostic and, when known,
 * the position of the fault.
 */
public class MalformedDocumentException extends BpmnCodecException {
    private final int lineNumber;
    private final int columnNumber;
    private final String diagnostic;

    public MalformedDocumentException(String diagnostic, int lineNumber, int columnNumber, Throwable cause) {
        super(formatMessage(diagnostic, lineNumber, columnNumber), cause);
        this.diagnostic = diagnostic;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    private static String formatMessage(String diagnostic, int lineNumber, int columnNumber) {
        if (lineNumber < 0) {
            return "Invalid XML format: " + diagnostic;
        }
        return String.format("Invalid XML format at line %d, column %d: %s", lineNumber, columnNumber, diagnostic);
    }

    /**
     * @return the line of the fault, or -1 when the parser did not report one
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
