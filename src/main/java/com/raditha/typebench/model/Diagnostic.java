package com.raditha.typebench.model;

/**
 * One message reported by the external type checker.
 *
 * @param file     path as printed by the checker
 * @param line     1-based line
 * @param column   1-based column, 0 when the checker did not report one
 * @param severity {@code error}, {@code warning} or {@code note}
 * @param message  message text without the trailing code
 * @param code     error code, {@code unknown} when absent
 */
public record Diagnostic(String file, int line, int column, String severity, String message, String code) {

    public static final String UNKNOWN_CODE = "unknown";

    public boolean isError() {
        return "error".equals(severity);
    }

    /**
     * Render in the checker's own {@code file:line: severity: message [code]} layout.
     */
    public String render() {
        String location = column > 0 ? file + ":" + line + ":" + column : file + ":" + line;
        return location + ": " + severity + ": " + message + " [" + code + "]";
    }
}
