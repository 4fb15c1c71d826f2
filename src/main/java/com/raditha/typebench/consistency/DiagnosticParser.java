package com.raditha.typebench.consistency;

import com.raditha.typebench.model.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses checker output in the {@code file:line[:column]: severity: message [code]} layout.
 * Lines that do not follow it (summaries, notes without a location, tracebacks) are ignored,
 * as are lines whose line or column number does not fit an {@code int}.
 */
public class DiagnosticParser {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticParser.class);

    private static final Pattern LINE = Pattern.compile(
            "^(?<file>.+?):(?<line>\\d+):(?:(?<column>\\d+):)?\\s*(?<severity>error|warning|note):\\s*"
                    + "(?<message>.*?)(?:\\s+\\[(?<code>[A-Za-z0-9_-]+)])?\\s*$");

    public List<Diagnostic> parse(String output) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String line : output.split("\\R")) {
            Matcher m = LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            String column = m.group("column");
            String code = m.group("code");
            int lineNumber;
            int columnNumber;
            try {
                lineNumber = Integer.parseInt(m.group("line"));
                columnNumber = column == null ? 0 : Integer.parseInt(column);
            } catch (NumberFormatException e) {
                logger.debug("Skipping diagnostic with an out-of-range location: {}", line);
                continue;
            }
            diagnostics.add(new Diagnostic(
                    m.group("file").strip(),
                    lineNumber,
                    columnNumber,
                    m.group("severity"),
                    m.group("message"),
                    code == null ? Diagnostic.UNKNOWN_CODE : code));
        }
        return diagnostics;
    }
}
