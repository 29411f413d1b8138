package org.pragmatica.mutagen.error;

import org.pragmatica.mutagen.source.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rich diagnostic message for Rust-style reporting of grammar errors.
 *
 * <p>Example output:
 * <pre>
 * error: undefined rule '-nme-'
 *   --> gorey.mut:3:10
 *    |
 *  3 | -greeting- = hello -nme-
 *    |                    ^^^^^ not defined in this grammar
 *    |
 *    = help: define it with: -nme- = ...
 * </pre>
 *
 * @param severity severity level
 * @param message  primary message
 * @param span     source span where the problem was found
 * @param labels   underline messages attached to the span
 * @param notes    additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String message,
    SourceSpan span,
    List<String> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(label);
        return new Diagnostic(severity, message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending source line and a caret underline.
     *
     * @param source   the grammar text
     * @param filename optional file name for display, may be null
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var loc = span.start();

        sb.append(severity.display())
          .append(": ")
          .append(message)
          .append("\n");
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename)
              .append(":");
        }
        sb.append(loc.line())
          .append(":")
          .append(loc.column())
          .append("\n");

        int gutterWidth = String.valueOf(loc.line())
                                .length();
        var gutter = " ".repeat(gutterWidth + 1);
        sb.append(gutter)
          .append("|\n");

        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineContent = lines[loc.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(underline(lineContent))
              .append("\n");
        }
        sb.append(gutter)
          .append("|\n");

        for (var note : notes) {
            sb.append(gutter)
              .append("= ")
              .append(note)
              .append("\n");
        }
        return sb.toString();
    }

    private String underline(String lineContent) {
        int startCol = span.start()
                           .column();
        int endCol = span.end()
                         .line() == span.start()
                                        .line()
                     ? span.end()
                           .column()
                     : lineContent.length() + 1;
        var sb = new StringBuilder();
        sb.append(" ".repeat(Math.max(0, startCol - 1)));
        sb.append("^".repeat(Math.max(1, endCol - startCol)));
        if (!labels.isEmpty()) {
            sb.append(" ")
              .append(String.join("; ", labels));
        }
        return sb.toString();
    }

    /**
     * Single-line format for logs.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("%d:%d: %s: %s", loc.line(), loc.column(), severity.display(), message);
    }
}
