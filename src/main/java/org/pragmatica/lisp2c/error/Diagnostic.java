package org.pragmatica.lisp2c.error;

import org.pragmatica.lisp2c.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Compile error rendered Rust-style against the source it was found in.
 *
 * <p>Example output:
 * <pre>
 * error[E0004]: unexpected end of input
 *   --> input:1:17
 *   |
 * 1 | (add 2 (sub 4 2)
 *   | -               ^ expected ')'
 *   | call opened here
 *   |
 * </pre>
 *
 * @param code    Error code, e.g. "E0001"
 * @param message Primary error message
 * @param span    Source span where the error was detected
 * @param labels  Labeled spans shown under the source line
 * @param notes   Trailing notes and help suggestions
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    /**
     * A labeled span. Primary labels are underlined with {@code ^}, secondary ones with {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(code, message, span, List.of(), List.of());
    }

    /**
     * Add a primary label at this diagnostic's span.
     */
    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(code, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, message));
        return new Diagnostic(code, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the affected source lines.
     *
     * @param source   The source text the error was found in
     * @param filename Name to show in the location line, {@code null} for "input"
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error[").append(code).append("]: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ")
          .append(filename == null ? "input" : filename)
          .append(":").append(loc.line())
          .append(":").append(loc.column())
          .append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        for (var label : labels) {
            minLine = Math.min(minLine, label.span().start().line());
            maxLine = Math.max(maxLine, label.span().end().line());
        }
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ").append(lineContent).append("\n");

            var lineLabels = labelsOnLine(lineNum);
            for (var row : underlines(lineNum, lineContent, lineLabels)) {
                sb.append(" ".repeat(gutterWidth)).append(" | ").append(row).append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form, e.g. {@code input:1:8: error[E0001]: unrecognized character '#'}.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("input:%d:%d: error[%s]: %s", loc.line(), loc.column(), code, message);
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && covers(span, lineNum)) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (covers(label.span(), lineNum)) {
                result.add(label);
            }
        }
        return result;
    }

    private static boolean covers(SourceSpan span, int lineNum) {
        return span.start().line() <= lineNum && span.end().line() >= lineNum;
    }

    /**
     * Underline row for all labels on the line, carrying the rightmost label's message,
     * followed by one row per remaining labeled message.
     */
    private static List<String> underlines(int lineNum, String lineContent, List<Label> lineLabels) {
        if (lineLabels.isEmpty()) {
            return List.of();
        }
        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                               .toList();
        var marks = new StringBuilder();
        var extraRows = new ArrayList<String>();
        int currentCol = 1;

        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                         ? label.span().end().column()
                         : lineContent.length() + 1;
            int from = Math.max(startCol, currentCol);
            int underlineLen = Math.max(1, endCol - from);

            marks.append(" ".repeat(from - currentCol))
                 .append(String.valueOf(label.primary() ? '^' : '-').repeat(underlineLen));
            currentCol = from + underlineLen;

            if (!label.message().isEmpty() && label != sorted.get(sorted.size() - 1)) {
                extraRows.add(" ".repeat(startCol - 1) + label.message());
            }
        }
        var last = sorted.get(sorted.size() - 1);
        if (!last.message().isEmpty()) {
            marks.append(" ").append(last.message());
        }

        var rows = new ArrayList<String>();
        rows.add(marks.toString());
        rows.addAll(extraRows);
        return rows;
    }
}
