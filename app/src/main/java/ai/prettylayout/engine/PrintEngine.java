package ai.prettylayout.engine;

import ai.prettylayout.document.Breaks;
import ai.prettylayout.document.MalformedDocumentException;
import ai.prettylayout.token.BeginToken;
import ai.prettylayout.token.BreakToken;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Output side of a print job. Receives tokens whose sizes are known, decides break versus flat for each
 * break and appends the result. Output is append-only; indentation is held back until text follows it so
 * that no line ends in whitespace.
 */
final class PrintEngine {

    private static final PrintFrame OUTER = PrintFrame.broken(0, Breaks.INCONSISTENT);

    private final StringBuilder out = new StringBuilder();
    private final LineWidthPolicy margin;
    private final boolean debugMarkers;
    private final Deque<PrintFrame> printStack = new ArrayDeque<>();
    private final Deque<Integer> scopes = new ArrayDeque<>();
    private int indent;
    private int scopeIndent;
    private int pendingIndentation;
    private int trailingNewlines;

    PrintEngine(LineWidthPolicy margin, boolean debugMarkers) {
        this.margin = margin;
        this.debugMarkers = debugMarkers;
    }

    void printBegin(BeginToken token, long size) {
        if (debugMarkers) {
            out.append(token.breaks() == Breaks.CONSISTENT ? '«' : '‹');
        }
        if (size > margin.remaining()) {
            printStack.push(PrintFrame.broken(indent, token.breaks()));
            indent = addIndent(indent, token.offset());
        } else {
            printStack.push(PrintFrame.fits(token.breaks()));
        }
    }

    void printEnd() {
        PrintFrame frame = printStack.poll();
        if (frame == null) {
            throw new MalformedDocumentException("Group end without a matching group begin");
        }
        if (frame.broken()) {
            indent = frame.savedIndent();
        }
        if (debugMarkers) {
            out.append(frame.breaks() == Breaks.CONSISTENT ? '»' : '›');
        }
    }

    void printBreak(BreakToken token, long size) {
        if (fits(token, size)) {
            pendingIndentation += token.blankSpace();
            margin.consume(token.blankSpace());
            if (debugMarkers) {
                out.append('·');
            }
            return;
        }
        if (!token.preBreak().isEmpty()) {
            out.append(" ".repeat(pendingIndentation));
            pendingIndentation = 0;
            out.append(token.preBreak());
            margin.consume(token.preBreakWidth());
            trailingNewlines = 0;
        }
        if (debugMarkers) {
            out.append('·');
        }
        if (token.blankLine()) {
            if (out.length() > 0) {
                while (trailingNewlines < 2) {
                    newline();
                }
            }
        } else {
            newline();
        }
        int lineIndent = lineIndentation(token.offset());
        pendingIndentation = lineIndent;
        margin.startLine(lineIndent);
    }

    void printString(String text, int width) {
        if (text.isEmpty()) {
            return;
        }
        out.append(" ".repeat(pendingIndentation));
        pendingIndentation = 0;
        out.append(text);
        margin.consume(width);
        trailingNewlines = 0;
    }

    void printIndent(int columns) {
        scopes.push(columns);
        scopeIndent = addIndent(scopeIndent, columns);
    }

    void printDedent() {
        Integer columns = scopes.poll();
        if (columns == null) {
            throw new MalformedDocumentException("Indent scope end without a matching indent scope");
        }
        scopeIndent -= columns;
    }

    String finish() {
        if (!printStack.isEmpty()) {
            throw new MalformedDocumentException(printStack.size() + " group(s) still open at end of input");
        }
        if (!scopes.isEmpty()) {
            throw new MalformedDocumentException(scopes.size() + " indent scope(s) still open at end of input");
        }
        return out.toString();
    }

    private boolean fits(BreakToken token, long size) {
        if (token.hard()) {
            return false;
        }
        PrintFrame top = printStack.isEmpty() ? OUTER : printStack.peek();
        if (!top.broken()) {
            return true;
        }
        if (top.breaks() == Breaks.CONSISTENT) {
            return false;
        }
        return size <= margin.remaining();
    }

    private void newline() {
        out.append('\n');
        trailingNewlines++;
    }

    private int lineIndentation(int breakOffset) {
        long total = (long) indent + scopeIndent + breakOffset;
        if (total > Integer.MAX_VALUE) {
            throw new MalformedDocumentException("Indentation overflows: " + total);
        }
        return (int) Math.max(0, total);
    }

    private static int addIndent(int current, int delta) {
        try {
            return Math.addExact(current, delta);
        } catch (ArithmeticException ex) {
            throw new MalformedDocumentException("Indentation overflows adding " + delta + " to " + current, ex);
        }
    }
}
