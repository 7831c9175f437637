package ai.prettylayout.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Imperative construction of a {@link Document}, in the style a syntax-tree visitor emits it: open a box,
 * write words and breaks, close the box.
 *
 * <pre>{@code
 * DocumentBuilder b = new DocumentBuilder();
 * b.word("call(");
 * b.cbox();
 * b.zerobreak();
 * for (...) { b.word(arg); b.trailingComma(isLast); }
 * b.offset(-b.indentUnit());
 * b.end();
 * b.word(")");
 * }</pre>
 */
public class DocumentBuilder {

    private static final int DEFAULT_INDENT_UNIT = 4;

    private final int indentUnit;
    private final Deque<Frame> open = new ArrayDeque<>();
    private Frame root = new Frame(null, 0, 0);

    public DocumentBuilder() {
        this(DEFAULT_INDENT_UNIT);
    }

    public DocumentBuilder(int indentUnit) {
        if (indentUnit < 0) {
            throw new IllegalArgumentException("indentUnit must be zero or greater");
        }
        this.indentUnit = indentUnit;
        open.push(root);
    }

    public int indentUnit() {
        return indentUnit;
    }

    public DocumentBuilder word(String value) {
        return append(new Text(value));
    }

    public DocumentBuilder nbsp() {
        return word(" ");
    }

    public DocumentBuilder space() {
        return append(Docs.space());
    }

    public DocumentBuilder zerobreak() {
        return append(Docs.zeroBreak());
    }

    public DocumentBuilder hardbreak() {
        return append(Docs.hardBreak());
    }

    public DocumentBuilder blankbreak() {
        return append(Docs.blankBreak());
    }

    public DocumentBuilder spaceIfNonempty() {
        return append(Docs.spaceIfNonempty());
    }

    public DocumentBuilder hardbreakIfNonempty() {
        return append(Docs.hardBreakIfNonempty());
    }

    /**
     * Separator after a list element: {@code ", "} (breakable) between elements, and after the last one a
     * comma that only shows up when the list is laid out vertically.
     */
    public DocumentBuilder trailingComma(boolean isLast) {
        if (isLast) {
            return append(Docs.trailingComma(0));
        }
        word(",");
        return space();
    }

    /**
     * Like {@link #trailingComma(boolean)}, but the last element is followed by a space when flat.
     */
    public DocumentBuilder trailingCommaOrSpace(boolean isLast) {
        if (isLast) {
            return append(new Break(BreakKind.SPACE, 0, ",", false));
        }
        word(",");
        return space();
    }

    public DocumentBuilder append(Doc node) {
        current().children.add(node);
        return this;
    }

    /**
     * Opens a consistent box indented by one indent unit when broken.
     */
    public DocumentBuilder cbox() {
        return cbox(indentUnit);
    }

    public DocumentBuilder cbox(int offset) {
        open.push(new Frame(Breaks.CONSISTENT, offset, 0));
        return this;
    }

    /**
     * Opens an inconsistent box indented by one indent unit when broken.
     */
    public DocumentBuilder ibox() {
        return ibox(indentUnit);
    }

    public DocumentBuilder ibox(int offset) {
        open.push(new Frame(Breaks.INCONSISTENT, offset, 0));
        return this;
    }

    /**
     * Opens an indentation scope; closed by {@link #end()} like a box.
     */
    public DocumentBuilder indent(int levels) {
        open.push(new Frame(null, 0, levels));
        return this;
    }

    public DocumentBuilder end() {
        if (open.size() == 1) {
            throw new MalformedDocumentException("end() called without an open box or indent scope");
        }
        Frame frame = open.pop();
        current().children.add(frame.toDoc());
        return this;
    }

    /**
     * Adds {@code delta} to the offset of the most recently written break. Right after a box was opened
     * there is nothing to adjust and the call has no effect.
     */
    public DocumentBuilder offset(int delta) {
        List<Doc> children = current().children;
        if (children.isEmpty()) {
            return this;
        }
        int last = children.size() - 1;
        if (!(children.get(last) instanceof Break lastBreak)) {
            throw new MalformedDocumentException("offset() must follow a break, found " + children.get(last));
        }
        int adjusted;
        try {
            adjusted = Math.addExact(lastBreak.offset(), delta);
        } catch (ArithmeticException ex) {
            throw new MalformedDocumentException(
                    "Break offset overflows adding " + delta + " to " + lastBreak.offset(), ex);
        }
        children.set(last, lastBreak.withOffset(adjusted));
        return this;
    }

    public Document build() {
        if (open.size() != 1) {
            throw new MalformedDocumentException((open.size() - 1) + " box(es) left open");
        }
        Document document = new Document(root.children);
        root = new Frame(null, 0, 0);
        open.clear();
        open.push(root);
        return document;
    }

    private Frame current() {
        return open.peek();
    }

    private static final class Frame {
        private final Breaks breaks;
        private final int offset;
        private final int levels;
        private final List<Doc> children = new ArrayList<>();

        private Frame(Breaks breaks, int offset, int levels) {
            this.breaks = breaks;
            this.offset = offset;
            this.levels = levels;
        }

        private Doc toDoc() {
            if (breaks == null) {
                return new IndentScope(levels, children);
            }
            return new Group(breaks, offset, children);
        }
    }
}
