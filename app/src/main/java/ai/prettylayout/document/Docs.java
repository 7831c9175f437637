package ai.prettylayout.document;

import java.util.Arrays;

/**
 * Static factories for building documents by composition.
 */
public final class Docs {

    private Docs() {
    }

    public static Text text(String value) {
        return new Text(value);
    }

    public static Break space() {
        return space(0);
    }

    public static Break space(int offset) {
        return new Break(BreakKind.SPACE, offset);
    }

    public static Break zeroBreak() {
        return zeroBreak(0);
    }

    public static Break zeroBreak(int offset) {
        return new Break(BreakKind.NONE_IF_FLAT, offset);
    }

    public static Break hardBreak() {
        return new Break(BreakKind.HARD, 0);
    }

    public static Break hardBreak(int offset) {
        return new Break(BreakKind.HARD, offset);
    }

    public static Break blankBreak() {
        return new Break(BreakKind.BLANK, 0);
    }

    public static Break blankBreak(int offset) {
        return new Break(BreakKind.BLANK, offset);
    }

    /**
     * Break that renders as nothing when flat and leaves a trailing comma behind when taken.
     */
    public static Break trailingComma(int offset) {
        return new Break(BreakKind.NONE_IF_FLAT, offset, ",", false);
    }

    public static Break spaceIfNonempty() {
        return new Break(BreakKind.SPACE, 0, "", true);
    }

    public static Break hardBreakIfNonempty() {
        return new Break(BreakKind.HARD, 0, "", true);
    }

    public static Group cbox(int offset, Doc... children) {
        return new Group(Breaks.CONSISTENT, offset, Arrays.asList(children));
    }

    public static Group ibox(int offset, Doc... children) {
        return new Group(Breaks.INCONSISTENT, offset, Arrays.asList(children));
    }

    public static Group group(Breaks breaks, Doc... children) {
        return new Group(breaks, 0, Arrays.asList(children));
    }

    public static IndentScope indent(int levels, Doc... body) {
        return new IndentScope(levels, Arrays.asList(body));
    }

    public static Document document(Doc... nodes) {
        return Document.of(nodes);
    }
}
