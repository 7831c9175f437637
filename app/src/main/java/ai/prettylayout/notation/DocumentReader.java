package ai.prettylayout.notation;

import ai.prettylayout.document.Break;
import ai.prettylayout.document.BreakKind;
import ai.prettylayout.document.Breaks;
import ai.prettylayout.document.Doc;
import ai.prettylayout.document.Document;
import ai.prettylayout.document.Group;
import ai.prettylayout.document.IndentScope;
import ai.prettylayout.document.Text;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads documents written in a small S-expression notation:
 *
 * <pre>
 * ; comment
 * "text"
 * space | zerobreak | hardbreak | blankbreak | nbsp
 * (space N) (zerobreak N) (hardbreak N) (blankbreak N)
 * (break KIND [N] [pre "TEXT"] [if-nonempty])      KIND is space, zero, hard or blank
 * (cbox [N] ...) (ibox [N] ...)                      N is the group offset
 * (indent [L] ...)                                   L indent levels, default 1
 * </pre>
 */
public class DocumentReader {

    public Document read(String source) {
        Objects.requireNonNull(source, "source");
        Cursor cursor = new Cursor(source);
        List<Doc> nodes = new ArrayList<>();
        cursor.skipTrivia();
        while (!cursor.atEnd()) {
            nodes.add(readNode(cursor));
            cursor.skipTrivia();
        }
        return new Document(nodes);
    }

    private Doc readNode(Cursor cursor) {
        char ch = cursor.peek();
        if (ch == '"') {
            return new Text(readString(cursor));
        }
        if (ch == '(') {
            return readForm(cursor);
        }
        if (ch == ')') {
            throw cursor.error("Unexpected ')'");
        }
        int line = cursor.line;
        int column = cursor.column;
        String symbol = readSymbol(cursor);
        return switch (symbol) {
            case "space" -> new Break(BreakKind.SPACE, 0);
            case "zerobreak" -> new Break(BreakKind.NONE_IF_FLAT, 0);
            case "hardbreak" -> new Break(BreakKind.HARD, 0);
            case "blankbreak" -> new Break(BreakKind.BLANK, 0);
            case "nbsp" -> new Text(" ");
            default -> throw new NotationException("Unknown symbol '" + symbol + "'", line, column);
        };
    }

    private Doc readForm(Cursor cursor) {
        cursor.expect('(');
        cursor.skipTrivia();
        int line = cursor.line;
        int column = cursor.column;
        String head = readSymbol(cursor);
        Doc node = switch (head) {
            case "space" -> new Break(BreakKind.SPACE, optionalInt(cursor, 0));
            case "zerobreak" -> new Break(BreakKind.NONE_IF_FLAT, optionalInt(cursor, 0));
            case "hardbreak" -> new Break(BreakKind.HARD, optionalInt(cursor, 0));
            case "blankbreak" -> new Break(BreakKind.BLANK, optionalInt(cursor, 0));
            case "break" -> readBreak(cursor);
            case "cbox" -> new Group(Breaks.CONSISTENT, optionalInt(cursor, 0), readChildren(cursor));
            case "ibox" -> new Group(Breaks.INCONSISTENT, optionalInt(cursor, 0), readChildren(cursor));
            case "indent" -> new IndentScope(optionalInt(cursor, 1), readChildren(cursor));
            default -> throw new NotationException("Unknown form '" + head + "'", line, column);
        };
        cursor.skipTrivia();
        cursor.expect(')');
        return node;
    }

    private Break readBreak(Cursor cursor) {
        cursor.skipTrivia();
        int line = cursor.line;
        int column = cursor.column;
        BreakKind kind;
        try {
            kind = BreakKind.from(readSymbol(cursor));
        } catch (IllegalArgumentException ex) {
            throw new NotationException(ex.getMessage(), line, column);
        }
        int offset = optionalInt(cursor, 0);
        String preBreak = "";
        boolean ifNonempty = false;
        cursor.skipTrivia();
        while (!cursor.atEnd() && cursor.peek() != ')') {
            line = cursor.line;
            column = cursor.column;
            String option = readSymbol(cursor);
            switch (option) {
                case "pre" -> {
                    cursor.skipTrivia();
                    preBreak = readString(cursor);
                }
                case "if-nonempty" -> ifNonempty = true;
                default -> throw new NotationException("Unknown break option '" + option + "'", line, column);
            }
            cursor.skipTrivia();
        }
        return new Break(kind, offset, preBreak, ifNonempty);
    }

    private List<Doc> readChildren(Cursor cursor) {
        List<Doc> children = new ArrayList<>();
        cursor.skipTrivia();
        while (!cursor.atEnd() && cursor.peek() != ')') {
            children.add(readNode(cursor));
            cursor.skipTrivia();
        }
        return children;
    }

    private int optionalInt(Cursor cursor, int defaultValue) {
        cursor.skipTrivia();
        if (cursor.atEnd()) {
            return defaultValue;
        }
        char ch = cursor.peek();
        if (ch != '-' && ch != '+' && !Character.isDigit(ch)) {
            return defaultValue;
        }
        int line = cursor.line;
        int column = cursor.column;
        String digits = readSymbol(cursor);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw new NotationException("Invalid integer '" + digits + "'", line, column);
        }
    }

    private String readSymbol(Cursor cursor) {
        if (cursor.atEnd()) {
            throw cursor.error("Unexpected end of input");
        }
        StringBuilder symbol = new StringBuilder();
        while (!cursor.atEnd()) {
            char ch = cursor.peek();
            if (Character.isWhitespace(ch) || ch == '(' || ch == ')' || ch == '"' || ch == ';') {
                break;
            }
            symbol.append(cursor.next());
        }
        if (symbol.length() == 0) {
            throw cursor.error("Expected a symbol");
        }
        return symbol.toString();
    }

    private String readString(Cursor cursor) {
        int line = cursor.line;
        int column = cursor.column;
        cursor.expect('"');
        StringBuilder value = new StringBuilder();
        while (true) {
            if (cursor.atEnd()) {
                throw new NotationException("Unterminated string", line, column);
            }
            char ch = cursor.next();
            if (ch == '"') {
                return value.toString();
            }
            if (ch == '\n' || ch == '\r') {
                throw new NotationException("Line break inside string", line, column);
            }
            if (ch == '\\') {
                if (cursor.atEnd()) {
                    throw new NotationException("Unterminated string", line, column);
                }
                char escaped = cursor.next();
                switch (escaped) {
                    case '"', '\\' -> value.append(escaped);
                    case 't' -> value.append('\t');
                    default -> throw cursor.error("Unsupported escape '\\" + escaped + "'");
                }
            } else {
                value.append(ch);
            }
        }
    }

    private static final class Cursor {
        private final String source;
        private int position;
        private int line = 1;
        private int column = 1;

        private Cursor(String source) {
            this.source = source;
        }

        private boolean atEnd() {
            return position >= source.length();
        }

        private char peek() {
            return source.charAt(position);
        }

        private char next() {
            char ch = source.charAt(position++);
            if (ch == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return ch;
        }

        private void expect(char expected) {
            if (atEnd() || peek() != expected) {
                throw error("Expected '" + expected + "'");
            }
            next();
        }

        private void skipTrivia() {
            while (!atEnd()) {
                char ch = peek();
                if (ch == ';') {
                    while (!atEnd() && peek() != '\n') {
                        next();
                    }
                } else if (Character.isWhitespace(ch)) {
                    next();
                } else {
                    return;
                }
            }
        }

        private NotationException error(String message) {
            return new NotationException(message, line, column);
        }
    }
}
