package ai.prettylayout.token;

import ai.prettylayout.document.Break;
import ai.prettylayout.document.BreakKind;
import ai.prettylayout.document.Doc;
import ai.prettylayout.document.Document;
import ai.prettylayout.document.Group;
import ai.prettylayout.document.IndentScope;
import ai.prettylayout.document.MalformedDocumentException;
import ai.prettylayout.document.Text;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Flattens a document tree into its token stream. The walk uses an explicit stack so arbitrarily deep
 * documents do not exhaust the thread stack.
 */
public class TokenLowering {

    private final int indentUnit;

    public TokenLowering(int indentUnit) {
        if (indentUnit < 0) {
            throw new IllegalArgumentException("indentUnit must be zero or greater");
        }
        this.indentUnit = indentUnit;
    }

    public List<Token> lower(Document document) {
        List<Token> tokens = new ArrayList<>();
        lower(document, tokens::add);
        return tokens;
    }

    public void lower(Document document, TokenSink sink) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(sink, "sink");
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(document.nodes().iterator(), null));
        while (!stack.isEmpty()) {
            Pending top = stack.peek();
            if (!top.children.hasNext()) {
                stack.pop();
                if (top.closing != null) {
                    sink.accept(top.closing);
                }
                continue;
            }
            Doc node = top.children.next();
            if (node instanceof Text text) {
                sink.accept(new StringToken(text.value()));
            } else if (node instanceof Break brk) {
                sink.accept(toToken(brk));
            } else if (node instanceof Group group) {
                sink.accept(new BeginToken(group.offset(), group.breaks()));
                stack.push(new Pending(group.children().iterator(), EndToken.INSTANCE));
            } else if (node instanceof IndentScope scope) {
                sink.accept(new IndentToken(columns(scope)));
                stack.push(new Pending(scope.body().iterator(), DedentToken.INSTANCE));
            } else {
                throw new MalformedDocumentException("Unsupported document node: " + node);
            }
        }
    }

    static BreakToken toToken(Break brk) {
        return new BreakToken(brk.offset(),
                brk.kind().flatWidth(),
                brk.preBreak(),
                brk.ifNonempty(),
                brk.kind() == BreakKind.BLANK,
                brk.isHard());
    }

    private int columns(IndentScope scope) {
        try {
            return Math.multiplyExact(scope.levels(), indentUnit);
        } catch (ArithmeticException ex) {
            throw new MalformedDocumentException("Indent scope of " + scope.levels() + " levels overflows", ex);
        }
    }

    private static final class Pending {
        private final Iterator<Doc> children;
        private final Token closing;

        private Pending(Iterator<Doc> children, Token closing) {
            this.children = children;
            this.closing = closing;
        }
    }
}
