package ai.prettylayout.engine;

import ai.prettylayout.document.MalformedDocumentException;
import ai.prettylayout.token.BeginToken;
import ai.prettylayout.token.BreakToken;
import ai.prettylayout.token.DedentToken;
import ai.prettylayout.token.EndToken;
import ai.prettylayout.token.IndentToken;
import ai.prettylayout.token.StringToken;
import ai.prettylayout.token.Token;
import ai.prettylayout.token.TokenSink;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Single-pass layout of a token stream.
 *
 * <p>Tokens enter a ring buffer with a provisional size. Begin and break tokens start with a negative size
 * (minus the running total at the point they were scanned) and are tracked on the scan stack until the
 * token that closes their extent arrives; adding the running total at that point yields their flat width.
 * Whenever the buffered content is wider than the space left on the line, the oldest pending entry cannot
 * fit whatever follows, so it is given {@link Token#SIZE_INFINITY} and printed. The buffer therefore never
 * holds more than a line's worth of text plus the zero-width tokens of the enclosing groups.
 *
 * <p>One instance serves exactly one print job and is not thread-safe.
 */
public final class ScanEngine implements TokenSink {

    private final LineWidthPolicy margin;
    private final PrintEngine printer;
    private final RingBuffer<BufEntry> buffer = new RingBuffer<>();
    private final Deque<Long> scanStack = new ArrayDeque<>();
    // Width of everything scanned up to the oldest buffered entry, and up to the newest.
    private long leftTotal;
    private long rightTotal;
    private int openGroups;
    private int openScopes;
    private long tokens;
    private int peakBuffered;
    private int peakScanDepth;
    private boolean finished;

    public ScanEngine(LayoutOptions options) {
        Objects.requireNonNull(options, "options");
        this.margin = new LineWidthPolicy(options.maxWidth(), options.minSpace());
        this.printer = new PrintEngine(margin, options.debugMarkers());
    }

    @Override
    public void accept(Token token) {
        if (token instanceof StringToken string) {
            scanString(string);
        } else if (token instanceof BreakToken brk) {
            scanBreak(brk);
        } else if (token instanceof BeginToken begin) {
            scanBegin(begin);
        } else if (token == EndToken.INSTANCE) {
            scanEnd();
        } else if (token instanceof IndentToken indent) {
            scanIndent(indent);
        } else if (token == DedentToken.INSTANCE) {
            scanDedent();
        } else {
            throw new MalformedDocumentException("Unsupported token: " + token);
        }
    }

    public void scanBegin(BeginToken token) {
        ensureOpen();
        tokens++;
        if (scanStack.isEmpty()) {
            resetTotals();
        }
        long right = push(new BufEntry(token, -rightTotal));
        pushScan(right);
        openGroups++;
    }

    public void scanEnd() {
        ensureOpen();
        tokens++;
        if (openGroups == 0) {
            throw new MalformedDocumentException("Group end without a matching group begin");
        }
        openGroups--;
        if (scanStack.isEmpty()) {
            printer.printEnd();
            return;
        }
        if (!buffer.isEmpty() && buffer.last().token instanceof BreakToken brk) {
            if (!brk.hard() && buffer.size() >= 2 && buffer.secondLast().token instanceof BeginToken) {
                // a group holding nothing but one soft break is dropped together with the break
                buffer.popLast();
                buffer.popLast();
                scanStack.pollLast();
                scanStack.pollLast();
                rightTotal -= brk.scanWidth();
                return;
            }
            if (brk.ifNonempty()) {
                buffer.popLast();
                scanStack.pollLast();
                rightTotal -= brk.scanWidth();
            }
        }
        long right = push(new BufEntry(EndToken.INSTANCE, -1));
        pushScan(right);
    }

    public void scanBreak(BreakToken token) {
        ensureOpen();
        tokens++;
        if (scanStack.isEmpty()) {
            resetTotals();
        } else {
            checkStack(0, token.preBreakWidth());
        }
        long right = push(new BufEntry(token, -rightTotal));
        pushScan(right);
        rightTotal += token.scanWidth();
    }

    public void scanString(StringToken token) {
        ensureOpen();
        tokens++;
        if (scanStack.isEmpty()) {
            printer.printString(token.text(), token.width());
            return;
        }
        int width = token.width();
        push(new BufEntry(token, width));
        rightTotal += width;
        checkStream();
    }

    public void scanIndent(IndentToken token) {
        ensureOpen();
        tokens++;
        openScopes++;
        if (scanStack.isEmpty()) {
            printer.printIndent(token.columns());
        } else {
            push(new BufEntry(token, 0));
        }
    }

    public void scanDedent() {
        ensureOpen();
        tokens++;
        if (openScopes == 0) {
            throw new MalformedDocumentException("Indent scope end without a matching indent scope");
        }
        openScopes--;
        if (scanStack.isEmpty()) {
            printer.printDedent();
        } else {
            push(new BufEntry(DedentToken.INSTANCE, 0));
        }
    }

    /**
     * Flushes everything still buffered and returns the rendered text. The engine cannot be used afterwards.
     */
    public LayoutResult finish() {
        ensureOpen();
        finished = true;
        if (openGroups != 0) {
            throw new MalformedDocumentException(openGroups + " group(s) still open at end of input");
        }
        if (openScopes != 0) {
            throw new MalformedDocumentException(openScopes + " indent scope(s) still open at end of input");
        }
        if (!scanStack.isEmpty()) {
            checkStack(0, 0);
            advanceLeft();
        }
        if (!buffer.isEmpty()) {
            throw new IllegalStateException(buffer.size() + " token(s) left unresolved at end of input");
        }
        return new LayoutResult(printer.finish(), tokens, peakBuffered, peakScanDepth);
    }

    private void checkStream() {
        while (rightTotal - leftTotal > margin.remaining()) {
            Long oldest = scanStack.peekFirst();
            if (oldest != null && oldest == buffer.indexOfFirst()) {
                scanStack.pollFirst();
                buffer.first().size = Token.SIZE_INFINITY;
            }
            advanceLeft();
            if (buffer.isEmpty()) {
                break;
            }
        }
    }

    private void advanceLeft() {
        while (!buffer.isEmpty() && buffer.first().size >= 0) {
            BufEntry left = buffer.popFirst();
            Token token = left.token;
            if (token instanceof StringToken string) {
                leftTotal += string.width();
                printer.printString(string.text(), string.width());
            } else if (token instanceof BreakToken brk) {
                leftTotal += brk.scanWidth();
                printer.printBreak(brk, left.size);
            } else if (token instanceof BeginToken begin) {
                printer.printBegin(begin, left.size);
            } else if (token == EndToken.INSTANCE) {
                printer.printEnd();
            } else if (token instanceof IndentToken indent) {
                printer.printIndent(indent.columns());
            } else if (token == DedentToken.INSTANCE) {
                printer.printDedent();
            }
        }
    }

    /**
     * Resolves pending entries from the top of the scan stack: closed groups and the most recent break of
     * the current level get their final size, stopping at the first open group begin. {@code trailing} is
     * the width of text that lands at the end of their line if the break that closes them is taken.
     */
    private void checkStack(int depth, int trailing) {
        while (!scanStack.isEmpty()) {
            long index = scanStack.peekLast();
            BufEntry entry = buffer.get(index);
            if (entry.token instanceof BeginToken) {
                if (depth == 0) {
                    break;
                }
                scanStack.pollLast();
                entry.size += rightTotal + trailing;
                depth--;
            } else if (entry.token == EndToken.INSTANCE) {
                scanStack.pollLast();
                entry.size = 1;
                depth++;
            } else {
                scanStack.pollLast();
                entry.size += rightTotal + trailing;
                if (depth == 0) {
                    break;
                }
            }
        }
    }

    private void resetTotals() {
        leftTotal = 1;
        rightTotal = 1;
        buffer.clear();
    }

    private long push(BufEntry entry) {
        long index = buffer.push(entry);
        peakBuffered = Math.max(peakBuffered, buffer.size());
        return index;
    }

    private void pushScan(long index) {
        scanStack.addLast(index);
        peakScanDepth = Math.max(peakScanDepth, scanStack.size());
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("print job already finished");
        }
    }

    private static final class BufEntry {
        private final Token token;
        private long size;

        private BufEntry(Token token, long size) {
            this.token = token;
            this.size = size;
        }
    }
}
