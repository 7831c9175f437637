package ai.prettylayout.document;

import java.util.Objects;

/**
 * Candidate line break.
 *
 * @param kind flat and broken rendering of the break
 * @param offset columns added to the indentation of the line this break starts
 * @param preBreak text appended to the current line only when the break is taken, empty for none
 * @param ifNonempty drop the break when nothing follows it inside its group
 */
public record Break(BreakKind kind, int offset, String preBreak, boolean ifNonempty) implements Doc {

    public Break {
        Objects.requireNonNull(kind, "kind");
        preBreak = preBreak == null ? "" : preBreak;
        if (preBreak.indexOf('\n') >= 0 || preBreak.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("preBreak must not contain line terminators");
        }
    }

    public Break(BreakKind kind, int offset) {
        this(kind, offset, "", false);
    }

    public Break withOffset(int newOffset) {
        return new Break(kind, newOffset, preBreak, ifNonempty);
    }

    public boolean isHard() {
        return kind == BreakKind.HARD;
    }
}
