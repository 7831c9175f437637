package ai.prettylayout.token;

import java.util.Objects;

/**
 * Break as seen by the layout engine.
 *
 * @param offset indentation delta for the line started by this break
 * @param blankSpace columns occupied when the break is rendered flat
 * @param preBreak text emitted before the newline when the break is taken
 * @param ifNonempty removed when directly followed by the end of its group
 * @param blankLine a taken break leaves an empty line behind
 * @param hard never rendered flat
 */
public record BreakToken(int offset, int blankSpace, String preBreak, boolean ifNonempty, boolean blankLine,
                         boolean hard) implements Token {

    public BreakToken {
        if (blankSpace < 0) {
            throw new IllegalArgumentException("blankSpace must be zero or greater");
        }
        preBreak = Objects.requireNonNullElse(preBreak, "");
    }

    /**
     * Columns the pre-break text adds to the end of the line when the break is taken.
     */
    public int preBreakWidth() {
        return preBreak.codePointCount(0, preBreak.length());
    }

    /**
     * Width this break contributes to the running total of the stream.
     */
    public long scanWidth() {
        return hard ? SIZE_INFINITY : blankSpace;
    }
}
