package ai.prettylayout.engine;

import ai.prettylayout.document.Breaks;

/**
 * State of a group being printed: either it fits on the current line, or it is broken and remembers the
 * indentation to restore at its end.
 */
record PrintFrame(boolean broken, int savedIndent, Breaks breaks) {

    static PrintFrame fits(Breaks breaks) {
        return new PrintFrame(false, 0, breaks);
    }

    static PrintFrame broken(int savedIndent, Breaks breaks) {
        return new PrintFrame(true, savedIndent, breaks);
    }
}
