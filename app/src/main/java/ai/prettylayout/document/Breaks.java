package ai.prettylayout.document;

/**
 * Breaking discipline of a {@link Group}.
 */
public enum Breaks {
    /** Once any direct break is taken, every direct break is taken. */
    CONSISTENT,
    /** Each direct break is taken only when the content after it does not fit. */
    INCONSISTENT
}
