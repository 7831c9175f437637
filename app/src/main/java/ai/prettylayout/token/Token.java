package ai.prettylayout.token;

/**
 * Element of the linear stream a document is lowered into before layout.
 */
public interface Token {

    /**
     * Size of content that cannot fit on any line.
     */
    long SIZE_INFINITY = 0xffff;
}
