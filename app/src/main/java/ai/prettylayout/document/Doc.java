package ai.prettylayout.document;

/**
 * Node of a layout document: {@link Text}, {@link Break}, {@link Group} or {@link IndentScope}.
 */
public interface Doc {
}
