package ai.prettylayout.token;

/**
 * Consumer of a token stream, fed in order.
 */
@FunctionalInterface
public interface TokenSink {

    void accept(Token token);
}
