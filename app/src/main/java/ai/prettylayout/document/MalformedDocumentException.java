package ai.prettylayout.document;

/**
 * Raised when a document or token stream violates the nesting rules. This signals a bug in the code
 * producing the document; the print job is abandoned without emitting partial output.
 */
public class MalformedDocumentException extends RuntimeException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
