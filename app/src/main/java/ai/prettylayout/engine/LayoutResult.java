package ai.prettylayout.engine;

import java.util.Objects;

/**
 * Rendered text of one print job together with the buffer usage it needed.
 *
 * @param text rendered output
 * @param tokens number of tokens scanned
 * @param peakBufferedTokens largest number of tokens held in the ring buffer at once
 * @param peakScanDepth largest number of pending entries on the scan stack at once
 */
public record LayoutResult(String text, long tokens, int peakBufferedTokens, int peakScanDepth) {

    public LayoutResult {
        Objects.requireNonNull(text, "text");
    }

    public int lineCount() {
        if (text.isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        return text.endsWith("\n") ? lines : lines + 1;
    }

    LayoutResult withText(String newText) {
        return new LayoutResult(newText, tokens, peakBufferedTokens, peakScanDepth);
    }
}
