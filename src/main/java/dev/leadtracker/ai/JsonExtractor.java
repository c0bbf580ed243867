package dev.leadtracker.ai;

import java.util.Optional;

/**
 * Locates a JSON array or object inside free model output, which often wraps the
 * payload in prose or markdown fences.
 */
public final class JsonExtractor {

    private JsonExtractor() {
    }

    /**
     * Text from the first {@code [} to the last {@code ]}, if both exist in that order.
     */
    public static Optional<String> array(String text) {
        return between(text, '[', ']');
    }

    /**
     * Text from the first <code>{</code> to the last <code>}</code>, if both exist in that order.
     */
    public static Optional<String> object(String text) {
        return between(text, '{', '}');
    }

    private static Optional<String> between(String text, char open, char close) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }
}
