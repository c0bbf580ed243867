package dev.leadtracker.ai;

/**
 * Outcome of a text-completion call. On failure {@code text} holds the reason.
 */
public record Completion(boolean success, String text) {

    public static Completion ok(String text) {
        return new Completion(true, text == null ? "" : text);
    }

    public static Completion failure(String reason) {
        return new Completion(false, reason == null ? "" : reason);
    }
}
