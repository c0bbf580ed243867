package dev.leadtracker.store;

/**
 * A job with the same non-empty link is already stored for this user.
 */
public class DuplicateLinkException extends IllegalStateException {

    public DuplicateLinkException(String link) {
        super("A job with link " + link + " already exists");
    }
}
