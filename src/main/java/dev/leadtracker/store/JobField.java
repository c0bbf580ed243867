package dev.leadtracker.store;

/**
 * Mutable job fields. Every update touches exactly one of them.
 */
public enum JobField {
    STATUS,
    COMPANY,
    TITLE,
    LOCATION,
    DESCRIPTION,
    FULL_DESCRIPTION,
    ADDRESSEE,
    COVER_LETTER_TOPICS,
    COVER_LETTER_BODY,
    COVER_LETTER_PDF_PATH,
    QUESTIONS,
    WRITING_INSTRUCTIONS
}
