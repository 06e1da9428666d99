package com.afttsync.domain.exception;

/**
 * The document shape is not recognized by any known layout.
 */
public class ExtractionException extends Exception {

    private static final int MAX_PREVIEW_LENGTH = 200;

    private final String preview;

    public ExtractionException(String message, String documentText) {
        super(message + " [preview: " + preview(documentText) + "]");
        this.preview = preview(documentText);
    }

    public String getPreview() {
        return preview;
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        return collapsed.length() > MAX_PREVIEW_LENGTH
            ? collapsed.substring(0, MAX_PREVIEW_LENGTH) + "..."
            : collapsed;
    }
}
