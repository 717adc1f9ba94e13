package io.mersel.services.patterns.application.interfaces;

/**
 * Belge lenient kurtarma modunda dahi parse edilemediğinde fırlatılır.
 */
public class DocumentParseException extends ExtractionException {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
