package io.mersel.services.patterns.application.interfaces;

/**
 * Extraction oracle çağrısının tipli hatası.
 */
public class OracleException extends Exception {

    /**
     * Hata sınıfı. Geçici hatalar geri çekilmeli yeniden denenir,
     * şemaya uymayan yanıt bir kez düzeltici talimatla tekrarlanır.
     */
    public enum Kind {
        TIMEOUT,
        RATE_LIMITED,
        UNAVAILABLE,
        INVALID_RESPONSE;

        public boolean isTransient() {
            return this != INVALID_RESPONSE;
        }
    }

    private final Kind kind;

    public OracleException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OracleException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
