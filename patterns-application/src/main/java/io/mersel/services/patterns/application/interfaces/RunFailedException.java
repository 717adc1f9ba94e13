package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.RunRecord;

/**
 * Çalıştırma kurtarılamaz şekilde başarısız olduğunda fırlatılır.
 * <p>
 * Başarısız çalıştırmanın kaydı (FAILED durumunda) incelenebilmesi için taşınır.
 */
public class RunFailedException extends Exception {

    private final RunRecord run;

    public RunFailedException(RunRecord run, String message, Throwable cause) {
        super(message, cause);
        this.run = run;
    }

    public RunRecord getRun() {
        return run;
    }
}
