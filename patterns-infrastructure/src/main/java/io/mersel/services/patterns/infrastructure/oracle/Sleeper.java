package io.mersel.services.patterns.infrastructure.oracle;

/**
 * Geri çekilme beklemesi. Testlerde gerçek bekleme yerine kaydedici kullanılır.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return Thread::sleep;
    }
}
