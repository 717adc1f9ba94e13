package io.mersel.services.patterns.application.models;

/**
 * Identify aday sorgusunun kapsamı.
 *
 * @param workspaceId  Partition
 * @param messageRoot  Mesaj root'u (zorunlu)
 * @param version      Versiyon; {@code crossVersion} ise yok sayılır
 * @param crossVersion Tüm versiyonlar aday mı
 * @param ownerCode    Sahip; {@code ownerScoped} ise sahip + kapsamsız pattern'ler
 * @param ownerScoped  Sahip filtresi uygulanır mı
 */
public record CandidateScope(
        String workspaceId,
        String messageRoot,
        String version,
        boolean crossVersion,
        String ownerCode,
        boolean ownerScoped
) {
}
