package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.ConflictResolution;

/**
 * Tek bir discovery/identify çalıştırmasının parametreleri.
 *
 * @param workspaceId        Çalıştırmanın izole olduğu partition
 * @param ownerCode          Sahip kapsamı; {@code null} ise belgeden tespit edilen kullanılır
 * @param versionOverride    Versiyon tespitini atlar ({@code null} ise tespit edilir)
 * @param crossVersion       Identify'da diğer versiyonların pattern'leri de aday mı
 * @param ownerScoped        Identify adaylarını sahip + kapsamsız pattern'lerle sınırla
 * @param conflictResolution Discovery sonrası çakışma politikası
 * @param cancellation       İptal sinyali
 */
public record RunConfig(
        String workspaceId,
        String ownerCode,
        String versionOverride,
        boolean crossVersion,
        boolean ownerScoped,
        ConflictResolution conflictResolution,
        CancellationToken cancellation
) {

    public RunConfig {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId boş olamaz");
        }
        conflictResolution = conflictResolution == null ? ConflictResolution.KEEP_BOTH : conflictResolution;
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    /**
     * Varsayılanlarla bir workspace için yapılandırma.
     */
    public static RunConfig forWorkspace(String workspaceId) {
        return new RunConfig(workspaceId, null, null, false, false, ConflictResolution.KEEP_BOTH, null);
    }

    public RunConfig withOwnerCode(String owner) {
        return new RunConfig(workspaceId, owner, versionOverride, crossVersion, ownerScoped, conflictResolution, cancellation);
    }

    public RunConfig withVersionOverride(String version) {
        return new RunConfig(workspaceId, ownerCode, version, crossVersion, ownerScoped, conflictResolution, cancellation);
    }

    public RunConfig withCrossVersion(boolean enabled) {
        return new RunConfig(workspaceId, ownerCode, versionOverride, enabled, ownerScoped, conflictResolution, cancellation);
    }

    public RunConfig withOwnerScoped(boolean enabled) {
        return new RunConfig(workspaceId, ownerCode, versionOverride, crossVersion, enabled, conflictResolution, cancellation);
    }

    public RunConfig withConflictResolution(ConflictResolution resolution) {
        return new RunConfig(workspaceId, ownerCode, versionOverride, crossVersion, ownerScoped, resolution, cancellation);
    }

    public RunConfig withCancellation(CancellationToken token) {
        return new RunConfig(workspaceId, ownerCode, versionOverride, crossVersion, ownerScoped, conflictResolution, token);
    }
}
