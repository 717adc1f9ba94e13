package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.VersionSource;

/**
 * Belgeden tespit edilen lehçe bilgisi.
 *
 * @param version       Normalize şema versiyonu (örn: "17.2")
 * @param messageRoot   Legacy prefix'i ayıklanmış root adı
 * @param namespaceUri  Root namespace URI'si (yoksa boş)
 * @param ownerCode     Belgeden okunan sahip/havayolu kodu ({@code null} olabilir)
 * @param versionSource Versiyonun tespit edildiği sinyal
 * @param legacyPrefix  Root'ta legacy prefix ({@code IATA_}) bulundu mu
 */
public record DocumentDialect(
        String version,
        String messageRoot,
        String namespaceUri,
        String ownerCode,
        VersionSource versionSource,
        boolean legacyPrefix
) {

    /**
     * Versiyon hiçbir sinyalden tespit edilemediyse {@code true}.
     */
    public boolean isLowConfidence() {
        return versionSource == VersionSource.DEFAULT;
    }
}
