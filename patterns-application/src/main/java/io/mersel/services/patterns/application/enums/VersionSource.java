package io.mersel.services.patterns.application.enums;

/**
 * Belge versiyonunun hangi sinyalden tespit edildiği (öncelik sırasıyla).
 */
public enum VersionSource {
    /** Root namespace URI'sinden ({@code .../2017.2}). */
    NAMESPACE,
    /** Root element üzerindeki açık versiyon attribute'ından. */
    VERSION_ATTRIBUTE,
    /** Header/metadata alanından ({@code PayloadAttributes/Version}). */
    HEADER,
    /** Çağıranın açıkça verdiği versiyon. */
    OVERRIDE,
    /** Hiç sinyal yok: yapılandırılmış varsayılan, düşük güven. */
    DEFAULT
}
