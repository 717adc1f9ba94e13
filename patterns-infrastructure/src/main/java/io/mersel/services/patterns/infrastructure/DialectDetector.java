package io.mersel.services.patterns.infrastructure;

import io.mersel.services.patterns.application.enums.VersionSource;
import io.mersel.services.patterns.application.models.DocumentDialect;
import io.mersel.services.patterns.application.models.DocumentSource;
import io.mersel.services.patterns.infrastructure.config.PatternEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SAX tabanlı belge lehçesi (şema versiyonu, mesaj root'u, sahip) tespiti.
 * <p>
 * Full parse yapmaz: gerekli sinyaller toplandığında parse erken durdurulur.
 * Versiyon öncelik sırası:
 * <ol>
 *   <li>Root namespace URI ({@code .../2017.2} → {@code 17.2}; bilinen işaretler: {@code IATA/2015} → 21.3, {@code EDIST} → 17.2)</li>
 *   <li>Root üzerindeki {@code Version} attribute'ı (legacy {@code 5.000} biçimi → 17.2)</li>
 *   <li>Header: {@code PayloadAttributes/Version} veya root altındaki {@code Version} elementi</li>
 *   <li>Hiçbiri yoksa yapılandırılmış varsayılan: düşük güven</li>
 * </ol>
 */
@Component
public class DialectDetector {

    private static final Logger log = LoggerFactory.getLogger(DialectDetector.class);

    // ── Versiyon kalıpları ──
    private static final Pattern FULL_YEAR_VERSION = Pattern.compile("(?<!\\d)(\\d{4})\\.(\\d{1,2})(?!\\d)");
    private static final Pattern SHORT_VERSION_SEGMENT = Pattern.compile("/(\\d{2})\\.(\\d{1,2})(?:/|$)");
    private static final Pattern SHORT_VERSION = Pattern.compile("^(\\d{2})\\.(\\d{1,2})$");
    private static final Pattern LEGACY_NUMERIC_VERSION = Pattern.compile("^\\d\\.\\d{3}$");

    private static final String LEGACY_NUMERIC_TARGET = "17.2";
    private static final String MARKER_IATA_2015 = "/IATA/2015/";
    private static final String MARKER_EDIST = "EDIST";

    // ── Sahip (havayolu) sinyalleri ──
    private static final Set<String> OWNER_ATTRIBUTES = Set.of("Owner", "OwnerCode", "AirlineDesigCode");
    private static final Set<String> OWNER_ELEMENTS = Set.of("OwnerCode", "AirlineDesigCode");
    private static final Pattern OWNER_CODE = Pattern.compile("^[A-Z0-9]{2,3}$");

    /** Header versiyonu ve sahip için taranacak en fazla element. */
    private static final int SCAN_ELEMENT_LIMIT = 2000;

    private final SectionPathNormalizer normalizer;
    private final String defaultVersion;

    @Autowired
    public DialectDetector(SectionPathNormalizer normalizer, PatternEngineProperties properties) {
        this(normalizer, properties.getDefaultVersion());
    }

    DialectDetector(SectionPathNormalizer normalizer, String defaultVersion) {
        this.normalizer = normalizer;
        this.defaultVersion = defaultVersion;
    }

    /**
     * Belge lehçesini tespit eder.
     *
     * @param source          Belge
     * @param lenient         Kurtarma modunda oku
     * @param versionOverride Çağıranın verdiği versiyon ({@code null}: tespit et)
     */
    public DocumentDialect detect(DocumentSource source, boolean lenient, String versionOverride)
            throws IOException, SAXException, ParserConfigurationException {
        var handler = new DetectionHandler();
        try {
            XmlSupport.parse(source, lenient, handler);
        } catch (DetectionCompleteException e) {
            // Normal akış: parse erken durduruldu, sonuç handler'da
        } catch (SAXParseException e) {
            // Kurtarma modunda root görüldüyse o ana kadarki sinyaller kullanılır
            if (!lenient || handler.rootLocalName == null) {
                throw e;
            }
            log.debug("Lehçe taraması satır {} konumunda parse hatasıyla durdu: {}", e.getLineNumber(), e.getMessage());
        }

        if (handler.rootLocalName == null) {
            throw new SAXException("Root element bulunamadı");
        }

        String messageRoot = normalizer.normalizeSegment(handler.rootLocalName);
        boolean legacy = normalizer.hasLegacyPrefix(handler.rootLocalName);
        String namespace = handler.rootNamespace == null ? "" : handler.rootNamespace;

        String version;
        VersionSource versionSource;
        if (versionOverride != null && !versionOverride.isBlank()) {
            version = versionOverride.trim();
            versionSource = VersionSource.OVERRIDE;
        } else if (versionFromNamespace(namespace) != null) {
            version = versionFromNamespace(namespace);
            versionSource = VersionSource.NAMESPACE;
        } else if (handler.attributeVersion != null) {
            version = handler.attributeVersion;
            versionSource = VersionSource.VERSION_ATTRIBUTE;
        } else if (handler.headerVersion != null) {
            version = handler.headerVersion;
            versionSource = VersionSource.HEADER;
        } else {
            version = defaultVersion;
            versionSource = VersionSource.DEFAULT;
        }

        log.debug("Lehçe tespit edildi: {} v{} ({}), namespace={}, owner={}",
                messageRoot, version, versionSource, namespace, handler.ownerCode);
        return new DocumentDialect(version, messageRoot, namespace, handler.ownerCode, versionSource, legacy);
    }

    /**
     * Namespace URI'sinden versiyon çıkarır; sinyal yoksa {@code null}.
     */
    static String versionFromNamespace(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            return null;
        }
        Matcher full = FULL_YEAR_VERSION.matcher(namespace);
        if (full.find()) {
            return shortYear(full.group(1)) + "." + full.group(2);
        }
        Matcher shortSegment = SHORT_VERSION_SEGMENT.matcher(namespace);
        if (shortSegment.find()) {
            return shortSegment.group(1) + "." + shortSegment.group(2);
        }
        if (namespace.contains(MARKER_IATA_2015)) {
            return "21.3";
        }
        if (namespace.contains(MARKER_EDIST)) {
            return "17.2";
        }
        return null;
    }

    /**
     * Attribute/header değerini normalize versiyona çevirir; tanınmazsa {@code null}.
     */
    static String normalizeVersion(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        Matcher full = FULL_YEAR_VERSION.matcher(value);
        if (full.matches()) {
            return shortYear(full.group(1)) + "." + full.group(2);
        }
        if (SHORT_VERSION.matcher(value).matches()) {
            return value;
        }
        if (LEGACY_NUMERIC_VERSION.matcher(value).matches()) {
            return LEGACY_NUMERIC_TARGET;
        }
        return null;
    }

    private static String shortYear(String year) {
        return String.format("%02d", Integer.parseInt(year) % 100);
    }

    // ── SAX Handler ─────────────────────────────────────────────────

    /**
     * Parse'ı erken durdurmak için kullanılan sentinel exception.
     */
    private static class DetectionCompleteException extends SAXException {
        DetectionCompleteException() {
            super("Detection complete");
        }
    }

    private class DetectionHandler extends DefaultHandler {

        private String rootNamespace;
        private String rootLocalName;
        private String attributeVersion;
        private String headerVersion;
        private String ownerCode;

        private final List<String> path = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private String capturing;
        private int elementCount = 0;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes)
                throws SAXException {
            elementCount++;
            String name = normalizer.normalizeSegment(localName);
            String parent = path.isEmpty() ? null : path.get(path.size() - 1);
            path.add(name);

            if (path.size() == 1) {
                rootNamespace = uri;
                rootLocalName = localName;
                String value = attributes.getValue("Version");
                attributeVersion = normalizeVersion(value != null ? value : attributes.getValue("version"));
            }

            if (ownerCode == null) {
                for (String attribute : OWNER_ATTRIBUTES) {
                    acceptOwner(attributes.getValue(attribute));
                }
            }

            capturing = null;
            if (headerVersion == null && "Version".equals(name)
                    && ("PayloadAttributes".equals(parent) || path.size() == 2)) {
                capturing = "version";
                text.setLength(0);
            } else if (ownerCode == null && OWNER_ELEMENTS.contains(name)) {
                capturing = "owner";
                text.setLength(0);
            }

            stopIfDone();
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (capturing != null) {
                text.append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) throws SAXException {
            if ("version".equals(capturing)) {
                headerVersion = normalizeVersion(text.toString());
            } else if ("owner".equals(capturing)) {
                acceptOwner(text.toString());
            }
            capturing = null;
            path.remove(path.size() - 1);
            if (path.isEmpty()) {
                // Root kapandı: kurtarma modunda sondaki çöp içerik okunmaz
                throw new DetectionCompleteException();
            }
            stopIfDone();
        }

        private void acceptOwner(String value) {
            if (ownerCode == null && value != null && OWNER_CODE.matcher(value.trim()).matches()) {
                ownerCode = value.trim();
            }
        }

        private void stopIfDone() throws DetectionCompleteException {
            if (capturing != null) {
                return;
            }
            boolean versionKnown = versionFromNamespace(rootNamespace) != null
                    || attributeVersion != null || headerVersion != null;
            if ((versionKnown && ownerCode != null) || elementCount >= SCAN_ELEMENT_LIMIT) {
                throw new DetectionCompleteException();
            }
        }
    }
}
