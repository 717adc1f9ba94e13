package io.mersel.services.patterns.infrastructure;

import io.mersel.services.patterns.infrastructure.config.PatternEngineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Section yolu ve element adı normalizasyonu.
 * <p>
 * Eski versiyonlar aynı mantıksal elementi prefix'li adlandırır
 * ({@code IATA_OrderViewRS} ≡ {@code OrderViewRS}); bu prefix'ler eşleştirme ve
 * saklama öncesi ayıklanır. Yollar {@code /} ile ayrılır, boş segmentler atılır.
 */
@Component
public class SectionPathNormalizer {

    private final List<String> legacyPrefixes;

    @Autowired
    public SectionPathNormalizer(PatternEngineProperties properties) {
        this(properties.getLegacyRootPrefixes());
    }

    public SectionPathNormalizer(List<String> legacyPrefixes) {
        var prefixes = new ArrayList<String>();
        for (String prefix : legacyPrefixes) {
            if (prefix != null && !prefix.isBlank()) {
                prefixes.add(prefix);
            }
        }
        this.legacyPrefixes = List.copyOf(prefixes);
    }

    /**
     * Element adından legacy prefix'i ayıklar. Namespace prefix'i ({@code ns:}) varsa önce o atılır.
     */
    public String normalizeSegment(String name) {
        if (name == null) {
            return "";
        }
        String local = name;
        int colon = local.indexOf(':');
        if (colon >= 0) {
            local = local.substring(colon + 1);
        }
        for (String prefix : legacyPrefixes) {
            if (local.startsWith(prefix) && local.length() > prefix.length()) {
                return local.substring(prefix.length());
            }
        }
        return local.trim();
    }

    public boolean hasLegacyPrefix(String name) {
        if (name == null) {
            return false;
        }
        return legacyPrefixes.stream().anyMatch(p -> name.startsWith(p) && name.length() > p.length());
    }

    /**
     * Yolu segmentlerine ayırıp her segmenti normalize eder.
     */
    public List<String> segments(String path) {
        var result = new ArrayList<String>();
        if (path == null) {
            return result;
        }
        for (String raw : path.split("/")) {
            String segment = normalizeSegment(raw.trim());
            if (!segment.isEmpty()) {
                result.add(segment);
            }
        }
        return result;
    }

    public String normalizePath(String path) {
        return String.join("/", segments(path));
    }

    /**
     * {@code child} yolu {@code parent} yolunun altında mı (eşitlik hariç).
     */
    public boolean isAncestor(String parent, String child) {
        String p = normalizePath(parent);
        String c = normalizePath(child);
        return !p.isEmpty() && c.length() > p.length() && c.startsWith(p + "/");
    }
}
