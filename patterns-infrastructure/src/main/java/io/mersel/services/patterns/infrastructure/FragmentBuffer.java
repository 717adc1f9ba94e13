package io.mersel.services.patterns.infrastructure;

import io.mersel.services.patterns.application.models.NodeConfiguration;
import org.xml.sax.Attributes;

/**
 * Eşleşen tek bir subtree'nin SAX olaylarından yeniden serileştirilmesi.
 * <p>
 * Boyut sınırına ulaşıldığında yeni element ve metin alınmaz; açık kalan
 * elementler yine kapatılır, böylece fragment iyi biçimli kalır. Sınır kontrolü
 * start tag'i attribute'larıyla birlikte ölçer. Kök elementin sığmayan
 * attribute'ları atılır.
 */
final class FragmentBuffer {

    private final StringBuilder xml = new StringBuilder();
    private final long sequence;
    private final NodeConfiguration target;
    private final int ordinal;
    private final int startDepth;
    private final int maxChars;

    private int relativeDepth = 0;
    private int skipFromDepth = -1;
    private boolean truncated = false;

    FragmentBuffer(long sequence, NodeConfiguration target, int ordinal, int startDepth, int maxChars) {
        this.sequence = sequence;
        this.target = target;
        this.ordinal = ordinal;
        this.startDepth = startDepth;
        this.maxChars = maxChars;
    }

    void startElement(String qName, Attributes attributes) {
        relativeDepth++;
        if (skipFromDepth > 0) {
            return;
        }
        var tag = new StringBuilder().append('<').append(qName);
        if (relativeDepth > 1) {
            appendAttributes(tag, attributes, Integer.MAX_VALUE);
            if (xml.length() + tag.length() + 1 > maxChars) {
                truncated = true;
                skipFromDepth = relativeDepth;
                return;
            }
        } else if (!appendAttributes(tag, attributes, maxChars - 1)) {
            truncated = true;
        }
        xml.append(tag).append('>');
    }

    /**
     * Attribute'ları {@code limit} karaktere kadar ekler; sığmayan attribute atlanır.
     *
     * @return tüm attribute'lar eklendiyse {@code true}
     */
    private static boolean appendAttributes(StringBuilder tag, Attributes attributes, int limit) {
        boolean complete = true;
        for (int i = 0; i < attributes.getLength(); i++) {
            var attribute = new StringBuilder();
            attribute.append(' ').append(attributes.getQName(i)).append("=\"");
            XmlSupport.appendEscapedAttribute(attribute, attributes.getValue(i));
            attribute.append('"');
            if (tag.length() + attribute.length() > limit) {
                complete = false;
                continue;
            }
            tag.append(attribute);
        }
        return complete;
    }

    void characters(char[] ch, int start, int length) {
        if (skipFromDepth > 0 || isBlank(ch, start, length)) {
            return;
        }
        int remaining = maxChars - xml.length();
        if (remaining <= 0) {
            truncated = true;
            return;
        }
        if (length > remaining) {
            truncated = true;
            length = remaining;
        }
        XmlSupport.appendEscaped(xml, ch, start, length);
    }

    void endElement(String qName) {
        if (skipFromDepth > 0) {
            if (relativeDepth == skipFromDepth) {
                skipFromDepth = -1;
            }
            relativeDepth--;
            return;
        }
        xml.append("</").append(qName).append('>');
        relativeDepth--;
    }

    /**
     * Bu buffer'ın kök elementi verilen derinlikte mi kapandı.
     */
    boolean closesAt(int depth) {
        return depth == startDepth;
    }

    ExtractedFragment toFragment() {
        return new ExtractedFragment(sequence, target, ordinal, xml.toString(), truncated, false);
    }

    /**
     * Parse hatası nedeniyle kapanmadan kalan subtree. Buffer'daki kısmi içerik
     * yalnızca snippet için taşınır.
     */
    ExtractedFragment toMalformedFragment() {
        return new ExtractedFragment(sequence, target, ordinal, xml.toString(), truncated, true);
    }

    NodeConfiguration target() {
        return target;
    }

    private static boolean isBlank(char[] ch, int start, int length) {
        for (int i = start; i < start + length; i++) {
            if (!Character.isWhitespace(ch[i])) {
                return false;
            }
        }
        return true;
    }
}
