package io.mersel.services.patterns.infrastructure;

import io.mersel.services.patterns.application.models.DocumentSource;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * SAX parser oluşturma ve escape yardımcıları.
 */
final class XmlSupport {

    private XmlSupport() {
    }

    /**
     * XXE korumalı, namespace-aware SAX parser.
     */
    static SAXParser newParser() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        // XXE koruma
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory.newSAXParser();
    }

    /**
     * Belge için parse girdisi. Lenient modda içerik UTF-8 olarak okunup
     * {@link LenientXmlReader} üzerinden süzülür.
     * Döndürülen stream çağıran tarafından kapatılmalıdır.
     */
    static InputSource open(InputStream stream, boolean lenient) {
        if (lenient) {
            return new InputSource(new LenientXmlReader(new InputStreamReader(stream, StandardCharsets.UTF_8)));
        }
        return new InputSource(stream);
    }

    /**
     * Kaynağı parse eder; stream her durumda kapatılır.
     */
    static void parse(DocumentSource source, boolean lenient, DefaultHandler handler)
            throws IOException, SAXException, ParserConfigurationException {
        SAXParser parser = newParser();
        try (InputStream stream = source.openStream()) {
            parser.parse(open(stream, lenient), handler);
        }
    }

    static void appendEscaped(StringBuilder out, char[] ch, int start, int length) {
        for (int i = start; i < start + length; i++) {
            appendEscaped(out, ch[i], false);
        }
    }

    static void appendEscapedAttribute(StringBuilder out, String value) {
        for (int i = 0; i < value.length(); i++) {
            appendEscaped(out, value.charAt(i), true);
        }
    }

    private static void appendEscaped(StringBuilder out, char c, boolean attribute) {
        switch (c) {
            case '&' -> out.append("&amp;");
            case '<' -> out.append("&lt;");
            case '>' -> out.append("&gt;");
            case '"' -> out.append(attribute ? "&quot;" : "\"");
            default -> out.append(c);
        }
    }

    /**
     * Boşlukları tek boşluğa indirip {@code maxLength} ile keser.
     */
    static String snippet(String xml, int maxLength) {
        String collapsed = xml.replaceAll(">\\s+<", "><").replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= maxLength) {
            return collapsed;
        }
        return collapsed.substring(0, maxLength) + "...";
    }
}
