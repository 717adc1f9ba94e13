package io.mersel.services.patterns.infrastructure;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;

/**
 * Bozuk XML için kurtarma modu okuyucusu.
 * <p>
 * İki tür yaygın bozulmayı karakter akışında düzeltir:
 * <ul>
 *   <li>Entity veya karakter referansı başlatmayan çıplak {@code &} → {@code &amp;}</li>
 *   <li>XML 1.0'da izin verilmeyen kontrol karakterleri → atlanır</li>
 * </ul>
 * Akış tabanlıdır; belgeyi belleğe almaz. Referans kontrolü için en fazla
 * {@value #LOOKAHEAD} karakter ileri bakar.
 */
final class LenientXmlReader extends Reader {

    private static final int LOOKAHEAD = 12;
    private static final String ESCAPED_AMP = "&amp;";

    private final PushbackReader in;
    private String pending = "";
    private int pendingPos = 0;

    LenientXmlReader(Reader source) {
        this.in = new PushbackReader(source, LOOKAHEAD + 1);
    }

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        int written = 0;
        while (written < len) {
            if (pendingPos < pending.length()) {
                cbuf[off + written++] = pending.charAt(pendingPos++);
                continue;
            }
            int c = in.read();
            if (c == -1) {
                break;
            }
            if (!isLegalXmlChar((char) c)) {
                continue;
            }
            if (c == '&' && !startsReference()) {
                pending = ESCAPED_AMP;
                pendingPos = 0;
                continue;
            }
            cbuf[off + written++] = (char) c;
        }
        return written == 0 ? -1 : written;
    }

    /**
     * {@code &} sonrasındaki karakterler geçerli bir referans mı ({@code &name;}, {@code &#10;}, {@code &#x1F;}).
     * Okunan karakterler geri itilir.
     */
    private boolean startsReference() throws IOException {
        char[] look = new char[LOOKAHEAD];
        int n = 0;
        boolean terminated = false;
        while (n < LOOKAHEAD) {
            int c = in.read();
            if (c == -1) {
                break;
            }
            look[n++] = (char) c;
            if (c == ';' || c == '<' || c == '&' || Character.isWhitespace(c)) {
                terminated = c == ';';
                break;
            }
        }
        if (n > 0) {
            in.unread(look, 0, n);
        }
        if (!terminated || n < 2) {
            return false;
        }
        String body = new String(look, 0, n - 1);
        if (body.startsWith("#x") || body.startsWith("#X")) {
            return body.length() > 2 && body.substring(2).chars().allMatch(ch -> Character.digit(ch, 16) >= 0);
        }
        if (body.startsWith("#")) {
            return body.length() > 1 && body.substring(1).chars().allMatch(Character::isDigit);
        }
        return Character.isLetter(body.charAt(0)) || body.charAt(0) == '_';
    }

    private static boolean isLegalXmlChar(char c) {
        return c == 0x9 || c == 0xA || c == 0xD
                || (c >= 0x20 && c <= 0xD7FF)
                || (c >= 0xE000 && c <= 0xFFFD)
                || Character.isSurrogate(c);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
