package io.mersel.services.patterns.application.models;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tekrar açılabilir belge kaynağı.
 * <p>
 * Lenient modda yeniden deneme için stream ikinci kez açılabilmelidir.
 */
public interface DocumentSource {

    /**
     * Belge içeriği için yeni bir stream açar. Çağıran kapatır.
     */
    InputStream openStream() throws IOException;

    /**
     * Loglama ve çalıştırma kaydı için belge adı.
     */
    String name();

    /**
     * Belge boyutu (byte); bilinmiyorsa -1.
     */
    long size();

    static DocumentSource ofBytes(String name, byte[] content) {
        return new DocumentSource() {
            @Override
            public InputStream openStream() {
                return new ByteArrayInputStream(content);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public long size() {
                return content.length;
            }
        };
    }

    static DocumentSource ofPath(Path path) {
        return new DocumentSource() {
            @Override
            public InputStream openStream() throws IOException {
                return Files.newInputStream(path);
            }

            @Override
            public String name() {
                return path.getFileName().toString();
            }

            @Override
            public long size() {
                try {
                    return Files.size(path);
                } catch (IOException e) {
                    return -1;
                }
            }
        };
    }
}
