package io.mersel.services.patterns.infrastructure;

import io.mersel.services.patterns.application.models.NodeConfiguration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hedef section yollarının derlenmiş trie'si.
 * <p>
 * Kök düğüm belge root element'ine karşılık gelir; section yolları root hariç
 * yazılır. Segmentler {@link SectionPathNormalizer} ile normalize edilerek
 * eklendiği için legacy prefix'li varyantlar ve yapılandırılmış alias yollar
 * aynı terminal düğüme (aynı kanonik section'a) çıkar.
 * <p>
 * Derlendikten sonra değiştirilmez; eşzamanlı okunabilir.
 */
public final class TargetPathTrie {

    private final Node root = new Node();
    private final SectionPathNormalizer normalizer;
    private int targetCount;

    private TargetPathTrie(SectionPathNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Etkin yapılandırmalardan trie derler. Her yapılandırma kanonik yolu ve alias'larıyla eklenir.
     */
    public static TargetPathTrie compile(List<NodeConfiguration> configurations, SectionPathNormalizer normalizer) {
        var trie = new TargetPathTrie(normalizer);
        for (var config : configurations) {
            trie.insert(config.sectionPath(), config);
            for (String alias : config.aliases()) {
                trie.insert(alias, config);
            }
        }
        return trie;
    }

    private void insert(String path, NodeConfiguration config) {
        var segments = normalizer.segments(path);
        if (segments.isEmpty()) {
            return;
        }
        Node current = root;
        for (String segment : segments) {
            current = current.children.computeIfAbsent(segment, k -> new Node());
        }
        if (current.target == null) {
            targetCount++;
        }
        current.target = config;
    }

    public Node root() {
        return root;
    }

    public boolean isEmpty() {
        return targetCount == 0;
    }

    public int targetCount() {
        return targetCount;
    }

    /**
     * Trie düğümü. {@code target} doluysa bu yol bir hedef section'dır.
     */
    public final class Node {
        private final Map<String, Node> children = new HashMap<>();
        private NodeConfiguration target;

        /**
         * Ham element adına göre çocuk düğüm; trie dışındaysa {@code null}.
         */
        public Node child(String elementName) {
            return children.get(normalizer.normalizeSegment(elementName));
        }

        public NodeConfiguration target() {
            return target;
        }
    }
}
