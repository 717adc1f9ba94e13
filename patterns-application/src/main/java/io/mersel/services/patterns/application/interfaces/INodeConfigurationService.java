package io.mersel.services.patterns.application.interfaces;

import io.mersel.services.patterns.application.models.NodeConfiguration;

import java.util.List;
import java.util.Optional;

/**
 * (versiyon, mesaj, section) anahtarlı hedef düğüm yapılandırması.
 */
public interface INodeConfigurationService {

    /**
     * Bir (versiyon, mesaj) için etkin section yapılandırmaları.
     */
    List<NodeConfiguration> getEnabledConfigurations(String version, String messageRoot);

    Optional<NodeConfiguration> find(String version, String messageRoot, String sectionPath);

    /**
     * Section için beklenen referans adları; yapılandırma yoksa boş.
     */
    default List<String> expectedReferences(String version, String messageRoot, String sectionPath) {
        return find(version, messageRoot, sectionPath)
                .map(NodeConfiguration::expectedReferences)
                .orElse(List.of());
    }

    /**
     * Yapılandırmada en az bir section'ı olan versiyonlar.
     */
    List<String> knownVersions();
}
