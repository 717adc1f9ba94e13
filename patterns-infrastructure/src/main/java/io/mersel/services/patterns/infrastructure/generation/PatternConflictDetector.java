package io.mersel.services.patterns.infrastructure.generation;

import io.mersel.services.patterns.application.enums.ConflictResolution;
import io.mersel.services.patterns.application.interfaces.IPatternCatalog;
import io.mersel.services.patterns.application.models.Pattern;
import io.mersel.services.patterns.application.models.PatternConflict;
import io.mersel.services.patterns.infrastructure.SectionPathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aynı (versiyon, mesaj) içindeki aktif pattern'ler arasında ebeveyn/çocuk
 * section yolu çakışması tespiti.
 * <p>
 * Yalnızca bu çalıştırmada dokunulan pattern'leri içeren çiftler raporlanır.
 * {@link ConflictResolution#SUPERSEDE_PARENT} ebeveyni ilk çocuğa bağlar;
 * supersede edilen pattern bir daha identify adayı olmaz.
 */
@Component
public class PatternConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternConflictDetector.class);

    private final IPatternCatalog catalog;
    private final SectionPathNormalizer normalizer;

    public PatternConflictDetector(IPatternCatalog catalog, SectionPathNormalizer normalizer) {
        this.catalog = catalog;
        this.normalizer = normalizer;
    }

    public List<PatternConflict> detectAndResolve(String workspaceId, String version, String messageRoot,
                                                  Collection<String> touchedPatternIds,
                                                  ConflictResolution resolution) {
        List<Pattern> active = catalog.findActive(workspaceId, version, messageRoot);
        var conflicts = new ArrayList<PatternConflict>();
        Set<String> superseded = new HashSet<>();

        for (Pattern parent : active) {
            for (Pattern child : active) {
                if (parent.id().equals(child.id())
                        || !normalizer.isAncestor(parent.sectionPath(), child.sectionPath())) {
                    continue;
                }
                if (!touchedPatternIds.contains(parent.id()) && !touchedPatternIds.contains(child.id())) {
                    continue;
                }
                conflicts.add(new PatternConflict(parent.id(), parent.sectionPath(),
                        child.id(), child.sectionPath(), resolution));

                if (resolution == ConflictResolution.SUPERSEDE_PARENT && superseded.add(parent.id())) {
                    catalog.markSuperseded(workspaceId, parent.id(), child.id());
                    log.info("Pattern supersede edildi: {} ({}) → {} ({})",
                            parent.id(), parent.sectionPath(), child.id(), child.sectionPath());
                }
            }
        }

        if (!conflicts.isEmpty()) {
            log.warn("{} {} için {} ebeveyn/çocuk pattern çakışması bulundu (çözüm: {})",
                    messageRoot, version, conflicts.size(), resolution);
        }
        return conflicts;
    }
}
