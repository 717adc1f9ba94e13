package io.mersel.services.patterns.infrastructure.diagnostics;

import io.mersel.services.patterns.application.interfaces.INodeConfigurationService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Pattern kataloğu ve hedef section yapılandırması sağlık göstergesi.
 * <p>
 * Katalog veritabanına erişilemiyorsa DOWN. Hiç section yapılandırması yüklenmemişse
 * servis UP kalır ama uyarı detayı eklenir; bu durumda extractor hiçbir fragment toplamaz.
 */
@Component
public class CatalogHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;
    private final INodeConfigurationService nodeConfigurations;

    public CatalogHealthIndicator(JdbcTemplate jdbcTemplate, INodeConfigurationService nodeConfigurations) {
        this.jdbcTemplate = jdbcTemplate;
        this.nodeConfigurations = nodeConfigurations;
    }

    @Override
    public Health health() {
        var versions = nodeConfigurations.knownVersions();

        long patternCount;
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM patterns", Long.class);
            patternCount = count == null ? 0 : count;
        } catch (DataAccessException e) {
            return Health.down()
                    .withDetail("catalog", "not_accessible")
                    .withDetail("error", e.getMessage())
                    .withDetail("configured_versions", versions)
                    .build();
        }

        var builder = Health.up()
                .withDetail("catalog", "accessible")
                .withDetail("patterns_total", patternCount)
                .withDetail("configured_versions", versions);

        if (versions.isEmpty()) {
            builder.withDetail("warning", "Hedef section yapılandırması yüklenmemiş. patterns.engine.node-configuration-path değerini kontrol edin");
        }
        return builder.build();
    }
}
