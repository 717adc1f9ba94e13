package io.mersel.services.patterns.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Extractor, ilişki analizi, pattern üretimi, identify motoru ve JDBC
 * katalog bileşenlerini tarar; motor, oracle ve skorlama özelliklerini etkinleştirir.
 * {@code DataSource} ve {@code MeterRegistry} çevreleyen servis tarafından sağlanır.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.patterns.infrastructure")
@EnableConfigurationProperties({
        PatternEngineProperties.class,
        OracleProperties.class,
        ScoringProperties.class
})
public class InfrastructureConfig {
}
