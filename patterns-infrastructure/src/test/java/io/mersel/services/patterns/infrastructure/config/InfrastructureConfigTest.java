package io.mersel.services.patterns.infrastructure.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mersel.services.patterns.application.interfaces.IDiscoveryWorkflow;
import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.application.interfaces.IIdentifyWorkflow;
import io.mersel.services.patterns.application.interfaces.INodeConfigurationService;
import io.mersel.services.patterns.application.interfaces.IPatternCatalog;
import io.mersel.services.patterns.infrastructure.oracle.ResilientExtractionOracle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InfrastructureConfig")
class InfrastructureConfigTest {

    private final EmbeddedDatabase database = new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("db/pattern-catalog-schema.sql")
            .build();

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withBean(DataSource.class, () -> database)
            .withBean(JdbcTemplate.class, () -> new JdbcTemplate(database))
            .withBean(PlatformTransactionManager.class, () -> new DataSourceTransactionManager(database))
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withUserConfiguration(InfrastructureConfig.class);

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("Tüm motor bileşenleri ve workflow'lar bağlanır")
    void wiresEngine() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(IDiscoveryWorkflow.class);
            assertThat(context).hasSingleBean(IIdentifyWorkflow.class);
            assertThat(context).hasSingleBean(IPatternCatalog.class);
            assertThat(context.getBean(INodeConfigurationService.class).knownVersions()).isNotEmpty();
        });
    }

    @Test
    @DisplayName("Birincil oracle dayanıklı sarmalayıcıdır")
    void primaryOracleIsResilient() {
        runner.run(context -> assertThat(context.getBean(IExtractionOracle.class))
                .isInstanceOf(ResilientExtractionOracle.class));
    }

    @Test
    @DisplayName("Özellikler patterns.* anahtarlarından bağlanır")
    void bindsProperties() {
        runner.withPropertyValues("patterns.engine.default-version=19.2", "patterns.scoring.mismatch-penalty=0.2")
                .run(context -> {
                    assertThat(context.getBean(PatternEngineProperties.class).getDefaultVersion()).isEqualTo("19.2");
                    assertThat(context.getBean(ScoringProperties.class).getMismatchPenalty()).isEqualTo(0.2);
                });
    }
}
