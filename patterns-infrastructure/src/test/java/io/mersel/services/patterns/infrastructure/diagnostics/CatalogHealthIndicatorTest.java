package io.mersel.services.patterns.infrastructure.diagnostics;

import io.mersel.services.patterns.application.interfaces.INodeConfigurationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogHealthIndicator")
class CatalogHealthIndicatorTest {

    @Mock
    JdbcTemplate jdbcTemplate;

    @Mock
    INodeConfigurationService nodeConfigurations;

    @InjectMocks
    CatalogHealthIndicator indicator;

    @Test
    @DisplayName("Katalog erişilebilir → UP, pattern sayısı ve versiyonlar detayda")
    void accessible_up() {
        when(nodeConfigurations.knownVersions()).thenReturn(List.of("17.2", "21.3"));
        when(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM patterns", Long.class)).thenReturn(42L);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("patterns_total", 42L)
                .containsEntry("configured_versions", List.of("17.2", "21.3"))
                .doesNotContainKey("warning");
    }

    @Test
    @DisplayName("Section yapılandırması yoksa UP kalır ama uyarı eklenir")
    void noConfigurations_warning() {
        when(nodeConfigurations.knownVersions()).thenReturn(List.of());
        when(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM patterns", Long.class)).thenReturn(0L);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsKey("warning");
    }

    @Test
    @DisplayName("Veritabanı erişilemezse DOWN")
    void databaseDown() {
        when(nodeConfigurations.knownVersions()).thenReturn(List.of("21.3"));
        when(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM patterns", Long.class))
                .thenThrow(new DataAccessResourceFailureException("bağlantı yok"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("catalog", "not_accessible")
                .containsEntry("error", "bağlantı yok");
    }
}
