package io.mersel.services.patterns.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PatternEngineProperties doğrulama testleri.
 */
@DisplayName("PatternEngineProperties")
class PatternEnginePropertiesTest {

    @Test
    @DisplayName("Varsayılan değerler")
    void defaults() {
        var props = new PatternEngineProperties();

        assertThat(props.getDefaultVersion()).isEqualTo("21.3");
        assertThat(props.getMaxDocumentSizeBytes()).isEqualTo(100L * 1024 * 1024);
        assertThat(props.getMaxFragmentChars()).isEqualTo(4096);
        assertThat(props.getLegacyRootPrefixes()).containsExactly("IATA_");
        assertThat(props.getMaxExamples()).isEqualTo(5);
    }

    @Test
    @DisplayName("validate_bos_default_version: blank resets to 21.3")
    void validate_blankDefaultVersion() throws Exception {
        var props = new PatternEngineProperties();
        props.setDefaultVersion("  ");

        invokeValidate(props);

        assertThat(props.getDefaultVersion()).isEqualTo("21.3");
    }

    @Test
    @DisplayName("validate_pozitif_olmayan_sinirlar: non-positive limits reset to defaults")
    void validate_nonPositiveLimits() throws Exception {
        var props = new PatternEngineProperties();
        props.setMaxDocumentSizeMb(0);
        props.setMaxFragmentKb(-1);
        props.setMaxSnippetLength(0);
        props.setWorkerThreads(0);
        props.setMaxExamples(-3);
        props.setUpsertMaxAttempts(0);

        invokeValidate(props);

        assertThat(props.getMaxDocumentSizeMb()).isEqualTo(100);
        assertThat(props.getMaxFragmentKb()).isEqualTo(4);
        assertThat(props.getMaxSnippetLength()).isEqualTo(120);
        assertThat(props.getWorkerThreads()).isEqualTo(4);
        assertThat(props.getMaxExamples()).isEqualTo(5);
        assertThat(props.getUpsertMaxAttempts()).isEqualTo(5);
    }

    @Test
    @DisplayName("validate_null_prefix_listesi: null becomes empty list")
    void validate_nullPrefixes() throws Exception {
        var props = new PatternEngineProperties();
        props.setLegacyRootPrefixes(null);

        invokeValidate(props);

        assertThat(props.getLegacyRootPrefixes()).isEmpty();
    }

    @Test
    @DisplayName("validate_gecerli_degerler: valid values are kept")
    void validate_validValuesKept() throws Exception {
        var props = new PatternEngineProperties();
        props.setWorkerThreads(8);
        props.setMaxFragmentKb(16);

        invokeValidate(props);

        assertThat(props.getWorkerThreads()).isEqualTo(8);
        assertThat(props.getMaxFragmentChars()).isEqualTo(16 * 1024);
    }

    private static void invokeValidate(PatternEngineProperties props) throws Exception {
        Method validate = PatternEngineProperties.class.getDeclaredMethod("validate");
        validate.setAccessible(true);
        validate.invoke(props);
    }
}
