package io.mersel.services.patterns.application.models;

import io.mersel.services.patterns.application.enums.Verdict;
import io.mersel.services.patterns.application.enums.VersionSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Model kayıtlarının değişmezleri: sıralama, null yerine boş koleksiyon ve türetilmiş değerler.
 */
@DisplayName("Model değişmezleri")
class ModelInvariantsTest {

    @Nested
    @DisplayName("FactPayload")
    class Payload {

        @Test
        @DisplayName("Attribute'lar anahtar sırasına göre saklanır")
        void attributes_sorted() {
            var attributes = new LinkedHashMap<String, String>();
            attributes.put("PaxID", "PAX1");
            attributes.put("Birthdate", "1980-01-01");
            attributes.put("PTC", "ADT");

            var payload = new FactPayload(attributes, null, null, null);

            assertThat(payload.attributes().keySet()).containsExactly("Birthdate", "PTC", "PaxID");
            assertThat(payload.children()).isEmpty();
            assertThat(payload.references()).isEmpty();
        }

        @Test
        @DisplayName("Aynı içerik farklı sırayla verilse de eşittir")
        void equality_orderIndependent() {
            var a = new LinkedHashMap<String, String>();
            a.put("x", "1");
            a.put("y", "2");
            var b = new LinkedHashMap<String, String>();
            b.put("y", "2");
            b.put("x", "1");

            assertThat(new FactPayload(a, List.of(), Map.of(), Map.of()))
                    .isEqualTo(new FactPayload(b, List.of(), Map.of(), Map.of()));
        }

        @Test
        @DisplayName("NodeFact null payload'ı boş payload'a çevirir")
        void nodeFact_nullPayload() {
            var fact = new NodeFact("f1", "ws1", "run-1", "21.3", "OrderViewRS", "Response/Order", "Order", 1,
                    null, null, false, false);

            assertThat(fact.payload()).isEqualTo(FactPayload.empty());
        }
    }

    @Nested
    @DisplayName("Verdict")
    class Verdicts {

        @ParameterizedTest
        @EnumSource(value = Verdict.class, names = {"EXACT", "HIGH", "PARTIAL"})
        @DisplayName("EXACT, HIGH ve PARTIAL eşleşme sayılır")
        void matched(Verdict verdict) {
            assertThat(verdict.isMatched()).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = Verdict.class, names = {"LOW", "NO_MATCH", "NEW_PATTERN"})
        @DisplayName("LOW, NO_MATCH ve NEW_PATTERN eşleşme sayılmaz")
        void notMatched(Verdict verdict) {
            assertThat(verdict.isMatched()).isFalse();
            assertThat(verdict.isHighConfidence()).isFalse();
        }

        @Test
        @DisplayName("Yüksek güven yalnızca EXACT ve HIGH")
        void highConfidence() {
            assertThat(Verdict.EXACT.isHighConfidence()).isTrue();
            assertThat(Verdict.HIGH.isHighConfidence()).isTrue();
            assertThat(Verdict.PARTIAL.isHighConfidence()).isFalse();
        }
    }

    @Nested
    @DisplayName("Türetilmiş değerler")
    class Derived {

        @Test
        @DisplayName("usableFacts başarısız fact'leri dışlar")
        void usableFacts() {
            var ok = new NodeFact("a", "ws1", "r", "21.3", "OrderViewRS", "S", "T", 1, null, null, false, false);
            var failed = new NodeFact("b", "ws1", "r", "21.3", "OrderViewRS", "S", "T", 2, null, null, false, true);
            var dialect = new DocumentDialect("21.3", "OrderViewRS", null, null, VersionSource.HEADER, false);

            var result = new ExtractionResult(dialect, List.of(ok, failed), null, 2, 1, 0, false, false);

            assertThat(result.usableFacts()).containsExactly(ok);
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("Yalnızca DEFAULT versiyon kaynağı düşük güvenlidir")
        void lowConfidenceDialect() {
            assertThat(new DocumentDialect("21.3", "OrderViewRS", null, null, VersionSource.DEFAULT, false)
                    .isLowConfidence()).isTrue();
            assertThat(new DocumentDialect("21.3", "OrderViewRS", null, null, VersionSource.OVERRIDE, false)
                    .isLowConfidence()).isFalse();
        }

        @Test
        @DisplayName("Bulunan ilişki sayısı dört sınıfın toplamıdır")
        void relationshipsFound() {
            var stats = new RelationshipAnalysis.Statistics(2, 8, 0, 3, 1, 2, 1, 4, 0);

            assertThat(stats.relationshipsFound()).isEqualTo(7);
            assertThat(RelationshipAnalysis.empty().statistics().relationshipsFound()).isZero();
        }

        @Test
        @DisplayName("Kayıtta olmayan istatistik 0 döner")
        void runRecord_missingStatistic() {
            var run = new RunRecord("r", "ws1", null, null, null, null, null, null, null, null,
                    Map.of("facts", 3L), null, Instant.now(), null);

            assertThat(run.statistic("facts")).isEqualTo(3);
            assertThat(run.statistic("missing")).isZero();
            assertThat(run.warnings()).isEmpty();
        }

        @Test
        @DisplayName("Pattern aktifliği supersede alanına bağlıdır")
        void patternActive() {
            Instant now = Instant.now();
            var active = new Pattern("p1", "ws1", "21.3", "OrderViewRS", "S", "T", null, null, "sig", 1, null,
                    null, null, now, now);
            var superseded = new Pattern("p2", "ws1", "21.3", "OrderViewRS", "S", "T", null, null, "sig2", 1, "p3",
                    null, null, now, now);

            assertThat(active.isActive()).isTrue();
            assertThat(active.hasExpectedRelationships()).isFalse();
            assertThat(active.examples()).isEmpty();
            assertThat(superseded.isActive()).isFalse();
        }
    }
}
