package com.codegraph.core.extractor;

import com.codegraph.core.model.Language;
import com.codegraph.core.model.ParseError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExtractionStatistics}.
 */
class ExtractionStatisticsTest {

    @Test
    void record_classifiesResultsBySuccess() {
        // Given: One clean result, one partial result and one failed result
        ExtractionResult clean = result("a.py", 2, List.of());
        ExtractionResult partial = result("b.py", 3, List.of(ParseError.syntax("b.py", 4, "Unclosed bracket")));
        ExtractionResult failed = ExtractionResult.failed("c.py", Language.PYTHON, ParseError.io("c.py", "denied"));

        // When: Results are recorded
        ExtractionStatistics statistics = new ExtractionStatistics.Builder()
            .filesDiscovered(4)
            .record(clean)
            .record(partial)
            .record(failed)
            .build();

        // Then: Counters and error tallies reflect each outcome
        assertThat(statistics.filesDiscovered()).isEqualTo(4);
        assertThat(statistics.filesScanned()).isEqualTo(3);
        assertThat(statistics.filesParsedSuccessfully()).isEqualTo(1);
        assertThat(statistics.filesParsedWithFallback()).isEqualTo(1);
        assertThat(statistics.filesFailed()).isEqualTo(1);
        assertThat(statistics.filesByLanguage()).containsEntry("python", 3);
        assertThat(statistics.errorCounts()).containsEntry("SYNTAX", 1).containsEntry("IO", 1);
        assertThat(statistics.topErrors()).containsExactly("b.py:4 [SYNTAX] Unclosed bracket", "c.py [IO] denied");
        assertThat(statistics.hasFailures()).isTrue();
        assertThat(statistics.getOverallParseRate()).isCloseTo(66.67, within(0.01));
    }

    @Test
    void addError_keepsOnlyTopTenDetails() {
        ExtractionStatistics.Builder builder = new ExtractionStatistics.Builder();
        for (int i = 0; i < 15; i++) {
            builder.addError("TIMEOUT", "file" + i);
        }

        ExtractionStatistics statistics = builder.build();

        assertThat(statistics.errorCounts()).containsEntry("TIMEOUT", 15);
        assertThat(statistics.topErrors()).hasSize(10).startsWith("file0");
    }

    @Test
    void empty_hasZeroRatesAndReadableSummary() {
        ExtractionStatistics statistics = ExtractionStatistics.empty();

        assertThat(statistics.getSuccessRate()).isZero();
        assertThat(statistics.getFailureRate()).isZero();
        assertThat(statistics.hasFailures()).isFalse();
        assertThat(statistics.getSummary()).startsWith("Discovered: 0, Scanned: 0");
    }

    private static ExtractionResult result(String path, int entityCount, List<ParseError> errors) {
        ExtractionResult.Builder builder = new ExtractionResult.Builder(path, Language.PYTHON, ConfidenceLevel.MEDIUM);
        for (int i = 0; i < entityCount; i++) {
            builder.addEntity(RawEntity.NO_PARENT, "e" + i, "m.e" + i, "function", 1, 1, null, null, null);
        }
        errors.forEach(builder::addError);
        return builder.build();
    }
}
