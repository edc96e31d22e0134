package com.energyanalytics.ingestion.validation;

import com.energyanalytics.ingestion.TestRecords;
import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.model.GridOperation;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.RunMode;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.SyntheticQuality;
import com.energyanalytics.ingestion.model.ValidationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordValidator Tests")
class RecordValidatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final RecordValidator validator = new RecordValidator(Clock.fixed(NOW, ZoneOffset.UTC));
    private final ValidationRules gridRules = ValidationRules.forSource(SourceType.GRID, SourceSettings.gridDefaults());

    private ValidationPolicy policy(boolean strict, RunMode mode) {
        EnergyIngestionProperties.Validation config = new EnergyIngestionProperties.Validation();
        config.setStrict(strict);
        return ValidationPolicy.of(config, gridRules, mode);
    }

    /** Ten fresh records, the first {@code bad} of them with a negative load. */
    private List<NormalizedRecord> batchWithBadRecords(int bad) {
        List<NormalizedRecord> records = TestRecords.hourlyGrid(NOW, "FR", 10);
        for (int i = 0; i < bad; i++) {
            ((GridOperation) records.get(i)).setLoadActualMw(-5.0);
        }
        return records;
    }

    // ============================================================================
    // Gate
    // ============================================================================

    @Test
    @DisplayName("Clean batch is accepted with every record scored")
    void testCleanBatch() {
        ValidationOutcome outcome = validator.validate(TestRecords.hourlyGrid(NOW, "FR", 10), policy(false, RunMode.INCREMENTAL));

        assertTrue(outcome.acceptable());
        assertEquals(10, outcome.acceptedCount());
        assertEquals(0, outcome.rejectedCount());
        outcome.acceptedRecords().forEach(r -> {
            assertNotNull(r.getDataQualityScore());
            assertTrue(r.getDataQualityScore() > 0 && r.getDataQualityScore() <= 1.0);
        });
    }

    @Test
    @DisplayName("Strict mode rejects the batch on a single bad record")
    void testStrictRejectsOneBadRecord() {
        ValidationOutcome outcome = validator.validate(batchWithBadRecords(1), policy(true, RunMode.INCREMENTAL));

        assertFalse(outcome.acceptable());
        assertEquals(1, outcome.rejectedCount());
    }

    @Test
    @DisplayName("Non-strict mode accepts rejections up to the tolerance")
    void testNonStrictWithinTolerance() {
        ValidationOutcome outcome = validator.validate(batchWithBadRecords(2), policy(false, RunMode.INCREMENTAL));

        assertTrue(outcome.acceptable());
        assertEquals(8, outcome.acceptedCount());
        assertEquals(2, outcome.rejectedCount());
    }

    @Test
    @DisplayName("Non-strict mode rejects the batch above the tolerance")
    void testNonStrictAboveTolerance() {
        ValidationOutcome outcome = validator.validate(batchWithBadRecords(3), policy(false, RunMode.INCREMENTAL));

        assertFalse(outcome.acceptable());
        assertEquals(3, outcome.rejectedCount());
        assertEquals(0.3, outcome.rejectionRatio(), 1e-9);
    }

    @Test
    @DisplayName("Empty batch is acceptable with a warning")
    void testEmptyBatch() {
        ValidationOutcome outcome = validator.validate(List.of(), policy(true, RunMode.INCREMENTAL));

        assertTrue(outcome.acceptable());
        assertEquals(0, outcome.totalCount());
        assertFalse(outcome.warnings().isEmpty());
    }

    // ============================================================================
    // Individual checks
    // ============================================================================

    @Test
    @DisplayName("Records missing a required field are dropped")
    void testIncompleteRecordDropped() {
        List<NormalizedRecord> records = TestRecords.hourlyGrid(NOW, "FR", 10);
        ((GridOperation) records.get(0)).setLoadActualMw(null);

        ValidationOutcome outcome = validator.validate(records, policy(false, RunMode.INCREMENTAL));

        assertEquals(9, outcome.acceptedCount());
        assertEquals(1, outcome.rejectedCount());
    }

    @Test
    @DisplayName("Duplicate keys keep the last occurrence and are not rejections")
    void testDuplicates() {
        List<NormalizedRecord> records = new ArrayList<>(TestRecords.hourlyGrid(NOW, "FR", 3));
        records.add(TestRecords.grid(NOW, "FR", 12345));

        ValidationOutcome outcome = validator.validate(records, policy(true, RunMode.INCREMENTAL));

        assertTrue(outcome.acceptable());
        assertEquals(1, outcome.duplicateCount());
        assertEquals(0, outcome.rejectedCount());
        assertEquals(3, outcome.acceptedCount());
        GridOperation kept = (GridOperation) outcome.acceptedRecords().stream()
                .filter(r -> r.getTimestamp().equals(NOW)).findFirst().orElseThrow();
        assertEquals(12345.0, kept.getLoadActualMw());
    }

    @Test
    @DisplayName("Consistency violations only warn")
    void testConsistencyWarnsOnly() {
        List<NormalizedRecord> records = TestRecords.hourlyGrid(NOW, "FR", 5);
        ((GridOperation) records.get(0)).setTotalGenerationMw(100.0);

        ValidationOutcome outcome = validator.validate(records, policy(true, RunMode.INCREMENTAL));

        assertTrue(outcome.acceptable());
        assertEquals(5, outcome.acceptedCount());
        assertTrue(outcome.warnings().stream().anyMatch(w -> w.contains("exceed total generation")));
        assertTrue(records.get(0).getDataQualityScore() < records.get(1).getDataQualityScore());
    }

    // ============================================================================
    // Freshness
    // ============================================================================

    @Test
    @DisplayName("Stale batch rejected in strict mode")
    void testStaleStrict() {
        List<NormalizedRecord> stale = TestRecords.hourlyGrid(NOW.minus(Duration.ofHours(5)), "FR", 4);

        ValidationOutcome outcome = validator.validate(stale, policy(true, RunMode.INCREMENTAL));

        assertFalse(outcome.acceptable());
        assertEquals(4, outcome.rejectedCount());
        assertTrue(outcome.acceptedRecords().isEmpty());
    }

    @Test
    @DisplayName("Stale batch only warns in non-strict mode")
    void testStaleNonStrict() {
        List<NormalizedRecord> stale = TestRecords.hourlyGrid(NOW.minus(Duration.ofHours(5)), "FR", 4);

        ValidationOutcome outcome = validator.validate(stale, policy(false, RunMode.INCREMENTAL));

        assertTrue(outcome.acceptable());
        assertTrue(outcome.warnings().stream().anyMatch(w -> w.startsWith("Stale data")));
    }

    @Test
    @DisplayName("Backfill skips the freshness check")
    void testBackfillSkipsFreshness() {
        List<NormalizedRecord> old = TestRecords.hourlyGrid(NOW.minus(Duration.ofDays(30)), "FR", 4);

        ValidationOutcome outcome = validator.validate(old, policy(true, RunMode.BACKFILL));

        assertTrue(outcome.acceptable());
        assertEquals(4, outcome.acceptedCount());
        // half the grid measurements are populated, every other ratio is 1
        assertEquals(0.875, outcome.acceptedRecords().get(0).getDataQualityScore(), 1e-9);
    }

    @Test
    @DisplayName("Freshness decays linearly past the threshold")
    void testFreshnessDecay() {
        Duration threshold = Duration.ofHours(1);
        assertEquals(1.0, RecordValidator.freshness(NOW.minus(Duration.ofMinutes(30)), NOW, threshold));
        assertEquals(0.5, RecordValidator.freshness(NOW.minus(Duration.ofMinutes(60 + 690)), NOW, threshold), 1e-9);
        assertEquals(0.0, RecordValidator.freshness(NOW.minus(Duration.ofDays(3)), NOW, threshold));
    }

    // ============================================================================
    // Synthetic scoring
    // ============================================================================

    @Test
    @DisplayName("Synthetic records are scored inside their tier band")
    void testSyntheticScoreBand() {
        List<NormalizedRecord> records = TestRecords.hourlyGrid(NOW, "FR", 5);
        records.forEach(r -> ((GridOperation) r).setSyntheticQuality(SyntheticQuality.BASIC));

        ValidationOutcome outcome = validator.validate(records, policy(false, RunMode.INCREMENTAL));

        outcome.acceptedRecords().forEach(r -> {
            assertTrue(r.getDataQualityScore() >= 0.30, "score " + r.getDataQualityScore());
            assertTrue(r.getDataQualityScore() <= 0.50, "score " + r.getDataQualityScore());
        });
    }
}
