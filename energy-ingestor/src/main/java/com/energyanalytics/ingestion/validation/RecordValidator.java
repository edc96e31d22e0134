package com.energyanalytics.ingestion.validation;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties.Validation.QualityWeights;
import com.energyanalytics.ingestion.model.NaturalKey;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.ValidationOutcome;
import com.energyanalytics.ingestion.validation.ValidationRules.ConsistencyCheck;
import com.energyanalytics.ingestion.validation.ValidationRules.Range;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Quality gate between fetch and write.
 *
 * Hard checks drop records: missing natural key, too few required fields, any value
 * outside its physical bounds. Consistency checks and duplicate keys only produce
 * warnings. Stale data is a warning, or rejects the whole batch in strict mode.
 *
 * Every accepted record gets a quality score: the weighted mean of its completeness,
 * accuracy, freshness and consistency ratios, mapped into its synthetic tier's band
 * when the record was generated.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecordValidator {

    private final Clock clock;

    public ValidationOutcome validate(List<NormalizedRecord> records, ValidationPolicy policy) {
        ValidationRules rules = policy.rules();
        List<String> warnings = new ArrayList<>();

        if (records.isEmpty()) {
            warnings.add("Empty batch: nothing to validate");
            return new ValidationOutcome(List.of(), 0, 0, 0, warnings, true);
        }

        // ── Duplicate natural keys: the last occurrence wins ──────────────────
        Map<NaturalKey, NormalizedRecord> unique = new LinkedHashMap<>();
        int rejected = 0;
        for (NormalizedRecord record : records) {
            if (record.getTimestamp() == null || record.getEntityKey() == null) {
                rejected++;
                continue;
            }
            unique.remove(record.naturalKey());
            unique.put(record.naturalKey(), record);
        }
        int duplicates = records.size() - rejected - unique.size();
        if (rejected > 0) {
            warnings.add(rejected + " records without timestamp or entity key");
        }
        if (duplicates > 0) {
            warnings.add(duplicates + " duplicate natural keys, kept last occurrence");
        }

        // ── Per-record completeness and accuracy ──────────────────────────────
        Instant now = clock.instant();
        int incomplete = 0;
        int outOfBounds = 0;
        Map<String, Integer> inconsistencies = new TreeMap<>();
        List<NormalizedRecord> accepted = new ArrayList<>();

        for (NormalizedRecord record : unique.values()) {
            Map<String, Double> values = record.measurements();

            if (requiredRatio(values, rules) < rules.getCompletenessMinimum()) {
                incomplete++;
                continue;
            }
            if (!withinBounds(values, rules)) {
                outOfBounds++;
                continue;
            }

            int passed = 0;
            for (ConsistencyCheck check : rules.getConsistencyChecks()) {
                if (check.holds().test(record)) {
                    passed++;
                } else {
                    inconsistencies.merge(check.description(), 1, Integer::sum);
                }
            }
            double consistency = rules.getConsistencyChecks().isEmpty()
                    ? 1.0 : (double) passed / rules.getConsistencyChecks().size();
            double freshness = policy.checkFreshness()
                    ? freshness(record.getTimestamp(), now, rules.getStalenessThreshold()) : 1.0;

            record.setDataQualityScore(score(record, presentRatio(values), freshness, consistency, policy.weights()));
            accepted.add(record);
        }

        rejected += incomplete + outOfBounds;
        if (incomplete > 0) {
            warnings.add(incomplete + " records below completeness minimum " + rules.getCompletenessMinimum());
        }
        if (outOfBounds > 0) {
            warnings.add(outOfBounds + " records with values outside physical bounds");
        }
        inconsistencies.forEach((description, count) -> warnings.add(count + " records: " + description));

        // ── Batch freshness ───────────────────────────────────────────────────
        if (policy.checkFreshness() && !accepted.isEmpty()) {
            Instant latest = accepted.stream().map(NormalizedRecord::getTimestamp).max(Instant::compareTo).orElseThrow();
            Duration age = Duration.between(latest, now);
            if (age.compareTo(rules.getStalenessThreshold()) > 0) {
                String message = String.format("Stale data: latest %s record is %d min old (threshold %d min)",
                        rules.getSourceType(), age.toMinutes(), rules.getStalenessThreshold().toMinutes());
                warnings.add(message);
                if (policy.strict()) {
                    log.warn("{}: {}, rejecting batch", rules.getSourceType(), message);
                    return new ValidationOutcome(List.of(), records.size(), records.size(), duplicates, warnings, false);
                }
            }
        }

        double ratio = (double) rejected / records.size();
        boolean acceptable = ratio <= policy.rejectionTolerance();
        ValidationOutcome outcome = new ValidationOutcome(accepted, records.size(), rejected, duplicates, warnings, acceptable);

        if (!warnings.isEmpty()) {
            log.warn("{} validation: {}", rules.getSourceType(), outcome.summary());
        }
        log.info("{} validation: {}/{} accepted, {} rejected, {} duplicates -> {}",
                rules.getSourceType(), accepted.size(), records.size(), rejected, duplicates,
                acceptable ? "acceptable" : "rejected");
        return outcome;
    }

    // ── Ratios ────────────────────────────────────────────────────────────────

    private double requiredRatio(Map<String, Double> values, ValidationRules rules) {
        if (rules.getRequiredFields().isEmpty()) return 1.0;
        long present = rules.getRequiredFields().stream().filter(f -> values.get(f) != null).count();
        return (double) present / rules.getRequiredFields().size();
    }

    private double presentRatio(Map<String, Double> values) {
        if (values.isEmpty()) return 1.0;
        long present = values.values().stream().filter(v -> v != null).count();
        return (double) present / values.size();
    }

    private boolean withinBounds(Map<String, Double> values, ValidationRules rules) {
        for (Map.Entry<String, Double> e : values.entrySet()) {
            Range range = rules.getBounds().get(e.getKey());
            Double v = e.getValue();
            if (v == null) continue;
            if (v.isNaN() || v.isInfinite()) return false;
            if (range != null && !range.contains(v)) return false;
        }
        return true;
    }

    /** 1.0 up to the threshold, then linear decay reaching 0 at 24x the threshold. */
    static double freshness(Instant timestamp, Instant now, Duration threshold) {
        long age = Duration.between(timestamp, now).getSeconds();
        long limit = threshold.getSeconds();
        if (age <= limit) return 1.0;
        return Math.max(0.0, 1.0 - (double) (age - limit) / (limit * 23));
    }

    private double score(NormalizedRecord record, double completeness, double freshness, double consistency,
                         QualityWeights w) {
        // Accepted records passed every bound
        double accuracy = 1.0;
        double totalWeight = w.getCompleteness() + w.getAccuracy() + w.getFreshness() + w.getConsistency();
        double raw = totalWeight <= 0 ? 1.0
                : (w.getCompleteness() * completeness + w.getAccuracy() * accuracy
                + w.getFreshness() * freshness + w.getConsistency() * consistency) / totalWeight;
        double scored = record.isSynthetic() ? record.getSyntheticQuality().scale(raw) : raw;
        return Math.round(scored * 1000) / 1000.0;
    }
}
