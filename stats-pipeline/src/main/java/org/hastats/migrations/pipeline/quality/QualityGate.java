package org.hastats.migrations.pipeline.quality;

import java.util.ArrayList;
import java.util.List;

import org.hastats.migrations.pipeline.ir.ClassifiedEntity;
import org.hastats.migrations.pipeline.ir.RawRecord;
import org.hastats.migrations.pipeline.ir.ValidatedRecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates record values before they enter the sink. Gaps are never interpolated:
 * a record without a usable value is dropped, not invented.
 */
@Slf4j
@RequiredArgsConstructor
public class QualityGate {

    private final QualityRules rules;

    public QualityOutcome validate(RawRecord candidate, ClassifiedEntity entity) {
        Double value = candidate.value();
        if (value == null) {
            return new QualityOutcome.Drop(DropReason.MISSING_VALUE);
        }
        if (!Double.isFinite(value)) {
            return new QualityOutcome.Drop(DropReason.NON_FINITE);
        }
        if (rules.sentinelValues().contains(value)) {
            return new QualityOutcome.Drop(DropReason.SENTINEL);
        }

        var bounds = rules.boundsFor(entity.descriptor().unit(), entity.category());
        if (bounds.isPresent() && !bounds.get().contains(value)) {
            if (rules.autoCorrect()) {
                return new QualityOutcome.Corrected(value, bounds.get().clamp(value));
            }
            return new QualityOutcome.Drop(DropReason.OUT_OF_RANGE);
        }
        return new QualityOutcome.Pass(value);
    }

    /**
     * Run a whole batch through the gate, tallying every outcome into {@code report}.
     */
    public ScreenedBatch screen(List<RawRecord> batch, ClassifiedEntity entity, QualityReport report) {
        var survivors = new ArrayList<ValidatedRecord>(batch.size());
        int corrected = 0;
        int dropped = 0;
        for (RawRecord raw : batch) {
            var outcome = validate(raw, entity);
            report.record(entity.externalId(), outcome);
            if (outcome instanceof QualityOutcome.Pass pass) {
                survivors.add(ValidatedRecord.of(raw, pass.value()));
            } else if (outcome instanceof QualityOutcome.Corrected correction) {
                survivors.add(ValidatedRecord.of(raw, correction.value()));
                corrected++;
            } else {
                dropped++;
            }
        }
        if (corrected > 0 || dropped > 0) {
            log.debug("{}: {} corrected, {} dropped of {} records", entity.externalId(), corrected, dropped, batch.size());
        }
        return new ScreenedBatch(survivors, corrected, dropped);
    }
}
