package com.costsentinel.core.ensemble;

import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What one aggregation produced: the confirmed records plus the per-slot
 * results they came from.
 *
 * @since 1.0.0
 */
public final class AggregationOutcome {

    private final List<AnomalyRecord> records;
    private final List<MethodResult> slotResults;
    private final String note;

    AggregationOutcome(List<AnomalyRecord> records, List<MethodResult> slotResults, String note) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records must not be null"));
        this.slotResults = List.copyOf(Objects.requireNonNull(slotResults, "slotResults must not be null"));
        this.note = note;
    }

    /**
     * @return confirmed records, best first
     */
    public List<AnomalyRecord> getRecords() {
        return records;
    }

    /**
     * @return one result per slot, in slot order
     */
    public List<MethodResult> getSlotResults() {
        return slotResults;
    }

    public List<DetectionMethod> getMethodsRun() {
        return slotResults.stream().map(MethodResult::getMethod).distinct().toList();
    }

    /**
     * @return {@code true} when no slot produced a usable result
     */
    public boolean isAllFailed() {
        return slotResults.stream().allMatch(MethodResult::isFailed);
    }

    public Optional<String> getNote() {
        return Optional.ofNullable(note);
    }

    @Override
    public String toString() {
        return "AggregationOutcome{" +
                "records=" + records.size() +
                ", methodsRun=" + getMethodsRun() +
                ", note='" + note + '\'' +
                '}';
    }
}
