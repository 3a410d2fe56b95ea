package com.costsentinel.core.ensemble;

import com.costsentinel.core.detection.CostAnomalyDetector;
import com.costsentinel.core.detection.DetectionException;
import com.costsentinel.core.model.AnomalyCandidate;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;
import com.costsentinel.core.series.NormalizedSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Detector with scripted behaviour: flags fixed indexes or fails.
 */
final class StubDetector implements CostAnomalyDetector {

    private final DetectionMethod method;
    private final int minimumPoints;
    private final int[] flagged;
    private final String failure;
    private final AtomicInteger calls = new AtomicInteger();

    private StubDetector(DetectionMethod method, int minimumPoints, int[] flagged, String failure) {
        this.method = method;
        this.minimumPoints = minimumPoints;
        this.flagged = flagged;
        this.failure = failure;
    }

    static StubDetector flagging(DetectionMethod method, int... indexes) {
        return new StubDetector(method, 1, indexes, null);
    }

    static StubDetector failing(DetectionMethod method, String message) {
        return new StubDetector(method, 1, new int[0], message);
    }

    static StubDetector needing(DetectionMethod method, int minimumPoints) {
        return new StubDetector(method, minimumPoints, new int[0], null);
    }

    int calls() {
        return calls.get();
    }

    @Override
    public DetectionMethod getMethod() {
        return method;
    }

    @Override
    public int getMinimumPoints() {
        return minimumPoints;
    }

    @Override
    public MethodResult detect(NormalizedSeries series, double threshold) {
        calls.incrementAndGet();
        if (failure != null) {
            throw new DetectionException(method, failure);
        }
        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int index : flagged) {
            candidates.add(AnomalyCandidate.of(series.get(index), 100.0, 3.0, method));
        }
        return MethodResult.primary(method, candidates);
    }
}
