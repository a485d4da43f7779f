package com.siteaudit.scan.service;

import com.siteaudit.scan.model.ScanJob;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Current state of every submitted scan job, keyed by scan id.
 */
@Component
public class ScanJobRegistry {
    private final Map<String, ScanJob> jobs = new ConcurrentHashMap<>();

    public void register(ScanJob job) {
        jobs.put(job.id(), job);
    }

    public Optional<ScanJob> get(String scanId) {
        return Optional.ofNullable(jobs.get(scanId));
    }

    /**
     * Applies a transition unless the job is already terminal.
     */
    public Optional<ScanJob> update(String scanId, UnaryOperator<ScanJob> transition) {
        return Optional.ofNullable(jobs.computeIfPresent(
            scanId,
            (id, current) -> current.isTerminal() ? current : transition.apply(current)
        ));
    }
}
