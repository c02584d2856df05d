package com.talent.sourcing.pipeline;

import java.util.List;

/**
 * Outcome of one collection page. Records are in candidate-id order; candidates that
 * failed after their retry are listed in {@code failures} and absent from {@code records}.
 *
 * @param sessionId  the run
 * @param startIndex first index of the page
 * @param requested  ids in the page after truncation at the end of the list
 * @param records    collected records
 * @param failures   per-candidate failures
 * @param ledger     credit accounting for this page
 * @param nextOffset session pagination offset after this page
 * @param cancelled  whether the page stopped early on cancellation
 */
public record CollectionResult(String sessionId, int startIndex, int requested, List<CandidateRecord> records,
                               List<ItemFailure> failures, CreditLedger ledger, int nextOffset,
                               boolean cancelled) {

    public CollectionResult {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
    }

    public int processed() {
        return records.size() + failures.size();
    }

    public String summary() {
        return records.size() + " of " + requested + " collected, " + failures.size() + " failed";
    }
}
