package com.talent.sourcing.rest.dto;

import com.talent.sourcing.pipeline.CandidateRecord;
import com.talent.sourcing.pipeline.CollectionResult;
import com.talent.sourcing.pipeline.CreditLedger;
import com.talent.sourcing.pipeline.ItemFailure;

import java.util.List;

/**
 * Response DTO for one collection page.
 */
public record CollectionResponse(
        String sessionId,
        List<CandidateRecord> records,
        List<ItemFailure> failures,
        Credits credits,
        int nextOffset,
        boolean cancelled,
        String summary
) {
    public record Credits(int fetched, int cached, int skipped, int failed,
                          int organizationsFetched, int organizationsCached, int creditsSpent) {

        static Credits from(CreditLedger ledger) {
            return new Credits(ledger.getFetched(), ledger.getCached(), ledger.getSkipped(), ledger.getFailed(),
                    ledger.getOrganizationsFetched(), ledger.getOrganizationsCached(), ledger.creditsSpent());
        }
    }

    public static CollectionResponse from(CollectionResult result) {
        return new CollectionResponse(result.sessionId(), result.records(), result.failures(),
                Credits.from(result.ledger()), result.nextOffset(), result.cancelled(), result.summary());
    }
}
