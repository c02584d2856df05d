package com.talent.sourcing.pipeline;

import java.util.List;

/**
 * Outcome of one preview batch.
 *
 * @param sessionId       the run
 * @param batchIndex      organization batch searched
 * @param idsFound        candidate ids returned by the search
 * @param idsAdded        ids newly appended to the session after dedupe and cap
 * @param totalIds        candidate ids now stored in the session
 * @param previews        partial records returned by the free preview call
 * @param hasMoreBatches  whether further organization batches remain
 */
public record PreviewResult(String sessionId, int batchIndex, int idsFound, int idsAdded, int totalIds,
                            List<CandidateRecord> previews, boolean hasMoreBatches) {

    public PreviewResult {
        previews = List.copyOf(previews);
    }
}
