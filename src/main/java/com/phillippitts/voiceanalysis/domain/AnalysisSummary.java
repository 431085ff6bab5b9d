package com.phillippitts.voiceanalysis.domain;

import java.time.Instant;

/**
 * Compact read model for "recent analyses" listings.
 *
 * @param id           analysis id
 * @param title        display title
 * @param status       {@code Completed}, {@code Pending} or {@code Failed}
 * @param creationDate creation timestamp
 */
public record AnalysisSummary(long id, String title, String status, Instant creationDate) {

    public static AnalysisSummary from(AnalysisRecord record) {
        String status;
        if (record.completionDate() != null) {
            status = "Completed";
        } else if (record.sendStatus() == SendStatus.ERROR) {
            status = "Failed";
        } else {
            status = "Pending";
        }
        return new AnalysisSummary(record.id(), record.title(), status, record.creationDate());
    }
}
