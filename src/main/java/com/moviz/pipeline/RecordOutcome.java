package com.moviz.pipeline;

/**
 * Result of normalizing one raw record: either a record or a rejection, never both.
 */
public record RecordOutcome(NormalizedRecord record, Rejection rejection) {

    public static RecordOutcome accepted(NormalizedRecord record) {
        return new RecordOutcome(record, null);
    }

    public static RecordOutcome rejected(Rejection rejection) {
        return new RecordOutcome(null, rejection);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
