package dev.autoapply.model;

/**
 * What a single dispatch attempt did to its queue entry.
 */
public enum DispatchResult {
    /** Worker answered 202; the entry waits for its callback in PROCESSING. */
    ACCEPTED,
    /** Daily cap reached; the entry was parked in STANDBY. */
    STANDBY,
    /** Worker never reported ready; the entry is FAILED. */
    WAKE_UP_FAILED,
    /** Worker answered something other than 202, or the handoff timed out; the entry is FAILED. */
    REJECTED,
    /** Payload was missing; the entry is FAILED. */
    PAYLOAD_MISSING,
    /** Entry was not PENDING when the dispatch started; nothing changed. */
    NOT_DISPATCHABLE,
    /** A callback finished the entry before the dispatch could record its failure; nothing changed. */
    ALREADY_FINISHED,
    /** The dispatch raised an unexpected error; the entry keeps whatever state it reached. */
    ERROR
}
