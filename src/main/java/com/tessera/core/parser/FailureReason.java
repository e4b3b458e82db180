package com.tessera.core.parser;

/**
 * Why a strategy did not produce a usable batch.
 */
public enum FailureReason {
    /** The text has no structure this strategy recognises. */
    NO_MATCH,
    EMPTY_INPUT,
    /** The strategy produced drafts but at least one had no description. */
    INVALID_ITEMS,
    GENERATION_FAILED,
    REPLAY_DISABLED,
    /** Replay needs the original intent and none was given. */
    REPLAY_UNAVAILABLE,
    /** The strategy threw; the chain recorded it and moved on. */
    INTERNAL_ERROR
}
