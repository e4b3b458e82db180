package com.tessera.core.parser;

import com.tessera.core.model.WorkItemDraft;

import java.util.List;

/**
 * Outcome of one strategy attempt: drafts on success, a reason on failure.
 *
 * @param drafts recovered drafts, empty on failure
 * @param reason null on success
 * @param detail human-readable detail for logs, may be null
 */
public record StrategyResult(List<WorkItemDraft> drafts, FailureReason reason, String detail) {

    public StrategyResult {
        drafts = drafts != null ? List.copyOf(drafts) : List.of();
    }

    public static StrategyResult success(List<WorkItemDraft> drafts) {
        return new StrategyResult(drafts, null, null);
    }

    public static StrategyResult failure(FailureReason reason, String detail) {
        return new StrategyResult(List.of(), reason, detail);
    }

    public boolean isSuccess() {
        return reason == null;
    }
}
