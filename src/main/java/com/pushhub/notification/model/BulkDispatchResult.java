package com.pushhub.notification.model;

import java.util.List;

/**
 * Aggregate of a sequential bulk dispatch. Items appear in submission order.
 */
public final class BulkDispatchResult {

    private final List<BulkItemResult> results;

    public BulkDispatchResult(final List<BulkItemResult> results) {
        this.results = List.copyOf(results);
    }

    public int getTotal()      { return results.size(); }
    public int getSuccessful() { return (int) results.stream().filter(BulkItemResult::isSuccess).count(); }
    public int getFailed()     { return getTotal() - getSuccessful(); }

    public List<BulkItemResult> getResults() { return results; }

    @Override
    public String toString() {
        return "BulkDispatchResult{total=" + getTotal()
             + ", successful=" + getSuccessful()
             + ", failed=" + getFailed() + "}";
    }
}
