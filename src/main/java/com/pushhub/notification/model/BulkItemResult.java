package com.pushhub.notification.model;

/**
 * Outcome of one notification within a bulk dispatch, keyed by its position
 * in the submitted list.
 */
public final class BulkItemResult {

    static final int PREVIEW_LENGTH = 50;

    private final int            index;
    private final String         title;
    private final String         bodyPreview;
    private final DispatchResult result;  // null on failure
    private final String         error;   // null on success

    private BulkItemResult(
            final int index,
            final Notification notification,
            final DispatchResult result,
            final String error) {
        this.index       = index;
        this.title       = notification.getTitle();
        this.bodyPreview = notification.bodyPreview(PREVIEW_LENGTH, true);
        this.result      = result;
        this.error       = error;
    }

    public static BulkItemResult success(final int index, final Notification n, final DispatchResult result) {
        return new BulkItemResult(index, n, result, null);
    }

    public static BulkItemResult failure(final int index, final Notification n, final String error) {
        return new BulkItemResult(index, n, null, error);
    }

    public int            getIndex()       { return index; }
    public String         getTitle()       { return title; }
    public String         getBodyPreview() { return bodyPreview; }
    public DispatchResult getResult()      { return result; }
    public String         getError()       { return error; }
    public boolean        isSuccess()      { return result != null; }
}
