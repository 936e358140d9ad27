package com.abroadhelper.resources.model;

/**
 * Outcome of one link probe. {@code statusCode} is 0 when no response arrived; {@code reason} is
 * set for broken transport failures and indeterminate outcomes.
 */
public record LinkCheckResult(LinkStatus status, int statusCode, String reason) {

    public static LinkCheckResult live(int statusCode) {
        return new LinkCheckResult(LinkStatus.LIVE, statusCode, null);
    }

    public static LinkCheckResult broken(int statusCode, String reason) {
        return new LinkCheckResult(LinkStatus.BROKEN, statusCode, reason);
    }

    public static LinkCheckResult indeterminate(String reason) {
        return new LinkCheckResult(LinkStatus.INDETERMINATE, 0, reason);
    }

    public boolean isLive() {
        return status == LinkStatus.LIVE;
    }
}
