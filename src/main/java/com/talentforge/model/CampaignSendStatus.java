package com.talentforge.model;

/**
 * Delivery status of a single campaign send.
 *
 * <p>Engagement statuses are ranked so a late event never moves a send
 * backwards. {@link #BOUNCED} and {@link #FAILED} are sticky.
 */
public enum CampaignSendStatus {
    PENDING(0),
    SENT(1),
    DELIVERED(2),
    OPENED(3),
    CLICKED(4),
    REPLIED(5),
    BOUNCED(100),
    FAILED(100);

    private final int rank;

    CampaignSendStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == BOUNCED || this == FAILED;
    }

    /**
     * Whether moving from this status to {@code next} is progress.
     */
    public boolean canAdvanceTo(CampaignSendStatus next) {
        if (isTerminal()) {
            return false;
        }
        return next.rank > rank;
    }
}
