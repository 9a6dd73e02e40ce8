package com.ruach.formation.domain.event;

import com.ruach.formation.domain.valueobject.ContentType;
import com.ruach.formation.domain.valueobject.EventType;

public final class ContentUnlocked implements EventPayload {

    private final ContentType contentType;
    private final String contentId;
    private final String reason;

    /**
     * @param reason e.g. {@code prerequisites_satisfied}
     */
    public ContentUnlocked(ContentType contentType, String contentId, String reason) {
        this.contentType = PayloadChecks.requireValue(contentType, "contentType");
        this.contentId = PayloadChecks.requireText(contentId, "contentId");
        this.reason = PayloadChecks.requireText(reason, "reason");
    }

    @Override
    public EventType eventType() {
        return EventType.CONTENT_UNLOCKED;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public String getContentId() {
        return contentId;
    }

    public String getReason() {
        return reason;
    }
}
