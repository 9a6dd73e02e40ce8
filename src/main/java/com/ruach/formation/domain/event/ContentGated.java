package com.ruach.formation.domain.event;

import java.util.List;

import com.ruach.formation.domain.valueobject.ContentType;
import com.ruach.formation.domain.valueobject.EventType;

public final class ContentGated implements EventPayload {

    private final ContentType contentType;
    private final String contentId;
    private final String reason;
    private final List<String> requirementsNeeded;

    public ContentGated(ContentType contentType, String contentId, String reason,
            List<String> requirementsNeeded) {
        this.contentType = PayloadChecks.requireValue(contentType, "contentType");
        this.contentId = PayloadChecks.requireText(contentId, "contentId");
        this.reason = PayloadChecks.requireText(reason, "reason");
        this.requirementsNeeded = requirementsNeeded != null
                ? List.copyOf(requirementsNeeded)
                : List.of();
    }

    @Override
    public EventType eventType() {
        return EventType.CONTENT_GATED;
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

    public List<String> getRequirementsNeeded() {
        return requirementsNeeded;
    }
}
