package com.ruach.formation.domain.entity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Optional request context attached to an event for debugging and analysis.
 * All fields may be null.
 */
public final class EventMetadata {

    private static final EventMetadata EMPTY = new EventMetadata(null, null, null, null);

    private final String ipAddress;
    private final String userAgent;
    private final String sessionId;
    private final String sourceUrl;

    public EventMetadata(String ipAddress, String userAgent, String sessionId, String sourceUrl) {
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.sessionId = sessionId;
        this.sourceUrl = sourceUrl;
    }

    public static EventMetadata empty() {
        return EMPTY;
    }

    /**
     * Builds metadata from a loosely typed map, ignoring unknown keys.
     */
    public static EventMetadata fromMap(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new EventMetadata(
                stringOrNull(values.get("ipAddress")),
                stringOrNull(values.get("userAgent")),
                stringOrNull(values.get("sessionId")),
                stringOrNull(values.get("sourceUrl")));
    }

    /**
     * @return the non-null fields keyed by their camelCase names
     */
    public Map<String, String> toMap() {
        Map<String, String> values = new LinkedHashMap<>();
        putIfPresent(values, "ipAddress", ipAddress);
        putIfPresent(values, "userAgent", userAgent);
        putIfPresent(values, "sessionId", sessionId);
        putIfPresent(values, "sourceUrl", sourceUrl);
        return values;
    }

    public boolean isEmpty() {
        return ipAddress == null && userAgent == null && sessionId == null && sourceUrl == null;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }

    private static void putIfPresent(Map<String, String> values, String key, String value) {
        if (value != null) {
            values.put(key, value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        EventMetadata that = (EventMetadata) o;
        return Objects.equals(ipAddress, that.ipAddress)
                && Objects.equals(userAgent, that.userAgent)
                && Objects.equals(sessionId, that.sessionId)
                && Objects.equals(sourceUrl, that.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ipAddress, userAgent, sessionId, sourceUrl);
    }
}
