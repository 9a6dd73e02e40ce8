package com.ruach.formation.domain.entity;

import java.util.Objects;

import com.ruach.formation.domain.valueobject.GapSeverity;
import com.ruach.formation.domain.valueobject.GapType;

/**
 * An identified deficiency area with a severity and a remedial recommendation.
 */
public final class FormationGap {

    private final GapType type;
    private final String area;
    private final GapSeverity severity;
    private final String recommendation;

    public FormationGap(GapType type, String area, GapSeverity severity, String recommendation) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (area == null || area.isBlank()) {
            throw new IllegalArgumentException("area cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        this.type = type;
        this.area = area;
        this.severity = severity;
        this.recommendation = recommendation != null ? recommendation : "";
    }

    public GapType getType() {
        return type;
    }

    public String getArea() {
        return area;
    }

    public GapSeverity getSeverity() {
        return severity;
    }

    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FormationGap that = (FormationGap) o;
        return type == that.type
                && Objects.equals(area, that.area)
                && severity == that.severity
                && Objects.equals(recommendation, that.recommendation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, area, severity, recommendation);
    }

    @Override
    public String toString() {
        return "FormationGap{type=" + type + ", area='" + area + "', severity=" + severity + "}";
    }
}
