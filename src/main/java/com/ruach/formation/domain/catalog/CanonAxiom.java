package com.ruach.formation.domain.catalog;

import java.util.List;
import java.util.Objects;

import com.ruach.formation.domain.valueobject.FormationPhase;

/**
 * A unit of doctrinal content, unlocked once all of its prerequisites hold.
 */
public final class CanonAxiom {

    private final String id;
    private final String title;
    private final String content;
    private final FormationPhase phase;
    private final String author;
    private final List<AxiomPrerequisite> prerequisites;
    private final List<String> tags;

    public CanonAxiom(String id, String title, String content, FormationPhase phase, String author,
            List<AxiomPrerequisite> prerequisites, List<String> tags) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        this.id = id;
        this.title = title;
        this.content = content != null ? content : "";
        this.phase = phase;
        this.author = author;
        this.prerequisites = prerequisites != null ? List.copyOf(prerequisites) : List.of();
        this.tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public FormationPhase getPhase() {
        return phase;
    }

    public String getAuthor() {
        return author;
    }

    public List<AxiomPrerequisite> getPrerequisites() {
        return prerequisites;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Objects.equals(id, ((CanonAxiom) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonAxiom{id='" + id + "', phase=" + phase + "}";
    }
}
