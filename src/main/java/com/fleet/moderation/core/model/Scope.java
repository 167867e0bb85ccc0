package com.fleet.moderation.core.model;

import java.util.Objects;

/**
 * A collaborative space (group or channel) the agent can act within.
 * Two scopes are equal when their ids are equal; the title is display-only.
 *
 * @param id    the scope's numeric id
 * @param title the scope's display title
 */
public record Scope(long id, String title) {

    public Scope {
        title = title != null ? title : String.valueOf(id);
    }

    public static Scope of(long id, String title) {
        return new Scope(id, title);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Scope other && id == other.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
