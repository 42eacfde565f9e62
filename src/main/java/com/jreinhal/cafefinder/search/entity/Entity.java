package com.jreinhal.cafefinder.search.entity;

import java.util.Objects;

/**
 * A typed span of the query. {@code position} is a half-open {@code [start, end)} range over the raw query.
 */
public record Entity(EntityType type, String value, String normalizedValue, double confidence, Position position) {

    public Entity {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(position, "position");
        value = value == null ? "" : value;
        normalizedValue = normalizedValue == null ? "" : normalizedValue;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public boolean overlaps(Entity other) {
        return this.position.overlaps(other.position);
    }

    public record Position(int start, int end) {

        public Position {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
            }
        }

        public boolean overlaps(Position other) {
            return this.start < other.end && other.start < this.end;
        }

        public int length() {
            return this.end - this.start;
        }
    }
}
