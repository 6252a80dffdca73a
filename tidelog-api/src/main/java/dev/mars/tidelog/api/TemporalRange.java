/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.tidelog.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Represents an inclusive time window {@code [start, end]} for replaying events.
 * Either bound may be {@code null}, meaning unbounded on that side.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class TemporalRange {

    private final Instant start;
    private final Instant end;

    /**
     * Creates a new inclusive temporal range.
     *
     * @param start The start time (can be null for unbounded start)
     * @param end The end time (can be null for unbounded end)
     */
    public TemporalRange(Instant start, Instant end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Start time cannot be after end time");
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Creates an unbounded temporal range (all time).
     */
    public TemporalRange() {
        this(null, null);
    }

    public static TemporalRange from(Instant start) {
        return new TemporalRange(start, null);
    }

    public static TemporalRange until(Instant end) {
        return new TemporalRange(null, end);
    }

    public static TemporalRange at(Instant pointInTime) {
        return new TemporalRange(pointInTime, pointInTime);
    }

    public static TemporalRange all() {
        return new TemporalRange();
    }

    /**
     * Creates a range from optional bounds.
     */
    public static TemporalRange between(Instant start, Instant end) {
        return new TemporalRange(start, end);
    }

    /**
     * @return The start time, or null if unbounded
     */
    public Instant getStart() {
        return start;
    }

    /**
     * @return The end time, or null if unbounded
     */
    public Instant getEnd() {
        return end;
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }

    /**
     * Checks if a given time falls within this range. Both bounds are inclusive.
     *
     * @param time The time to check
     * @return true if the time is within the range
     */
    public boolean contains(Instant time) {
        if (time == null) {
            return false;
        }
        if (start != null && time.isBefore(start)) {
            return false;
        }
        return end == null || !time.isAfter(end);
    }

    /**
     * Checks whether the closed interval {@code [from, to]} intersects this range.
     */
    public boolean overlaps(Instant from, Instant to) {
        if (start != null && to.isBefore(start)) {
            return false;
        }
        return end == null || !from.isAfter(end);
    }

    /**
     * @return true if {@code time} lies after the end of this range
     */
    public boolean isBeyond(Instant time) {
        return end != null && time.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemporalRange that = (TemporalRange) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + (start != null ? start.toString() : "-∞") + ", "
                + (end != null ? end.toString() : "+∞") + "]";
    }
}
