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

import java.util.Objects;

/**
 * The outcome of resolving overlays for one event: the latest overlay wins.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class OverlayDecision {

    public enum Kind {
        /** No overlay targets the event; the original payload stands. */
        NONE,
        /** The latest overlay replaces the payload. */
        UPDATE,
        /** The latest overlay is a tombstone. */
        DELETE
    }

    private static final OverlayDecision NONE = new OverlayDecision(Kind.NONE, null);

    private final Kind kind;
    private final String overlayId;

    private OverlayDecision(Kind kind, String overlayId) {
        this.kind = kind;
        this.overlayId = overlayId;
    }

    public static OverlayDecision none() {
        return NONE;
    }

    public static OverlayDecision update(String overlayId) {
        return new OverlayDecision(Kind.UPDATE, Objects.requireNonNull(overlayId, "Overlay ID cannot be null"));
    }

    public static OverlayDecision delete(String overlayId) {
        return new OverlayDecision(Kind.DELETE, Objects.requireNonNull(overlayId, "Overlay ID cannot be null"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return id of the winning overlay, or null for {@link Kind#NONE}
     */
    public String getOverlayId() {
        return overlayId;
    }

    public boolean isDelete() {
        return kind == Kind.DELETE;
    }

    public boolean isUpdate() {
        return kind == Kind.UPDATE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OverlayDecision that = (OverlayDecision) o;
        return kind == that.kind && Objects.equals(overlayId, that.overlayId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, overlayId);
    }

    @Override
    public String toString() {
        return kind == Kind.NONE ? "NONE" : kind + "(" + overlayId + ")";
    }
}
