package com.sqlshaper.expression;

import java.util.Locale;
import java.util.Objects;

/**
 * A window frame: {@code ROWS|RANGE|GROUPS start} or {@code ... BETWEEN start AND end}.
 *
 * @param unit the frame unit
 * @param start the start bound
 * @param end the end bound, or null for the single-bound form
 */
public record WindowFrame(Unit unit, Bound start, Bound end) {

    public enum Unit {
        ROWS, RANGE, GROUPS;

        public String keyword() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum BoundKind {
        UNBOUNDED_PRECEDING("unbounded preceding"),
        PRECEDING("preceding"),
        CURRENT_ROW("current row"),
        FOLLOWING("following"),
        UNBOUNDED_FOLLOWING("unbounded following");

        private final String keyword;

        BoundKind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    /**
     * A frame bound; {@code offset} is set only for {@code n PRECEDING} and {@code n FOLLOWING}.
     */
    public record Bound(BoundKind kind, ValueExpression offset) {
        public Bound {
            Objects.requireNonNull(kind, "kind must not be null");
            boolean needsOffset = kind == BoundKind.PRECEDING || kind == BoundKind.FOLLOWING;
            if (needsOffset != (offset != null)) {
                throw new IllegalArgumentException("Offset is required exactly for PRECEDING and FOLLOWING bounds");
            }
        }

        public static Bound of(BoundKind kind) {
            return new Bound(kind, null);
        }
    }

    public WindowFrame {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(start, "start must not be null");
    }
}
