package com.sqlshaper.expression;

import com.sqlshaper.query.OrderByItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The inline window of {@code OVER (PARTITION BY ... ORDER BY ... frame)}.
 */
public final class WindowSpec {

    private final List<ValueExpression> partitionBy;
    private final List<OrderByItem> orderBy;
    private final WindowFrame frame;

    public WindowSpec(List<ValueExpression> partitionBy, List<OrderByItem> orderBy, WindowFrame frame) {
        this.partitionBy = partitionBy == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(partitionBy));
        this.orderBy = orderBy == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(orderBy));
        this.frame = frame;
    }

    public List<ValueExpression> partitionBy() {
        return partitionBy;
    }

    public List<OrderByItem> orderBy() {
        return orderBy;
    }

    /**
     * Returns the frame clause, or null when the default frame applies.
     */
    public WindowFrame frame() {
        return frame;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowSpec)) return false;
        WindowSpec that = (WindowSpec) obj;
        return partitionBy.equals(that.partitionBy) && orderBy.equals(that.orderBy)
            && Objects.equals(frame, that.frame);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitionBy, orderBy, frame);
    }
}
