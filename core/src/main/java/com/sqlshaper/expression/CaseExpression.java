package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A searched ({@code CASE WHEN cond THEN ...}) or simple ({@code CASE x WHEN v THEN ...})
 * conditional expression.
 */
public final class CaseExpression extends SqlComponent implements ValueExpression {

    /**
     * One WHEN/THEN pair.
     *
     * @param when the condition, or the comparison value of a simple CASE
     * @param then the result value
     */
    public record WhenThen(ValueExpression when, ValueExpression then) {
        public WhenThen {
            Objects.requireNonNull(when, "when must not be null");
            Objects.requireNonNull(then, "then must not be null");
        }
    }

    private final ValueExpression operand;
    private final List<WhenThen> branches;
    private final ValueExpression elseValue;

    /**
     * Creates a CASE expression.
     *
     * @param operand the compared value of a simple CASE, or null for a searched CASE
     * @param branches the WHEN/THEN pairs in order, at least one
     * @param elseValue the ELSE value, or null
     * @throws IllegalArgumentException if no branch is given
     */
    public CaseExpression(ValueExpression operand, List<WhenThen> branches, ValueExpression elseValue) {
        Objects.requireNonNull(branches, "branches must not be null");
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one WHEN branch");
        }
        this.operand = operand;
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
        this.elseValue = elseValue;
    }

    public ValueExpression operand() {
        return operand;
    }

    public List<WhenThen> branches() {
        return branches;
    }

    public ValueExpression elseValue() {
        return elseValue;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseExpression)) return false;
        CaseExpression that = (CaseExpression) obj;
        return Objects.equals(operand, that.operand)
            && branches.equals(that.branches)
            && Objects.equals(elseValue, that.elseValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, branches, elseValue);
    }

    @Override
    public String toString() {
        return "CASE" + (operand != null ? " " + operand : "") + " " + branches
            + (elseValue != null ? " ELSE " + elseValue : "") + " END";
    }
}
