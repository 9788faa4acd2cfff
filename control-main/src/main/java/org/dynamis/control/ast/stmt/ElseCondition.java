package org.dynamis.control.ast.stmt;

import org.dynamis.control.ast.ControlExpression;

/**
 * A {@link Condition} preceded by {@code else}. Renders with or without a guard.
 */
final class ElseCondition extends Condition {

    ElseCondition(Condition condition) {
        super(condition.guard(), condition.getBody());
    }

    @Override
    public ControlExpression getExpression() {
        return ControlExpression.elseStatement(ifStatement());
    }

    @Override
    public Condition asElse() {
        return this;
    }
}
