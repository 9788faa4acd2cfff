package org.dynamis.control.ast.stmt;

import com.github.javaparser.ast.expr.Expression;
import org.dynamis.control.ConstructValidationException;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.ast.LabeledControlBlock;
import org.dynamis.control.ast.visitor.ControlFlowVisitor;
import org.dynamis.control.printer.PrintUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A conditional loop.
 * <pre>
 * while (condition) {
 *   body
 * }
 * </pre>
 * When {@link #isDoWhile()} is {@code true} the condition is checked after the body:
 * <pre>
 * do {
 *   body
 * } while (condition);
 * </pre>
 */
public final class WhileLoop implements LabeledControlBlock {

    private static final Logger LOGGER = LoggerFactory.getLogger(WhileLoop.class);

    private final String label;
    private final boolean doWhile;
    private final JavaNode condition;
    private final Block body;

    private WhileLoop(Builder builder) {
        this.label = builder.label;
        this.doWhile = builder.doWhile;
        this.condition = JavaNode.of(builder.condition);
        this.body = builder.body.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WhileLoop build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    @Override
    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    public boolean isDoWhile() {
        return doWhile;
    }

    public Expression getCondition() {
        return (Expression) condition.getNode();
    }

    /**
     * Always the {@code while (condition)} clause, whatever {@link #isDoWhile()} is.
     */
    public ControlExpression getStatement() {
        return ControlExpression.whileLoop(condition);
    }

    /**
     * {@code do} for a do-while loop; the trailing clause comes from {@link #getStatement()}.
     */
    @Override
    public ControlExpression getExpression() {
        return doWhile ? ControlExpression.DO_STATEMENT : getStatement();
    }

    @Override
    public Block getBody() {
        return body;
    }

    @Override
    public <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg) {
        return visitor.visitWhileLoop(this, arg);
    }

    public Builder toBuilder() {
        return builder()
                .label(label)
                .doWhile(doWhile)
                .condition(getCondition())
                .body(body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WhileLoop)) {
            return false;
        }
        WhileLoop that = (WhileLoop) o;
        return doWhile == that.doWhile
                && Objects.equals(label, that.label)
                && condition.equals(that.condition)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, doWhile, condition, body);
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private String label;
        private boolean doWhile;
        private Expression condition;
        private Block.Builder body = Block.builder();

        private Builder() {
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder doWhile(boolean doWhile) {
            this.doWhile = doWhile;
            return this;
        }

        public Builder condition(Expression condition) {
            this.condition = condition;
            return this;
        }

        public Builder body(Block body) {
            this.body = body.toBuilder();
            return this;
        }

        public Builder body(Consumer<Block.Builder> updates) {
            updates.accept(body);
            return this;
        }

        public WhileLoop build() {
            if (condition == null) {
                LOGGER.debug("Rejecting WhileLoop without a condition");
                throw new ConstructValidationException("WhileLoop requires a 'condition'", "WhileLoop", "condition");
            }
            return new WhileLoop(this);
        }
    }
}
