package org.dynamis.control.ast.stmt;

import com.github.javaparser.ast.expr.Expression;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.ast.LabeledControlBlock;
import org.dynamis.control.printer.PrintUtil;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A classic counted loop.
 * <pre>
 * for (initialize; condition; advance) {
 *   body
 * }
 * </pre>
 * Each clause may be left out; both separators are still emitted.
 */
public final class ForLoop implements LabeledControlBlock {

    private final String label;
    private final JavaNode initialize;
    private final JavaNode condition;
    private final JavaNode advance;
    private final Block body;

    private ForLoop(Builder builder) {
        this.label = builder.label;
        this.initialize = JavaNode.ofNullable(builder.initialize);
        this.condition = JavaNode.ofNullable(builder.condition);
        this.advance = JavaNode.ofNullable(builder.advance);
        this.body = builder.body.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ForLoop build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    @Override
    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    public Optional<Expression> getInitialize() {
        return expressionOf(initialize);
    }

    public Optional<Expression> getCondition() {
        return expressionOf(condition);
    }

    public Optional<Expression> getAdvance() {
        return expressionOf(advance);
    }

    private static Optional<Expression> expressionOf(JavaNode node) {
        return node == null ? Optional.empty() : Optional.of((Expression) node.getNode());
    }

    @Override
    public ControlExpression getExpression() {
        return ControlExpression.forLoop(initialize, condition, advance);
    }

    @Override
    public Block getBody() {
        return body;
    }

    public Builder toBuilder() {
        Builder builder = builder().label(label).body(body);
        getInitialize().ifPresent(builder::initialize);
        getCondition().ifPresent(builder::condition);
        getAdvance().ifPresent(builder::advance);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ForLoop)) {
            return false;
        }
        ForLoop that = (ForLoop) o;
        return Objects.equals(label, that.label)
                && Objects.equals(initialize, that.initialize)
                && Objects.equals(condition, that.condition)
                && Objects.equals(advance, that.advance)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, initialize, condition, advance, body);
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private String label;
        private Expression initialize;
        private Expression condition;
        private Expression advance;
        private Block.Builder body = Block.builder();

        private Builder() {
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder initialize(Expression initialize) {
            this.initialize = initialize;
            return this;
        }

        public Builder condition(Expression condition) {
            this.condition = condition;
            return this;
        }

        public Builder advance(Expression advance) {
            this.advance = advance;
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

        public ForLoop build() {
            return new ForLoop(this);
        }
    }
}
