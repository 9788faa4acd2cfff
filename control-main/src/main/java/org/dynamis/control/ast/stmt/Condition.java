package org.dynamis.control.ast.stmt;

import com.github.javaparser.ast.expr.Expression;
import org.dynamis.control.InvalidConstructException;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlBlock;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.printer.PrintUtil;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A single {@code if} block.
 * <p>
 * Use {@link IfTree} to chain {@code if}, {@code else if} and {@code else} blocks.
 * A condition without a guard can be built, but only renders once it is turned
 * into its {@link #asElse() else view}.
 */
public class Condition implements ControlBlock {

    private final JavaNode condition;
    private final Block body;

    Condition(JavaNode condition, Block body) {
        this.condition = condition;
        this.body = body;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Condition build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    /**
     * The guard. Required for a standalone condition and for the first block of an
     * {@link IfTree}, optional otherwise.
     */
    public Optional<Expression> getCondition() {
        return condition == null ? Optional.empty() : Optional.of((Expression) condition.getNode());
    }

    JavaNode guard() {
        return condition;
    }

    ControlExpression ifStatement() {
        return condition == null ? null : ControlExpression.ifStatement(condition);
    }

    @Override
    public ControlExpression getExpression() {
        ControlExpression statement = ifStatement();
        if (statement == null) {
            throw new InvalidConstructException("A condition must be provided with an 'if' statement", "condition");
        }
        return statement;
    }

    @Override
    public Block getBody() {
        return body;
    }

    /**
     * This condition as an {@code else} block: {@code else} without a guard,
     * {@code else if (...)} with one.
     */
    public Condition asElse() {
        return new ElseCondition(this);
    }

    /**
     * An {@link IfTree} holding only this condition.
     */
    public IfTree asTree() {
        return IfTree.of(this);
    }

    public Builder toBuilder() {
        Builder builder = builder().body(body);
        getCondition().ifPresent(builder::condition);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Condition that = (Condition) o;
        return Objects.equals(condition, that.condition) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), condition, body);
    }

    @Override
    public String toString() {
        if (condition == null && !(this instanceof ElseCondition)) {
            return "Condition[body=" + body + "]";
        }
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private Expression condition;
        private Block.Builder body = Block.builder();

        private Builder() {
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

        public Condition build() {
            return new Condition(JavaNode.ofNullable(condition), body.build());
        }
    }
}
