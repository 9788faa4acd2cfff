package org.dynamis.control.ast.stmt;

import com.github.javaparser.ast.expr.Expression;
import org.dynamis.control.ConstructValidationException;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.ast.LabeledControlBlock;
import org.dynamis.control.printer.PrintUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A loop over the elements of an iterable object.
 * <pre>
 * for (variable in object) {
 *   body
 * }
 * </pre>
 * When {@link #isAsync()} is {@code true} the loop is emitted as {@code await for}.
 */
public final class ForInLoop implements LabeledControlBlock {

    private static final Logger LOGGER = LoggerFactory.getLogger(ForInLoop.class);

    private final String label;
    private final boolean async;
    private final JavaNode variable;
    private final JavaNode object;
    private final Block body;

    private ForInLoop(Builder builder) {
        this.label = builder.label;
        this.async = builder.async;
        this.variable = JavaNode.of(builder.variable);
        this.object = JavaNode.of(builder.object);
        this.body = builder.body.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ForInLoop build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    @Override
    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    public boolean isAsync() {
        return async;
    }

    /**
     * The iterated variable, before {@code in}.
     */
    public Expression getVariable() {
        return (Expression) variable.getNode();
    }

    /**
     * The object iterated on, after {@code in}.
     */
    public Expression getObject() {
        return (Expression) object.getNode();
    }

    @Override
    public ControlExpression getExpression() {
        return async
                ? ControlExpression.awaitForLoop(variable, object)
                : ControlExpression.forInLoop(variable, object);
    }

    @Override
    public Block getBody() {
        return body;
    }

    public Builder toBuilder() {
        return builder()
                .label(label)
                .async(async)
                .variable(getVariable())
                .object(getObject())
                .body(body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ForInLoop)) {
            return false;
        }
        ForInLoop that = (ForInLoop) o;
        return async == that.async
                && Objects.equals(label, that.label)
                && variable.equals(that.variable)
                && object.equals(that.object)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, async, variable, object, body);
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private String label;
        private boolean async;
        private Expression variable;
        private Expression object;
        private Block.Builder body = Block.builder();

        private Builder() {
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public Builder variable(Expression variable) {
            this.variable = variable;
            return this;
        }

        public Builder object(Expression object) {
            this.object = object;
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

        public ForInLoop build() {
            if (variable == null) {
                throw missing("variable");
            }
            if (object == null) {
                throw missing("object");
            }
            return new ForInLoop(this);
        }

        private static ConstructValidationException missing(String field) {
            LOGGER.debug("Rejecting ForInLoop without '{}'", field);
            return new ConstructValidationException("ForInLoop requires '" + field + "'", "ForInLoop", field);
        }
    }
}
