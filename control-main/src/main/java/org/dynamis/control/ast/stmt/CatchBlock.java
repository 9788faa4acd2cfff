package org.dynamis.control.ast.stmt;

import com.github.javaparser.ast.type.Type;
import org.dynamis.control.ConstructValidationException;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlBlock;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.printer.PrintUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A {@code catch} clause of a {@link TryCatch}.
 * <pre>
 * catch (exception) { ... }
 * catch (exception, stacktrace) { ... }
 * on Type catch (exception) { ... }
 * </pre>
 */
public final class CatchBlock implements ControlBlock {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatchBlock.class);

    private final JavaNode type;
    private final String exception;
    private final String stacktrace;
    private final Block body;

    private CatchBlock(Builder builder) {
        this.type = JavaNode.ofNullable(builder.type);
        this.exception = builder.exception;
        this.stacktrace = builder.stacktrace;
        this.body = builder.body.build();
    }

    /**
     * A builder whose exception name is {@code e}.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static CatchBlock build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    /**
     * The type of exception to catch, emitted as an {@code on} clause.
     */
    public Optional<Type> getType() {
        return type == null ? Optional.empty() : Optional.of((Type) type.getNode());
    }

    public String getException() {
        return exception;
    }

    public Optional<String> getStacktrace() {
        return Optional.ofNullable(stacktrace);
    }

    private ControlExpression catchStatement() {
        return ControlExpression.catchStatement(exception, stacktrace);
    }

    @Override
    public ControlExpression getExpression() {
        return type == null ? catchStatement() : ControlExpression.onStatement(type, catchStatement());
    }

    @Override
    public Block getBody() {
        return body;
    }

    public Builder toBuilder() {
        Builder builder = builder().exception(exception).stacktrace(stacktrace).body(body);
        getType().ifPresent(builder::type);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CatchBlock)) {
            return false;
        }
        CatchBlock that = (CatchBlock) o;
        return Objects.equals(type, that.type)
                && exception.equals(that.exception)
                && Objects.equals(stacktrace, that.stacktrace)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, exception, stacktrace, body);
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private Type type;
        private String exception;
        private String stacktrace;
        private Block.Builder body = Block.builder();

        private Builder() {
            this.exception = "e";
        }

        public Builder type(Type type) {
            this.type = type;
            return this;
        }

        public Builder exception(String exception) {
            this.exception = exception;
            return this;
        }

        /**
         * The stacktrace parameter name; left out of the clause when {@code null}.
         */
        public Builder stacktrace(String stacktrace) {
            this.stacktrace = stacktrace;
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

        public CatchBlock build() {
            if (exception == null || exception.isBlank()) {
                LOGGER.debug("Rejecting CatchBlock without an exception name");
                throw new ConstructValidationException("CatchBlock requires an 'exception' name", "CatchBlock", "exception");
            }
            return new CatchBlock(this);
        }
    }
}
