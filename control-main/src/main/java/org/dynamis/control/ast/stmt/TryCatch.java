package org.dynamis.control.ast.stmt;

import org.dynamis.control.ConstructValidationException;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlBlock;
import org.dynamis.control.ast.ControlTree;
import org.dynamis.control.printer.PrintUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A {@code try}/{@code catch} construct with an optional {@code finally} clause.
 * <pre>
 * try { body } catch (e) { ... } finally { handleAll }
 * </pre>
 * At least one handler is required; a try with only a finally clause is not
 * supported by this type.
 */
public final class TryCatch implements ControlTree {

    private static final Logger LOGGER = LoggerFactory.getLogger(TryCatch.class);

    private final Block body;
    private final List<CatchBlock> handlers;
    private final Block handleAll;

    private TryCatch(Block body, List<CatchBlock> handlers, Block handleAll) {
        this.body = body;
        this.handlers = handlers;
        this.handleAll = handleAll;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TryCatch build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    /**
     * The body of the {@code try} clause.
     */
    public Block getBody() {
        return body;
    }

    public List<CatchBlock> getHandlers() {
        return handlers;
    }

    /**
     * The body of the {@code finally} clause.
     */
    public Optional<Block> getHandleAll() {
        return Optional.ofNullable(handleAll);
    }

    /**
     * {@code try}, every handler in order, then {@code finally} or {@code null} when
     * there is no finally clause.
     */
    @Override
    public List<ControlBlock> getBlocks() {
        List<ControlBlock> blocks = new ArrayList<>(handlers.size() + 2);
        blocks.add(new TryBlock(body, TryBlock.Kind.TRY));
        blocks.addAll(handlers);
        blocks.add(handleAll == null ? null : new TryBlock(handleAll, TryBlock.Kind.FINALLY));
        return blocks;
    }

    public Builder toBuilder() {
        Builder builder = builder().body(body).addHandlers(handlers);
        if (handleAll != null) {
            builder.handleAll(handleAll);
        }
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TryCatch)) {
            return false;
        }
        TryCatch that = (TryCatch) o;
        return body.equals(that.body)
                && handlers.equals(that.handlers)
                && Objects.equals(handleAll, that.handleAll);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, handlers, handleAll);
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private Block.Builder body = Block.builder();
        private Block.Builder handleAll;
        private final List<CatchBlock> handlers = new ArrayList<>();

        private Builder() {
        }

        public Builder body(Block body) {
            this.body = body.toBuilder();
            return this;
        }

        public Builder body(Consumer<Block.Builder> updates) {
            updates.accept(body);
            return this;
        }

        /**
         * Builds a {@code catch} clause with {@code updates} and adds it to the handlers.
         */
        public Builder addCatch(Consumer<CatchBlock.Builder> updates) {
            return addHandler(CatchBlock.build(updates));
        }

        public Builder addHandler(CatchBlock handler) {
            if (handler == null) {
                throw new NullPointerException("handler");
            }
            handlers.add(handler);
            return this;
        }

        public Builder addHandlers(Iterable<CatchBlock> handlers) {
            for (CatchBlock handler : handlers) {
                addHandler(handler);
            }
            return this;
        }

        /**
         * Replaces the {@code finally} body with one built by {@code updates}.
         */
        public Builder addFinally(Consumer<Block.Builder> updates) {
            Block.Builder builder = Block.builder();
            updates.accept(builder);
            this.handleAll = builder;
            return this;
        }

        public Builder handleAll(Block handleAll) {
            this.handleAll = handleAll == null ? null : handleAll.toBuilder();
            return this;
        }

        public TryCatch build() {
            if (handlers.isEmpty()) {
                LOGGER.debug("Rejecting TryCatch without handlers");
                throw new ConstructValidationException("One or more 'catch' clauses must be specified", "TryCatch", "handlers");
            }
            return new TryCatch(body.build(), List.copyOf(handlers), handleAll == null ? null : handleAll.build());
        }
    }
}
