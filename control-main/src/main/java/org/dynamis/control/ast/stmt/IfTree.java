package org.dynamis.control.ast.stmt;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.ThrowStmt;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlBlock;
import org.dynamis.control.ast.ControlTree;
import org.dynamis.control.printer.PrintUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@code if}/{@code else} chain.
 * <p>
 * The first condition is emitted as an {@code if} block; every following one is
 * emitted through {@link Condition#asElse()}. The stored conditions are never
 * rewritten: the else form is derived from each condition's position whenever
 * {@link #getBlocks()} is called.
 */
public final class IfTree implements ControlTree {

    private static final IfTree EMPTY = new IfTree(List.of());

    private final List<Condition> conditions;

    private IfTree(List<Condition> conditions) {
        this.conditions = conditions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static IfTree build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    public static IfTree of(Iterable<Condition> conditions) {
        return builder().addAll(conditions).build();
    }

    public static IfTree of(Condition... conditions) {
        return of(Arrays.asList(conditions));
    }

    /**
     * The conditions as they were added.
     */
    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public List<ControlBlock> getBlocks() {
        List<ControlBlock> blocks = new ArrayList<>(conditions.size());
        for (int i = 0; i < conditions.size(); i++) {
            blocks.add(blockAt(i, conditions.get(i)));
        }
        return blocks;
    }

    private static Condition blockAt(int position, Condition condition) {
        return position == 0 ? condition : condition.asElse();
    }

    /**
     * A new tree with {@code condition} appended.
     */
    public IfTree withCondition(Condition condition) {
        return toBuilder().add(condition).build();
    }

    /**
     * Builds a condition with {@code updates} and returns a new tree with it appended.
     */
    public IfTree elseIf(Consumer<Condition.Builder> updates) {
        return withCondition(Condition.build(updates));
    }

    /**
     * Builds a body with {@code updates} and returns a new tree ending in a plain
     * {@code else} block.
     */
    public IfTree orElse(Consumer<Block.Builder> updates) {
        return toBuilder().orElse(updates).build();
    }

    public Builder toBuilder() {
        return builder().addAll(conditions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IfTree)) {
            return false;
        }
        return conditions.equals(((IfTree) o).conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private final List<Condition> conditions = new ArrayList<>();

        private Builder() {
        }

        /**
         * Builds a condition with {@code updates} and adds it.
         */
        public Builder ifThen(Consumer<Condition.Builder> updates) {
            return add(Condition.build(updates));
        }

        public Builder add(Condition condition) {
            if (condition == null) {
                throw new NullPointerException("condition");
            }
            conditions.add(condition);
            return this;
        }

        public Builder addAll(Iterable<Condition> conditions) {
            for (Condition condition : conditions) {
                add(condition);
            }
            return this;
        }

        /**
         * Adds a guard-less condition whose body is built with {@code updates}.
         */
        public Builder orElse(Consumer<Block.Builder> updates) {
            return add(Condition.build(block -> block.body(updates)));
        }

        /**
         * Adds a guard-less condition whose body throws {@code expression}.
         */
        public Builder orElseThrow(Expression expression) {
            return orElse(body -> body.addStatement(new ThrowStmt(expression.clone())));
        }

        public IfTree build() {
            return conditions.isEmpty() ? EMPTY : new IfTree(List.copyOf(conditions));
        }
    }
}
