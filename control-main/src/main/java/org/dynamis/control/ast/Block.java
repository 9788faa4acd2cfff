package org.dynamis.control.ast;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.control.ast.visitor.ControlFlowVisitor;
import org.dynamis.control.printer.PrintUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * An ordered sequence of statements forming the body of a control block.
 * Always rendered between braces by the enclosing block.
 */
public final class Block implements Code {

    private static final Block EMPTY = new Block(List.of());

    private final List<Code> statements;

    private Block(List<Code> statements) {
        this.statements = statements;
    }

    public static Block empty() {
        return EMPTY;
    }

    public static Block of(Code... statements) {
        return new Block(List.of(statements));
    }

    public static Block of(Statement... statements) {
        Builder builder = builder();
        for (Statement statement : statements) {
            builder.addStatement(statement);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Block build(Consumer<Builder> updates) {
        Builder builder = builder();
        updates.accept(builder);
        return builder.build();
    }

    public List<Code> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public Builder toBuilder() {
        return builder().addAll(statements);
    }

    @Override
    public <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg) {
        return visitor.visitBlock(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Block)) {
            return false;
        }
        return statements.equals(((Block) o).statements);
    }

    @Override
    public int hashCode() {
        return statements.hashCode();
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }

    public static final class Builder {

        private final List<Code> statements = new ArrayList<>();

        private Builder() {
        }

        public Builder addCode(Code code) {
            if (code == null) {
                throw new NullPointerException("code");
            }
            statements.add(code);
            return this;
        }

        public Builder addStatement(Statement statement) {
            return addCode(JavaNode.of(statement));
        }

        /**
         * Adds {@code expression} as an expression statement ({@code expression;}).
         */
        public Builder addExpression(Expression expression) {
            return addStatement(new ExpressionStmt(expression.clone()));
        }

        public Builder addAll(Iterable<? extends Code> codes) {
            for (Code code : codes) {
                addCode(code);
            }
            return this;
        }

        public boolean isEmpty() {
            return statements.isEmpty();
        }

        public Block build() {
            return statements.isEmpty() ? EMPTY : new Block(List.copyOf(statements));
        }
    }
}
