package org.dynamis.control.ast.stmt;

import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlBlock;
import org.dynamis.control.ast.ControlExpression;

import java.util.Objects;

/**
 * The {@code try} or {@code finally} segment of a {@link TryCatch}. Only created while
 * the tree is traversed.
 */
final class TryBlock implements ControlBlock {

    enum Kind {
        TRY,
        FINALLY
    }

    private final Block body;
    private final Kind kind;

    TryBlock(Block body, Kind kind) {
        this.body = body;
        this.kind = kind;
    }

    Kind getKind() {
        return kind;
    }

    @Override
    public ControlExpression getExpression() {
        return kind == Kind.FINALLY ? ControlExpression.FINALLY_STATEMENT : ControlExpression.TRY_STATEMENT;
    }

    @Override
    public Block getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TryBlock)) {
            return false;
        }
        TryBlock that = (TryBlock) o;
        return kind == that.kind && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, kind);
    }
}
