package org.dynamis.control.ast;

import org.dynamis.control.ast.visitor.ControlFlowVisitor;

/**
 * A control-flow block: a header expression followed by a braced body.
 */
public interface ControlBlock extends Code {

    /**
     * The full control-flow expression that precedes the body.
     */
    ControlExpression getExpression();

    /**
     * The body of this block; always wrapped in braces when emitted.
     */
    Block getBody();

    @Override
    default <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg) {
        return visitor.visitControlBlock(this, arg);
    }
}
