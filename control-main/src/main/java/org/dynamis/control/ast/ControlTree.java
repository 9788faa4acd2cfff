package org.dynamis.control.ast;

import org.dynamis.control.ast.visitor.ControlFlowVisitor;

import java.util.List;

/**
 * An ordered composite of control blocks emitted one after the other, such as an
 * if/else chain or a try/catch/finally construct.
 */
public interface ControlTree extends Code {

    /**
     * The members in emission order. Entries may be {@code null}; those are skipped.
     */
    List<ControlBlock> getBlocks();

    @Override
    default <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg) {
        return visitor.visitControlTree(this, arg);
    }
}
