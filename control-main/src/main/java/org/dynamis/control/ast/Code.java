package org.dynamis.control.ast;

import org.dynamis.control.ast.visitor.ControlFlowVisitor;

/**
 * A unit of emitted source: a statement, a control block, a tree of blocks, or the
 * header expression of a block.
 */
public interface Code {

    <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg);
}
