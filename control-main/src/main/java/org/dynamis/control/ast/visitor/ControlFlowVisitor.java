package org.dynamis.control.ast.visitor;

import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.ControlBlock;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.ControlTree;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.ast.LabeledControlBlock;
import org.dynamis.control.ast.stmt.WhileLoop;

/**
 * Double-dispatch target for every {@link org.dynamis.control.ast.Code} type.
 *
 * @param <R> the return type of the visit methods
 * @param <A> the type of the argument threaded through the traversal
 */
public interface ControlFlowVisitor<R, A> {

    R visitJavaNode(JavaNode node, A arg);

    R visitBlock(Block block, A arg);

    R visitControlExpression(ControlExpression expression, A arg);

    R visitControlBlock(ControlBlock block, A arg);

    R visitLabeledBlock(LabeledControlBlock block, A arg);

    R visitWhileLoop(WhileLoop loop, A arg);

    R visitControlTree(ControlTree tree, A arg);
}
