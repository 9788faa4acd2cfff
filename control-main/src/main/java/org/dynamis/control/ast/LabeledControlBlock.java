package org.dynamis.control.ast;

import org.dynamis.control.ast.visitor.ControlFlowVisitor;

import java.util.Optional;

/**
 * A {@link ControlBlock} that may carry a label:
 * <pre>
 * label: for (...) { ... }
 * </pre>
 */
public interface LabeledControlBlock extends ControlBlock {

    Optional<String> getLabel();

    @Override
    default <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg) {
        return visitor.visitLabeledBlock(this, arg);
    }
}
