package org.dynamis.control.ast;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import org.dynamis.control.ast.visitor.ControlFlowVisitor;
import org.dynamis.control.printer.PrintUtil;

/**
 * Adapts a JavaParser node (expression, statement or type) to {@link Code}.
 * <p>
 * The node is cloned on wrap and on every read, so neither the original nor
 * anything returned by {@link #getNode()} can change this value. Equality is
 * JavaParser's structural node equality.
 */
public final class JavaNode implements Code {

    private final Node node;

    private JavaNode(Node node) {
        this.node = node.clone();
    }

    public static JavaNode of(Node node) {
        if (node == null) {
            throw new NullPointerException("node");
        }
        return new JavaNode(node);
    }

    /**
     * @return the adapted node, or {@code null} when {@code node} is {@code null}
     */
    public static JavaNode ofNullable(Node node) {
        return node == null ? null : new JavaNode(node);
    }

    /**
     * A bare identifier, as used for catch parameters.
     */
    public static JavaNode name(String identifier) {
        return new JavaNode(new NameExpr(identifier));
    }

    /**
     * A copy of the adapted node; changing it does not affect this value.
     */
    public Node getNode() {
        return node.clone();
    }

    public boolean isExpression() {
        return node instanceof Expression;
    }

    @Override
    public <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg) {
        return visitor.visitJavaNode(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JavaNode)) {
            return false;
        }
        return node.equals(((JavaNode) o).node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return PrintUtil.printNode(node);
    }
}
