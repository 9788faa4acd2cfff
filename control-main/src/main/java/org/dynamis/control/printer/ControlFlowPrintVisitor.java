package org.dynamis.control.printer;

import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.PrinterConfiguration;
import org.dynamis.control.MissingSeparatorException;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.Code;
import org.dynamis.control.ast.ControlBlock;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.ControlTree;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.ast.LabeledControlBlock;
import org.dynamis.control.ast.stmt.WhileLoop;
import org.dynamis.control.ast.visitor.ControlFlowVisitor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Writes control-flow code as source text.
 * <p>
 * Every visit method appends to the sink passed as argument, creating a
 * {@link StringBuilder} when it is {@code null}, and returns that sink. The visitor
 * keeps no state between calls and can be shared across threads.
 */
public class ControlFlowPrintVisitor implements ControlFlowVisitor<Appendable, Appendable> {

    private final DefaultPrettyPrinter nodePrinter;

    public ControlFlowPrintVisitor(PrinterConfiguration configuration) {
        this.nodePrinter = new DefaultPrettyPrinter(configuration);
    }

    @Override
    public Appendable visitJavaNode(JavaNode node, Appendable output) {
        output = orNew(output);
        write(output, nodePrinter.print(node.getNode()).trim());
        return output;
    }

    @Override
    public Appendable visitBlock(Block block, Appendable output) {
        output = orNew(output);
        List<Code> statements = block.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (i != 0) {
                write(output, " ");
            }
            statements.get(i).accept(this, output);
        }
        return output;
    }

    @Override
    public Appendable visitControlBlock(ControlBlock block, Appendable output) {
        output = orNew(output);
        block.getExpression().accept(this, output);
        write(output, " { ");
        block.getBody().accept(this, output);
        write(output, " }");
        return output;
    }

    @Override
    public Appendable visitLabeledBlock(LabeledControlBlock block, Appendable output) {
        output = orNew(output);
        if (block.getLabel().isPresent()) {
            write(output, block.getLabel().get());
            write(output, ": ");
        }
        return visitControlBlock(block, output);
    }

    @Override
    public Appendable visitWhileLoop(WhileLoop loop, Appendable output) {
        output = orNew(output);
        visitLabeledBlock(loop, output);

        if (!loop.isDoWhile()) {
            return output;
        }

        write(output, " ");
        loop.getStatement().accept(this, output);
        write(output, ";");
        return output;
    }

    @Override
    public Appendable visitControlTree(ControlTree tree, Appendable output) {
        output = orNew(output);
        for (ControlBlock item : tree.getBlocks()) {
            if (item == null) {
                continue;
            }
            item.accept(this, output);
            write(output, " ");
        }
        return output;
    }

    @Override
    public Appendable visitControlExpression(ControlExpression expression, Appendable output) {
        output = orNew(output);
        write(output, expression.getKeyword());

        List<Code> slots = expression.getSlots();
        if (slots.isEmpty()) {
            return output;
        }

        write(output, " ");
        if (expression.isParenthesised()) {
            write(output, "(");
        }

        if (slots.size() == 1) {
            Code only = slots.get(0);
            if (only != null) {
                only.accept(this, output);
            }
            if (expression.isParenthesised()) {
                write(output, ")");
            }
            return output;
        }

        if (expression.getSeparator().isEmpty()) {
            throw new MissingSeparatorException(expression.getKeyword(), slots.size());
        }

        String separator = expression.getSeparator().get();
        for (int i = 0; i < slots.size(); i++) {
            Code slot = slots.get(i);

            if (i != 0 && slot != null) {
                write(output, " ");
            }

            if (slot != null) {
                slot.accept(this, output);
            }

            if (i == slots.size() - 1) {
                continue; // no separator after the last slot
            }

            write(output, separator);
        }

        if (expression.isParenthesised()) {
            write(output, ")");
        }
        return output;
    }

    private static Appendable orNew(Appendable output) {
        return output == null ? new StringBuilder() : output;
    }

    private static void write(Appendable output, CharSequence text) {
        try {
            output.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
