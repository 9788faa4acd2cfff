package org.dynamis.control.printer;

import com.github.javaparser.ast.Node;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import org.dynamis.control.ast.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for emitting code. The {@value PrinterSettings#PRINT_COMMENTS_PROPERTY}
 * property is checked on every call.
 */
public class PrintUtil {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrintUtil.class);

    private static final ControlFlowPrintVisitor VISITOR = new ControlFlowPrintVisitor(PrinterSettings.singleLine(false));
    private static final ControlFlowPrintVisitor COMMENTING_VISITOR = new ControlFlowPrintVisitor(PrinterSettings.singleLine(true));

    private static final DefaultPrettyPrinter NODE_PRINTER = new DefaultPrettyPrinter(PrinterSettings.singleLine(false));
    private static final DefaultPrettyPrinter COMMENTING_NODE_PRINTER = new DefaultPrettyPrinter(PrinterSettings.singleLine(true));

    private PrintUtil() {
    }

    public static String print(Code code) {
        return print(code, new StringBuilder()).toString();
    }

    /**
     * Appends {@code code} to {@code output}. When emission fails, whatever was
     * already appended stays in {@code output} and must be discarded.
     */
    public static <T extends Appendable> T print(Code code, T output) {
        ControlFlowPrintVisitor visitor = PrinterSettings.isPrintComments() ? COMMENTING_VISITOR : VISITOR;
        try {
            code.accept(visitor, output);
        } catch (RuntimeException e) {
            LOGGER.error("Caught exception emitting {}", code.getClass().getSimpleName());
            throw e;
        }
        LOGGER.trace("Emitted {}", code.getClass().getSimpleName());
        return output;
    }

    /**
     * Prints a JavaParser node on a single line.
     */
    public static String printNode(Node node) {
        DefaultPrettyPrinter printer = PrinterSettings.isPrintComments() ? COMMENTING_NODE_PRINTER : NODE_PRINTER;
        return printer.print(node).trim();
    }
}
