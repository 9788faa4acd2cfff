package org.dynamis.control.printer;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.PrinterConfiguration;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.JavaNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrinterSettingsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(PrinterSettings.PRINT_COMMENTS_PROPERTY);
    }

    @Test
    void commentsAreOffByDefault() {
        assertThat(PrinterSettings.isPrintComments()).isFalse();
        PrinterConfiguration configuration = PrinterSettings.defaultConfiguration();

        assertThat(configuration.get(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS))).isEmpty();
    }

    @Test
    void systemPropertyEnablesComments() {
        System.setProperty(PrinterSettings.PRINT_COMMENTS_PROPERTY, "true");

        assertThat(PrinterSettings.isPrintComments()).isTrue();
        assertThat(PrinterSettings.defaultConfiguration().get(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS)))
            .isPresent();
    }

    @Test
    void singleLine_dropsOrKeepsComments() {
        Statement statement = StaticJavaParser.parseStatement("// note\na();");
        JavaNode node = JavaNode.of(statement);

        String withoutComments = node.accept(new ControlFlowPrintVisitor(PrinterSettings.singleLine(false)), null).toString();
        String withComments = node.accept(new ControlFlowPrintVisitor(PrinterSettings.singleLine(true)), null).toString();

        assertThat(withoutComments).isEqualTo("a();");
        assertThat(withComments).contains("note").contains("a();").doesNotContain("\n");
    }

    @Test
    void singleLine_usesSpaceAsLineEnd() {
        String printed = new DefaultPrettyPrinter(PrinterSettings.singleLine(false))
            .print(StaticJavaParser.parseStatement("while (x) {\n a();\n}"));

        assertThat(printed).doesNotContain("\n");
    }

    @Test
    void printUtil_readsTheCommentsPropertyOnEachCall() {
        Block block = Block.of(StaticJavaParser.parseStatement("// note\na();"));

        assertThat(PrintUtil.print(block)).isEqualTo("a();");

        System.setProperty(PrinterSettings.PRINT_COMMENTS_PROPERTY, "true");
        assertThat(PrintUtil.print(block)).contains("note").contains("a();");

        System.clearProperty(PrinterSettings.PRINT_COMMENTS_PROPERTY);
        assertThat(PrintUtil.print(block)).isEqualTo("a();");
    }
}
