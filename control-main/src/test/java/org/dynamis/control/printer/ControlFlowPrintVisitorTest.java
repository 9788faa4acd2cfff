package org.dynamis.control.printer;

import com.github.javaparser.StaticJavaParser;
import org.dynamis.control.MissingSeparatorException;
import org.dynamis.control.ast.Block;
import org.dynamis.control.ast.Code;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.JavaNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ControlFlowPrintVisitor}: the control expression rendering rules
 * and block/statement emission.
 */
class ControlFlowPrintVisitorTest {

    private final ControlFlowPrintVisitor visitor = new ControlFlowPrintVisitor(PrinterSettings.singleLine(false));

    private static JavaNode expr(String source) {
        return JavaNode.of(StaticJavaParser.parseExpression(source));
    }

    private String render(Code code) {
        return code.accept(visitor, new StringBuilder()).toString();
    }

    @Test
    void keywordOnly_writesNothingElse() {
        assertThat(render(ControlExpression.DO_STATEMENT)).isEqualTo("do");
        assertThat(render(ControlExpression.TRY_STATEMENT)).isEqualTo("try");
        assertThat(render(ControlExpression.FINALLY_STATEMENT)).isEqualTo("finally");
    }

    @Test
    void singleSlot_parenthesised() {
        assertThat(render(ControlExpression.whileLoop(expr("i < 10")))).isEqualTo("while (i < 10)");
        assertThat(render(ControlExpression.ifStatement(expr("ready")))).isEqualTo("if (ready)");
    }

    @Test
    void singleNullSlot_isSkipped() {
        ControlExpression expression = ControlExpression.of("if", Arrays.asList((Code) null), null, true);

        assertThat(render(expression)).isEqualTo("if ()");
    }

    @Test
    void singleSlot_ignoresMissingSeparator() {
        ControlExpression expression = ControlExpression.of("guard", List.of(expr("x")), null, false);

        assertThat(render(expression)).isEqualTo("guard x");
    }

    @Test
    void threeSlots_keepBothSeparatorsWhenEmpty() {
        assertThat(render(ControlExpression.forLoop(null, null, null))).isEqualTo("for (;;)");
    }

    @Test
    void threeSlots_spaceOnlyBeforePresentSlots() {
        assertThat(render(ControlExpression.forLoop(expr("i = 0"), null, expr("i++")))).isEqualTo("for (i = 0;; i++)");
        assertThat(render(ControlExpression.forLoop(null, expr("i < n"), null))).isEqualTo("for (; i < n;)");
        assertThat(render(ControlExpression.forLoop(expr("i = 0"), expr("i < n"), expr("i++"))))
            .isEqualTo("for (i = 0; i < n; i++)");
    }

    @Test
    void forIn_usesInSeparator() {
        assertThat(render(ControlExpression.forInLoop(expr("item"), expr("items")))).isEqualTo("for (item in items)");
        assertThat(render(ControlExpression.awaitForLoop(expr("event"), expr("events"))))
            .isEqualTo("await for (event in events)");
    }

    @Test
    void elseStatement_withAndWithoutIf() {
        assertThat(render(ControlExpression.elseStatement(null))).isEqualTo("else");
        assertThat(render(ControlExpression.elseStatement(ControlExpression.ifStatement(expr("b")))))
            .isEqualTo("else if (b)");
    }

    @Test
    void catchAndOn_compose() {
        assertThat(render(ControlExpression.catchStatement("e", null))).isEqualTo("catch (e)");
        assertThat(render(ControlExpression.catchStatement("e", "s"))).isEqualTo("catch (e, s)");

        JavaNode type = JavaNode.of(StaticJavaParser.parseClassOrInterfaceType("FormatException"));
        assertThat(render(ControlExpression.onStatement(type, ControlExpression.catchStatement("e", "s"))))
            .isEqualTo("on FormatException catch (e, s)");
    }

    @Test
    void multipleSlots_withoutSeparatorFail() {
        ControlExpression expression = ControlExpression.of("pair", List.of(expr("a"), expr("b")), null, false);

        assertThatThrownBy(() -> render(expression))
            .isInstanceOf(MissingSeparatorException.class)
            .hasMessageContaining("pair");
    }

    @Test
    void nullSink_createsStringBuilder() {
        Appendable output = visitor.visitControlExpression(ControlExpression.DO_STATEMENT, null);

        assertThat(output).isInstanceOf(StringBuilder.class);
        assertThat(output.toString()).isEqualTo("do");
    }

    @Test
    void block_separatesStatementsWithOneSpace() {
        Block block = Block.build(body -> body
            .addStatement(StaticJavaParser.parseStatement("a();"))
            .addExpression(StaticJavaParser.parseExpression("b = 2")));

        assertThat(render(block)).isEqualTo("a(); b = 2;");
        assertThat(render(Block.empty())).isEmpty();
    }

    @Test
    void javaNode_printsNestedBlocksOnOneLine() {
        JavaNode statement = JavaNode.of(StaticJavaParser.parseStatement("if (a) {\n  b();\n}"));

        assertThat(render(statement)).doesNotContain("\n").startsWith("if (a) {").endsWith("}").contains("b();");
    }
}
