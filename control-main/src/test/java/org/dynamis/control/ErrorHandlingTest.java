package org.dynamis.control;

import com.github.javaparser.StaticJavaParser;
import org.dynamis.control.ast.ControlExpression;
import org.dynamis.control.ast.JavaNode;
import org.dynamis.control.ast.stmt.Condition;
import org.dynamis.control.ast.stmt.TryCatch;
import org.dynamis.control.ast.stmt.WhileLoop;
import org.dynamis.control.printer.PrintUtil;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlingTest {

    // 1. ConstructValidationException: raised at build, names type and field
    @Test
    void structuralValidation_namesTypeAndField() {
        assertThatThrownBy(() -> TryCatch.build(tree -> tree.body(body -> body.addStatement(StaticJavaParser.parseStatement("run();")))))
            .isInstanceOf(ConstructValidationException.class)
            .satisfies(e -> {
                ConstructValidationException cve = (ConstructValidationException) e;
                assertThat(cve.getTypeName()).isEqualTo("TryCatch");
                assertThat(cve.getFieldName()).isEqualTo("handlers");
                assertThat(cve.getMessage()).contains("catch");
            });

        assertThatThrownBy(() -> WhileLoop.builder().build())
            .isInstanceOf(ConstructValidationException.class)
            .satisfies(e -> assertThat(((ConstructValidationException) e).getFieldName()).isEqualTo("condition"));
    }

    // 2. InvalidConstructException: legal to build, illegal to render
    @Test
    void lazyConstruction_failsOnlyWhenExpressionIsRequested() {
        Condition condition = Condition.build(block -> block.body(body -> body.addStatement(StaticJavaParser.parseStatement("run();"))));

        assertThat(condition.getCondition()).isEmpty();
        assertThatThrownBy(condition::getExpression)
            .isInstanceOf(InvalidConstructException.class)
            .satisfies(e -> assertThat(((InvalidConstructException) e).getFieldName()).isEqualTo("condition"));
        assertThatThrownBy(() -> PrintUtil.print(condition))
            .isInstanceOf(InvalidConstructException.class)
            .hasMessageContaining("'if'");
    }

    // 3. MissingSeparatorException: raised during emission
    @Test
    void emission_missingSeparatorCarriesKeyword() {
        ControlExpression expression = ControlExpression.of("switch",
            List.of(JavaNode.name("a"), JavaNode.name("b")), null, true);

        assertThatThrownBy(() -> PrintUtil.print(expression))
            .isInstanceOf(MissingSeparatorException.class)
            .satisfies(e -> {
                MissingSeparatorException mse = (MissingSeparatorException) e;
                assertThat(mse.getKeyword()).isEqualTo("switch");
                assertThat(mse.getSlotCount()).isEqualTo(2);
            });
    }

    // 4. Partial output is left in the sink
    @Test
    void emission_leavesPartialPrefixInSink() {
        ControlExpression expression = ControlExpression.of("for",
            List.of(JavaNode.name("a"), JavaNode.name("b")), null, true);
        StringBuilder sink = new StringBuilder();

        assertThatThrownBy(() -> PrintUtil.print(expression, sink))
            .isInstanceOf(MissingSeparatorException.class);
        assertThat(sink.toString()).isEqualTo("for (");
    }

    // 5. Hierarchy: everything extends ControlFlowException
    @Test
    void exceptionHierarchy_allExtendRoot() {
        assertThat(ControlFlowException.class).isAssignableFrom(ConstructValidationException.class);
        assertThat(ControlFlowException.class).isAssignableFrom(InvalidConstructException.class);
        assertThat(ControlFlowException.class).isAssignableFrom(MissingSeparatorException.class);
        assertThat(RuntimeException.class).isAssignableFrom(ControlFlowException.class);
    }

    // 6. Root exception only carries a message; emission I/O failures stay UncheckedIOException
    @Test
    void rootException_messageOnly() {
        assertThat(ControlFlowException.class.getConstructors()).hasSize(1);
        assertThat(new ControlFlowException("boom")).hasMessage("boom").hasNoCause();
    }

    @Test
    void catchRoot_catchesAllSubtypes() {
        assertCaughtByRoot(new ConstructValidationException("test", "Type", "field"));
        assertCaughtByRoot(new InvalidConstructException("test", "field"));
        assertCaughtByRoot(new MissingSeparatorException("for", 3));
    }

    private void assertCaughtByRoot(ControlFlowException ex) {
        try {
            throw ex;
        } catch (ControlFlowException caught) {
            assertThat(caught).isSameAs(ex);
        }
    }
}
