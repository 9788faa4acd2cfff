package org.dynamis.control.benchmark.domain;

import com.github.javaparser.StaticJavaParser;
import org.dynamis.control.ast.stmt.ForLoop;
import org.dynamis.control.ast.stmt.IfTree;
import org.dynamis.control.ast.stmt.TryCatch;
import org.dynamis.control.ast.stmt.WhileLoop;

/**
 * Trees of the shapes a generator typically produces, built once per trial.
 */
public final class SampleTrees {

    private SampleTrees() {
    }

    /**
     * An if/else chain of {@code branches} guarded blocks followed by a plain else.
     */
    public static IfTree ifChain(int branches) {
        IfTree.Builder tree = IfTree.builder();
        for (int i = 0; i < branches; i++) {
            int branch = i;
            tree.ifThen(c -> c
                    .condition(StaticJavaParser.parseExpression("state == " + branch))
                    .body(body -> body.addStatement(StaticJavaParser.parseStatement("handle" + branch + "();"))));
        }
        return tree.orElseThrow(StaticJavaParser.parseExpression("new IllegalStateException()")).build();
    }

    /**
     * A counted loop wrapping a do-while inside a try/catch/finally.
     */
    public static TryCatch guardedLoop() {
        ForLoop loop = ForLoop.build(f -> f
                .initialize(StaticJavaParser.parseVariableDeclarationExpr("int i = 0"))
                .condition(StaticJavaParser.parseExpression("i < limit"))
                .advance(StaticJavaParser.parseExpression("i++"))
                .body(body -> body.addCode(WhileLoop.build(w -> w
                        .doWhile(true)
                        .condition(StaticJavaParser.parseExpression("pending(i)"))
                        .body(inner -> inner.addStatement(StaticJavaParser.parseStatement("drain(i);")))))));

        return TryCatch.build(t -> t
                .body(body -> body.addCode(loop))
                .addCatch(c -> c
                        .type(StaticJavaParser.parseClassOrInterfaceType("TimeoutException"))
                        .body(body -> body.addStatement(StaticJavaParser.parseStatement("retry();"))))
                .addCatch(c -> c
                        .stacktrace("s")
                        .body(body -> body.addStatement(StaticJavaParser.parseStatement("report(e, s);"))))
                .addFinally(body -> body.addStatement(StaticJavaParser.parseStatement("close();"))));
    }
}
