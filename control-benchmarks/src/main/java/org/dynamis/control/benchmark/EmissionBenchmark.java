package org.dynamis.control.benchmark;

import java.util.concurrent.TimeUnit;

import org.dynamis.control.ast.stmt.IfTree;
import org.dynamis.control.ast.stmt.TryCatch;
import org.dynamis.control.benchmark.domain.SampleTrees;
import org.dynamis.control.printer.ControlFlowPrintVisitor;
import org.dynamis.control.printer.PrintUtil;
import org.dynamis.control.printer.PrinterSettings;
import org.openjdk.jmh.annotations.*;

/**
 * Cost of one emission pass over pre-built trees. Building happens once per trial;
 * only rendering is measured.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Ddynamis.control.print.comments=false"
})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class EmissionBenchmark {

    @State(Scope.Thread)
    public static class TreeState {

        @Param({"2", "16"})
        int branches;

        IfTree ifChain;
        TryCatch guardedLoop;
        ControlFlowPrintVisitor visitor;

        @Setup(Level.Trial)
        public void build() {
            ifChain = SampleTrees.ifChain(branches);
            guardedLoop = SampleTrees.guardedLoop();
            visitor = new ControlFlowPrintVisitor(PrinterSettings.defaultConfiguration());
        }
    }

    @Benchmark
    public String emitIfChain(TreeState state) {
        return PrintUtil.print(state.ifChain);
    }

    @Benchmark
    public String emitTryCatch(TreeState state) {
        return PrintUtil.print(state.guardedLoop);
    }

    @Benchmark
    public Appendable emitTryCatchWithOwnVisitor(TreeState state) {
        return state.guardedLoop.accept(state.visitor, new StringBuilder(256));
    }
}
