package org.dynamis.control.benchmark;

import java.util.concurrent.TimeUnit;

import org.dynamis.control.ast.Code;
import org.dynamis.control.benchmark.domain.SampleTrees;
import org.dynamis.control.printer.PrintUtil;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads emitting the same immutable trees at once. Finalized trees carry no
 * mutable state, so this should scale with the thread count.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentEmissionBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        Code[] trees;

        @Setup(Level.Trial)
        public void init() {
            trees = new Code[] {
                    SampleTrees.ifChain(8),
                    SampleTrees.guardedLoop()
            };
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        int index;

        @Setup(Level.Iteration)
        public void next() {
            index = (index + 1) % 2;
        }
    }

    @Benchmark
    public String concurrentEmitSharedTree(SharedState shared, ThreadState local) {
        return PrintUtil.print(shared.trees[local.index]);
    }
}
