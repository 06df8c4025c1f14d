package com.flagged.benchmark;

import com.flagged.core.Flag;
import com.flagged.core.FlagSet;
import com.flagged.ops.FlagOperations;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for interned OR and value lookup on a wide flag set.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class FlagCombineBenchmark {

    private FlagSet flags;
    private Flag first;
    private Flag last;
    private Flag combined;

    @Setup
    public void setup() throws Exception {
        var builder = FlagSet.builder("Wide");
        for (int i = 0; i < 32; i++) {
            builder.auto("flag_" + i);
        }
        flags = builder.build();
        first = flags.get("flag_0");
        last = flags.get("flag_31");
        combined = first.or(last);
    }

    // ===== COMBINATION =====

    @Benchmark
    public void orInterned(Blackhole bh) throws Exception {
        bh.consume(first.or(last));
    }

    @Benchmark
    public void orDeclaredIdempotent(Blackhole bh) throws Exception {
        bh.consume(first.or(first));
    }

    @Benchmark
    public void andDeclared(Blackhole bh) throws Exception {
        bh.consume(combined.and(last));
    }

    @Benchmark
    public void unionAll(Blackhole bh) throws Exception {
        bh.consume(FlagOperations.union(flags));
    }

    // ===== LOOKUP =====

    @Benchmark
    public void lookupByName(Blackhole bh) throws Exception {
        bh.consume(flags.getByName("flag_17"));
    }

    @Benchmark
    public void lookupByValue(Blackhole bh) throws Exception {
        bh.consume(flags.getByValue(combined.getValue()));
    }

    @Benchmark
    public void render(Blackhole bh) {
        bh.consume(combined.toString());
    }
}
