package bench;

import fischer.engine.Move;
import fischer.engine.Position;
import fischer.engine.Square;
import fischer.engine.contracts.MoveGenerator;
import fischer.engine.internal.MoveGeneratorImpl;
import fischer.main.Main;
import fischer.notation.FenCodec;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/** Micro-benchmark: legal-move generation, direct legality checks and shallow perft. */
@BenchmarkMode(Mode.Throughput)            // higher = better
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(2)
public class MoveGenerationBench {

    /** Fixed positions so every run sees identical inputs. */
    @State(Scope.Thread)
    public static class TestData {
        @Param({
                "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
                "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
                "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1"
        })
        String fen;

        MoveGenerator gen;
        Position position;

        @Setup(Level.Trial)
        public void init() {
            gen = new MoveGeneratorImpl();
            position = FenCodec.parse(fen);
        }
    }

    @Benchmark
    public int legalMoves(TestData td) {
        return td.gen.legalMoves(td.position).size();
    }

    /* every from/to pair, the same grid the cross-check test walks */
    @Benchmark
    public void isLegalGrid(TestData td, Blackhole bh) {
        for (Square from : Square.values()) {
            for (Square to : Square.values()) {
                bh.consume(td.gen.isLegal(td.position, new Move(from, to)));
            }
        }
    }

    @Benchmark
    public long perft2(TestData td) {
        return Main.perft(td.position, 2).nodes();
    }
}
