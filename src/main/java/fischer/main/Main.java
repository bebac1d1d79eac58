package fischer.main;

import fischer.engine.Move;
import fischer.engine.Piece;
import fischer.engine.Ply;
import fischer.engine.Position;
import fischer.engine.Rank;
import fischer.engine.records.PerftResult;
import fischer.notation.FenCodec;
import fischer.notation.UciNotation;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point.
 *
 * <pre>
 *   perft  &lt;depth&gt; [fen]   leaf count from the given (or standard) position
 *   divide &lt;depth&gt; [fen]   leaf count per root move
 *   bench                  perft over fixed positions, depth from -Dfischer.perft.depth
 * </pre>
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final List<String> BENCH_FENS = List.of(
            FenCodec.STANDARD,
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1",
            "r3k2r/Pppp1ppp/1b3nbN/nP6/BBP1P3/q4N2/Pp1P2PP/R2Q1RK1 w kq - 0 1");

    private static final Piece.Kind[] PROMOTIONS = {
            Piece.Kind.QUEEN, Piece.Kind.ROOK, Piece.Kind.BISHOP, Piece.Kind.KNIGHT
    };
    private static final Piece.Kind[] NO_PROMOTION = {null};

    private Main() {}

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) System.exit(status);
    }

    /** Runs one command and returns the process exit status. */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("usage: perft <depth> [fen] | divide <depth> [fen] | bench");
            return 2;
        }
        try {
            switch (args[0].toLowerCase()) {
                case "bench" -> runPerftBench(Integer.getInteger("fischer.perft.depth", 4), out);
                case "perft" -> {
                    PerftResult r = perft(positionArg(args), depthArg(args));
                    out.printf("Nodes searched: %d%n", r.nodes());
                }
                case "divide" -> {
                    PerftResult r = divide(positionArg(args), depthArg(args));
                    r.divide().forEach((move, n) -> out.printf("%s: %d%n", move, n));
                    out.printf("%nNodes searched: %d%n", r.nodes());
                }
                default -> {
                    out.println("unknown command: " + args[0]);
                    return 2;
                }
            }
            return 0;
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Cannot run " + String.join(" ", args), e);
            out.println("error: " + e.getMessage());
            return 1;
        }
    }

    private static int depthArg(String[] args) {
        if (args.length < 2) throw new IllegalArgumentException("missing depth");
        int depth = Integer.parseInt(args[1]);
        if (depth < 0) throw new IllegalArgumentException("negative depth: " + depth);
        return depth;
    }

    private static Position positionArg(String[] args) {
        if (args.length < 3) return Position.standard();
        return FenCodec.parse(String.join(" ", Arrays.copyOfRange(args, 2, args.length)));
    }

    private static void runPerftBench(int depth, PrintStream out) {
        long totalNodes = 0, totalTimeMs = 0;

        for (String fen : BENCH_FENS) {
            PerftResult r = perft(FenCodec.parse(fen), depth);
            totalNodes += r.nodes();
            totalTimeMs += r.elapsedNanos() / 1_000_000;
        }

        long totalNps = totalTimeMs > 0 ? (1000L * totalNodes) / totalTimeMs : 0;
        out.printf("Nodes searched: %d%n", totalNodes);
        out.printf("nps: %d%n", totalNps);
        out.println("benchok");
    }

    /* ────── perft ────── */

    public static PerftResult perft(Position root, int depth) {
        long t0 = System.nanoTime();
        long nodes = count(root, depth);
        return new PerftResult(depth, nodes, System.nanoTime() - t0, Map.of());
    }

    /** Perft with a subtotal for every root ply, in generation order. */
    public static PerftResult divide(Position root, int depth) {
        long t0 = System.nanoTime();
        Map<String, Long> split = new LinkedHashMap<>();
        long nodes = 0;
        if (depth > 0) {
            for (Move m : root.legalMoves()) {
                for (Piece.Kind k : promotionsFor(root, m)) {
                    long n = count(root.successor(m, k), depth - 1);
                    split.put(UciNotation.format(Ply.of(m, k)), n);
                    nodes += n;
                }
            }
        } else {
            nodes = 1;
        }
        return new PerftResult(depth, nodes, System.nanoTime() - t0, split);
    }

    private static long count(Position pos, int depth) {
        if (depth == 0) return 1;

        long nodes = 0;
        for (Move m : pos.legalMoves()) {
            Piece.Kind[] kinds = promotionsFor(pos, m);
            if (depth == 1) {
                nodes += kinds.length;
                continue;
            }
            for (Piece.Kind k : kinds) {
                nodes += count(pos.successor(m, k), depth - 1);
            }
        }
        return nodes;
    }

    /* a promoting move stands for one ply per promotion piece */
    private static Piece.Kind[] promotionsFor(Position pos, Move m) {
        Piece p = pos.pieceAt(m.start());
        return p.isPawn() && m.end().rank() == Rank.promotionRank(p.color()) ? PROMOTIONS : NO_PROMOTION;
    }
}
