package fischer.engine.internal;

import fischer.engine.Move;
import fischer.engine.Piece;
import fischer.engine.Position;
import fischer.engine.Rank;
import fischer.engine.contracts.MoveGenerator;
import fischer.engine.contracts.MoveMaker;
import fischer.notation.FenCodec;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Stream;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Perft regression over the vectors in {@code /perft/perft.txt}. Every promotion is expanded into
 * its four pieces, so the counts match the published reference numbers.
 *
 * <p>Vectors deeper than {@code -Dfischer.perft.maxDepth} (default 4) are skipped.
 */
@Tag("perft")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class MoveGeneratorPerftTest {

  /* ── wiring ───────────────────────────────────────────────────── */
  private static final MoveGenerator GEN = new MoveGeneratorImpl();
  private static final MoveMaker MAKER = new MoveMakerImpl(GEN);

  private static final int MAX_DEPTH = Integer.getInteger("fischer.perft.maxDepth", 4);

  private static final Piece.Kind[] PROMOTIONS = {
    Piece.Kind.QUEEN, Piece.Kind.ROOK, Piece.Kind.BISHOP, Piece.Kind.KNIGHT
  };

  /* ── per-test-case record ─────────────────────────────────────── */
  private record TestCase(String fen, int depth, long expected) {}

  private List<TestCase> cases;
  private long nodes = 0, timeNs = 0;

  /* ── load the perft vectors once ──────────────────────────────── */
  @BeforeAll
  void loadVectors() throws Exception {
    cases = new ArrayList<>();
    try (InputStream is = getClass().getResourceAsStream("/perft/perft.txt");
        BufferedReader br =
            new BufferedReader(
                new InputStreamReader(Objects.requireNonNull(is), StandardCharsets.UTF_8))) {

      br.lines()
          .map(String::trim)
          .filter(l -> !(l.isEmpty() || l.startsWith("#")))
          .forEach(
              l -> {
                String[] p = l.split(";");
                if (p.length < 3) return;
                int depth = Integer.parseInt(p[1].trim());
                if (depth > MAX_DEPTH) return;
                cases.add(new TestCase(p[0].trim(), depth, Long.parseLong(p[2].trim())));
              });
    }
    Assertions.assertFalse(cases.isEmpty(), "no perft vectors found");
  }

  /* ── JUnit parameter source ───────────────────────────────────── */
  Stream<TestCase> caseStream() {
    return cases.stream();
  }

  @ParameterizedTest(name = "perft({0})")
  @MethodSource("caseStream")
  void perft(TestCase tc) {
    Position root = FenCodec.parse(tc.fen);
    long t0 = System.nanoTime();
    long got = perft(root, tc.depth);
    timeNs += System.nanoTime() - t0;
    nodes += got;
    Assertions.assertEquals(
        tc.expected, got, () -> "mismatch depth=" + tc.depth + " FEN=" + tc.fen);
  }

  /* ── aggregate speed report ───────────────────────────────────── */
  @AfterAll
  void report() {
    double s = timeNs / 1_000_000_000.0;
    System.out.printf(
        "PERFT : %,d nodes  %.3f s  %,d NPS%n", nodes, s, (long) (nodes / Math.max(1e-9, s)));
  }

  /* ===================================================================
   *  Recursive perft over immutable positions
   * =================================================================== */
  private static long perft(Position pos, int depth) {
    if (depth == 0) return 1;

    long nodes = 0;
    for (Move m : GEN.legalMoves(pos)) {
      Piece mover = pos.pieceAt(m.start());
      boolean promotes = mover.isPawn() && m.end().rank() == Rank.promotionRank(mover.color());
      if (depth == 1) {
        nodes += promotes ? PROMOTIONS.length : 1;
      } else if (promotes) {
        for (Piece.Kind k : PROMOTIONS) nodes += perft(MAKER.make(pos, m, k), depth - 1);
      } else {
        nodes += perft(MAKER.make(pos, m, null), depth - 1);
      }
    }
    return nodes;
  }
}
