package fischer.main;

import static org.junit.jupiter.api.Assertions.*;

import fischer.engine.Position;
import fischer.engine.records.PerftResult;
import fischer.notation.FenCodec;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class MainTest {

  private static String run(int expectedStatus, String... args) {
    ByteArrayOutputStream buf = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
    assertEquals(expectedStatus, Main.run(args, out));
    return buf.toString(StandardCharsets.UTF_8);
  }

  @Test
  void perftFromTheStandardPosition() {
    assertTrue(run(0, "perft", "3").contains("Nodes searched: 8902"));
  }

  @Test
  void perftFromAFen() {
    String out = run(0, "perft", "2", "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8", "w", "-", "-", "0", "1");
    assertTrue(out.contains("Nodes searched: 191"), out);
  }

  @Test
  void divideListsEveryPromotionPiece() {
    PerftResult r = Main.divide(FenCodec.parse("8/4P3/8/8/8/8/k7/4K3 w - - 0 1"), 1);
    assertTrue(r.divide().keySet().containsAll(
        List.of("e7e8q", "e7e8r", "e7e8b", "e7e8n")));
    assertEquals(r.nodes(), r.divide().values().stream().mapToLong(Long::longValue).sum());
  }

  @Test
  void divideSumsToPerft() {
    Position kiwipete = FenCodec.parse(
        "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1");
    PerftResult split = Main.divide(kiwipete, 2);
    assertEquals(48, split.divide().size());
    assertEquals(2039, split.nodes());
    assertEquals(Main.perft(kiwipete, 2).nodes(), split.nodes());
  }

  @Test
  void benchPrintsTotals() {
    System.setProperty("fischer.perft.depth", "1");
    try {
      String out = run(0, "bench");
      assertTrue(out.contains("Nodes searched: " + (20 + 14 + 6)), out);
      assertTrue(out.contains("benchok"));
    } finally {
      System.clearProperty("fischer.perft.depth");
    }
  }

  @Test
  void badInputIsReported() {
    assertTrue(run(2).startsWith("usage"));
    assertTrue(run(2, "search").contains("unknown command"));
    assertTrue(run(1, "perft").contains("missing depth"));
    assertTrue(run(1, "perft", "x").startsWith("error"));
    assertTrue(run(1, "perft", "1", "not", "a", "fen").startsWith("error"));
  }
}
