package fischer.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Files, ranks and squares. */
class CoordinatesTest {

  /* ─── files ─────────────────────────────────────────────────── */

  @Test
  void fileRangesWalkBothWays() {
    assertEquals(List.of(File.B, File.C, File.D), File.B.to(File.D));
    assertEquals(List.of(File.D, File.C, File.B), File.D.to(File.B));
    assertEquals(List.of(File.E), File.E.to(File.E));
    assertEquals(List.of(File.C), File.B.between(File.D));
    assertEquals(List.of(File.G, File.F), File.H.between(File.E));
    assertTrue(File.A.between(File.B).isEmpty());
  }

  @Test
  void fileLookups() {
    assertEquals(Optional.of(File.E), File.of('e'));
    assertEquals(Optional.of(File.E), File.of('E'));
    assertEquals(Optional.empty(), File.of('i'));
    assertEquals(Optional.empty(), File.of(8));
    assertEquals(File.H, File.A.opposite());
    assertEquals(Optional.empty(), File.H.next());
    assertEquals(Optional.of(File.G), File.H.previous());
    assertEquals("c", File.C.toString());
  }

  /* ─── ranks ─────────────────────────────────────────────────── */

  @Test
  void rankRangesAndLandmarks() {
    assertEquals(List.of(Rank.SEVEN, Rank.SIX, Rank.FIVE), Rank.SEVEN.to(Rank.FIVE));
    assertEquals(List.of(Rank.TWO, Rank.THREE), Rank.ONE.between(Rank.FOUR));
    assertEquals(Optional.of(Rank.FOUR), Rank.of(4));
    assertEquals(Optional.empty(), Rank.of(0));
    assertEquals(Optional.empty(), Rank.of(9));
    assertEquals(Rank.EIGHT, Rank.ONE.opposite());
    assertEquals(Rank.SEVEN, Rank.pawnRank(Color.BLACK));
    assertEquals(Rank.ONE, Rank.promotionRank(Color.BLACK));
    assertEquals(Rank.EIGHT, Rank.backRank(Color.BLACK));
    assertEquals("5", Rank.FIVE.toString());
  }

  /* ─── squares ───────────────────────────────────────────────── */

  @Test
  void squareOrdinalIsRankMajor() {
    assertEquals(0, Square.A1.index());
    assertEquals(7, Square.H1.index());
    assertEquals(8, Square.A2.index());
    assertEquals(63, Square.H8.index());
    for (Square sq : Square.values()) {
      assertEquals(sq, Square.of(sq.file(), sq.rank()));
      assertEquals(Optional.of(sq), Square.of(sq.index()));
    }
  }

  @Test
  void squareParsingAndPrinting() {
    assertEquals(Optional.of(Square.E4), Square.parse("e4"));
    assertEquals("e4", Square.E4.toString());
    assertEquals(Optional.empty(), Square.parse("e9"));
    assertEquals(Optional.empty(), Square.parse("z1"));
    assertEquals(Optional.empty(), Square.parse("e"));
    assertEquals(Optional.empty(), Square.of(64));
  }

  @Test
  void squareGeometry() {
    assertEquals(Optional.of(Square.F6), Square.E4.offset(1, 2));
    assertEquals(Optional.empty(), Square.H4.offset(1, 0));
    assertEquals(Optional.of(Square.E5), Square.E4.ahead(Color.WHITE, 1));
    assertEquals(Optional.of(Square.E3), Square.E4.ahead(Color.BLACK, 1));
    assertEquals(Square.H8, Square.A1.rotated());
    assertEquals(Square.D5, Square.E4.rotated());
    assertFalse(Square.A1.isLight());
    assertTrue(Square.H1.isLight());
    assertTrue(Square.A8.isLight());
  }

  @Test
  void colorBasics() {
    assertEquals(Color.BLACK, Color.WHITE.inverse());
    assertEquals('b', Color.BLACK.character());
    assertEquals(Optional.of(Color.WHITE), Color.fromCharacter('w'));
    assertEquals(Optional.empty(), Color.fromCharacter('x'));
  }
}
