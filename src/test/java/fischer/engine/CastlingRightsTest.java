package fischer.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CastlingRightsTest {

  @Test
  void printsInFenOrder() {
    assertEquals("KQkq", CastlingRights.ALL.toString());
    assertEquals("-", CastlingRights.NONE.toString());
    assertEquals(
        "Kq",
        CastlingRights.of(CastlingRight.BLACK_QUEENSIDE, CastlingRight.WHITE_KINGSIDE).toString());
  }

  @Test
  void setOperations() {
    CastlingRights r = CastlingRights.ALL.without(CastlingRight.WHITE_QUEENSIDE);
    assertFalse(r.contains(CastlingRight.WHITE_QUEENSIDE));
    assertEquals(3, r.size());
    assertEquals(CastlingRights.ALL, r.with(CastlingRight.WHITE_QUEENSIDE));
    assertEquals("kq", CastlingRights.ALL.withoutColor(Color.WHITE).toString());
    assertTrue(CastlingRights.ALL.withoutColor(Color.WHITE).withoutColor(Color.BLACK).isEmpty());
    assertEquals(CastlingRights.fromMask(0b0101), CastlingRights.of(
        CastlingRight.WHITE_KINGSIDE, CastlingRight.BLACK_KINGSIDE));
  }

  @Test
  void iterationFollowsMaskOrder() {
    assertEquals(List.of(CastlingRight.values()), CastlingRights.ALL.toList());
  }

  @Test
  void rightGeometry() {
    CastlingRight wq = CastlingRight.WHITE_QUEENSIDE;
    assertEquals(Square.C1, wq.kingDestination());
    assertEquals(Square.D1, wq.rookDestination());
    assertEquals(List.of(Square.D1, Square.C1, Square.B1), wq.emptySquares());
    assertEquals(List.of(Square.E1, Square.D1, Square.C1), wq.kingPath());
    assertEquals(CastlingRight.BLACK_KINGSIDE, CastlingRight.of(Color.BLACK, Side.KINGSIDE));
    assertEquals(CastlingRight.BLACK_KINGSIDE, CastlingRight.fromCharacter('k').orElseThrow());
  }
}
