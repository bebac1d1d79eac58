package fischer.engine.internal;

import static org.junit.jupiter.api.Assertions.*;

import fischer.engine.Color;
import fischer.engine.IllegalMoveException;
import fischer.engine.Move;
import fischer.engine.Piece;
import fischer.engine.Position;
import fischer.engine.Square;
import fischer.engine.contracts.MoveMaker;
import fischer.notation.FenCodec;
import org.junit.jupiter.api.Test;

class MoveMakerImplTest {

  private static final MoveMaker MAKER = new MoveMakerImpl(new MoveGeneratorImpl());

  @Test
  void reportsWhyAMoveIsRejected() {
    Position start = Position.standard();
    assertMessage("no piece on e4", start, Move.of(Square.E4, Square.E5));
    assertMessage("it is white's turn", start, Move.of(Square.E7, Square.E5));
    assertMessage("pawn cannot move that way", start, Move.of(Square.E2, Square.E5));

    Position pinned = FenCodec.parse("4k3/8/8/8/4r3/8/4R3/4K3 w - - 0 1");
    assertMessage("leaves the white king in check", pinned, Move.of(Square.E2, Square.D2));
  }

  private static void assertMessage(String reason, Position pos, Move move) {
    IllegalMoveException e =
        assertThrows(IllegalMoveException.class, () -> MAKER.make(pos, move, null));
    assertEquals("Illegal move " + move + ": " + reason, e.getMessage());
  }

  @Test
  void capturedPieceIsReportedBeforeTheMove() {
    Position ep = FenCodec.parse("4k3/8/8/3Pp3/8/8/8/4K3 w - e6 0 1");
    assertEquals(Piece.pawn(Color.BLACK), MAKER.capturedBy(ep, Move.of(Square.D5, Square.E6)));
    assertNull(MAKER.capturedBy(ep, Move.of(Square.D5, Square.D6)));

    Position rook = FenCodec.parse("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");
    assertEquals(Piece.rook(Color.BLACK), MAKER.capturedBy(rook, Move.of(Square.A1, Square.A8)));
  }

  @Test
  void enPassantRemovesThePawnBehindTheTarget() {
    Position ep = FenCodec.parse("4k3/8/8/3Pp3/8/8/8/4K3 w - e6 0 1");
    Position after = MAKER.make(ep, Move.of(Square.D5, Square.E6), null);
    assertNull(after.pieceAt(Square.E5));
    assertNull(after.pieceAt(Square.D5));
    assertEquals(Piece.pawn(Color.WHITE), after.pieceAt(Square.E6));
    assertNull(after.enPassantTarget());
  }

  @Test
  void doubleStepAlwaysRecordsTheTarget() {
    Position p = MAKER.make(Position.standard(), Move.of(Square.A2, Square.A4), null);
    assertEquals(Square.A3, p.enPassantTarget());
    p = MAKER.make(p, Move.of(Square.H7, Square.H5), null);
    assertEquals(Square.H6, p.enPassantTarget());
  }
}
