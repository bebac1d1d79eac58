package fischer.engine;

import fischer.engine.contracts.MoveGenerator;
import fischer.engine.contracts.MoveMaker;
import fischer.engine.internal.MoveGeneratorImpl;
import fischer.engine.internal.MoveMakerImpl;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a chess game between two plies: piece placement, side to move, castling
 * rights, en-passant target and the two move counters.
 *
 * <p>The constructor performs structural validation only (one king per side, no pawns on the
 * first or last rank, an en-passant target that a double step could have produced, castling rights
 * backed by an unmoved king and rook) and throws {@link IllegalArgumentException} naming the
 * offending field. It never parses text; see {@code fischer.notation.FenCodec} for that.
 *
 * <p>The board is copied on the way in and on the way out, so a position can be shared freely
 * between threads.
 *
 * @param board piece placement
 * @param sideToMove color about to move
 * @param castlingRights rights still held by either side
 * @param enPassantTarget square a pawn may capture onto en passant this ply, or {@code null}
 * @param halfmoveClock plies since the last capture or pawn move (fifty-move rule)
 * @param fullmoveNumber starts at 1, incremented after Black's move
 */
public record Position(
    Board board,
    Color sideToMove,
    CastlingRights castlingRights,
    Square enPassantTarget,
    int halfmoveClock,
    int fullmoveNumber) {

  /* ────── construction & validation ────── */
  public Position {
    Objects.requireNonNull(board, "board must not be null");
    Objects.requireNonNull(sideToMove, "sideToMove must not be null");
    Objects.requireNonNull(castlingRights, "castlingRights must not be null");
    board = board.copy();

    if (halfmoveClock < 0) {
      throw new IllegalArgumentException("Invalid half-move clock: " + halfmoveClock);
    }
    if (fullmoveNumber < 1) {
      throw new IllegalArgumentException("Invalid full-move number: " + fullmoveNumber);
    }
    for (Color c : Color.values()) {
      int kings = board.count(Piece.king(c));
      if (kings != 1) {
        throw new IllegalArgumentException(
            "Expected exactly one " + c.name().toLowerCase() + " king, found " + kings);
      }
    }
    for (File f : File.values()) {
      Piece low = board.get(f, Rank.ONE), high = board.get(f, Rank.EIGHT);
      if ((low != null && low.isPawn()) || (high != null && high.isPawn())) {
        throw new IllegalArgumentException("Pawn on back rank at file " + f);
      }
    }
    validateEnPassant(board, sideToMove, enPassantTarget);
    validateCastling(board, castlingRights);
  }

  private static void validateEnPassant(Board board, Color sideToMove, Square target) {
    if (target == null) return;
    Color passer = sideToMove.inverse();
    Rank expected = passer.isWhite() ? Rank.THREE : Rank.SIX;
    if (target.rank() != expected) {
      throw new IllegalArgumentException("Bad EP square for " + sideToMove + " to move: " + target);
    }
    Square pawnSquare = target.ahead(passer, 1).orElseThrow();
    Square origin = target.ahead(passer, -1).orElseThrow();
    if (!board.isEmpty(target)
        || !board.isEmpty(origin)
        || !Piece.pawn(passer).equals(board.get(pawnSquare))) {
      throw new IllegalArgumentException("EP square " + target + " not behind a double-stepped pawn");
    }
  }

  private static void validateCastling(Board board, CastlingRights rights) {
    for (CastlingRight r : rights) {
      if (!Piece.king(r.color()).equals(board.get(r.kingStart()))
          || !Piece.rook(r.color()).equals(board.get(r.rookStart()))) {
        throw new IllegalArgumentException(
            "Castling right " + r.character() + " without king and rook on their home squares");
      }
    }
  }

  /** The standard opening position. */
  public static Position standard() {
    return new Position(new Board(Variant.STANDARD), Color.WHITE, CastlingRights.ALL, null, 0, 1);
  }

  /* ────── accessors ────── */

  /** Copy of the piece placement; mutating it does not affect this position. */
  @Override
  public Board board() {
    return board.copy();
  }

  /** Piece on {@code square}, or {@code null}. */
  public Piece pieceAt(Square square) {
    return board.get(square);
  }

  /* ────── rules ────── */

  /**
   * Position reached by playing {@code move} (with {@code promotion} for a promoting pawn).
   *
   * @throws IllegalMoveException if {@code move} is not legal here
   * @throws InvalidPromotionException if the promotion argument does not fit the move
   */
  public Position successor(Move move, Piece.Kind promotion) {
    return Rules.MAKER.make(this, move, promotion);
  }

  /** Same as {@link #successor(Move, Piece.Kind)} for a non-promoting move. */
  public Position successor(Move move) {
    return successor(move, null);
  }

  /** Legal moves of the side to move. */
  public List<Move> legalMoves() {
    return Rules.GENERATOR.legalMoves(this);
  }

  public boolean isLegal(Move move) {
    return Rules.GENERATOR.isLegal(this, move);
  }

  /**
   * {@code true} if the side to move is in check.
   *
   * @throws NoKingException never for a validated position
   */
  public boolean kingIsChecked() {
    return Rules.GENERATOR.kingIsChecked(this);
  }

  @Override
  public String toString() {
    return "Position["
        + sideToMove.character()
        + ' '
        + castlingRights
        + ' '
        + (enPassantTarget == null ? "-" : enPassantTarget.toString())
        + ' '
        + halfmoveClock
        + ' '
        + fullmoveNumber
        + "]\n"
        + board;
  }

  /* lazily wired default rule set */
  private static final class Rules {
    static final MoveGenerator GENERATOR = new MoveGeneratorImpl();
    static final MoveMaker MAKER = new MoveMakerImpl(GENERATOR);
  }
}
