package fischer.engine.internal;

import fischer.engine.Board;
import fischer.engine.CastlingRight;
import fischer.engine.CastlingRights;
import fischer.engine.Color;
import fischer.engine.IllegalMoveException;
import fischer.engine.InvalidPromotionException;
import fischer.engine.Move;
import fischer.engine.MoveKind;
import fischer.engine.Piece;
import fischer.engine.Position;
import fischer.engine.Side;
import fischer.engine.Square;
import fischer.engine.contracts.MoveGenerator;
import fischer.engine.contracts.MoveMaker;
import java.util.Arrays;
import java.util.Objects;

/**
 * Computes successor positions. Validation happens up front through the {@link MoveGenerator};
 * only then is a scratch board mutated, so a rejected move has no effect anywhere.
 */
public final class MoveMakerImpl implements MoveMaker {

  /* Precomputed masks for castling rights updates, indexed by square */
  private static final int[] CR_MASK_LOST_FROM = new int[64];
  private static final int[] CR_MASK_LOST_TO = new int[64];

  static {
    Arrays.fill(CR_MASK_LOST_FROM, 0b1111);
    Arrays.fill(CR_MASK_LOST_TO, 0b1111);

    CR_MASK_LOST_FROM[Square.E1.index()] = 0b1100; // white king
    CR_MASK_LOST_FROM[Square.E8.index()] = 0b0011; // black king
    for (CastlingRight r : CastlingRight.values()) {
      CR_MASK_LOST_FROM[r.rookStart().index()] &= ~r.mask(); // rook leaves home
      CR_MASK_LOST_TO[r.rookStart().index()] &= ~r.mask(); // rook captured at home
    }
  }

  private final MoveGenerator generator;

  public MoveMakerImpl(MoveGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator must not be null");
  }

  @Override
  public Position make(Position pos, Move move, Piece.Kind promotion) {
    Objects.requireNonNull(move, "move must not be null");
    if (!generator.isLegal(pos, move)) {
      throw new IllegalMoveException(move, whyIllegal(pos, move));
    }

    MoveKind kind = generator.classify(pos, move);
    if (kind.isPromotion()) {
      if (promotion == null) {
        throw new InvalidPromotionException(move, null, "a pawn reaching the last rank must promote");
      }
      if (!promotion.isPromotable()) {
        throw new InvalidPromotionException(move, promotion, "cannot promote to " + promotion);
      }
    } else if (promotion != null) {
      throw new InvalidPromotionException(move, promotion, "move does not promote");
    }

    Color us = pos.sideToMove();
    Piece mover = pos.pieceAt(move.start());
    Board board = pos.board();
    displace(board, move, kind, promotion);

    int rights =
        pos.castlingRights().mask()
            & CR_MASK_LOST_FROM[move.start().index()]
            & CR_MASK_LOST_TO[move.end().index()];

    Square enPassant =
        kind == MoveKind.DOUBLE_PAWN_PUSH ? move.start().ahead(us, 1).orElseThrow() : null;

    int halfmoves = mover.isPawn() || kind.isCapture() ? 0 : pos.halfmoveClock() + 1;
    int fullmoves = us.isBlack() ? pos.fullmoveNumber() + 1 : pos.fullmoveNumber();

    return new Position(
        board, us.inverse(), CastlingRights.fromMask(rights), enPassant, halfmoves, fullmoves);
  }

  @Override
  public Piece capturedBy(Position pos, Move move) {
    MoveKind kind = generator.classify(pos, move);
    if (kind == MoveKind.EN_PASSANT) return Piece.pawn(pos.sideToMove().inverse());
    return kind.isCapture() ? pos.pieceAt(move.end()) : null;
  }

  private String whyIllegal(Position pos, Move move) {
    Piece piece = pos.pieceAt(move.start());
    if (piece == null) return "no piece on " + move.start();
    if (piece.color() != pos.sideToMove()) {
      return "it is " + pos.sideToMove().name().toLowerCase() + "'s turn";
    }
    if (generator.pseudoLegalMoves(pos, move.start()).contains(move)) {
      return "leaves the " + piece.color().name().toLowerCase() + " king in check";
    }
    return piece.kind().name().toLowerCase() + " cannot move that way";
  }

  /**
   * Moves pieces on {@code board} for an already validated move: lifts the mover, removes the
   * captured piece (behind the destination for en passant), relocates the rook when castling and
   * drops the mover, or its promoted replacement, on the destination.
   */
  static void displace(Board board, Move move, MoveKind kind, Piece.Kind promotion) {
    Piece piece = board.remove(move.start());
    switch (kind) {
      case EN_PASSANT -> board.remove(Square.of(move.end().file(), move.start().rank()));
      case CASTLE_KINGSIDE, CASTLE_QUEENSIDE -> {
        Side side = kind == MoveKind.CASTLE_KINGSIDE ? Side.KINGSIDE : Side.QUEENSIDE;
        CastlingRight right = CastlingRight.of(piece.color(), side);
        board.set(right.rookDestination(), board.remove(right.rookStart()));
      }
      default -> {}
    }
    Piece placed = kind.isPromotion() ? new Piece(promotion, piece.color()) : piece;
    board.set(move.end(), placed);
  }
}
