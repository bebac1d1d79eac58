package fischer.engine.internal;

import static fischer.engine.internal.Geometry.*;

import fischer.engine.Board;
import fischer.engine.CastlingRight;
import fischer.engine.Color;
import fischer.engine.Move;
import fischer.engine.MoveKind;
import fischer.engine.NoKingException;
import fischer.engine.Piece;
import fischer.engine.Position;
import fischer.engine.Rank;
import fischer.engine.Side;
import fischer.engine.Square;
import fischer.engine.contracts.MoveGenerator;
import java.util.ArrayList;
import java.util.List;

/**
 * Square-centric move generator. Pseudo-legal moves are produced per piece kind from the step and
 * ray tables in {@link Geometry}; the legality filter plays each candidate on a scratch board and
 * rejects it if the mover's king is then attacked. Simulating every candidate handles pins,
 * discovered checks and en-passant discoveries with one rule.
 *
 * <p>Stateless and therefore safe to share between threads.
 */
public final class MoveGeneratorImpl implements MoveGenerator {

  private static final Square[] SQUARES = Square.values();

  /* ───────────────────── pseudo-legal generation ───────────────────── */

  @Override
  public List<Move> pseudoLegalMoves(Position position) {
    List<Move> out = new ArrayList<>(48);
    Color us = position.sideToMove();
    for (Square from : SQUARES) {
      Piece p = position.pieceAt(from);
      if (p != null && p.color() == us) addPieceMoves(position, from, p, out);
    }
    return out;
  }

  @Override
  public List<Move> pseudoLegalMoves(Position position, Square from) {
    List<Move> out = new ArrayList<>(16);
    Piece p = position.pieceAt(from);
    if (p != null && p.color() == position.sideToMove()) addPieceMoves(position, from, p, out);
    return out;
  }

  private void addPieceMoves(Position pos, Square from, Piece piece, List<Move> out) {
    switch (piece.kind()) {
      case PAWN -> addPawnMoves(pos, from, piece.color(), out);
      case KNIGHT -> addStepMoves(pos, from, piece.color(), KNIGHT_STEPS, out);
      case BISHOP -> addSliderMoves(pos, from, piece.color(), DIAGONALS, out);
      case ROOK -> addSliderMoves(pos, from, piece.color(), ORTHOGONALS, out);
      case QUEEN -> addSliderMoves(pos, from, piece.color(), ALL_RAYS, out);
      case KING -> {
        addStepMoves(pos, from, piece.color(), KING_STEPS, out);
        addCastles(pos, from, piece.color(), out);
      }
    }
  }

  private static void addPawnMoves(Position pos, Square from, Color us, List<Move> out) {
    int dir = pawnDirection(us);

    /* pushes */
    Square one = from.offset(0, dir).orElse(null);
    if (one != null && pos.pieceAt(one) == null) {
      out.add(new Move(from, one));
      if (from.rank() == Rank.pawnRank(us)) {
        Square two = from.offset(0, 2 * dir).orElse(null);
        if (two != null && pos.pieceAt(two) == null) out.add(new Move(from, two));
      }
    }

    /* captures, en passant included */
    for (int df : PAWN_CAPTURE_FILES) {
      Square to = from.offset(df, dir).orElse(null);
      if (to == null) continue;
      Piece victim = pos.pieceAt(to);
      if ((victim != null && victim.color() != us) || to == pos.enPassantTarget()) {
        out.add(new Move(from, to));
      }
    }
  }

  private static void addStepMoves(
      Position pos, Square from, Color us, int[][] steps, List<Move> out) {
    for (int[] s : steps) {
      Square to = from.offset(s[0], s[1]).orElse(null);
      if (to == null) continue;
      Piece occupant = pos.pieceAt(to);
      if (occupant == null || occupant.color() != us) out.add(new Move(from, to));
    }
  }

  private static void addSliderMoves(
      Position pos, Square from, Color us, int[][] rays, List<Move> out) {
    for (int[] ray : rays) {
      Square to = from.offset(ray[0], ray[1]).orElse(null);
      while (to != null) {
        Piece occupant = pos.pieceAt(to);
        if (occupant != null) {
          if (occupant.color() != us) out.add(new Move(from, to)); // capture, then stop
          break;
        }
        out.add(new Move(from, to));
        to = to.offset(ray[0], ray[1]).orElse(null);
      }
    }
  }

  private static void addCastles(Position pos, Square from, Color us, List<Move> out) {
    for (Side side : Side.values()) {
      CastlingRight right = CastlingRight.of(us, side);
      if (from == right.kingStart() && canCastle(pos, right)) {
        out.add(new Move(right.kingStart(), right.kingDestination()));
      }
    }
  }

  /* right held, rook at home, path empty, and no square the king touches is attacked */
  private static boolean canCastle(Position pos, CastlingRight right) {
    if (!pos.castlingRights().contains(right)) return false;
    if (!Piece.king(right.color()).equals(pos.pieceAt(right.kingStart()))) return false;
    if (!Piece.rook(right.color()).equals(pos.pieceAt(right.rookStart()))) return false;
    for (Square sq : right.emptySquares()) {
      if (pos.pieceAt(sq) != null) return false;
    }
    Board board = pos.board();
    Color them = right.color().inverse();
    for (Square sq : right.kingPath()) {
      if (board.isAttacked(sq, them)) return false;
    }
    return true;
  }

  /* ───────────────────── legality filter ───────────────────── */

  @Override
  public List<Move> legalMoves(Position position) {
    Board base = position.board();
    List<Move> out = new ArrayList<>(48);
    for (Move m : pseudoLegalMoves(position)) {
      if (!leavesKingAttacked(position, base, m)) out.add(m);
    }
    return out;
  }

  @Override
  public List<Move> legalMoves(Position position, Square from) {
    Board base = position.board();
    List<Move> out = new ArrayList<>(16);
    for (Move m : pseudoLegalMoves(position, from)) {
      if (!leavesKingAttacked(position, base, m)) out.add(m);
    }
    return out;
  }

  /**
   * Plays {@code move} on a copy of {@code base} and reports whether the mover's king is then
   * attacked. The promotion kind is irrelevant here: any promoted piece blocks the same square.
   */
  private boolean leavesKingAttacked(Position pos, Board base, Move move) {
    Color us = pos.sideToMove();
    Board scratch = base.copy();
    MoveKind kind = classify(pos, move);
    MoveMakerImpl.displace(scratch, move, kind, kind.isPromotion() ? Piece.Kind.QUEEN : null);
    Square king = scratch.squareForKing(us).orElseThrow(() -> new NoKingException(us));
    return scratch.isAttacked(king, us.inverse());
  }

  /* ───────────────────── direct rule evaluation ───────────────────── */

  @Override
  public boolean isLegal(Position position, Move move) {
    Piece piece = position.pieceAt(move.start());
    Color us = position.sideToMove();
    if (piece == null || piece.color() != us || !move.isChange()) return false;
    Piece target = position.pieceAt(move.end());
    if (target != null && target.color() == us) return false;

    boolean geometryOk =
        switch (piece.kind()) {
          case PAWN -> pawnMoveOk(position, move, us, target);
          case KNIGHT -> move.isKnightJump();
          case BISHOP -> move.isDiagonal() && pathClear(position, move);
          case ROOK -> (move.isHorizontal() || move.isVertical()) && pathClear(position, move);
          case QUEEN -> (move.isDiagonal() || move.isHorizontal() || move.isVertical())
              && pathClear(position, move);
          case KING -> kingMoveOk(position, move, us);
        };
    return geometryOk && !leavesKingAttacked(position, position.board(), move);
  }

  private static boolean pawnMoveOk(Position pos, Move move, Color us, Piece target) {
    int forward = move.rankChange() * pawnDirection(us);
    int df = Math.abs(move.fileChange());
    if (df == 0 && forward == 1) return target == null;
    if (df == 0 && forward == 2) {
      Square mid = move.start().ahead(us, 1).orElseThrow();
      return move.start().rank() == Rank.pawnRank(us) && target == null && pos.pieceAt(mid) == null;
    }
    if (df == 1 && forward == 1) return target != null || move.end() == pos.enPassantTarget();
    return false;
  }

  private static boolean kingMoveOk(Position pos, Move move, Color us) {
    if (Math.abs(move.fileChange()) <= 1 && Math.abs(move.rankChange()) <= 1) return true;
    for (Side side : Side.values()) {
      CastlingRight right = CastlingRight.of(us, side);
      if (move.start() == right.kingStart() && move.end() == right.kingDestination()) {
        return canCastle(pos, right);
      }
    }
    return false;
  }

  /* every square strictly between start and end must be empty */
  private static boolean pathClear(Position pos, Move move) {
    int sf = Integer.signum(move.fileChange());
    int sr = Integer.signum(move.rankChange());
    Square sq = move.start().offset(sf, sr).orElseThrow();
    while (sq != move.end()) {
      if (pos.pieceAt(sq) != null) return false;
      sq = sq.offset(sf, sr).orElseThrow();
    }
    return true;
  }

  /* ───────────────────── attack queries ───────────────────── */

  @Override
  public boolean isAttacked(Board board, Square square, Color by) {
    return board.isAttacked(square, by);
  }

  @Override
  public boolean kingIsChecked(Position position) {
    return position.board().kingIsChecked(position.sideToMove());
  }

  /* ───────────────────── classification ───────────────────── */

  @Override
  public MoveKind classify(Position position, Move move) {
    Piece piece = position.pieceAt(move.start());
    if (piece == null || piece.color() != position.sideToMove()) {
      throw new IllegalArgumentException("No piece of the side to move on " + move.start());
    }
    boolean occupied = position.pieceAt(move.end()) != null;
    if (piece.isKing() && Math.abs(move.fileChange()) == 2) {
      return move.fileChange() > 0 ? MoveKind.CASTLE_KINGSIDE : MoveKind.CASTLE_QUEENSIDE;
    }
    if (piece.isPawn()) {
      if (move.end().rank() == Rank.promotionRank(piece.color())) {
        return occupied ? MoveKind.PROMOTION_CAPTURE : MoveKind.PROMOTION;
      }
      if (Math.abs(move.rankChange()) == 2) return MoveKind.DOUBLE_PAWN_PUSH;
      if (move.fileChange() != 0 && !occupied && move.end() == position.enPassantTarget()) {
        return MoveKind.EN_PASSANT;
      }
    }
    return occupied ? MoveKind.CAPTURE : MoveKind.QUIET;
  }
}
