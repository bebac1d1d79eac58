package fischer.engine.contracts;

import fischer.engine.Board;
import fischer.engine.Color;
import fischer.engine.Move;
import fischer.engine.MoveKind;
import fischer.engine.Position;
import fischer.engine.Square;
import java.util.List;

/**
 * Enumerates and validates moves for the side to move of a {@link Position}.
 *
 * <p>Pseudo-legal moves obey piece geometry only; legal moves are the pseudo-legal moves that do
 * not leave the mover's own king attacked. A promotion appears once per {@code (start, end)}
 * pair; the promotion kind is chosen when the move is applied.
 */
public interface MoveGenerator {

  /** Geometry-only moves for every piece of the side to move. */
  List<Move> pseudoLegalMoves(Position position);

  /** Geometry-only moves of the piece on {@code from}; empty unless it belongs to the mover. */
  List<Move> pseudoLegalMoves(Position position, Square from);

  /** Every legal move of the side to move. */
  List<Move> legalMoves(Position position);

  /** Legal moves of the piece on {@code from}; empty unless it belongs to the mover. */
  List<Move> legalMoves(Position position, Square from);

  /**
   * Evaluates the rules for a single move directly, without enumerating the position's move list.
   * Agrees with {@code legalMoves(position).contains(move)} for every move.
   */
  boolean isLegal(Position position, Move move);

  /** {@code true} if a piece of color {@code by} attacks {@code square} on {@code board}. */
  boolean isAttacked(Board board, Square square, Color by);

  /**
   * {@code true} if the side to move is in check.
   *
   * @throws fischer.engine.NoKingException if the side to move has no king
   */
  boolean kingIsChecked(Position position);

  /**
   * Tags a pseudo-legal move of the side to move.
   *
   * @throws IllegalArgumentException if no piece of the side to move stands on the start square
   */
  MoveKind classify(Position position, Move move);
}
