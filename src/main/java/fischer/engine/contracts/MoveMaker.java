package fischer.engine.contracts;

import fischer.engine.Move;
import fischer.engine.Piece;
import fischer.engine.Position;

public interface MoveMaker {
  /**
   * Applies {@code move} to {@code pos} and returns the resulting position; {@code pos} is left
   * untouched.
   *
   * @param promotion kind a promoting pawn becomes, {@code null} for every other move
   * @throws fischer.engine.IllegalMoveException if {@code move} is not legal in {@code pos}.
   * @throws fischer.engine.InvalidPromotionException if {@code promotion} is missing, not
   *     promotable, or given for a move that does not promote.
   */
  Position make(Position pos, Move move, Piece.Kind promotion);

  /**
   * The piece {@code move} would capture in {@code pos}, including the pawn taken en passant, or
   * {@code null} for a non-capture.
   */
  Piece capturedBy(Position pos, Move move);
}
