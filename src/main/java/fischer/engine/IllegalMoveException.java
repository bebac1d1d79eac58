package fischer.engine;

/**
 * The submitted move is not in the legal-move set of the current position: wrong geometry,
 * blocked path, wrong side's piece, missing castling right, own king left in check, or the game
 * is already over.
 */
public class IllegalMoveException extends MoveExecutionException {

  public IllegalMoveException(Move move, String reason) {
    super(move, "Illegal move " + move + ": " + reason);
  }
}
