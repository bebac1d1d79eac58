package fischer.engine;

/**
 * Base type for every rejected move. A rejected move never changes the position or game it was
 * submitted to, so callers may simply retry with a different move.
 */
public abstract class MoveExecutionException extends RuntimeException {

  private final Move move;

  protected MoveExecutionException(Move move, String message) {
    super(message);
    this.move = move;
  }

  /** The move that was rejected. */
  public Move move() {
    return move;
  }
}
