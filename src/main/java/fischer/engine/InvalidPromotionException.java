package fischer.engine;

/**
 * A pawn reached its last rank without a promotable kind (knight, bishop, rook or queen), or a
 * promotion kind was supplied for a move that does not promote.
 */
public class InvalidPromotionException extends MoveExecutionException {

  private final Piece.Kind promotion;

  public InvalidPromotionException(Move move, Piece.Kind promotion, String reason) {
    super(move, "Invalid promotion for " + move + " (" + promotion + "): " + reason);
    this.promotion = promotion;
  }

  /** The offending promotion kind, or {@code null} if none was given. */
  public Piece.Kind promotion() {
    return promotion;
  }
}
