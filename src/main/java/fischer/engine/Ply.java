package fischer.engine;

import java.util.Objects;

/**
 * A move as it is actually played: the displacement plus, for promotions, the kind the pawn
 * becomes.
 *
 * @param move the displacement
 * @param promotion promotion kind, or {@code null} when the move does not promote
 */
public record Ply(Move move, Piece.Kind promotion) {

  public Ply {
    Objects.requireNonNull(move, "move must not be null");
  }

  public static Ply of(Move move) {
    return new Ply(move, null);
  }

  public static Ply of(Move move, Piece.Kind promotion) {
    return new Ply(move, promotion);
  }

  public boolean isPromotion() {
    return promotion != null;
  }
}
