package fischer.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal classification of a finished game.
 *
 * @param winner winning color, or {@code null} for a draw
 * @param reason how the game ended
 */
public record Outcome(Color winner, Reason reason) {

  /** Why a game ended. Only {@link #CHECKMATE} produces a winner. */
  public enum Reason {
    CHECKMATE,
    STALEMATE,
    FIFTY_MOVE_RULE,
    INSUFFICIENT_MATERIAL
  }

  public Outcome {
    Objects.requireNonNull(reason, "reason must not be null");
    if ((winner != null) != (reason == Reason.CHECKMATE)) {
      throw new IllegalArgumentException("Only checkmate has a winner: " + winner + "/" + reason);
    }
  }

  public static Outcome checkmate(Color winner) {
    return new Outcome(Objects.requireNonNull(winner, "winner"), Reason.CHECKMATE);
  }

  public static Outcome draw(Reason reason) {
    return new Outcome(null, reason);
  }

  public boolean isWin() {
    return winner != null;
  }

  public boolean isDraw() {
    return winner == null;
  }

  public Optional<Color> winColor() {
    return Optional.ofNullable(winner);
  }

  /** Points scored by {@code color}: 1 for a win, 0.5 for a draw, 0 for a loss. */
  public double valueFor(Color color) {
    if (winner == null) return 0.5;
    return winner == color ? 1 : 0;
  }

  /** Result token as written in game records: {@code 1-0}, {@code 0-1} or {@code 1/2-1/2}. */
  public String result() {
    if (winner == null) return "1/2-1/2";
    return winner.isWhite() ? "1-0" : "0-1";
  }

  /**
   * Reads a result token. Decisive results are assumed to be checkmates and draws are reported
   * as stalemates, since the token alone does not carry the reason.
   */
  public static Optional<Outcome> fromResult(String result) {
    return switch (result) {
      case "1-0" -> Optional.of(checkmate(Color.WHITE));
      case "0-1" -> Optional.of(checkmate(Color.BLACK));
      case "1/2-1/2" -> Optional.of(draw(Reason.STALEMATE));
      default -> Optional.empty();
    };
  }

  @Override
  public String toString() {
    return result() + " (" + reason.name().toLowerCase().replace('_', ' ') + ")";
  }
}
