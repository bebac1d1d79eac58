package fischer.notation;

import fischer.engine.Move;
import fischer.engine.Piece;
import fischer.engine.Ply;
import fischer.engine.Square;
import java.util.Objects;

/** Long algebraic coordinates as used by UCI: {@code e2e4}, {@code e7e8q}. */
public final class UciNotation {

  private UciNotation() {}

  public static String format(Move move) {
    return move.start().toString() + move.end();
  }

  /** Coordinates plus the lower-case promotion letter, if any. */
  public static String format(Ply ply) {
    String s = format(ply.move());
    return ply.isPromotion() ? s + ply.promotion().character() : s;
  }

  /**
   * Parses {@code e2e4} or {@code e7e8q}. Only the shape is checked; whether the move is legal is
   * up to the position it is played in.
   *
   * @throws IllegalArgumentException on malformed input or a non-promotable promotion letter
   */
  public static Ply parse(String text) {
    Objects.requireNonNull(text, "move text must not be null");
    String s = text.trim();
    if (s.length() != 4 && s.length() != 5) {
      throw new IllegalArgumentException("Bad UCI move: " + text);
    }
    Square from =
        Square.parse(s.substring(0, 2))
            .orElseThrow(() -> new IllegalArgumentException("Bad UCI move: " + text));
    Square to =
        Square.parse(s.substring(2, 4))
            .orElseThrow(() -> new IllegalArgumentException("Bad UCI move: " + text));
    Move move = new Move(from, to);
    if (s.length() == 4) return Ply.of(move);

    Piece.Kind kind =
        Piece.Kind.fromCharacter(s.charAt(4))
            .filter(Piece.Kind::isPromotable)
            .orElseThrow(() -> new IllegalArgumentException("Bad promotion piece in " + text));
    return Ply.of(move, kind);
  }
}
