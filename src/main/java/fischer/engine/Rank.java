package fischer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Board rows 1 through 8; declaration order is board order. */
public enum Rank {
  ONE,
  TWO,
  THREE,
  FOUR,
  FIVE,
  SIX,
  SEVEN,
  EIGHT;

  private static final Rank[] VALUES = values();

  /** Zero-based row index (rank 1 = 0). */
  public int index() {
    return ordinal();
  }

  /** Rank number as printed on a board, 1-8. */
  public int number() {
    return ordinal() + 1;
  }

  /** Mirror across the board's horizontal centre line (1 ⇄ 8). */
  public Rank opposite() {
    return VALUES[7 - ordinal()];
  }

  public Optional<Rank> offset(int delta) {
    return ofIndex(ordinal() + delta);
  }

  public Optional<Rank> next() {
    return offset(1);
  }

  public Optional<Rank> previous() {
    return offset(-1);
  }

  /** Ranks from {@code this} to {@code other}, both inclusive, walking in either direction. */
  public List<Rank> to(Rank other) {
    int step = other.ordinal() >= ordinal() ? 1 : -1;
    List<Rank> out = new ArrayList<>();
    for (int i = ordinal(); ; i += step) {
      out.add(VALUES[i]);
      if (i == other.ordinal()) return List.copyOf(out);
    }
  }

  /** Ranks strictly between {@code this} and {@code other}, ordered from {@code this}. */
  public List<Rank> between(Rank other) {
    List<Rank> all = to(other);
    return all.size() <= 2 ? List.of() : List.copyOf(all.subList(1, all.size() - 1));
  }

  /** Looks up a rank by its printed number, 1-8. */
  public static Optional<Rank> of(int number) {
    return ofIndex(number - 1);
  }

  static Optional<Rank> ofIndex(int index) {
    return index < 0 || index > 7 ? Optional.empty() : Optional.of(VALUES[index]);
  }

  /* ────── color-relative landmarks ────── */

  /** Rank holding the officers of {@code color} at the start of a standard game. */
  public static Rank backRank(Color color) {
    return color.isWhite() ? ONE : EIGHT;
  }

  /** Rank holding the pawns of {@code color} at the start of a standard game. */
  public static Rank pawnRank(Color color) {
    return color.isWhite() ? TWO : SEVEN;
  }

  /** Farthest rank for pawns of {@code color}; reaching it forces promotion. */
  public static Rank promotionRank(Color color) {
    return color.isWhite() ? EIGHT : ONE;
  }

  @Override
  public String toString() {
    return Integer.toString(number());
  }
}
