package fischer.engine;

import java.util.Optional;

/**
 * One of the 64 board cells. Ordinals follow the little-endian rank-file convention:
 *
 * <pre>
 * A1 = 0, B1 = 1, …, H1 = 7, A2 = 8, …, H8 = 63
 * </pre>
 */
public enum Square {
  A1, B1, C1, D1, E1, F1, G1, H1,
  A2, B2, C2, D2, E2, F2, G2, H2,
  A3, B3, C3, D3, E3, F3, G3, H3,
  A4, B4, C4, D4, E4, F4, G4, H4,
  A5, B5, C5, D5, E5, F5, G5, H5,
  A6, B6, C6, D6, E6, F6, G6, H6,
  A7, B7, C7, D7, E7, F7, G7, H7,
  A8, B8, C8, D8, E8, F8, G8, H8;

  private static final Square[] VALUES = values();
  private static final File[] FILES = File.values();
  private static final Rank[] RANKS = Rank.values();

  /** Square at the intersection of {@code file} and {@code rank}. */
  public static Square of(File file, Rank rank) {
    return VALUES[rank.index() * 8 + file.index()];
  }

  /** Square for a 0-63 index, or empty when out of range. */
  public static Optional<Square> of(int index) {
    return index < 0 || index > 63 ? Optional.empty() : Optional.of(VALUES[index]);
  }

  /** Parses algebraic coordinates such as {@code "e4"} (case-insensitive). */
  public static Optional<Square> parse(String text) {
    if (text == null || text.length() != 2) return Optional.empty();
    return File.of(text.charAt(0))
        .flatMap(f -> Rank.of(text.charAt(1) - '0').map(r -> of(f, r)));
  }

  public int index() {
    return ordinal();
  }

  public File file() {
    return FILES[ordinal() & 7];
  }

  public Rank rank() {
    return RANKS[ordinal() >>> 3];
  }

  /** The square {@code df} files and {@code dr} ranks away, if it is still on the board. */
  public Optional<Square> offset(int df, int dr) {
    int f = (ordinal() & 7) + df;
    int r = (ordinal() >>> 3) + dr;
    if (f < 0 || f > 7 || r < 0 || r > 7) return Optional.empty();
    return Optional.of(VALUES[r * 8 + f]);
  }

  /** The square {@code ranks} steps towards the opponent of {@code color}. */
  public Optional<Square> ahead(Color color, int ranks) {
    return offset(0, color.isWhite() ? ranks : -ranks);
  }

  /** Image of this square under a 180° board rotation (a1 ⇄ h8). */
  public Square rotated() {
    return VALUES[63 - ordinal()];
  }

  /** {@code true} for light squares (h1, a8, …). */
  public boolean isLight() {
    return ((ordinal() & 7) + (ordinal() >>> 3)) % 2 == 1;
  }

  @Override
  public String toString() {
    return "" + file().character() + (char) ('1' + (ordinal() >>> 3));
  }
}
