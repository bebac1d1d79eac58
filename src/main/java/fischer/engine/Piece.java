package fischer.engine;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable identity of a chess piece: a {@link Kind} and a {@link Color}. Equality is structural,
 * so two pawns of the same color are interchangeable.
 */
public record Piece(Kind kind, Color color) {

  /** Enumerates the six piece kinds recognised by orthodox chess. */
  public enum Kind {
    PAWN('p', 1),
    KNIGHT('n', 3),
    BISHOP('b', 3.25),
    ROOK('r', 5),
    QUEEN('q', 9),
    KING('k', Double.POSITIVE_INFINITY);

    private final char character;
    private final double relativeValue;

    Kind(char character, double relativeValue) {
      this.character = character;
      this.relativeValue = relativeValue;
    }

    /** Lower-case FEN letter. */
    public char character() {
      return character;
    }

    /** Conventional material value in pawns; the king is priceless. */
    public double relativeValue() {
      return relativeValue;
    }

    /** {@code true} for the four kinds a pawn may promote to. */
    public boolean isPromotable() {
      return this == KNIGHT || this == BISHOP || this == ROOK || this == QUEEN;
    }

    /** Parses a FEN letter in either case. */
    public static Optional<Kind> fromCharacter(char c) {
      char lower = Character.toLowerCase(c);
      for (Kind k : values()) {
        if (k.character == lower) return Optional.of(k);
      }
      return Optional.empty();
    }
  }

  private static final List<Piece> ALL;

  static {
    Piece[] all = new Piece[12];
    int i = 0;
    for (Color c : Color.values()) {
      for (Kind k : Kind.values()) {
        all[i++] = new Piece(k, c);
      }
    }
    ALL = List.of(all);
  }

  /** Performs basic sanity checks (non-null kind and color). */
  public Piece {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(color, "color must not be null");
  }

  /* ────── factories ────── */

  public static Piece pawn(Color color) {
    return new Piece(Kind.PAWN, color);
  }

  public static Piece knight(Color color) {
    return new Piece(Kind.KNIGHT, color);
  }

  public static Piece bishop(Color color) {
    return new Piece(Kind.BISHOP, color);
  }

  public static Piece rook(Color color) {
    return new Piece(Kind.ROOK, color);
  }

  public static Piece queen(Color color) {
    return new Piece(Kind.QUEEN, color);
  }

  public static Piece king(Color color) {
    return new Piece(Kind.KING, color);
  }

  /** All twelve pieces, white pawn first and black king last. */
  public static List<Piece> all() {
    return ALL;
  }

  /** Parses a FEN letter: upper case is white, lower case is black. */
  public static Optional<Piece> fromCharacter(char c) {
    Color color = Character.isUpperCase(c) ? Color.WHITE : Color.BLACK;
    return Kind.fromCharacter(c).map(k -> new Piece(k, color));
  }

  /* ────── predicates ────── */

  public boolean isPawn() {
    return kind == Kind.PAWN;
  }

  public boolean isKnight() {
    return kind == Kind.KNIGHT;
  }

  public boolean isBishop() {
    return kind == Kind.BISHOP;
  }

  public boolean isRook() {
    return kind == Kind.ROOK;
  }

  public boolean isQueen() {
    return kind == Kind.QUEEN;
  }

  public boolean isKing() {
    return kind == Kind.KING;
  }

  /** FEN letter: upper case for white, lower case for black. */
  public char character() {
    return color.isWhite() ? Character.toUpperCase(kind.character()) : kind.character();
  }

  @Override
  public String toString() {
    return String.valueOf(character());
  }
}
