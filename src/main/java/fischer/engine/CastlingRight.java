package fischer.engine;

import java.util.List;
import java.util.Optional;

/**
 * One of the four castling options. Each constant knows the squares involved so that move
 * generation and move application never hard-code them.
 */
public enum CastlingRight {
  WHITE_KINGSIDE(Color.WHITE, Side.KINGSIDE, 'K', 0x1,
      Square.E1, Square.G1, Square.H1, Square.F1, List.of(Square.F1, Square.G1)),
  WHITE_QUEENSIDE(Color.WHITE, Side.QUEENSIDE, 'Q', 0x2,
      Square.E1, Square.C1, Square.A1, Square.D1, List.of(Square.D1, Square.C1, Square.B1)),
  BLACK_KINGSIDE(Color.BLACK, Side.KINGSIDE, 'k', 0x4,
      Square.E8, Square.G8, Square.H8, Square.F8, List.of(Square.F8, Square.G8)),
  BLACK_QUEENSIDE(Color.BLACK, Side.QUEENSIDE, 'q', 0x8,
      Square.E8, Square.C8, Square.A8, Square.D8, List.of(Square.D8, Square.C8, Square.B8));

  private final Color color;
  private final Side side;
  private final char character;
  private final int mask;
  private final Square kingStart;
  private final Square kingDestination;
  private final Square rookStart;
  private final Square rookDestination;
  private final List<Square> emptySquares;

  CastlingRight(
      Color color,
      Side side,
      char character,
      int mask,
      Square kingStart,
      Square kingDestination,
      Square rookStart,
      Square rookDestination,
      List<Square> emptySquares) {
    this.color = color;
    this.side = side;
    this.character = character;
    this.mask = mask;
    this.kingStart = kingStart;
    this.kingDestination = kingDestination;
    this.rookStart = rookStart;
    this.rookDestination = rookDestination;
    this.emptySquares = emptySquares;
  }

  public static CastlingRight of(Color color, Side side) {
    if (color.isWhite()) return side.isKingside() ? WHITE_KINGSIDE : WHITE_QUEENSIDE;
    return side.isKingside() ? BLACK_KINGSIDE : BLACK_QUEENSIDE;
  }

  /** Parses one of {@code K Q k q}. */
  public static Optional<CastlingRight> fromCharacter(char c) {
    for (CastlingRight r : values()) {
      if (r.character == c) return Optional.of(r);
    }
    return Optional.empty();
  }

  public Color color() {
    return color;
  }

  public Side side() {
    return side;
  }

  /** FEN letter, {@code K Q k q}. */
  public char character() {
    return character;
  }

  /** Bit in a castling mask: 0x1 = K, 0x2 = Q, 0x4 = k, 0x8 = q. */
  public int mask() {
    return mask;
  }

  public Square kingStart() {
    return kingStart;
  }

  public Square kingDestination() {
    return kingDestination;
  }

  public Square rookStart() {
    return rookStart;
  }

  public Square rookDestination() {
    return rookDestination;
  }

  /** Squares strictly between king and rook; all must be empty to castle. */
  public List<Square> emptySquares() {
    return emptySquares;
  }

  /** King start, transit and destination squares; none may be attacked to castle. */
  public List<Square> kingPath() {
    return List.of(kingStart, rookDestination, kingDestination);
  }
}
