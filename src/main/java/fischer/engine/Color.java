package fischer.engine;

import java.util.Optional;

/** The two sides of a chess game. */
public enum Color {
  WHITE,
  BLACK;

  /** Returns the opposing color. */
  public Color inverse() {
    return this == WHITE ? BLACK : WHITE;
  }

  public boolean isWhite() {
    return this == WHITE;
  }

  public boolean isBlack() {
    return this == BLACK;
  }

  /** FEN side-to-move letter, {@code 'w'} or {@code 'b'}. */
  public char character() {
    return this == WHITE ? 'w' : 'b';
  }

  /** Parses {@code w}/{@code b} in either case. */
  public static Optional<Color> fromCharacter(char c) {
    return switch (c) {
      case 'w', 'W' -> Optional.of(WHITE);
      case 'b', 'B' -> Optional.of(BLACK);
      default -> Optional.empty();
    };
  }
}
