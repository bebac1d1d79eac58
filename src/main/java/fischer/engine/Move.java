package fischer.engine;

import java.util.Objects;

/**
 * Displacement of a piece from {@code start} to {@code end}. Equality and hashing are structural.
 *
 * <p>A move carries no knowledge of the position it is played in; captures, castling, en passant
 * and promotion are tagged separately by {@link MoveKind}, and the promotion piece travels beside
 * the move in a {@link Ply}.
 */
public record Move(Square start, Square end) {

  public Move {
    Objects.requireNonNull(start, "start must not be null");
    Objects.requireNonNull(end, "end must not be null");
  }

  public static Move of(Square start, Square end) {
    return new Move(start, end);
  }

  /** The king move that performs castling for {@code color} towards {@code side}. */
  public static Move castle(Color color, Side side) {
    CastlingRight right = CastlingRight.of(color, side);
    return new Move(right.kingStart(), right.kingDestination());
  }

  /* ────── geometry ────── */

  /** Signed number of files travelled (positive towards h). */
  public int fileChange() {
    return end.file().index() - start.file().index();
  }

  /** Signed number of ranks travelled (positive towards rank 8). */
  public int rankChange() {
    return end.rank().index() - start.rank().index();
  }

  /** {@code false} for a null displacement. */
  public boolean isChange() {
    return start != end;
  }

  public boolean isDiagonal() {
    return isChange() && Math.abs(fileChange()) == Math.abs(rankChange());
  }

  public boolean isHorizontal() {
    return isChange() && rankChange() == 0;
  }

  public boolean isVertical() {
    return isChange() && fileChange() == 0;
  }

  /** Two-by-one jump, the only shape a knight can make. */
  public boolean isKnightJump() {
    int df = Math.abs(fileChange()), dr = Math.abs(rankChange());
    return (df == 1 && dr == 2) || (df == 2 && dr == 1);
  }

  public boolean isUpward() {
    return rankChange() > 0;
  }

  public boolean isDownward() {
    return rankChange() < 0;
  }

  /** Same path travelled backwards. */
  public Move reversed() {
    return new Move(end, start);
  }

  /** Image of this move under a 180° board rotation, used for color-symmetric lookups. */
  public Move rotated() {
    return new Move(start.rotated(), end.rotated());
  }

  /** Coordinate form, e.g. {@code "e2e4"}. */
  @Override
  public String toString() {
    return start.toString() + end;
  }
}
