package fischer.engine.internal;

import fischer.engine.Color;

/**
 * Step tables shared by the board's attack queries and the move generator. Every entry is a
 * {@code {fileDelta, rankDelta}} pair.
 */
public final class Geometry {

  private Geometry() {}

  /* ────── leapers ────── */
  public static final int[][] KNIGHT_STEPS = {
    {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
  };

  public static final int[][] KING_STEPS = {
    {0, 1}, {1, 1}, {1, 0}, {1, -1}, {0, -1}, {-1, -1}, {-1, 0}, {-1, 1}
  };

  /* ────── slider rays ────── */
  public static final int[][] DIAGONALS = {{1, 1}, {1, -1}, {-1, -1}, {-1, 1}};

  public static final int[][] ORTHOGONALS = {{0, 1}, {1, 0}, {0, -1}, {-1, 0}};

  public static final int[][] ALL_RAYS = {
    {0, 1}, {1, 1}, {1, 0}, {1, -1}, {0, -1}, {-1, -1}, {-1, 0}, {-1, 1}
  };

  /* ────── pawns ────── */

  /** Rank direction pawns of a color advance in: +1 for white, -1 for black. */
  public static int pawnDirection(Color color) {
    return color.isWhite() ? 1 : -1;
  }

  /** File deltas of the two pawn capture diagonals. */
  public static final int[] PAWN_CAPTURE_FILES = {-1, 1};
}
