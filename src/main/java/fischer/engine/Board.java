package fischer.engine;

import static fischer.engine.internal.Geometry.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Square-addressable container of pieces: 64 fixed slots, at most one piece each.
 *
 * <p>Iteration visits every square in rank-major order (a1, b1, …, h1, a2, …, h8), yielding one
 * {@link Space} per square whether or not it is occupied. Equality is based on cell contents only,
 * so an empty board equals a standard board whose pieces have all been removed.
 *
 * <p>Boards are mutable and not thread-safe; {@link Position} keeps private copies.
 */
public final class Board implements Iterable<Board.Space> {

  /** A square together with its occupant, or {@code null} when the square is empty. */
  public record Space(Square square, Piece piece) {
    public Space {
      Objects.requireNonNull(square, "square must not be null");
    }

    public boolean isEmpty() {
      return piece == null;
    }

    public Optional<Piece> occupant() {
      return Optional.ofNullable(piece);
    }
  }

  private static final Square[] SQUARES = Square.values();
  private static final Piece.Kind[] BACK_RANK = {
    Piece.Kind.ROOK, Piece.Kind.KNIGHT, Piece.Kind.BISHOP, Piece.Kind.QUEEN,
    Piece.Kind.KING, Piece.Kind.BISHOP, Piece.Kind.KNIGHT, Piece.Kind.ROOK
  };

  private final Piece[] cells;

  /** Creates a board populated with the standard starting arrangement. */
  public Board() {
    this(Variant.STANDARD);
  }

  /**
   * Creates a board for {@code variant}.
   *
   * @param variant arrangement to populate, or {@code null} for an empty board
   */
  public Board(Variant variant) {
    this.cells = new Piece[64];
    if (variant == Variant.STANDARD) populateStandard();
  }

  private Board(Piece[] cells) {
    this.cells = cells;
  }

  private void populateStandard() {
    for (Color color : Color.values()) {
      Rank back = Rank.backRank(color);
      Rank pawns = Rank.pawnRank(color);
      for (File file : File.values()) {
        cells[Square.of(file, back).index()] = new Piece(BACK_RANK[file.index()], color);
        cells[Square.of(file, pawns).index()] = Piece.pawn(color);
      }
    }
  }

  /** Independent copy of this board. */
  public Board copy() {
    return new Board(cells.clone());
  }

  /* ────── cell access ────── */

  /** Piece on {@code square}, or {@code null} if it is empty. */
  public Piece get(Square square) {
    return cells[square.index()];
  }

  public Piece get(File file, Rank rank) {
    return get(Square.of(file, rank));
  }

  /** Places {@code piece} on {@code square}; {@code null} clears it. */
  public void set(Square square, Piece piece) {
    cells[square.index()] = piece;
  }

  public void set(File file, Rank rank, Piece piece) {
    set(Square.of(file, rank), piece);
  }

  /** Clears {@code square} and returns what stood there, or {@code null}. */
  public Piece remove(Square square) {
    Piece old = cells[square.index()];
    cells[square.index()] = null;
    return old;
  }

  /** Exchanges the contents of two squares; either or both may be empty. */
  public void swap(Square a, Square b) {
    Piece tmp = cells[a.index()];
    cells[a.index()] = cells[b.index()];
    cells[b.index()] = tmp;
  }

  public boolean isEmpty(Square square) {
    return cells[square.index()] == null;
  }

  /* ────── full-board queries ────── */

  /** All pieces on the board in iteration order. */
  public List<Piece> pieces() {
    List<Piece> out = new ArrayList<>(32);
    for (Piece p : cells) {
      if (p != null) out.add(p);
    }
    return out;
  }

  public List<Piece> pieces(Color color) {
    List<Piece> out = new ArrayList<>(16);
    for (Piece p : cells) {
      if (p != null && p.color() == color) out.add(p);
    }
    return out;
  }

  public List<Piece> whitePieces() {
    return pieces(Color.WHITE);
  }

  public List<Piece> blackPieces() {
    return pieces(Color.BLACK);
  }

  /** Squares occupied by pieces of {@code color}. */
  public List<Square> squares(Color color) {
    List<Square> out = new ArrayList<>(16);
    for (int i = 0; i < 64; i++) {
      if (cells[i] != null && cells[i].color() == color) out.add(SQUARES[i]);
    }
    return out;
  }

  /** Squares holding exactly {@code piece}. */
  public List<Square> squares(Piece piece) {
    List<Square> out = new ArrayList<>(8);
    for (int i = 0; i < 64; i++) {
      if (piece.equals(cells[i])) out.add(SQUARES[i]);
    }
    return out;
  }

  public int count(Piece piece) {
    int n = 0;
    for (Piece p : cells) {
      if (piece.equals(p)) n++;
    }
    return n;
  }

  /** Number of pieces of {@code color}, or of both colors when {@code color} is {@code null}. */
  public int pieceCount(Color color) {
    int n = 0;
    for (Piece p : cells) {
      if (p != null && (color == null || p.color() == color)) n++;
    }
    return n;
  }

  public boolean contains(Piece piece) {
    return count(piece) > 0;
  }

  /** Square of the king of {@code color}; empty if the board has none. */
  public Optional<Square> squareForKing(Color color) {
    Piece king = Piece.king(color);
    for (int i = 0; i < 64; i++) {
      if (king.equals(cells[i])) return Optional.of(SQUARES[i]);
    }
    return Optional.empty();
  }

  /* ────── attack geometry ────── */

  /**
   * Squares holding pieces of color {@code by} that attack {@code target}. Attacks are pure
   * geometry: pawns attack diagonally whether or not the target is occupied, sliders stop at the
   * first occupied square, and castling never attacks anything.
   */
  public List<Square> attackers(Square target, Color by) {
    List<Square> out = new ArrayList<>(4);
    collectAttackers(target, by, out, false);
    return out;
  }

  /** {@code true} if any piece of color {@code by} attacks {@code target}. */
  public boolean isAttacked(Square target, Color by) {
    return collectAttackers(target, by, null, true);
  }

  /**
   * {@code true} if the king of {@code color} stands on an attacked square.
   *
   * @throws NoKingException if there is no king of that color
   */
  public boolean kingIsChecked(Color color) {
    Square king = squareForKing(color).orElseThrow(() -> new NoKingException(color));
    return isAttacked(king, color.inverse());
  }

  private boolean collectAttackers(Square target, Color by, List<Square> out, boolean firstOnly) {
    boolean found = false;

    /* 1) pawns – a white pawn attacks upwards, so it stands one rank below the target */
    int back = -pawnDirection(by);
    for (int df : PAWN_CAPTURE_FILES) {
      Square from = target.offset(df, back).orElse(null);
      if (from != null && isPiece(from, Piece.Kind.PAWN, by)) {
        if (firstOnly) return true;
        out.add(from);
        found = true;
      }
    }

    /* 2) leapers */
    found |= scanSteps(target, by, KNIGHT_STEPS, Piece.Kind.KNIGHT, out, firstOnly);
    if (found && firstOnly) return true;
    found |= scanSteps(target, by, KING_STEPS, Piece.Kind.KING, out, firstOnly);
    if (found && firstOnly) return true;

    /* 3) sliders */
    found |= scanRays(target, by, DIAGONALS, Piece.Kind.BISHOP, out, firstOnly);
    if (found && firstOnly) return true;
    found |= scanRays(target, by, ORTHOGONALS, Piece.Kind.ROOK, out, firstOnly);
    return found;
  }

  private boolean scanSteps(
      Square target, Color by, int[][] steps, Piece.Kind kind, List<Square> out, boolean firstOnly) {
    boolean found = false;
    for (int[] s : steps) {
      Square from = target.offset(s[0], s[1]).orElse(null);
      if (from != null && isPiece(from, kind, by)) {
        if (firstOnly) return true;
        out.add(from);
        found = true;
      }
    }
    return found;
  }

  /* queens count on both ray sets */
  private boolean scanRays(
      Square target, Color by, int[][] rays, Piece.Kind slider, List<Square> out, boolean firstOnly) {
    boolean found = false;
    for (int[] ray : rays) {
      Square sq = target.offset(ray[0], ray[1]).orElse(null);
      while (sq != null) {
        Piece p = get(sq);
        if (p != null) {
          if (p.color() == by && (p.kind() == slider || p.kind() == Piece.Kind.QUEEN)) {
            if (firstOnly) return true;
            out.add(sq);
            found = true;
          }
          break;
        }
        sq = sq.offset(ray[0], ray[1]).orElse(null);
      }
    }
    return found;
  }

  private boolean isPiece(Square square, Piece.Kind kind, Color color) {
    Piece p = get(square);
    return p != null && p.kind() == kind && p.color() == color;
  }

  /* ────── iteration / equality ────── */

  @Override
  public Iterator<Space> iterator() {
    return new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < 64;
      }

      @Override
      public Space next() {
        if (next >= 64) throw new NoSuchElementException();
        int i = next++;
        return new Space(SQUARES[i], cells[i]);
      }
    };
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Board other && Arrays.equals(cells, other.cells));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(cells);
  }

  /** Eight lines, rank 8 first, {@code .} for empty squares. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(72);
    for (int rank = 7; rank >= 0; --rank) {
      for (int file = 0; file < 8; ++file) {
        Piece p = cells[rank * 8 + file];
        sb.append(p == null ? '.' : p.character());
      }
      if (rank != 0) sb.append('\n');
    }
    return sb.toString();
  }
}
