package fischer.notation;

import fischer.engine.Board;
import fischer.engine.CastlingRight;
import fischer.engine.CastlingRights;
import fischer.engine.Color;
import fischer.engine.Piece;
import fischer.engine.Position;
import fischer.engine.Square;
import java.util.Objects;
import java.util.Optional;

/**
 * Forsyth–Edwards Notation for {@link Position}s.
 *
 * <p>Parsing accepts any whitespace between the six fields and castling letters in any order;
 * formatting always produces the canonical form (minimal digit runs, {@code KQkq} ordering).
 */
public final class FenCodec {

  public static final String STANDARD = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

  private FenCodec() {}

  /* ────── parsing ────── */

  /**
   * Parses a full six-field FEN record.
   *
   * @throws IllegalArgumentException if a field is malformed or the resulting position fails
   *     validation
   */
  public static Position parse(String fen) {
    Objects.requireNonNull(fen, "FEN must not be null");
    String[] tokens = fen.trim().split("\\s+");
    if (tokens.length != 6) {
      throw new IllegalArgumentException("FEN must have six fields, got " + tokens.length);
    }

    /* 1) board */
    Board board = parsePlacement(tokens[0]);

    /* 2) active colour */
    Color side =
        tokens[1].length() == 1
            ? Color.fromCharacter(tokens[1].charAt(0)).orElse(null)
            : null;
    if (side == null) throw new IllegalArgumentException("Invalid active colour: " + tokens[1]);

    /* 3) castling rights */
    CastlingRights rights = parseCastling(tokens[2]);

    /* 4) en-passant */
    Square ep = parseEnPassant(tokens[3]);

    /* 5) half-move clock */
    int halfmoves;
    try {
      halfmoves = Integer.parseUnsignedInt(tokens[4]);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid half-move clock: " + tokens[4], e);
    }

    /* 6) full-move number */
    int fullmoves;
    try {
      fullmoves = Integer.parseUnsignedInt(tokens[5]);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid full-move number: " + tokens[5], e);
    }
    if (fullmoves < 1) throw new IllegalArgumentException("Invalid full-move number: " + tokens[5]);

    return new Position(board, side, rights, ep, halfmoves, fullmoves);
  }

  /** Like {@link #parse} but reports any failure as an empty result. */
  public static Optional<Position> tryParse(String fen) {
    if (fen == null) return Optional.empty();
    try {
      return Optional.of(parse(fen));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * Parses the placement field alone ({@code rnbqkbnr/pppppppp/8/...}). The board is not
   * validated beyond its shape, so it may lack kings.
   */
  public static Board parsePlacement(String field) {
    Objects.requireNonNull(field, "placement must not be null");
    Board board = new Board(null);

    int rank = 7, file = 0;
    for (int idx = 0; idx < field.length(); ++idx) {
      char c = field.charAt(idx);
      if (c == '/') {
        if (file != 8) throw new IllegalArgumentException("Rank " + (rank + 1) + " is not 8 files wide");
        if (--rank < 0) throw new IllegalArgumentException("Too many ranks in placement");
        file = 0;
        continue;
      }
      if (c >= '1' && c <= '8') {
        file += c - '0';
        if (file > 8) throw new IllegalArgumentException("Too many files in rank " + (rank + 1));
      } else {
        if (file >= 8) throw new IllegalArgumentException("Too many files in rank " + (rank + 1));
        Piece piece =
            Piece.fromCharacter(c)
                .orElseThrow(() -> new IllegalArgumentException("Invalid piece char: " + c));
        board.set(Square.values()[rank * 8 + file], piece);
        file++;
      }
    }
    if (rank != 0 || file != 8) throw new IllegalArgumentException("Incomplete board in FEN");
    return board;
  }

  private static CastlingRights parseCastling(String field) {
    if (field.equals("-")) return CastlingRights.NONE;
    CastlingRights rights = CastlingRights.NONE;
    for (char c : field.toCharArray()) {
      CastlingRight right =
          CastlingRight.fromCharacter(c)
              .orElseThrow(() -> new IllegalArgumentException("Invalid castling char: " + c));
      if (rights.contains(right)) {
        throw new IllegalArgumentException("Duplicate castling char: " + c);
      }
      rights = rights.with(right);
    }
    return rights;
  }

  private static Square parseEnPassant(String field) {
    if (field.equals("-")) return null;
    return Square.parse(field)
        .orElseThrow(() -> new IllegalArgumentException("Bad EP square: " + field));
  }

  /* ────── formatting ────── */

  /** Canonical six-field FEN of {@code position}. */
  public static String format(Position position) {
    StringBuilder sb = new StringBuilder(96);
    sb.append(placement(position.board()));
    sb.append(' ').append(position.sideToMove().character());
    sb.append(' ').append(position.castlingRights());
    sb.append(' ');
    Square ep = position.enPassantTarget();
    sb.append(ep == null ? "-" : ep.toString());
    sb.append(' ').append(position.halfmoveClock()).append(' ').append(position.fullmoveNumber());
    return sb.toString();
  }

  /** Placement field with minimal digit runs, rank 8 first. */
  public static String placement(Board board) {
    StringBuilder sb = new StringBuilder(72);
    Square[] squares = Square.values();
    for (int rank = 7; rank >= 0; --rank) {
      int empty = 0;
      for (int file = 0; file < 8; ++file) {
        Piece p = board.get(squares[rank * 8 + file]);
        if (p == null) empty++;
        else {
          if (empty != 0) {
            sb.append(empty);
            empty = 0;
          }
          sb.append(p.character());
        }
      }
      if (empty != 0) sb.append(empty);
      if (rank != 0) sb.append('/');
    }
    return sb.toString();
  }
}
