package fischer.engine;

import fischer.engine.contracts.DrawRule;
import fischer.engine.contracts.MoveGenerator;
import fischer.engine.contracts.MoveMaker;
import fischer.engine.records.GameSpec;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A game in progress: the current {@link Position}, the plies that led to it and the plies that
 * were taken back. Every change goes through {@link #execute}, {@link #undoMove} or {@link
 * #redoMove}; after each one the outcome is evaluated again.
 *
 * <p>Positions are stored by value, so undoing restores exactly the snapshot that was current
 * before the move, clocks and rights included.
 *
 * <p>Not thread-safe. Callers sharing a game must serialize access themselves.
 */
public final class Game {

  private static final Logger LOGGER = Logger.getLogger(Game.class.getName());

  /* one played ply together with the position it was played from */
  private record Entry(Position before, Ply ply, Piece captured) {}

  private final MoveGenerator generator;
  private final MoveMaker maker;
  private final List<DrawRule> drawRules;

  private final Deque<Entry> history = new ArrayDeque<>();
  private final Deque<Ply> redo = new ArrayDeque<>();

  private Position position;
  private Outcome outcome;

  /** New game from the standard opening position with the default rules. */
  public Game() {
    this(GameSpec.standard());
  }

  /** New game from {@code start} with the default rules. */
  public Game(Position start) {
    this(GameSpec.builder().start(start).build());
  }

  public Game(GameSpec spec) {
    Objects.requireNonNull(spec, "spec must not be null");
    this.generator = spec.generator();
    this.maker = spec.maker();
    this.drawRules = spec.drawRules();
    this.position = spec.start();
    this.outcome = evaluate();
  }

  /**
   * Plays {@code plies} in order from {@code start}.
   *
   * @throws MoveExecutionException for the first ply that cannot be played
   */
  public static Game replay(Position start, List<Ply> plies) {
    Game game = new Game(start);
    for (Ply ply : plies) {
      game.execute(ply.move(), ply.promotion());
    }
    return game;
  }

  /* ────── mutation ────── */

  /**
   * Plays a non-promoting move.
   *
   * @throws IllegalMoveException if the move is not legal or the game is over
   * @throws InvalidPromotionException if the move reaches the last rank with a pawn
   */
  public void execute(Move move) {
    execute(move, null);
  }

  /**
   * Plays {@code move}, promoting to {@code promotion} when a pawn reaches the last rank. Clears
   * the redo stack.
   *
   * @throws IllegalMoveException if the move is not legal or the game is over
   * @throws InvalidPromotionException if {@code promotion} is missing, not a promotable kind, or
   *     given for a move that does not promote
   */
  public void execute(Move move, Piece.Kind promotion) {
    apply(Ply.of(move, promotion));
    redo.clear();
  }

  /**
   * Takes back the last ply.
   *
   * @return the move taken back, or empty if nothing has been played
   */
  public Optional<Move> undoMove() {
    Entry last = history.pollLast();
    if (last == null) return Optional.empty();
    position = last.before();
    redo.push(last.ply());
    outcome = evaluate();
    LOGGER.fine(() -> "undo " + last.ply().move());
    return Optional.of(last.ply().move());
  }

  /**
   * Plays the most recently undone ply again.
   *
   * @return the move replayed, or empty if there is nothing to redo
   */
  public Optional<Move> redoMove() {
    Ply next = redo.peek();
    if (next == null) return Optional.empty();
    apply(next);
    redo.pop();
    LOGGER.fine(() -> "redo " + next.move());
    return Optional.of(next.move());
  }

  private void apply(Ply ply) {
    Move move = Objects.requireNonNull(ply.move(), "move must not be null");
    if (outcome != null) {
      LOGGER.fine(() -> "rejected " + move + ": game is over");
      throw new IllegalMoveException(move, "the game is over, " + outcome);
    }
    Position next;
    Piece captured;
    try {
      next = maker.make(position, move, ply.promotion());
      captured = maker.capturedBy(position, move);
    } catch (MoveExecutionException e) {
      LOGGER.log(Level.FINE, "rejected " + move, e);
      throw e;
    }
    history.addLast(new Entry(position, ply, captured));
    position = next;
    outcome = evaluate();
    LOGGER.fine(() -> "played " + move + (ply.isPromotion() ? "=" + ply.promotion() : ""));
    if (outcome != null) {
      LOGGER.info(() -> "game over after " + history.size() + " plies: " + outcome);
    }
  }

  /* no legal moves ends the game before any draw rule is consulted */
  private Outcome evaluate() {
    if (generator.legalMoves(position).isEmpty()) {
      return generator.kingIsChecked(position)
          ? Outcome.checkmate(position.sideToMove().inverse())
          : Outcome.draw(Outcome.Reason.STALEMATE);
    }
    for (DrawRule rule : drawRules) {
      if (rule.isDraw(position)) return Outcome.draw(rule.reason());
    }
    return null;
  }

  /* ────── queries ────── */

  /** Legal moves of the side to move; empty once the game is over. */
  public List<Move> availableMoves() {
    return isComplete() ? List.of() : generator.legalMoves(position);
  }

  /** Legal moves of the piece on {@code square}; empty if it does not belong to the side to move. */
  public List<Move> movesForPiece(Square square) {
    return isComplete() ? List.of() : generator.legalMoves(position, square);
  }

  public boolean isLegal(Move move) {
    return !isComplete() && generator.isLegal(position, move);
  }

  /** {@code true} if the side to move is in check. */
  public boolean kingIsChecked() {
    return generator.kingIsChecked(position);
  }

  /** Moves played so far, oldest first. */
  public List<Move> playedMoves() {
    List<Move> out = new ArrayList<>(history.size());
    for (Entry e : history) out.add(e.ply().move());
    return List.copyOf(out);
  }

  /** Number of plies played. */
  public int moveCount() {
    return history.size();
  }

  /**
   * Pieces captured so far, in capture order.
   *
   * @param color the color of the captured pieces, or {@code null} for both
   */
  public List<Piece> capturedPieces(Color color) {
    List<Piece> out = new ArrayList<>();
    for (Entry e : history) {
      Piece p = e.captured();
      if (p != null && (color == null || p.color() == color)) out.add(p);
    }
    return List.copyOf(out);
  }

  public Optional<Move> moveToUndo() {
    Iterator<Entry> it = history.descendingIterator();
    return it.hasNext() ? Optional.of(it.next().ply().move()) : Optional.empty();
  }

  public Optional<Move> moveToRedo() {
    Ply next = redo.peek();
    return next == null ? Optional.empty() : Optional.of(next.move());
  }

  public Position position() {
    return position;
  }

  /** Copy of the current placement. */
  public Board board() {
    return position.board();
  }

  public Color sideToMove() {
    return position.sideToMove();
  }

  public CastlingRights castlingRights() {
    return position.castlingRights();
  }

  public Optional<Square> enPassantTarget() {
    return Optional.ofNullable(position.enPassantTarget());
  }

  public int halfmoveClock() {
    return position.halfmoveClock();
  }

  public int fullmoveNumber() {
    return position.fullmoveNumber();
  }

  /** How the game ended, or empty while it is still in progress. */
  public Optional<Outcome> outcome() {
    return Optional.ofNullable(outcome);
  }

  public boolean isComplete() {
    return outcome != null;
  }

  @Override
  public String toString() {
    return "Game[" + history.size() + " plies, " + (outcome == null ? "in progress" : outcome) + "]";
  }
}
