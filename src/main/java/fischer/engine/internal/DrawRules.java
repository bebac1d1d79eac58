package fischer.engine.internal;

import fischer.engine.Board;
import fischer.engine.Outcome;
import fischer.engine.Piece;
import fischer.engine.Position;
import fischer.engine.contracts.DrawRule;
import java.util.List;

/** Draw conditions that depend on the current position alone. */
public enum DrawRules implements DrawRule {

  /** One hundred plies without a capture or a pawn move. */
  FIFTY_MOVE(Outcome.Reason.FIFTY_MOVE_RULE) {
    @Override
    public boolean isDraw(Position position) {
      return position.halfmoveClock() >= FIFTY_MOVE_PLIES;
    }
  },

  /**
   * Neither side can ever mate: no pawns, rooks or queens remain, and either there is at most one
   * minor piece on the board or every minor piece is a bishop and they all share a square color.
   */
  INSUFFICIENT_MATERIAL(Outcome.Reason.INSUFFICIENT_MATERIAL) {
    @Override
    public boolean isDraw(Position position) {
      Board board = position.board();
      int minors = 0, knights = 0, lightBishops = 0, darkBishops = 0;
      for (Board.Space space : board) {
        Piece p = space.piece();
        if (p == null || p.isKing()) continue;
        switch (p.kind()) {
          case PAWN, ROOK, QUEEN -> {
            return false;
          }
          case KNIGHT -> knights++;
          case BISHOP -> {
            if (space.square().isLight()) lightBishops++;
            else darkBishops++;
          }
          default -> {}
        }
        minors++;
      }
      if (minors <= 1) return true;
      return knights == 0 && (lightBishops == 0 || darkBishops == 0);
    }
  };

  public static final int FIFTY_MOVE_PLIES = 100;

  private final Outcome.Reason reason;

  DrawRules(Outcome.Reason reason) {
    this.reason = reason;
  }

  @Override
  public Outcome.Reason reason() {
    return reason;
  }

  /** Both rules, the default set for a new game. */
  public static List<DrawRule> standard() {
    return List.of(FIFTY_MOVE, INSUFFICIENT_MATERIAL);
  }
}
