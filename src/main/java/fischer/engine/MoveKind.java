package fischer.engine;

/** Tag describing what a legal move does beyond moving a piece. */
public enum MoveKind {
  QUIET,
  DOUBLE_PAWN_PUSH,
  CAPTURE,
  EN_PASSANT,
  CASTLE_KINGSIDE,
  CASTLE_QUEENSIDE,
  PROMOTION,
  PROMOTION_CAPTURE;

  /** {@code true} if the move removes an enemy piece, including en passant. */
  public boolean isCapture() {
    return this == CAPTURE || this == EN_PASSANT || this == PROMOTION_CAPTURE;
  }

  /** {@code true} if the move requires a promotion kind. */
  public boolean isPromotion() {
    return this == PROMOTION || this == PROMOTION_CAPTURE;
  }

  public boolean isCastle() {
    return this == CASTLE_KINGSIDE || this == CASTLE_QUEENSIDE;
  }
}
