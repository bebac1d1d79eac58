package fischer.engine;

/** The wing of the board a king castles towards. */
public enum Side {
  KINGSIDE,
  QUEENSIDE;

  public boolean isKingside() {
    return this == KINGSIDE;
  }

  public boolean isQueenside() {
    return this == QUEENSIDE;
  }
}
