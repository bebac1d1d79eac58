package fischer.engine.contracts;

import fischer.engine.Outcome;
import fischer.engine.Position;

/**
 * Pluggable draw condition evaluated after every position change, once checkmate and stalemate
 * have been ruled out.
 */
public interface DrawRule {

  /** {@code true} if {@code position} is drawn under this rule. */
  boolean isDraw(Position position);

  /** Reason reported in the {@link Outcome} when this rule fires. */
  Outcome.Reason reason();
}
