package fischer.engine.internal;

import static org.junit.jupiter.api.Assertions.*;

import fischer.engine.Outcome;
import fischer.notation.FenCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DrawRulesTest {

  @Test
  void fiftyMoveRuleCountsPlies() {
    assertFalse(DrawRules.FIFTY_MOVE.isDraw(FenCodec.parse("4k3/8/8/8/8/8/8/R3K3 w - - 99 70")));
    assertTrue(DrawRules.FIFTY_MOVE.isDraw(FenCodec.parse("4k3/8/8/8/8/8/8/R3K3 w - - 100 70")));
    assertEquals(Outcome.Reason.FIFTY_MOVE_RULE, DrawRules.FIFTY_MOVE.reason());
  }

  @ParameterizedTest(name = "{0}")
  @ValueSource(strings = {
      "4k3/8/8/8/8/8/8/4K3 w - - 0 1",     // bare kings
      "4k3/8/8/8/8/8/8/4KN2 w - - 0 1",    // single knight
      "4k3/8/8/8/8/8/8/4KB2 w - - 0 1",    // single bishop
      "4kb2/8/8/8/8/8/8/2B1K3 w - - 0 1",  // bishops on dark squares only
      "2b1k3/8/8/8/8/8/8/3BK3 w - - 0 1"   // bishops on light squares only
  })
  void deadPositions(String fen) {
    assertTrue(DrawRules.INSUFFICIENT_MATERIAL.isDraw(FenCodec.parse(fen)));
  }

  @ParameterizedTest(name = "{0}")
  @ValueSource(strings = {
      "4k3/8/8/8/8/8/4P3/4K3 w - - 0 1",   // pawn
      "4k3/8/8/8/8/8/8/R3K3 w - - 0 1",    // rook
      "4k3/8/8/8/8/8/8/3QK3 w - - 0 1",    // queen
      "4k3/8/8/8/8/8/8/2NNK3 w - - 0 1",   // two knights
      "4kn2/8/8/8/8/8/8/4KB2 w - - 0 1",   // bishop against knight
      "4k3/8/8/8/8/8/8/2B1KB2 w - - 0 1"   // bishops on both colors
  })
  void matingMaterialRemains(String fen) {
    assertFalse(DrawRules.INSUFFICIENT_MATERIAL.isDraw(FenCodec.parse(fen)));
  }

  @Test
  void standardSetHasBothRules() {
    assertEquals(2, DrawRules.standard().size());
    assertTrue(DrawRules.standard().contains(DrawRules.FIFTY_MOVE));
    assertTrue(DrawRules.standard().contains(DrawRules.INSUFFICIENT_MATERIAL));
  }
}
