package fischer.engine.records;

import static org.junit.jupiter.api.Assertions.*;

import fischer.engine.Game;
import fischer.engine.Move;
import fischer.engine.Outcome;
import fischer.engine.Position;
import fischer.engine.Square;
import fischer.engine.contracts.DrawRule;
import fischer.engine.internal.DrawRules;
import fischer.engine.internal.MoveGeneratorImpl;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GameSpecTest {

  @Test
  void defaults() {
    GameSpec spec = GameSpec.standard();
    assertEquals(Position.standard(), spec.start());
    assertEquals(DrawRules.standard(), spec.drawRules());
    assertNotNull(spec.generator());
    assertNotNull(spec.maker());
  }

  @Test
  void drawRulesAreCopied() {
    List<DrawRule> rules = new ArrayList<>(List.of(DrawRules.FIFTY_MOVE));
    GameSpec spec = GameSpec.builder().drawRules(rules).build();
    rules.add(DrawRules.INSUFFICIENT_MATERIAL);
    assertEquals(List.of(DrawRules.FIFTY_MOVE), spec.drawRules());
    assertThrows(UnsupportedOperationException.class, () -> spec.drawRules().clear());
  }

  @Test
  void customRulesAreConsulted() {
    DrawRule fromMoveTwo = new DrawRule() {
      @Override
      public boolean isDraw(Position position) {
        return position.fullmoveNumber() >= 2;
      }

      @Override
      public Outcome.Reason reason() {
        return Outcome.Reason.FIFTY_MOVE_RULE;
      }
    };
    Game game = new Game(GameSpec.builder()
        .generator(new MoveGeneratorImpl())
        .drawRules(List.of(fromMoveTwo))
        .build());
    game.execute(Move.of(Square.E2, Square.E4));
    assertFalse(game.isComplete());
    game.execute(Move.of(Square.E7, Square.E5));
    assertTrue(game.isComplete());
  }

  @Test
  void perftResultRate() {
    PerftResult r = new PerftResult(3, 8902, 2_000_000_000L, Map.of());
    assertEquals(4451, r.nps());
    assertEquals(0, new PerftResult(1, 20, 10, Map.of()).nps());
    assertTrue(r.divide().isEmpty());
  }
}
