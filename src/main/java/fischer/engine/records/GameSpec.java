package fischer.engine.records;

import fischer.engine.Position;
import fischer.engine.contracts.DrawRule;
import fischer.engine.contracts.MoveGenerator;
import fischer.engine.contracts.MoveMaker;
import fischer.engine.internal.DrawRules;
import fischer.engine.internal.MoveGeneratorImpl;
import fischer.engine.internal.MoveMakerImpl;
import java.util.List;
import java.util.Objects;

/**
 * Immutable set of <em>game settings</em>.
 *
 * <p>Use the nested {@link Builder} to construct an instance of this record.
 *
 * @param start position the game begins from
 * @param drawRules draw conditions checked after every ply, in order
 * @param generator move generator used for legality and outcome checks
 * @param maker successor computation, normally wired to {@code generator}
 */
public record GameSpec(
        Position start, List<DrawRule> drawRules, MoveGenerator generator, MoveMaker maker) {

    public GameSpec {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(generator, "generator must not be null");
        Objects.requireNonNull(maker, "maker must not be null");
        drawRules = List.copyOf(drawRules);
    }

    /** Standard start, both draw rules, default rule implementations. */
    public static GameSpec standard() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder; every setting is optional. */
    public static class Builder {
        private Position start = Position.standard();
        private List<DrawRule> drawRules = DrawRules.standard();
        private MoveGenerator generator;
        private MoveMaker maker;

        public Builder start(Position start) { this.start = start; return this; }
        public Builder drawRules(List<DrawRule> drawRules) { this.drawRules = drawRules; return this; }
        public Builder noDrawRules() { this.drawRules = List.of(); return this; }
        public Builder generator(MoveGenerator generator) { this.generator = generator; return this; }
        public Builder maker(MoveMaker maker) { this.maker = maker; return this; }

        public GameSpec build() {
            MoveGenerator gen = generator != null ? generator : new MoveGeneratorImpl();
            MoveMaker mk = maker != null ? maker : new MoveMakerImpl(gen);
            return new GameSpec(start, drawRules, gen, mk);
        }
    }
}
