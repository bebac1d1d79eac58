package fischer.engine.records;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leaf-node count of a perft run.
 *
 * @param depth        Plies searched from the root.
 * @param nodes        Leaf positions reached; promotions count once per promotion piece.
 * @param elapsedNanos Wall-clock time of the run.
 * @param divide       Per-root-move subtotals keyed by UCI move text, empty unless requested.
 */
public record PerftResult(int depth, long nodes, long elapsedNanos, Map<String, Long> divide) {

    public PerftResult {
        divide = Collections.unmodifiableMap(new LinkedHashMap<>(divide));
    }

    /** Nodes per second, 0 when the run was too short to time. */
    public long nps() {
        long ms = elapsedNanos / 1_000_000;
        return ms > 0 ? (1000L * nodes) / ms : 0;
    }
}
