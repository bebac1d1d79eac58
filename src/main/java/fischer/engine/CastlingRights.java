package fischer.engine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable set of {@link CastlingRight}s packed into a 4-bit mask:
 *
 * <pre>
 * 0x1 = White O-O, 0x2 = White O-O-O,
 * 0x4 = Black O-O, 0x8 = Black O-O-O
 * </pre>
 */
public final class CastlingRights implements Iterable<CastlingRight> {

  public static final CastlingRights NONE = new CastlingRights(0);
  public static final CastlingRights ALL = new CastlingRights(0xF);

  private static final CastlingRight[] RIGHTS = CastlingRight.values();

  private final int mask;

  private CastlingRights(int mask) {
    this.mask = mask;
  }

  public static CastlingRights of(CastlingRight... rights) {
    int m = 0;
    for (CastlingRight r : rights) m |= r.mask();
    return fromMask(m);
  }

  /** Builds a set from the low four bits of {@code mask}. */
  public static CastlingRights fromMask(int mask) {
    int m = mask & 0xF;
    if (m == 0) return NONE;
    if (m == 0xF) return ALL;
    return new CastlingRights(m);
  }

  public int mask() {
    return mask;
  }

  public boolean contains(CastlingRight right) {
    return (mask & right.mask()) != 0;
  }

  public boolean isEmpty() {
    return mask == 0;
  }

  public int size() {
    return Integer.bitCount(mask);
  }

  public CastlingRights with(CastlingRight right) {
    return fromMask(mask | right.mask());
  }

  public CastlingRights without(CastlingRight right) {
    return fromMask(mask & ~right.mask());
  }

  /** Drops both rights of {@code color}. */
  public CastlingRights withoutColor(Color color) {
    return without(CastlingRight.of(color, Side.KINGSIDE))
        .without(CastlingRight.of(color, Side.QUEENSIDE));
  }

  /** Rights in {@code KQkq} order. */
  public List<CastlingRight> toList() {
    List<CastlingRight> out = new ArrayList<>(4);
    for (CastlingRight r : RIGHTS) {
      if (contains(r)) out.add(r);
    }
    return List.copyOf(out);
  }

  @Override
  public Iterator<CastlingRight> iterator() {
    return toList().iterator();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof CastlingRights other && other.mask == mask);
  }

  @Override
  public int hashCode() {
    return mask;
  }

  /** FEN castling field, e.g. {@code "KQkq"}, {@code "Kq"} or {@code "-"}. */
  @Override
  public String toString() {
    if (mask == 0) return "-";
    StringBuilder sb = new StringBuilder(4);
    for (CastlingRight r : this) sb.append(r.character());
    return sb.toString();
  }
}
