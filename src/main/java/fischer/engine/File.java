package fischer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Board columns {@code a} through {@code h}; declaration order is board order. */
public enum File {
  A,
  B,
  C,
  D,
  E,
  F,
  G,
  H;

  private static final File[] VALUES = values();

  /** Zero-based column index (a = 0). */
  public int index() {
    return ordinal();
  }

  /** Lower-case file letter. */
  public char character() {
    return (char) ('a' + ordinal());
  }

  /** Mirror across the board's vertical centre line (a ⇄ h). */
  public File opposite() {
    return VALUES[7 - ordinal()];
  }

  /** The file {@code delta} columns away, if still on the board. */
  public Optional<File> offset(int delta) {
    return of(ordinal() + delta);
  }

  public Optional<File> next() {
    return offset(1);
  }

  public Optional<File> previous() {
    return offset(-1);
  }

  /** Files from {@code this} to {@code other}, both inclusive, walking in either direction. */
  public List<File> to(File other) {
    int step = other.ordinal() >= ordinal() ? 1 : -1;
    List<File> out = new ArrayList<>();
    for (int i = ordinal(); ; i += step) {
      out.add(VALUES[i]);
      if (i == other.ordinal()) return List.copyOf(out);
    }
  }

  /** Files strictly between {@code this} and {@code other}, ordered from {@code this}. */
  public List<File> between(File other) {
    List<File> all = to(other);
    return all.size() <= 2 ? List.of() : List.copyOf(all.subList(1, all.size() - 1));
  }

  /** Parses a file letter, case-insensitive. */
  public static Optional<File> of(char c) {
    return of(Character.toLowerCase(c) - 'a');
  }

  /** Looks up a file by zero-based index. */
  public static Optional<File> of(int index) {
    return index < 0 || index > 7 ? Optional.empty() : Optional.of(VALUES[index]);
  }

  @Override
  public String toString() {
    return String.valueOf(character());
  }
}
