package fischer.engine;

/** Thrown by king-dependent queries on a board that has no king of the requested color. */
public class NoKingException extends IllegalStateException {

  private final Color color;

  public NoKingException(Color color) {
    super("No " + color.name().toLowerCase() + " king on the board");
    this.color = color;
  }

  public Color color() {
    return color;
  }
}
