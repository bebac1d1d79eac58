package fischer.engine;

/** Starting arrangements a {@link Board} can be populated with. */
public enum Variant {
  /** Orthodox chess: white on ranks 1-2, black on ranks 7-8. */
  STANDARD
}
