package ca.gc.cra.devlog.infrastructure.render;

/**
 * ANSI escape sequences used by {@link DevHandler}, plus a colorless variant whose codes are all empty.
 *
 * @since 0.1.0
 */
public final class AnsiPalette {
  public static final char ESC = '\u001b';

  public static final String RESET_CODE = "\u001b[0m";
  public static final String RED_CODE = "\u001b[31m";
  public static final String FAINT_CODE = "\u001b[90m";
  public static final String GREEN_CODE = "\u001b[32m";
  public static final String YELLOW_CODE = "\u001b[33m";
  public static final String BLUE_CODE = "\u001b[34m";
  public static final String MAGENTA_CODE = "\u001b[35m";
  public static final String CYAN_CODE = "\u001b[36m";
  public static final String BRIGHT_GREEN_CODE = "\u001b[92m";
  public static final String BRIGHT_YELLOW_CODE = "\u001b[93m";

  /** Palette emitting real escape codes. */
  public static final AnsiPalette ANSI = new AnsiPalette(true);
  /** Palette emitting nothing. */
  public static final AnsiPalette NONE = new AnsiPalette(false);

  private final boolean enabled;

  private AnsiPalette(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean enabled() {
    return enabled;
  }

  public String reset() {
    return code(RESET_CODE);
  }

  public String red() {
    return code(RED_CODE);
  }

  public String faint() {
    return code(FAINT_CODE);
  }

  public String green() {
    return code(GREEN_CODE);
  }

  public String yellow() {
    return code(YELLOW_CODE);
  }

  public String blue() {
    return code(BLUE_CODE);
  }

  public String magenta() {
    return code(MAGENTA_CODE);
  }

  public String cyan() {
    return code(CYAN_CODE);
  }

  public String brightGreen() {
    return code(BRIGHT_GREEN_CODE);
  }

  public String brightYellow() {
    return code(BRIGHT_YELLOW_CODE);
  }

  private String code(String code) {
    return enabled ? code : "";
  }
}
