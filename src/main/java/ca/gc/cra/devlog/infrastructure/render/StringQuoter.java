package ca.gc.cra.devlog.infrastructure.render;

import ca.gc.cra.devlog.infrastructure.buffer.GrowableBuffer;

/**
 * <strong>What:</strong> Quoting and escaping rules for text values in rendered lines.
 * <p><strong>Why:</strong> A value stays bare only while it cannot be confused with the {@code key=value }
 * separators; anything else becomes a double-quoted literal with C-style escapes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decide whether a string needs quoting.</li>
 *   <li>Produce the quoted literal, optionally keeping ESC bytes raw so color codes stay live.</li>
 *   <li>Strip color escape runs for colorless output.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class StringQuoter {
  private static final char[] HEX = "0123456789abcdef".toCharArray();
  private static final boolean[] SAFE_SET = new boolean[0x80];

  static {
    for (int c = 0x20; c <= 0x7f; c++) {
      SAFE_SET[c] = true;
    }
    SAFE_SET['"'] = false;
    SAFE_SET['\\'] = false;
    SAFE_SET[AnsiPalette.ESC] = true;
  }

  private StringQuoter() {}

  /**
   * Appends {@code value}, quoting it when {@code quote} is set and the text requires it.
   *
   * @param buf destination
   * @param value text to append
   * @param quote whether quoting is allowed at all
   * @param color whether the destination honors escape codes; when {@code false} and {@code quote} is set,
   *     escape runs are stripped first
   */
  public static void append(GrowableBuffer buf, String value, boolean quote, boolean color) {
    String text = value;
    if (quote && !color) {
      text = stripEscapes(text);
    }
    if (quote && needsQuoting(text)) {
      buf.writeString(quote(text, color));
    } else {
      buf.writeString(text);
    }
  }

  /**
   * Reports whether {@code value} must be quoted: it is empty, or contains a space, {@code =}, an ASCII byte
   * outside the safe set, a lone surrogate, the replacement character, a Unicode space or a non-printable
   * code point. Backslashes alone never force quoting.
   */
  public static boolean needsQuoting(String value) {
    if (value.isEmpty()) {
      return true;
    }
    for (int i = 0; i < value.length(); ) {
      char c = value.charAt(i);
      if (c < 0x80) {
        if (c != '\\' && (c == ' ' || c == '=' || !SAFE_SET[c])) {
          return true;
        }
        i++;
        continue;
      }
      int cp = value.codePointAt(i);
      if (Character.isSurrogate((char) cp) || cp == 0xfffd || isSpace(cp) || !isPrint(cp)) {
        return true;
      }
      i += Character.charCount(cp);
    }
    return false;
  }

  /**
   * Renders {@code value} as a double-quoted literal.
   *
   * @param value text to quote
   * @param keepEscape emit ESC raw instead of {@code \x1b}
   * @return quoted literal
   */
  public static String quote(String value, boolean keepEscape) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); ) {
      int cp = value.codePointAt(i);
      i += Character.charCount(cp);
      if (cp == '"' || cp == '\\') {
        sb.append('\\').appendCodePoint(cp);
        continue;
      }
      if (isPrint(cp) && !Character.isSurrogate((char) cp)) {
        sb.appendCodePoint(cp);
        continue;
      }
      switch (cp) {
        case 0x07 -> sb.append("\\a");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case 0x0b -> sb.append("\\v");
        default -> appendEscaped(sb, cp, keepEscape);
      }
    }
    return sb.append('"').toString();
  }

  /**
   * Removes escape runs: an ESC and every following code point up to and including the next letter.
   */
  public static String stripEscapes(String value) {
    if (value.indexOf(AnsiPalette.ESC) < 0) {
      return value;
    }
    StringBuilder sb = new StringBuilder(value.length());
    boolean inEscape = false;
    for (int i = 0; i < value.length(); ) {
      int cp = value.codePointAt(i);
      i += Character.charCount(cp);
      if (cp == AnsiPalette.ESC) {
        inEscape = true;
      } else if (inEscape) {
        if (Character.isLetter(cp)) {
          inEscape = false;
        }
      } else {
        sb.appendCodePoint(cp);
      }
    }
    return sb.toString();
  }

  /**
   * Printable per Unicode: letters, marks, numbers, punctuation, symbols and the ASCII space.
   */
  static boolean isPrint(int cp) {
    if (cp < 0x80) {
      return cp >= 0x20 && cp < 0x7f;
    }
    switch (Character.getType(cp)) {
      case Character.UPPERCASE_LETTER:
      case Character.LOWERCASE_LETTER:
      case Character.TITLECASE_LETTER:
      case Character.MODIFIER_LETTER:
      case Character.OTHER_LETTER:
      case Character.NON_SPACING_MARK:
      case Character.ENCLOSING_MARK:
      case Character.COMBINING_SPACING_MARK:
      case Character.DECIMAL_DIGIT_NUMBER:
      case Character.LETTER_NUMBER:
      case Character.OTHER_NUMBER:
      case Character.CONNECTOR_PUNCTUATION:
      case Character.DASH_PUNCTUATION:
      case Character.START_PUNCTUATION:
      case Character.END_PUNCTUATION:
      case Character.INITIAL_QUOTE_PUNCTUATION:
      case Character.FINAL_QUOTE_PUNCTUATION:
      case Character.OTHER_PUNCTUATION:
      case Character.MATH_SYMBOL:
      case Character.CURRENCY_SYMBOL:
      case Character.MODIFIER_SYMBOL:
      case Character.OTHER_SYMBOL:
        return true;
      default:
        return false;
    }
  }

  static boolean isSpace(int cp) {
    return switch (cp) {
      case '\t', '\n', 0x0b, '\f', '\r', ' ', 0x85 -> true;
      default -> Character.isSpaceChar(cp);
    };
  }

  private static void appendEscaped(StringBuilder sb, int cp, boolean keepEscape) {
    if (cp == AnsiPalette.ESC && keepEscape) {
      sb.append(AnsiPalette.ESC);
    } else if (cp < ' ' || cp == 0x7f) {
      sb.append("\\x").append(HEX[cp >> 4]).append(HEX[cp & 0xf]);
    } else if (cp < 0x10000) {
      sb.append("\\u");
      appendHex(sb, cp, 4);
    } else {
      sb.append("\\U");
      appendHex(sb, cp, 8);
    }
  }

  private static void appendHex(StringBuilder sb, int value, int digits) {
    for (int shift = (digits - 1) * 4; shift >= 0; shift -= 4) {
      sb.append(HEX[(value >> shift) & 0xf]);
    }
  }
}
