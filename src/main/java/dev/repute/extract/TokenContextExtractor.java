/* Repute © 2025 Repute Devs — MIT */
package dev.repute.extract;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the token address and display symbol a voting message is about.
 *
 * <p>All methods are pure and thread-safe.
 */
public final class TokenContextExtractor {
  /** Sentinel address used when no address could be found. */
  public static final String UNKNOWN_ADDRESS = "unknown";

  private static final Pattern BASE58_ADDRESS =
      Pattern.compile("(?<![0-9A-Za-z])[1-9A-HJ-NP-Za-km-z]{32,44}(?![0-9A-Za-z])");
  private static final Pattern HEX_ADDRESS = Pattern.compile("0x[a-fA-F0-9]{40}");

  private static final Pattern BOLD_DOLLAR = Pattern.compile("\\*\\*\\$([A-Za-z0-9 ]{2,20})\\*\\*");
  // Continuation words after a single space must look like a ticker, so "$BAR baz" yields BAR.
  private static final Pattern DOLLAR = Pattern.compile("\\$([A-Za-z0-9]+(?: [A-Z0-9]+)*)");
  private static final Pattern LINK_LABEL = Pattern.compile("\\[([A-Za-z0-9 ]{2,20})]\\(");
  private static final Pattern PAREN_LABEL = Pattern.compile("\\(([A-Za-z0-9 ]{2,20})\\)");
  private static final Pattern LEADING_NOISE = Pattern.compile("^[\\s\\x{10000}-\\x{10FFFF}]+");
  private static final Pattern WORD_SPLIT = Pattern.compile("[\\s\\-–—]+");
  private static final String TRIM_CHARS = ".,:;!?*$";
  private static final int MAX_SYMBOL = 20;

  private TokenContextExtractor() {}

  /**
   * Finds the first token address in an embed.
   *
   * <p>Title, description, each field's name and value, and the footer are scanned as one text, one
   * part per line. Base58 (Solana-style) addresses win over {@code 0x} hex addresses; a base58 run
   * must stand alone, so the tail of a hex address never counts.
   *
   * @param content embed to scan, may be {@code null}
   * @return the address or {@link #UNKNOWN_ADDRESS}
   */
  public static String extractAddress(StructuredContent content) {
    if (content == null) {
      return UNKNOWN_ADDRESS;
    }
    StringBuilder text = new StringBuilder();
    append(text, content.title());
    append(text, content.description());
    for (StructuredContent.Field field : content.fields()) {
      append(text, field.name());
      append(text, field.value());
    }
    append(text, content.footer());

    Matcher base58 = BASE58_ADDRESS.matcher(text);
    if (base58.find()) {
      return base58.group();
    }
    Matcher hex = HEX_ADDRESS.matcher(text);
    if (hex.find()) {
      return hex.group();
    }
    return UNKNOWN_ADDRESS;
  }

  /**
   * Extracts a ticker-like symbol from free text.
   *
   * <p>Precedence: {@code **$SYM**}, {@code $SYM}, {@code [SYM](}, {@code (SYM)}, then the first
   * word of the text with leading pictographs and surrounding punctuation removed.
   *
   * @param text message text, may be {@code null}
   * @return upper-cased symbol of at most 20 characters, or {@code ""}
   */
  public static String extractSymbol(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    Matcher bold = BOLD_DOLLAR.matcher(text);
    if (bold.find()) {
      return upper(bold.group(1).strip());
    }
    Matcher dollar = DOLLAR.matcher(text);
    while (dollar.find()) {
      String candidate = dollar.group(1);
      if (candidate.length() > MAX_SYMBOL) {
        candidate = candidate.substring(0, MAX_SYMBOL).strip();
      }
      if (candidate.length() >= 2) {
        return upper(candidate);
      }
    }
    Matcher link = LINK_LABEL.matcher(text);
    if (link.find()) {
      return upper(link.group(1).strip());
    }
    Matcher paren = PAREN_LABEL.matcher(text);
    if (paren.find()) {
      return upper(paren.group(1).strip());
    }

    String clean = LEADING_NOISE.matcher(text).replaceFirst("");
    String[] parts = WORD_SPLIT.split(clean);
    if (parts.length == 0) {
      return "";
    }
    String symbol = stripChars(parts[0].strip());
    if (symbol.isEmpty()) {
      return "";
    }
    if (symbol.length() > MAX_SYMBOL) {
      symbol = symbol.substring(0, MAX_SYMBOL);
    }
    return upper(symbol);
  }

  /**
   * Symbol shown for a token when none was extracted.
   *
   * @param address token address or {@link #UNKNOWN_ADDRESS}
   * @param symbol extracted symbol, may be blank
   * @return the symbol, {@code "unknown"} for the sentinel, or the first six address characters
   *     followed by {@code ...}
   */
  public static String displaySymbol(String address, String symbol) {
    if (address == null || UNKNOWN_ADDRESS.equals(address)) {
      return UNKNOWN_ADDRESS;
    }
    if (symbol == null || symbol.isBlank()) {
      return shortAddress(address);
    }
    return symbol;
  }

  /** First six characters of an address followed by {@code ...}. */
  public static String shortAddress(String address) {
    if (address == null) {
      return UNKNOWN_ADDRESS;
    }
    return (address.length() > 6 ? address.substring(0, 6) : address) + "...";
  }

  private static void append(StringBuilder text, String part) {
    if (part != null) {
      text.append(part).append('\n');
    }
  }

  private static String stripChars(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && TRIM_CHARS.indexOf(value.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && TRIM_CHARS.indexOf(value.charAt(end - 1)) >= 0) {
      end--;
    }
    return value.substring(start, end);
  }

  private static String upper(String value) {
    return value.toUpperCase(Locale.ROOT);
  }
}
