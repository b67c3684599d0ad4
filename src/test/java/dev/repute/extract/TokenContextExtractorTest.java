/* Repute © 2025 Repute Devs — MIT */
package dev.repute.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class TokenContextExtractorTest {
  private static final String SOLANA = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";
  private static final String ETH = "0x6982508145454Ce325dDbE47a25d4ec3d2311933";
  private static final String UNKNOWN = TokenContextExtractor.UNKNOWN_ADDRESS;

  @Test
  void boldDollarSymbol() {
    assertEquals("FOO", TokenContextExtractor.extractSymbol("**$FOO**"));
  }

  @Test
  void dollarSymbolStopsAtLowerCaseWord() {
    assertEquals("BAR", TokenContextExtractor.extractSymbol("$BAR baz"));
  }

  @Test
  void dollarSymbolKeepsUpperCaseContinuation() {
    assertEquals("PEPE COIN", TokenContextExtractor.extractSymbol("buy $PEPE COIN now"));
  }

  @Test
  void markdownLinkLabel() {
    assertEquals("BAZ", TokenContextExtractor.extractSymbol("[BAZ](http://x)"));
  }

  @Test
  void parenthesizedLabel() {
    assertEquals("WIF", TokenContextExtractor.extractSymbol("dogwifhat (wif) launched"));
  }

  @Test
  void firstWordFallback() {
    assertEquals("HELLO", TokenContextExtractor.extractSymbol("Hello World - rest"));
  }

  @Test
  void leadingPictographsAreSkipped() {
    assertEquals("MOON", TokenContextExtractor.extractSymbol("🚀🚀 moon! shot"));
  }

  @Test
  void emptyTextHasNoSymbol() {
    assertEquals("", TokenContextExtractor.extractSymbol(""));
    assertEquals("", TokenContextExtractor.extractSymbol(null));
  }

  @Test
  void base58AddressWinsOverHex() {
    StructuredContent embed =
        new StructuredContent(
            "New pair",
            "contract " + ETH,
            List.of(new StructuredContent.Field("CA", SOLANA)),
            "alice");

    assertEquals(SOLANA, TokenContextExtractor.extractAddress(embed));
  }

  @Test
  void hexAddressFound() {
    StructuredContent embed = new StructuredContent("", "ca: " + ETH, List.of(), null);

    assertEquals(ETH, TokenContextExtractor.extractAddress(embed));
  }

  @Test
  void missingAddressIsUnknown() {
    StructuredContent embed = new StructuredContent("hi", "nothing here", List.of(), "bob");

    assertEquals(UNKNOWN, TokenContextExtractor.extractAddress(embed));
    assertEquals(UNKNOWN, TokenContextExtractor.extractAddress(null));
  }

  @Test
  void displaySymbolFallsBackToShortAddress() {
    assertEquals("7GCihg...", TokenContextExtractor.displaySymbol(SOLANA, ""));
    assertEquals("SOL", TokenContextExtractor.displaySymbol(SOLANA, "SOL"));
    assertEquals("unknown", TokenContextExtractor.displaySymbol("unknown", "SOL"));
  }
}
