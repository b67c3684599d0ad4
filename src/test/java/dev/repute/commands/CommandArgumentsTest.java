/* Repute © 2025 Repute Devs — MIT */
package dev.repute.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

final class CommandArgumentsTest {

  @Test
  void tokenizeHonorsQuotes() {
    List<String> tokens = CommandArguments.tokenize("<@10> '3' \"good\"\nnext");
    assertEquals(List.of("<@10>", "3", "good", "next"), tokens);
  }

  @Test
  void tokenizeRejectsUnterminatedQuotes() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CommandArguments.tokenize("'oops"));
    assertEquals("unterminated quote in arguments", ex.getMessage());
  }

  @Test
  void mentionsAndRawIdsResolve() {
    assertEquals(Optional.of(10L), CommandArguments.parseUser("<@10>"));
    assertEquals(Optional.of(10L), CommandArguments.parseUser("<@!10>"));
    assertEquals(Optional.of(10L), CommandArguments.parseUser(" 10 "));
    assertEquals(Optional.of(7L), CommandArguments.parseChannel("<#7>"));
    assertTrue(CommandArguments.parseUser("<#7>").isEmpty());
    assertTrue(CommandArguments.parseChannel("<@7>").isEmpty());
    assertTrue(CommandArguments.parseUser("alice").isEmpty());
    assertTrue(CommandArguments.parseUser("99999999999999999999999").isEmpty());
  }

  @Test
  void cursorConsumesInOrder() {
    CommandArguments args = CommandArguments.from("<@10> 3 bad trailing words");

    assertEquals(10L, args.nextUser("user"));
    assertEquals("3", args.next("amount"));
    assertEquals("bad", args.next("type"));
    assertEquals("trailing words", args.rest());
    assertFalse(args.hasNext());
    args.expectEnd();
  }

  @Test
  void missingAndMalformedArgumentsAreNamed() {
    CommandArguments empty = CommandArguments.from("");
    IllegalArgumentException missing =
        assertThrows(IllegalArgumentException.class, () -> empty.nextUser("user"));
    assertEquals("user is required", missing.getMessage());

    CommandArguments bad = CommandArguments.from("general");
    IllegalArgumentException malformed =
        assertThrows(IllegalArgumentException.class, () -> bad.nextChannel("channel"));
    assertEquals("channel must be a channel mention or ID", malformed.getMessage());

    CommandArguments extra = CommandArguments.from("a b");
    extra.next("first");
    IllegalArgumentException unexpected =
        assertThrows(IllegalArgumentException.class, extra::expectEnd);
    assertEquals("unexpected argument: b", unexpected.getMessage());
  }
}
