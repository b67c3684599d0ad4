/* Repute © 2025 Repute Devs — MIT */
package dev.repute.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Tokenizes raw command arguments and resolves mentions and IDs. */
final class CommandArguments {
  private static final Pattern USER_MENTION = Pattern.compile("<@!?(\\d+)>");
  private static final Pattern CHANNEL_MENTION = Pattern.compile("<#(\\d+)>");
  private static final Pattern RAW_ID = Pattern.compile("\\d+");

  private final List<String> tokens;
  private int index;

  private CommandArguments(List<String> tokens) {
    this.tokens = tokens;
  }

  static CommandArguments from(String raw) {
    return new CommandArguments(tokenize(raw));
  }

  static List<String> tokenize(String raw) {
    List<String> tokens = new ArrayList<>();
    if (raw == null) {
      return tokens;
    }
    String s = raw.trim();
    if (s.isEmpty()) {
      return tokens;
    }
    StringBuilder current = new StringBuilder();
    boolean inQuote = false;
    char quoteChar = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (inQuote) {
        if (ch == quoteChar) {
          inQuote = false;
        } else {
          current.append(ch);
        }
        continue;
      }
      if (ch == '\'' || ch == '"') {
        inQuote = true;
        quoteChar = ch;
        continue;
      }
      if (Character.isWhitespace(ch)) {
        if (current.length() > 0) {
          tokens.add(current.toString());
          current.setLength(0);
        }
        continue;
      }
      current.append(ch);
    }
    if (inQuote) {
      throw new IllegalArgumentException("unterminated quote in arguments");
    }
    if (current.length() > 0) {
      tokens.add(current.toString());
    }
    return tokens;
  }

  boolean hasNext() {
    return index < tokens.size();
  }

  String next(String name) {
    if (!hasNext()) {
      throw new IllegalArgumentException(name + " is required");
    }
    return tokens.get(index++);
  }

  /** Everything not consumed yet, joined with single spaces. */
  String rest() {
    String joined = String.join(" ", tokens.subList(index, tokens.size()));
    index = tokens.size();
    return joined;
  }

  long nextUser(String name) {
    String token = next(name);
    return parseUser(token)
        .orElseThrow(() -> new IllegalArgumentException(name + " must be a user mention or ID"));
  }

  long nextChannel(String name) {
    String token = next(name);
    return parseChannel(token)
        .orElseThrow(() -> new IllegalArgumentException(name + " must be a channel mention or ID"));
  }

  void expectEnd() {
    if (hasNext()) {
      throw new IllegalArgumentException("unexpected argument: " + tokens.get(index));
    }
  }

  static Optional<Long> parseUser(String token) {
    return parseId(token, USER_MENTION);
  }

  static Optional<Long> parseChannel(String token) {
    return parseId(token, CHANNEL_MENTION);
  }

  private static Optional<Long> parseId(String token, Pattern mention) {
    if (token == null) {
      return Optional.empty();
    }
    String value = token.trim();
    Matcher matcher = mention.matcher(value);
    if (matcher.matches()) {
      value = matcher.group(1);
    } else if (!RAW_ID.matcher(value).matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(value));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }
}
