/* Repute © 2025 Repute Devs — MIT */
package dev.repute.commands;

import dev.repute.api.Card;
import dev.repute.api.ChatGateway;
import dev.repute.core.Config;
import dev.repute.core.LocaleManager;
import dev.repute.extract.TokenContextExtractor;
import dev.repute.ledger.TokenView;
import dev.repute.ledger.UserView;
import dev.repute.ledger.VoteRecord;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.LongFunction;

/** Renders profiles, the leaderboard and the vote manager listing. */
final class ReputationCards {
  static final int PROFILE_TOKENS = 5;
  static final int BOARD_SIZE = 10;

  /** Leaderboard order: highest score, then most good votes, then fewest bad votes. */
  static final Comparator<UserView> BOARD_ORDER =
      Comparator.comparingInt(UserView::score)
          .reversed()
          .thenComparing(Comparator.comparingInt(UserView::good).reversed())
          .thenComparingInt(UserView::bad)
          .thenComparingLong(UserView::userId);

  private static final List<String> MEDALS =
      List.of("🥇", "🥈", "🥉", "4️⃣", "5️⃣", "6️⃣", "7️⃣", "8️⃣", "9️⃣", "🔟");
  private static final DateTimeFormatter VOTE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
  private static final String MARKDOWN_SPECIALS = "\\*_~`|>[]";

  private final ChatGateway gateway;
  private final Config.Bot bot;

  ReputationCards(ChatGateway gateway, Config.Bot bot) {
    this.gateway = gateway;
    this.bot = bot;
  }

  Card profile(UserView user) {
    StringBuilder body = new StringBuilder();
    body.append(heading("profile.totals_heading")).append('\n');
    body.append(
        LocaleManager.format(
            "profile.totals", "score", user.score(), "good", user.good(), "bad", user.bad()));

    List<TokenView> tokens = new ArrayList<>(user.tokens().values());
    tokens.sort(Comparator.comparingInt(TokenView::totalVotes).reversed());
    if (!tokens.isEmpty()) {
      body.append("\n\n").append(heading("profile.tokens_heading")).append('\n');
      List<String> lines = new ArrayList<>();
      for (int i = 0; i < Math.min(PROFILE_TOKENS, tokens.size()); i++) {
        TokenView token = tokens.get(i);
        lines.add(
            LocaleManager.format(
                "profile.token",
                "medal", medal(i),
                "display", tokenDisplay(token),
                "good", token.good(),
                "bad", token.bad(),
                "score", token.score()));
      }
      body.append(String.join("\n", lines));
    }
    String title = LocaleManager.format("profile.title", "user", gateway.mention(user.userId()));
    return new Card(title, body.toString(), Card.Tone.NEUTRAL);
  }

  /**
   * Leaderboard over already filtered participants.
   *
   * @param ranked participants in {@link #BOARD_ORDER}
   */
  Card leaderboard(List<UserView> ranked) {
    String title = LocaleManager.translate("board.title");
    if (ranked.isEmpty()) {
      return new Card(title, LocaleManager.translate("board.empty"), Card.Tone.NEUTRAL);
    }
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < Math.min(BOARD_SIZE, ranked.size()); i++) {
      UserView entry = ranked.get(i);
      lines.add(
          LocaleManager.format(
              "board.entry",
              "medal", medal(i),
              "member", gateway.mention(entry.userId()),
              "score", entry.score(),
              "good", entry.good(),
              "bad", entry.bad()));
    }
    lines.add("");
    lines.add(LocaleManager.format("board.total", "count", ranked.size()));
    return new Card(title, String.join("\n", lines), Card.Tone.NEUTRAL);
  }

  /**
   * Listing of recent active votes.
   *
   * @param votes newest first
   * @param users aggregate lookup used to resolve token symbols
   */
  Card voteManager(List<VoteRecord> votes, LongFunction<Optional<UserView>> users) {
    List<String> entries = new ArrayList<>();
    entries.add(LocaleManager.translate("command.repmanager.header"));
    for (VoteRecord vote : votes) {
      entries.add(
          LocaleManager.format(
              "command.repmanager.entry",
              "voteId", vote.voteId(),
              "type", vote.voteType().key().toUpperCase(Locale.ROOT),
              "author", gateway.mention(vote.authorId()),
              "voter", gateway.mention(vote.voterId()),
              "symbol", symbolOf(vote, users),
              "short", TokenContextExtractor.shortAddress(vote.tokenAddress()),
              "time", VOTE_TIME.format(vote.timestamp()),
              "reversed", vote.reversed()));
    }
    return new Card(
        LocaleManager.translate("command.repmanager.title"),
        String.join("\n\n", entries),
        Card.Tone.NEUTRAL);
  }

  private static String symbolOf(VoteRecord vote, LongFunction<Optional<UserView>> users) {
    if (vote.adminAdded()) {
      return TokenContextExtractor.UNKNOWN_ADDRESS;
    }
    String symbol =
        users
            .apply(vote.authorId())
            .map(UserView::tokens)
            .map(tokens -> tokens.get(vote.tokenAddress()))
            .map(TokenView::symbol)
            .orElse("");
    return TokenContextExtractor.displaySymbol(vote.tokenAddress(), symbol);
  }

  private String tokenDisplay(TokenView token) {
    String symbol =
        escapeMarkdown(TokenContextExtractor.displaySymbol(token.address(), token.symbol()));
    if (TokenContextExtractor.UNKNOWN_ADDRESS.equals(token.address())
        || token.symbol() == null
        || token.symbol().isBlank()) {
      return symbol;
    }
    String link = bot.tokenLink(token.address());
    return link == null ? symbol : "[" + symbol + "](" + link + ")";
  }

  private static String heading(String key) {
    return "**" + LocaleManager.translate(key) + "**";
  }

  static String medal(int index) {
    return index < MEDALS.size() ? MEDALS.get(index) : (index + 1) + ".";
  }

  static String escapeMarkdown(String text) {
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (MARKDOWN_SPECIALS.indexOf(ch) >= 0) {
        out.append('\\');
      }
      out.append(ch);
    }
    return out.toString();
  }
}
