/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonWriter;
import dev.repute.api.VoteType;
import dev.repute.extract.TokenContextExtractor;
import dev.repute.ledger.TokenView;
import dev.repute.ledger.UserView;
import dev.repute.ledger.VoteRecord;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON form of the five snapshot records.
 *
 * <p>Layouts match the documents earlier deployments wrote, so existing data loads unchanged:
 * numeric IDs as JSON numbers (or object keys as strings), vote types as {@code good}/{@code bad},
 * voter lists as {@code goodvoters}/{@code badvoters}. The vote log is written in creation order
 * and creation order is read back from document order.
 */
final class SnapshotCodec {
  static final String REPUTATION = "reputation.json";
  static final String VOTE_LOG = "reputation_log.json";
  static final String DISABLED_VOTERS = "disabled_voters.json";
  static final String AUDIT_SINKS = "reputation_log_channels.json";
  static final String ACTIVE_VOTES = "current_votes.json";

  static final List<String> RECORDS =
      List.of(REPUTATION, VOTE_LOG, DISABLED_VOTERS, AUDIT_SINKS, ACTIVE_VOTES);

  private SnapshotCodec() {}

  static String encodeReputation(Collection<UserView> users) {
    return write(
        json -> {
          json.beginObject();
          for (UserView user : users) {
            json.name(Long.toString(user.userId())).beginObject();
            json.name("good").value(user.good());
            json.name("bad").value(user.bad());
            json.name("tokens").beginObject();
            for (TokenView token : user.tokens().values()) {
              json.name(token.address()).beginObject();
              json.name("good").value(token.good());
              json.name("bad").value(token.bad());
              json.name("goodvoters");
              writeIds(json, token.goodVoters());
              json.name("badvoters");
              writeIds(json, token.badVoters());
              json.name("symbol").value(token.symbol());
              json.endObject();
            }
            json.endObject();
            json.endObject();
          }
          json.endObject();
        });
  }

  /** Votes keyed by ID, in the iteration order given. */
  static String encodeVotes(Collection<VoteRecord> votes) {
    return write(
        json -> {
          json.beginObject();
          for (VoteRecord vote : votes) {
            json.name(vote.voteId()).beginObject();
            json.name("vote_id").value(vote.voteId());
            json.name("voter_id").value(vote.voterId());
            json.name("author_id").value(vote.authorId());
            json.name("token_address").value(vote.tokenAddress());
            json.name("vote_type").value(vote.voteType().key());
            json.name("message_id").value(vote.sourceMessageId());
            json.name("timestamp").value(vote.timestamp().toString());
            json.name("reversed").value(vote.reversed());
            json.endObject();
          }
          json.endObject();
        });
  }

  static String encodeDisabled(Collection<Long> ids) {
    return write(json -> writeIds(json, ids));
  }

  static String encodeSinks(Map<Long, Long> sinks) {
    return write(
        json -> {
          json.beginObject();
          for (Map.Entry<Long, Long> entry : sinks.entrySet()) {
            json.name(Long.toString(entry.getKey())).value(entry.getValue());
          }
          json.endObject();
        });
  }

  /**
   * Parses {@code reputation.json}.
   *
   * <p>Tokens stored without a symbol get the short address, or {@code unknown} for the unknown
   * sentinel.
   */
  static List<UserView> decodeReputation(String body) {
    List<UserView> users = new ArrayList<>();
    for (Map.Entry<String, JsonElement> entry : parseObject(body, REPUTATION).entrySet()) {
      long userId = Long.parseLong(entry.getKey());
      JsonObject user = entry.getValue().getAsJsonObject();
      Map<String, TokenView> tokens = new LinkedHashMap<>();
      JsonObject tokensObj = user.has("tokens") ? user.getAsJsonObject("tokens") : new JsonObject();
      for (Map.Entry<String, JsonElement> tokenEntry : tokensObj.entrySet()) {
        String address = tokenEntry.getKey();
        JsonObject token = tokenEntry.getValue().getAsJsonObject();
        String symbol =
            token.has("symbol") && !token.get("symbol").isJsonNull()
                ? token.get("symbol").getAsString()
                : TokenContextExtractor.displaySymbol(address, "");
        tokens.put(
            address,
            new TokenView(
                address,
                symbol,
                intOr(token, "good"),
                intOr(token, "bad"),
                readIds(token.get("goodvoters")),
                readIds(token.get("badvoters"))));
      }
      users.add(new UserView(userId, intOr(user, "good"), intOr(user, "bad"), tokens));
    }
    return users;
  }

  /** Parses a vote map; sequences follow document order starting at 1. */
  static List<VoteRecord> decodeVotes(String body, String record) {
    List<VoteRecord> votes = new ArrayList<>();
    long sequence = 0;
    for (Map.Entry<String, JsonElement> entry : parseObject(body, record).entrySet()) {
      JsonObject vote = entry.getValue().getAsJsonObject();
      String voteId = vote.has("vote_id") ? vote.get("vote_id").getAsString() : entry.getKey();
      votes.add(
          new VoteRecord(
              voteId,
              vote.get("voter_id").getAsLong(),
              vote.get("author_id").getAsLong(),
              vote.get("token_address").getAsString(),
              VoteType.fromKey(vote.get("vote_type").getAsString()),
              vote.has("message_id") ? vote.get("message_id").getAsLong() : 0L,
              parseTimestamp(vote.get("timestamp").getAsString()),
              ++sequence,
              vote.has("reversed") && vote.get("reversed").getAsBoolean()));
    }
    return votes;
  }

  static Set<String> decodeActiveIds(String body) {
    return new LinkedHashSet<>(parseObject(body, ACTIVE_VOTES).keySet());
  }

  static List<Long> decodeDisabled(String body) {
    JsonElement root = parse(body, DISABLED_VOTERS);
    if (!root.isJsonArray()) {
      throw new IllegalStateException(DISABLED_VOTERS + " must be a JSON array");
    }
    return readIds(root);
  }

  static Map<Long, Long> decodeSinks(String body) {
    Map<Long, Long> sinks = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> entry : parseObject(body, AUDIT_SINKS).entrySet()) {
      sinks.put(Long.parseLong(entry.getKey()), entry.getValue().getAsLong());
    }
    return sinks;
  }

  /** Accepts {@code 2024-01-01T00:00:00Z} and offset forms such as {@code +00:00}. */
  static Instant parseTimestamp(String raw) {
    try {
      return OffsetDateTime.parse(raw).toInstant();
    } catch (DateTimeParseException e) {
      return Instant.parse(raw);
    }
  }

  private static JsonElement parse(String body, String record) {
    try {
      return JsonParser.parseString(body);
    } catch (RuntimeException e) {
      throw new IllegalStateException(record + " is not valid JSON: " + e.getMessage(), e);
    }
  }

  private static JsonObject parseObject(String body, String record) {
    JsonElement root = parse(body, record);
    if (!root.isJsonObject()) {
      throw new IllegalStateException(record + " must be a JSON object");
    }
    return root.getAsJsonObject();
  }

  private static int intOr(JsonObject obj, String key) {
    return obj.has(key) && !obj.get(key).isJsonNull() ? obj.get(key).getAsInt() : 0;
  }

  private static List<Long> readIds(JsonElement element) {
    List<Long> ids = new ArrayList<>();
    if (element != null && element.isJsonArray()) {
      JsonArray array = element.getAsJsonArray();
      for (JsonElement id : array) {
        ids.add(id.getAsLong());
      }
    }
    return ids;
  }

  private static void writeIds(JsonWriter json, Collection<Long> ids) throws IOException {
    json.beginArray();
    for (Long id : ids) {
      json.value(id);
    }
    json.endArray();
  }

  private static String write(JsonBody body) {
    StringWriter out = new StringWriter();
    try (JsonWriter json = new JsonWriter(out)) {
      json.setIndent("  ");
      body.write(json);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface JsonBody {
    void write(JsonWriter json) throws IOException;
  }
}
