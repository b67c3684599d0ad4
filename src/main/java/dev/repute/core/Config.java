/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime configuration loaded from {@code config/repute.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first boot.
 *   <li>Emits a {@code repute.json5.example} snapshot for ops tooling.
 *   <li>Supports environment overrides for the DB connection ({@code REPUTE_DB_*}) and the source
 *       bot ({@code REPUTE_SOURCE_BOT_ID}).
 *   <li>Validates every value at load; failures name the offending key.
 * </ul>
 */
public final class Config {

  static final String TEMPLATE =
      """
      // Repute v1.0.0 configuration (JSON5 with comments)
      // Drop into config/repute.json5. Environment overrides:
      // REPUTE_DB_HOST|PORT|DATABASE|USER|PASSWORD, REPUTE_SOURCE_BOT_ID.
      {
        bot: {
          // Account whose embed posts are turned into voting messages (0 = disabled).
          sourceBotId: 0,
          // {address} is replaced with the token address in profile links ("" = no links).
          tokenLinkTemplate: "https://axiom.trade/t/{address}/@monki"
        },
        votes: {
          goodGlyph: "🟢",
          badGlyph: "🔴"
        },
        tracking: {
          // Voting messages remembered for reaction handling; oldest evicted first (0 = unbounded).
          maxMessages: 50000
        },
        admin: {
          // Upper bound for a single repadd amount.
          maxVotesPerAdd: 1000
        },
        storage: {
          backend: "file",         // file | mariadb
          dir: "./data",
          flushDebounceMs: 500,
          db: {
            host: "127.0.0.1",
            port: 3306,
            database: "repute",
            user: "repute",
            password: "change-me",
            tls: { enabled: false },
            pool: {
              maxPoolSize: 4,
              minimumIdle: 1,
              connectionTimeoutMs: 10000,
              idleTimeoutMs: 600000,
              maxLifetimeMs: 1700000,
              startupAttempts: 3
            }
          }
        },
        notices: {
          transientSeconds: 10,
          selfVote: { capacity: 2, refillPerSec: 0.1 }
        },
        i18n: {
          defaultLocale: "en_US",
          enabledLocales: [ "en_US" ],
          fallbackLocale: "en_US"
        },
        log: {
          json: false,
          level: "INFO"
        }
      }
      """;

  private final Bot bot;
  private final Votes votes;
  private final Tracking tracking;
  private final Admin admin;
  private final Storage storage;
  private final Notices notices;
  private final I18n i18n;
  private final Log log;

  Config(
      Bot bot,
      Votes votes,
      Tracking tracking,
      Admin admin,
      Storage storage,
      Notices notices,
      I18n i18n,
      Log log) {
    this.bot = bot;
    this.votes = votes;
    this.tracking = tracking;
    this.admin = admin;
    this.storage = storage;
    this.notices = notices;
    this.i18n = i18n;
    this.log = log;
  }

  public Bot bot() {
    return bot;
  }

  public Votes votes() {
    return votes;
  }

  public Tracking tracking() {
    return tracking;
  }

  public Admin admin() {
    return admin;
  }

  public Storage storage() {
    return storage;
  }

  public Notices notices() {
    return notices;
  }

  public I18n i18n() {
    return i18n;
  }

  public Log log() {
    return log;
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    return loadOrWriteDefault(path, System.getenv());
  }

  static Config loadOrWriteDefault(Path path, Map<String, String> env) {
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("repute.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }

      String raw = Files.readString(path, StandardCharsets.UTF_8);
      return parse(raw, env);
    } catch (IOException e) {
      throw new RuntimeException("Failed to read config: " + path, e);
    }
  }

  /** Parses JSON5 text; missing blocks take their defaults. */
  static Config parse(String raw, Map<String, String> env) {
    JsonObject root;
    try {
      root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    } catch (RuntimeException e) {
      throw new IllegalStateException("config is not valid JSON5: " + e.getMessage(), e);
    }
    Config config =
        new Config(
            parseBot(optObject(root, "bot"), env),
            parseVotes(optObject(root, "votes")),
            parseTracking(optObject(root, "tracking")),
            new Admin(optInt(optObject(root, "admin"), "maxVotesPerAdd", 1000)),
            parseStorage(optObject(root, "storage"), env),
            parseNotices(optObject(root, "notices")),
            parseI18n(optObject(root, "i18n")),
            parseLog(optObject(root, "log")));
    validate(config);
    return config;
  }

  /** Config with every block at its default, for tests and embedded use. */
  public static Config defaults() {
    return parse("{}", Map.of());
  }

  /** Drops comments outside string literals, then trailing commas. */
  private static String stripJson5(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    char quote = 0;
    int i = 0;
    while (i < raw.length()) {
      char ch = raw.charAt(i);
      if (quote != 0) {
        out.append(ch);
        if (ch == '\\' && i + 1 < raw.length()) {
          out.append(raw.charAt(i + 1));
          i += 2;
          continue;
        }
        if (ch == quote) {
          quote = 0;
        }
        i++;
      } else if (ch == '"' || ch == '\'') {
        quote = ch;
        out.append(ch);
        i++;
      } else if (raw.startsWith("//", i)) {
        while (i < raw.length() && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (raw.startsWith("/*", i)) {
        int end = raw.indexOf("*/", i + 2);
        i = end < 0 ? raw.length() : end + 2;
      } else {
        out.append(ch);
        i++;
      }
    }
    return out.toString().replaceAll(",(?=\\s*[}\\]])", "");
  }

  private static Bot parseBot(JsonObject bot, Map<String, String> env) {
    String envBot = env.get("REPUTE_SOURCE_BOT_ID");
    long sourceBotId;
    try {
      sourceBotId =
          envBot != null ? Long.parseLong(envBot.trim()) : optLong(bot, "sourceBotId", 0L);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("bot.sourceBotId must be a number: " + envBot, e);
    }
    String template =
        optString(bot, "tokenLinkTemplate", "https://axiom.trade/t/{address}/@monki");
    return new Bot(sourceBotId, template);
  }

  private static Votes parseVotes(JsonObject votes) {
    return new Votes(optString(votes, "goodGlyph", "🟢"), optString(votes, "badGlyph", "🔴"));
  }

  private static Tracking parseTracking(JsonObject tracking) {
    return new Tracking(optInt(tracking, "maxMessages", 50_000));
  }

  private static Storage parseStorage(JsonObject storage, Map<String, String> env) {
    Backend backend = Backend.from(optString(storage, "backend", "file"));
    String dir = optString(storage, "dir", "./data");
    long debounce = optLong(storage, "flushDebounceMs", 500L);
    Db db = parseDb(optObject(storage, "db"), env);
    return new Storage(backend, dir, debounce, db);
  }

  private static Db parseDb(JsonObject db, Map<String, String> env) {
    String envHost = env.get("REPUTE_DB_HOST");
    String envPort = env.get("REPUTE_DB_PORT");
    String envDatabase = env.get("REPUTE_DB_DATABASE");
    String envUser = env.get("REPUTE_DB_USER");
    String envPassword = env.get("REPUTE_DB_PASSWORD");

    String host = envHost != null ? envHost : optString(db, "host", "127.0.0.1");
    int port;
    try {
      port = envPort != null ? Integer.parseInt(envPort.trim()) : optInt(db, "port", 3306);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("storage.db.port must be a number: " + envPort, e);
    }
    String database = envDatabase != null ? envDatabase : optString(db, "database", "repute");
    String user = envUser != null ? envUser : optString(db, "user", "repute");
    String password = envPassword != null ? envPassword : optString(db, "password", "change-me");

    JsonObject tlsObj = optObject(db, "tls");
    boolean tls = tlsObj != null && optBoolean(tlsObj, "enabled", false);

    JsonObject poolObj = optObject(db, "pool");
    int maxPool = optInt(poolObj, "maxPoolSize", 4);
    int minIdle = optInt(poolObj, "minimumIdle", 1);
    long connTimeout = optLong(poolObj, "connectionTimeoutMs", 10_000L);
    long idleTimeout = optLong(poolObj, "idleTimeoutMs", 600_000L);
    long maxLifetime = optLong(poolObj, "maxLifetimeMs", 1_700_000L);
    int startupAttempts = optInt(poolObj, "startupAttempts", 3);

    return new Db(
        host,
        port,
        database,
        user,
        password,
        tls,
        new Pool(maxPool, minIdle, connTimeout, idleTimeout, maxLifetime, startupAttempts));
  }

  private static Notices parseNotices(JsonObject notices) {
    int transientSeconds = optInt(notices, "transientSeconds", 10);
    JsonObject selfVote = optObject(notices, "selfVote");
    int capacity = optInt(selfVote, "capacity", 2);
    double refill = optDouble(selfVote, "refillPerSec", 0.1);
    return new Notices(transientSeconds, capacity, refill);
  }

  private static I18n parseI18n(JsonObject i18n) {
    if (i18n == null) {
      return new I18n(
          Locale.forLanguageTag("en-US"), List.of("en_US"), Locale.forLanguageTag("en-US"));
    }
    String def = optString(i18n, "defaultLocale", "en_US");
    String fallback = optString(i18n, "fallbackLocale", def);
    List<String> enabled = new ArrayList<>();
    if (i18n.has("enabledLocales") && i18n.get("enabledLocales").isJsonArray()) {
      for (JsonElement el : i18n.get("enabledLocales").getAsJsonArray()) {
        enabled.add(el.getAsString());
      }
    } else {
      enabled.add(def);
    }
    if (enabled.isEmpty()) enabled.add(def);
    return new I18n(locale(def), List.copyOf(enabled), locale(fallback));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, "INFO");
    }
    return new Log(optBoolean(log, "json", false), optString(log, "level", "INFO"));
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static double optDouble(JsonObject obj, String key, double def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsDouble() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }

  private static Locale locale(String code) {
    Objects.requireNonNull(code, "locale");
    return Locale.forLanguageTag(code.replace('_', '-'));
  }

  private static void validate(Config cfg) {
    validateBot(cfg.bot());
    validateVotes(cfg.votes());
    if (cfg.tracking().maxMessages() < 0) {
      throw new IllegalStateException("tracking.maxMessages must be >= 0");
    }
    if (cfg.admin().maxVotesPerAdd() < 1) {
      throw new IllegalStateException("admin.maxVotesPerAdd must be >= 1");
    }
    validateStorage(cfg.storage());
    validateNotices(cfg.notices());
    validateI18n(cfg.i18n());
    validateLog(cfg.log());
  }

  private static void validateBot(Bot bot) {
    if (bot.sourceBotId() < 0) {
      throw new IllegalStateException("bot.sourceBotId must be >= 0");
    }
    if (bot.tokenLinkTemplate() == null) {
      throw new IllegalStateException("bot.tokenLinkTemplate must be provided");
    }
    if (!bot.tokenLinkTemplate().isEmpty() && !bot.tokenLinkTemplate().contains("{address}")) {
      throw new IllegalStateException("bot.tokenLinkTemplate must contain {address}");
    }
  }

  private static void validateVotes(Votes votes) {
    requireNonBlank(votes.goodGlyph(), "votes.goodGlyph");
    requireNonBlank(votes.badGlyph(), "votes.badGlyph");
    if (votes.goodGlyph().equals(votes.badGlyph())) {
      throw new IllegalStateException("votes.goodGlyph and votes.badGlyph must differ");
    }
  }

  private static void validateStorage(Storage storage) {
    requireNonBlank(storage.dir(), "storage.dir");
    try {
      Path.of(storage.dir());
    } catch (Exception e) {
      throw new IllegalStateException("storage.dir must be a valid file system path", e);
    }
    if (storage.flushDebounceMs() < 0 || storage.flushDebounceMs() > 60_000) {
      throw new IllegalStateException("storage.flushDebounceMs must be between 0 and 60000");
    }
    if (storage.backend() == Backend.MARIADB) {
      validateDb(storage.db());
    }
  }

  private static void validateDb(Db db) {
    requireNonBlank(db.host(), "storage.db.host");
    requireNonBlank(db.database(), "storage.db.database");
    requireNonBlank(db.user(), "storage.db.user");
    requireNonBlank(db.password(), "storage.db.password");
    if (db.port() <= 0 || db.port() > 65535) {
      throw new IllegalStateException("storage.db.port must be between 1 and 65535");
    }
    if (db.host().contains(" ")) {
      throw new IllegalStateException("storage.db.host must not contain spaces");
    }
    if (!db.database().matches("[A-Za-z0-9_]+")) {
      throw new IllegalStateException("storage.db.database must match [A-Za-z0-9_]+");
    }
    int maxPool = db.pool().maxPoolSize();
    if (maxPool < 1 || maxPool > 50) {
      throw new IllegalStateException("storage.db.pool.maxPoolSize must be between 1 and 50");
    }
    int minIdle = db.pool().minimumIdle();
    if (minIdle < 0 || minIdle > maxPool) {
      throw new IllegalStateException(
          "storage.db.pool.minimumIdle must be between 0 and maxPoolSize");
    }
    long connectionTimeout = db.pool().connectionTimeoutMs();
    if (connectionTimeout < 1_000 || connectionTimeout > 120_000) {
      throw new IllegalStateException(
          "storage.db.pool.connectionTimeoutMs must be between 1000 and 120000");
    }
    long idleTimeout = db.pool().idleTimeoutMs();
    if (idleTimeout < 10_000 || idleTimeout > 3_600_000) {
      throw new IllegalStateException(
          "storage.db.pool.idleTimeoutMs must be between 10000 and 3600000");
    }
    long maxLifetime = db.pool().maxLifetimeMs();
    if (maxLifetime < 30_000L || maxLifetime > 3_600_000L) {
      throw new IllegalStateException(
          "storage.db.pool.maxLifetimeMs must be between 30000 and 3600000");
    }
    int attempts = db.pool().startupAttempts();
    if (attempts < 1 || attempts > 10) {
      throw new IllegalStateException("storage.db.pool.startupAttempts must be between 1 and 10");
    }
    if (idleTimeout >= maxLifetime) {
      throw new IllegalStateException(
          "storage.db.pool.idleTimeoutMs must be less than maxLifetimeMs");
    }
  }

  private static void validateNotices(Notices notices) {
    if (notices.transientSeconds() < 1 || notices.transientSeconds() > 300) {
      throw new IllegalStateException("notices.transientSeconds must be between 1 and 300");
    }
    if (notices.selfVoteCapacity() < 1) {
      throw new IllegalStateException("notices.selfVote.capacity must be >= 1");
    }
    if (notices.selfVoteRefillPerSec() <= 0) {
      throw new IllegalStateException("notices.selfVote.refillPerSec must be > 0");
    }
  }

  private static void validateI18n(I18n i18n) {
    if (i18n.enabledLocales().isEmpty()) {
      throw new IllegalStateException("i18n.enabledLocales must include at least one entry");
    }
    for (String locale : i18n.enabledLocales()) {
      requireNonBlank(locale, "i18n.enabledLocales entry");
    }
    String defaultCode = i18n.defaultLocale().toLanguageTag().replace('-', '_');
    if (i18n.enabledLocales().stream().noneMatch(l -> l.equalsIgnoreCase(defaultCode))) {
      throw new IllegalStateException("i18n.enabledLocales must include defaultLocale");
    }
    String fallbackCode = i18n.fallbackLocale().toLanguageTag().replace('-', '_');
    if (i18n.enabledLocales().stream().noneMatch(l -> l.equalsIgnoreCase(fallbackCode))) {
      throw new IllegalStateException("i18n.enabledLocales must include fallbackLocale");
    }
  }

  private static void validateLog(Log log) {
    requireNonBlank(log.level(), "log.level");
    String normalized = log.level().toUpperCase(Locale.ROOT);
    if (!List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR").contains(normalized)) {
      throw new IllegalStateException("log.level must be TRACE, DEBUG, INFO, WARN, or ERROR");
    }
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException(field + " must be provided");
    }
  }

  /**
   * Source bot settings.
   *
   * @param sourceBotId account whose embed posts become voting messages, {@code 0} when disabled
   * @param tokenLinkTemplate profile link pattern with an {@code {address}} placeholder, or empty
   */
  public record Bot(long sourceBotId, String tokenLinkTemplate) {

    /** Link for a known token address, or {@code null} when links are disabled. */
    public String tokenLink(String address) {
      return tokenLinkTemplate.isEmpty() ? null : tokenLinkTemplate.replace("{address}", address);
    }
  }

  /**
   * Reaction glyphs counted as votes.
   *
   * @param goodGlyph glyph for a good vote
   * @param badGlyph glyph for a bad vote
   */
  public record Votes(String goodGlyph, String badGlyph) {}

  /**
   * Tracked message retention.
   *
   * @param maxMessages cap on remembered voting messages, {@code 0} for unbounded
   */
  public record Tracking(int maxMessages) {}

  /**
   * Administrator adjustment limits.
   *
   * @param maxVotesPerAdd largest amount a single admin add may create
   */
  public record Admin(int maxVotesPerAdd) {}

  /**
   * Snapshot storage.
   *
   * @param backend blob store implementation
   * @param dir directory for the file backend
   * @param flushDebounceMs delay that coalesces flush requests
   * @param db database settings for the MariaDB backend
   */
  public record Storage(Backend backend, String dir, long flushDebounceMs, Db db) {}

  /** Blob store implementations. */
  public enum Backend {
    FILE,
    MARIADB;

    static Backend from(String raw) {
      if (raw == null) return FILE;
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "file" -> FILE;
        case "mariadb" -> MARIADB;
        default -> throw new IllegalStateException("storage.backend must be file or mariadb");
      };
    }
  }

  /**
   * Database settings parsed from {@code storage.db}.
   *
   * @param host hostname or IP for the MariaDB/MySQL server
   * @param port TCP port for the database service
   * @param database schema name to use when connecting
   * @param user database user
   * @param password password for the configured {@code user}
   * @param tlsEnabled whether to request TLS/SSL when connecting
   * @param pool pool tuning overrides applied to HikariCP
   */
  public record Db(
      String host,
      int port,
      String database,
      String user,
      String password,
      boolean tlsEnabled,
      Pool pool) {

    /**
     * Fully formed JDBC URL (MariaDB tuned for UTF-8 + UTC).
     *
     * @return JDBC URL string for MariaDB connections
     */
    public String jdbcUrl() {
      StringBuilder url =
          new StringBuilder("jdbc:mariadb://")
              .append(host)
              .append(':')
              .append(port)
              .append('/')
              .append(database)
              .append("?useUnicode=true&characterEncoding=utf8mb4&serverTimezone=UTC");
      if (tlsEnabled) {
        url.append("&sslMode=VERIFY_IDENTITY");
      } else {
        url.append("&sslMode=DISABLE");
      }
      return url.toString();
    }
  }

  /**
   * Connection pool tuning.
   *
   * @param maxPoolSize maximum number of pooled connections
   * @param minimumIdle minimum number of idle connections to retain
   * @param connectionTimeoutMs wait time when borrowing a connection
   * @param idleTimeoutMs idle connection eviction threshold
   * @param maxLifetimeMs maximum lifetime of each connection
   * @param startupAttempts retry count when initializing the pool
   */
  public record Pool(
      int maxPoolSize,
      int minimumIdle,
      long connectionTimeoutMs,
      long idleTimeoutMs,
      long maxLifetimeMs,
      int startupAttempts) {}

  /**
   * User notices.
   *
   * @param transientSeconds lifetime of public fallback notices
   * @param selfVoteCapacity self-vote notices a participant may receive in a burst
   * @param selfVoteRefillPerSec notice allowance regained per second
   */
  public record Notices(int transientSeconds, int selfVoteCapacity, double selfVoteRefillPerSec) {}

  /**
   * Localization configuration.
   *
   * @param defaultLocale locale used for responses
   * @param enabledLocales locales bundled with the service
   * @param fallbackLocale locale used when a translation key is missing
   */
  public record I18n(Locale defaultLocale, List<String> enabledLocales, Locale fallbackLocale) {}

  /**
   * Logging block.
   *
   * @param json whether to emit structured JSON logs
   * @param level textual log level for the console logger
   */
  public record Log(boolean json, String level) {}
}
