/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locale bundles for every user-facing string (command responses, notices, audit entries).
 *
 * <p>Bundles live at {@code assets/repute/lang/<code>.json} on the classpath. Lookups fall back
 * from the default locale to the fallback locale and finally to the key itself.
 */
public final class LocaleManager {
  private static final Logger LOG = LoggerFactory.getLogger("repute");
  private static final String LANG_PATH = "assets/repute/lang/";

  private static volatile Locale defaultLocale = Locale.forLanguageTag("en-US");
  private static volatile Locale fallbackLocale = Locale.forLanguageTag("en-US");
  private static volatile Map<String, Map<String, String>> bundles = Map.of();

  private LocaleManager() {}

  /**
   * Loads the configured locales.
   *
   * @param i18n locale settings
   * @throws IllegalStateException if a bundle is missing or malformed
   */
  public static synchronized void initialize(Config.I18n i18n) {
    Objects.requireNonNull(i18n, "i18n");
    Map<String, Map<String, String>> loaded = new LinkedHashMap<>();
    ClassLoader loader = LocaleManager.class.getClassLoader();
    for (String rawCode : i18n.enabledLocales()) {
      String normalized = normalize(rawCode);
      loaded.put(normalized, loadTranslations(loader, normalized));
    }
    String defaultCode = normalize(i18n.defaultLocale());
    String fallbackCode = normalize(i18n.fallbackLocale());
    if (!loaded.containsKey(defaultCode)) {
      throw new IllegalStateException(
          "Default locale %s is not enabled".formatted(i18n.defaultLocale().toLanguageTag()));
    }
    if (!loaded.containsKey(fallbackCode)) {
      throw new IllegalStateException(
          "Fallback locale %s is not enabled".formatted(i18n.fallbackLocale().toLanguageTag()));
    }
    bundles = Map.copyOf(loaded);
    defaultLocale = i18n.defaultLocale();
    fallbackLocale = i18n.fallbackLocale();
    LOG.info(
        "(repute) loaded {} locale(s); default={} fallback={}",
        bundles.size(),
        defaultLocale.toLanguageTag(),
        fallbackLocale.toLanguageTag());
  }

  private static Map<String, String> loadTranslations(ClassLoader loader, String normalizedCode) {
    String resourcePath = LANG_PATH + normalizedCode + ".json";
    try (InputStream stream = loader.getResourceAsStream(resourcePath)) {
      if (stream == null) {
        throw new IllegalStateException("Missing translation file for locale: " + resourcePath);
      }
      try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
        JsonObject object = JsonParser.parseReader(reader).getAsJsonObject();
        Map<String, String> translations = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
          translations.put(entry.getKey(), entry.getValue().getAsString());
        }
        return Map.copyOf(translations);
      } catch (RuntimeException ex) {
        throw new IllegalStateException(
            "Failed to parse translation file for locale: " + resourcePath, ex);
      }
    } catch (IOException ex) {
      throw new IllegalStateException(
          "Failed to read translation file for locale: " + resourcePath, ex);
    }
  }

  private static String normalize(String code) {
    Objects.requireNonNull(code, "code");
    return code.replace('-', '_').toLowerCase(Locale.ROOT);
  }

  private static String normalize(Locale locale) {
    return normalize(locale.toLanguageTag());
  }

  public static Locale defaultLocale() {
    return defaultLocale;
  }

  /** Resolves a key in the default locale, then the fallback locale; the key itself otherwise. */
  public static String translate(String key) {
    if (key == null || key.isBlank()) {
      return "";
    }
    Map<String, String> direct = bundles.get(normalize(defaultLocale));
    if (direct != null && direct.containsKey(key)) {
      return direct.get(key);
    }
    Map<String, String> fallback = bundles.get(normalize(fallbackLocale));
    if (fallback != null && fallback.containsKey(key)) {
      return fallback.get(key);
    }
    return key;
  }

  /**
   * Translates {@code key} and substitutes {@code {name}} placeholders.
   *
   * @param key bundle key
   * @param args alternating placeholder names and values
   */
  public static String format(String key, Object... args) {
    String text = translate(key);
    if (args.length % 2 != 0) {
      throw new IllegalArgumentException("placeholder arguments must be name/value pairs");
    }
    for (int i = 0; i < args.length; i += 2) {
      text = text.replace("{" + args[i] + "}", String.valueOf(args[i + 1]));
    }
    return text;
  }

  /** Loads the default bundle if nothing was initialized yet. */
  public static synchronized void ensureInitialized() {
    if (bundles.isEmpty()) {
      initialize(Config.defaults().i18n());
    }
  }

  static synchronized void resetForTests() {
    bundles = Map.of();
    defaultLocale = Locale.forLanguageTag("en-US");
    fallbackLocale = Locale.forLanguageTag("en-US");
  }
}
