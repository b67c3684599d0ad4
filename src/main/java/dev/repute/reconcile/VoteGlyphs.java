/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

import dev.repute.api.VoteType;
import java.util.List;
import java.util.Optional;

/**
 * The two reaction glyphs that count as votes.
 *
 * @param good glyph for {@link VoteType#GOOD}
 * @param bad glyph for {@link VoteType#BAD}
 */
public record VoteGlyphs(String good, String bad) {
  public static final VoteGlyphs DEFAULT = new VoteGlyphs("🟢", "🔴");

  public VoteGlyphs {
    if (good == null || bad == null || good.isBlank() || bad.isBlank() || good.equals(bad)) {
      throw new IllegalArgumentException("vote glyphs must be two distinct non-blank values");
    }
  }

  public Optional<VoteType> typeOf(String glyph) {
    if (good.equals(glyph)) {
      return Optional.of(VoteType.GOOD);
    }
    if (bad.equals(glyph)) {
      return Optional.of(VoteType.BAD);
    }
    return Optional.empty();
  }

  public String glyph(VoteType type) {
    return type == VoteType.GOOD ? good : bad;
  }

  /** Good glyph first. */
  public List<String> both() {
    return List.of(good, bad);
  }
}
