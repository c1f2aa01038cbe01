package io.sysvtz.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Represents a parsed recipe. Immutable and safe to share between threads.
 *
 * @param rawRecipe the recipe string exactly as given
 * @param displayName the name reported for the zone, the recipe unless overridden
 * @param stdAbbreviation the standard-time abbreviation
 * @param stdOffsetSeconds the standard offset east of UT, in seconds
 * @param dst the DST half, or null for a fixed-offset zone
 */
public record TimezoneDescriptor(
    String rawRecipe,
    String displayName,
    String stdAbbreviation,
    int stdOffsetSeconds,
    DstRules dst) {
  /** Defaults the display name to the recipe. */
  public TimezoneDescriptor {
    Objects.requireNonNull(rawRecipe, "rawRecipe");
    Objects.requireNonNull(stdAbbreviation, "stdAbbreviation");
    displayName = displayName == null ? rawRecipe : displayName;
  }

  /**
   * Creates a fixed-offset descriptor.
   *
   * @param recipe the recipe string
   * @param abbreviation the abbreviation
   * @param offsetSeconds the offset east of UT, in seconds
   * @return a descriptor without DST
   */
  public static TimezoneDescriptor fixed(String recipe, String abbreviation, int offsetSeconds) {
    return new TimezoneDescriptor(recipe, null, abbreviation, offsetSeconds, null);
  }

  /**
   * Returns whether the zone alternates between standard time and DST.
   *
   * @return true if a DST half is present
   */
  public boolean hasDst() {
    return dst != null;
  }

  /**
   * Returns the DST half, if present.
   *
   * @return the DST rules, or empty for a fixed-offset zone
   */
  public Optional<DstRules> dstRules() {
    return Optional.ofNullable(dst);
  }

  /**
   * Returns a copy with the specified display name.
   *
   * @param name the display name, or null to fall back to the recipe
   * @return a new descriptor with the updated name
   */
  public TimezoneDescriptor withDisplayName(String name) {
    return new TimezoneDescriptor(rawRecipe, name, stdAbbreviation, stdOffsetSeconds, dst);
  }
}
