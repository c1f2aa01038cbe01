package io.sysvtz;

import io.sysvtz.ast.DstRules;
import io.sysvtz.ast.TimezoneDescriptor;
import io.sysvtz.display.Display;
import io.sysvtz.eval.LocalTimeResolver;
import io.sysvtz.eval.TransitionEngine;
import io.sysvtz.parser.RecipeParser;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for System V and POSIX timezone recipes.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * SystemVTimeZone tz = SystemVTimeZone.parse("EST5EDT,M3.2.0,M11.1.0");
 * int offset = tz.offset(Instant.now());
 * String abbreviation = tz.abbreviation(Instant.now());
 * }</pre>
 *
 * <p>Instances are immutable and may be queried from any number of threads.
 */
public final class SystemVTimeZone {
  private static final Logger log = LoggerFactory.getLogger(SystemVTimeZone.class);

  private final TimezoneDescriptor descriptor;

  private SystemVTimeZone(TimezoneDescriptor descriptor) {
    this.descriptor = descriptor;
  }

  /**
   * Parses a recipe into a timezone named after the recipe.
   *
   * @param recipe the recipe, e.g. "EST5EDT,M3.2.0,M11.1.0"
   * @return the parsed timezone
   * @throws TzException if the recipe is invalid
   */
  public static SystemVTimeZone parse(String recipe) throws TzException {
    return parse(recipe, null);
  }

  /**
   * Parses a recipe into a timezone with the given name.
   *
   * @param recipe the recipe
   * @param name the name to report, or null to use the recipe
   * @return the parsed timezone
   * @throws TzException if the recipe is invalid
   */
  public static SystemVTimeZone parse(String recipe, String name) throws TzException {
    TimezoneDescriptor descriptor = RecipeParser.parse(recipe).withDisplayName(name);
    log.debug("Parsed timezone recipe {} as {}", recipe, descriptor);
    return new SystemVTimeZone(descriptor);
  }

  /**
   * Validates a recipe without throwing.
   *
   * @param recipe the recipe
   * @return true if the recipe is valid
   */
  public static boolean validate(String recipe) {
    try {
      RecipeParser.parse(recipe);
      return true;
    } catch (TzException e) {
      return false;
    }
  }

  // Identification

  /**
   * Returns the zone name: the recipe unless a name was supplied.
   *
   * @return the name
   */
  public String name() {
    return descriptor.displayName();
  }

  /**
   * Returns the recipe exactly as parsed.
   *
   * @return the recipe
   */
  public String recipe() {
    return descriptor.rawRecipe();
  }

  /**
   * Always false: the zone has a definite offset.
   *
   * @return false
   */
  public boolean isFloating() {
    return false;
  }

  /**
   * Always false, even for a recipe with a zero offset.
   *
   * @return false
   */
  public boolean isUtc() {
    return false;
  }

  /**
   * Always false: the zone does not come from the Olson database.
   *
   * @return false
   */
  public boolean isOlson() {
    return false;
  }

  /**
   * Always empty: the Olson category concept does not apply.
   *
   * @return empty
   */
  public Optional<String> category() {
    return Optional.empty();
  }

  // Offsets

  /**
   * Returns whether the zone has a DST offset.
   *
   * @return true if the recipe defines DST
   */
  public boolean hasDstChanges() {
    return descriptor.hasDst();
  }

  /**
   * Returns whether DST is in effect at a UTC instant.
   *
   * @param utc the UTC day number and seconds of day
   * @return true if DST is in effect
   */
  public boolean isDst(CivilInstant utc) {
    return TransitionEngine.isDstActive(descriptor, utc);
  }

  /**
   * Returns whether DST is in effect at an instant.
   *
   * @param instant the instant
   * @return true if DST is in effect
   */
  public boolean isDst(Instant instant) {
    return isDst(CivilInstant.ofInstant(instant));
  }

  /**
   * Returns whether DST is in effect at the provider's UTC reading.
   *
   * @param provider the instant provider
   * @return true if DST is in effect
   */
  public boolean isDst(CivilInstantProvider provider) {
    return isDst(provider.utcCivil());
  }

  /**
   * Returns the offset in effect at a UTC instant.
   *
   * @param utc the UTC day number and seconds of day
   * @return the offset east of UT, in seconds
   */
  public int offset(CivilInstant utc) {
    return TransitionEngine.offsetFor(descriptor, utc);
  }

  /**
   * Returns the offset in effect at an instant.
   *
   * @param instant the instant
   * @return the offset east of UT, in seconds
   */
  public int offset(Instant instant) {
    return offset(CivilInstant.ofInstant(instant));
  }

  /**
   * Returns the offset in effect at the provider's UTC reading.
   *
   * @param provider the instant provider
   * @return the offset east of UT, in seconds
   */
  public int offset(CivilInstantProvider provider) {
    return offset(provider.utcCivil());
  }

  /**
   * Returns the offset in effect at an instant as a ZoneOffset.
   *
   * @param instant the instant
   * @return the zone offset
   * @throws java.time.DateTimeException if the offset exceeds 18 hours
   */
  public ZoneOffset zoneOffset(Instant instant) {
    return ZoneOffset.ofTotalSeconds(offset(instant));
  }

  /**
   * Returns the abbreviation in effect at a UTC instant.
   *
   * @param utc the UTC day number and seconds of day
   * @return the abbreviation
   */
  public String abbreviation(CivilInstant utc) {
    return TransitionEngine.abbreviationFor(descriptor, utc);
  }

  /**
   * Returns the abbreviation in effect at an instant.
   *
   * @param instant the instant
   * @return the abbreviation
   */
  public String abbreviation(Instant instant) {
    return abbreviation(CivilInstant.ofInstant(instant));
  }

  /**
   * Returns the abbreviation in effect at the provider's UTC reading.
   *
   * @param provider the instant provider
   * @return the abbreviation
   */
  public String abbreviation(CivilInstantProvider provider) {
    return abbreviation(provider.utcCivil());
  }

  // Local times

  /**
   * Returns the offset in effect at a local reading in this zone.
   *
   * <p>An ambiguous reading gets the numerically lower of the two offsets.
   *
   * @param local the local day number and seconds of day
   * @return the offset east of UT, in seconds
   * @throws TzException if the reading does not exist in this zone
   */
  public int offsetForLocal(CivilInstant local) throws TzException {
    return LocalTimeResolver.offsetForLocal(descriptor, local);
  }

  /**
   * Returns the offset in effect at a local date-time in this zone.
   *
   * @param dateTime the local date-time
   * @return the offset east of UT, in seconds
   * @throws TzException if the date-time does not exist in this zone
   */
  public int offsetForLocal(LocalDateTime dateTime) throws TzException {
    return offsetForLocal(CivilInstant.ofLocalDateTime(dateTime));
  }

  /**
   * Returns the offset in effect at the provider's local reading, read as a time in this zone.
   *
   * @param provider the instant provider
   * @return the offset east of UT, in seconds
   * @throws TzException if the reading does not exist in this zone
   */
  public int offsetForLocal(CivilInstantProvider provider) throws TzException {
    return offsetForLocal(provider.localCivil());
  }

  /**
   * Returns whether a local reading in this zone is in DST.
   *
   * @param local the local day number and seconds of day
   * @return true if the DST offset applies
   * @throws TzException if the reading does not exist in this zone
   */
  public boolean isDstForLocal(CivilInstant local) throws TzException {
    return LocalTimeResolver.isDstForLocal(descriptor, local);
  }

  /**
   * Returns whether a local date-time in this zone is in DST.
   *
   * @param dateTime the local date-time
   * @return true if the DST offset applies
   * @throws TzException if the date-time does not exist in this zone
   */
  public boolean isDstForLocal(LocalDateTime dateTime) throws TzException {
    return isDstForLocal(CivilInstant.ofLocalDateTime(dateTime));
  }

  // Transitions

  /**
   * Returns the UTC instant at which DST starts under the given year's rule.
   *
   * @param year the year
   * @return the transition, or empty for a fixed-offset zone
   */
  public Optional<CivilInstant> dstStart(int year) {
    return descriptor.dstRules().map(d -> TransitionEngine.transitionIn(d.startRule(), year));
  }

  /**
   * Returns the UTC instant at which DST ends under the given year's rule.
   *
   * @param year the year
   * @return the transition, or empty for a fixed-offset zone
   */
  public Optional<CivilInstant> dstEnd(int year) {
    return descriptor.dstRules().map(d -> TransitionEngine.transitionIn(d.endRule(), year));
  }

  /**
   * Returns the underlying descriptor.
   *
   * @return the descriptor
   */
  public TimezoneDescriptor descriptor() {
    return descriptor;
  }

  /**
   * Returns the abbreviation used during standard time.
   *
   * @return the standard abbreviation
   */
  public String standardAbbreviation() {
    return descriptor.stdAbbreviation();
  }

  /**
   * Returns the abbreviation used during DST, if the zone has DST.
   *
   * @return the DST abbreviation, or empty
   */
  public Optional<String> dstAbbreviation() {
    return descriptor.dstRules().map(DstRules::abbreviation);
  }

  /**
   * Returns the canonical recipe for this zone.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(descriptor);
  }
}
