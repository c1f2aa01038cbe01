package io.sysvtz.eval;

import io.sysvtz.CivilInstant;
import io.sysvtz.TzException;
import io.sysvtz.ast.DstRules;
import io.sysvtz.ast.TimezoneDescriptor;

/**
 * Interprets a wall-clock reading in a timezone.
 *
 * <h2>Algorithm</h2>
 *
 * <p>The reading is converted to UTC twice, once assuming the standard offset and once assuming
 * the DST offset. A candidate is consistent if DST is (for the DST candidate) or is not (for the
 * standard candidate) in effect at its own UTC instant.
 *
 * <ol>
 *   <li><b>One consistent candidate:</b> its offset applies.
 *   <li><b>Both consistent (fall back):</b> the reading is ambiguous; the numerically lower offset
 *       applies. This is usually, but not always, the standard offset.
 *   <li><b>Neither consistent (spring forward):</b> the reading does not exist and a {@link
 *       TzException} of kind NON_EXISTENT_LOCAL_TIME is thrown.
 * </ol>
 */
public final class LocalTimeResolver {
  private LocalTimeResolver() {}

  /**
   * Returns the offset in effect at the given local reading.
   *
   * @param descriptor the timezone
   * @param local the local day number and seconds of day
   * @return the offset east of UT, in seconds
   * @throws TzException if the reading falls in a spring-forward gap
   */
  public static int offsetForLocal(TimezoneDescriptor descriptor, CivilInstant local)
      throws TzException {
    return isDstForLocal(descriptor, local)
        ? descriptor.dst().offsetSeconds()
        : descriptor.stdOffsetSeconds();
  }

  /**
   * Returns whether the given local reading is in DST.
   *
   * @param descriptor the timezone
   * @param local the local day number and seconds of day
   * @return true if the DST offset applies to the reading
   * @throws TzException if the reading falls in a spring-forward gap
   */
  public static boolean isDstForLocal(TimezoneDescriptor descriptor, CivilInstant local)
      throws TzException {
    DstRules dst = descriptor.dst();
    if (dst == null) {
      return false;
    }

    int stdOffset = descriptor.stdOffsetSeconds();
    CivilInstant stdCandidate = toUtc(local, stdOffset);
    CivilInstant dstCandidate = toUtc(local, dst.offsetSeconds());
    boolean stdValid =
        !TransitionEngine.isDstActive(
            dst, stdCandidate.dayNumber(), stdCandidate.clampedSecondsOfDay());
    boolean dstValid =
        TransitionEngine.isDstActive(
            dst, dstCandidate.dayNumber(), dstCandidate.clampedSecondsOfDay());

    if (stdValid && dstValid) {
      return stdOffset > dst.offsetSeconds();
    }
    if (stdValid) {
      return false;
    }
    if (dstValid) {
      return true;
    }
    throw TzException.nonExistentLocalTime(local, descriptor.displayName());
  }

  private static CivilInstant toUtc(CivilInstant local, int offsetSeconds) {
    return local.plusSeconds(-(long) offsetSeconds);
  }
}
