package io.sysvtz;

import java.time.ZonedDateTime;

/**
 * Anything that can report where it sits on the UTC and local civil time scales.
 *
 * <p>Queries about the offset in effect at an instant read {@link #utcCivil()}; queries that
 * interpret a wall-clock reading read {@link #localCivil()}.
 */
public interface CivilInstantProvider {
  /**
   * Returns the UTC reading.
   *
   * @return the UTC day number and seconds of day
   */
  CivilInstant utcCivil();

  /**
   * Returns the local wall-clock reading.
   *
   * @return the local day number and seconds of day
   */
  CivilInstant localCivil();

  /**
   * Adapts a zoned date-time, using its own zone for the local reading.
   *
   * @param dateTime the zoned date-time
   * @return a provider over the date-time
   */
  static CivilInstantProvider of(ZonedDateTime dateTime) {
    CivilInstant utc = CivilInstant.ofInstant(dateTime.toInstant());
    CivilInstant local = CivilInstant.ofLocalDateTime(dateTime.toLocalDateTime());
    return new CivilInstantProvider() {
      @Override
      public CivilInstant utcCivil() {
        return utc;
      }

      @Override
      public CivilInstant localCivil() {
        return local;
      }
    };
  }
}
