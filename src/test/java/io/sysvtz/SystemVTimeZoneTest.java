package io.sysvtz;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneRules;
import org.junit.jupiter.api.Test;

/** Tests for the SystemVTimeZone facade. */
public class SystemVTimeZoneTest {
  private static final String US_EASTERN = "EST5EDT,M3.2.0,M11.1.0";

  @Test
  void testNameDefaultsToRecipe() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(US_EASTERN);
    assertEquals(US_EASTERN, tz.name());
    assertEquals(US_EASTERN, tz.recipe());
  }

  @Test
  void testNameOverride() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse("EST5EDT", "US/Legacy");
    assertEquals("US/Legacy", tz.name());
    assertEquals("EST5EDT", tz.recipe());
  }

  @Test
  void testIdentificationFlags() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse("UTC0");
    assertFalse(tz.isFloating());
    assertFalse(tz.isUtc());
    assertFalse(tz.isOlson());
    assertTrue(tz.category().isEmpty());
  }

  @Test
  void testValidate() {
    assertTrue(SystemVTimeZone.validate(US_EASTERN));
    assertTrue(SystemVTimeZone.validate("<+0530>-5:30"));
    assertFalse(SystemVTimeZone.validate(""));
    assertFalse(SystemVTimeZone.validate(null));
    assertFalse(SystemVTimeZone.validate("EST"));
    assertFalse(SystemVTimeZone.validate("EST5EDT,M3.2.0"));
  }

  @Test
  void testParseErrorCarriesRecipe() {
    TzException e =
        assertThrows(
            TzException.class, () -> SystemVTimeZone.parse("EST5EDT,M13.1.0,M11.1.0"));
    assertEquals(ErrorKind.INVALID_RECIPE, e.kind());
    assertEquals("EST5EDT,M13.1.0,M11.1.0", e.input().orElseThrow());
    assertEquals("13", e.fragment().orElseThrow());
    assertTrue(e.getMessage().startsWith("not a valid SysV-style timezone specification"));
  }

  @Test
  void testFixedZone() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse("MUT-4");
    Instant instant = Instant.parse("2020-07-01T12:00:00Z");
    assertFalse(tz.hasDstChanges());
    assertFalse(tz.isDst(instant));
    assertEquals(14400, tz.offset(instant));
    assertEquals("MUT", tz.abbreviation(instant));
    assertEquals("MUT", tz.standardAbbreviation());
    assertTrue(tz.dstAbbreviation().isEmpty());
    assertTrue(tz.dstStart(2020).isEmpty());
    assertTrue(tz.dstEnd(2020).isEmpty());
    assertEquals(14400, tz.offsetForLocal(LocalDateTime.of(2020, 7, 1, 12, 0)));
  }

  @Test
  void testSummerAndWinter() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(US_EASTERN);
    Instant summer = Instant.parse("2020-07-01T12:00:00Z");
    Instant winter = Instant.parse("2020-01-15T12:00:00Z");

    assertTrue(tz.hasDstChanges());
    assertTrue(tz.isDst(summer));
    assertEquals(-14400, tz.offset(summer));
    assertEquals("EDT", tz.abbreviation(summer));
    assertEquals(ZoneOffset.ofHours(-4), tz.zoneOffset(summer));

    assertFalse(tz.isDst(winter));
    assertEquals(-18000, tz.offset(winter));
    assertEquals("EST", tz.abbreviation(winter));
    assertEquals(ZoneOffset.ofHours(-5), tz.zoneOffset(winter));
  }

  @Test
  void testTransitionsOfYear() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(US_EASTERN);
    assertEquals(
        CivilInstant.ofInstant(Instant.parse("2020-03-08T07:00:00Z")), tz.dstStart(2020).get());
    assertEquals(
        CivilInstant.ofInstant(Instant.parse("2020-11-01T06:00:00Z")), tz.dstEnd(2020).get());
  }

  @Test
  void testBoundariesAreExact() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(US_EASTERN);
    Instant start = Instant.parse("2020-03-08T07:00:00Z");
    Instant end = Instant.parse("2020-11-01T06:00:00Z");
    assertFalse(tz.isDst(start.minusSeconds(1)));
    assertTrue(tz.isDst(start));
    assertTrue(tz.isDst(end.minusSeconds(1)));
    assertFalse(tz.isDst(end));
  }

  @Test
  void testProviderOverloads() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(US_EASTERN);
    ZonedDateTime dateTime =
        ZonedDateTime.of(2020, 7, 1, 8, 0, 0, 0, ZoneId.of("America/New_York"));
    CivilInstantProvider provider = CivilInstantProvider.of(dateTime);

    assertTrue(tz.isDst(provider));
    assertEquals(-14400, tz.offset(provider));
    assertEquals("EDT", tz.abbreviation(provider));
    assertEquals(-14400, tz.offsetForLocal(provider));
  }

  @Test
  void testLocalTimes() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(US_EASTERN);
    assertEquals(-18000, tz.offsetForLocal(LocalDateTime.of(2020, 1, 15, 12, 0)));
    assertEquals(-14400, tz.offsetForLocal(LocalDateTime.of(2020, 7, 1, 12, 0)));
    assertTrue(tz.isDstForLocal(LocalDateTime.of(2020, 7, 1, 12, 0)));

    // 01:30 happens twice on 1 November; the lower offset wins
    LocalDateTime repeated = LocalDateTime.of(2020, 11, 1, 1, 30);
    assertEquals(-18000, tz.offsetForLocal(repeated));
    assertFalse(tz.isDstForLocal(repeated));
  }

  @Test
  void testNonExistentLocalTime() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(US_EASTERN, "US/Eastern");
    LocalDateTime skipped = LocalDateTime.of(2020, 3, 8, 2, 30);
    TzException e = assertThrows(TzException.class, () -> tz.offsetForLocal(skipped));
    assertEquals(ErrorKind.NON_EXISTENT_LOCAL_TIME, e.kind());
    assertEquals("US/Eastern", e.input().orElseThrow());
    assertEquals(CivilInstant.ofLocalDateTime(skipped), e.localTime().orElseThrow());
    assertTrue(e.getMessage().contains("US/Eastern"));
    assertTrue(e.span().isEmpty());
    assertThrows(TzException.class, () -> tz.isDstForLocal(skipped));
  }

  @Test
  void testCanonicalToString() throws TzException {
    assertEquals("EST5EDT,M4.5.0,M10.5.0", SystemVTimeZone.parse("EST5EDT").toString());
    assertEquals(
        "EST5EDT,M3.2.0,M11.1.0",
        SystemVTimeZone.parse("EST5EDT4,M3.2.0/2,M11.1.0/02:00:00").toString());
    assertEquals(
        "NST3:30NDT,M3.2.0/0:01,M11.1.0/0:01",
        SystemVTimeZone.parse("NST3:30NDT,M3.2.0/0:01,M11.1.0/0:01").toString());
    assertEquals("<+0530>-5:30", SystemVTimeZone.parse("<+0530>-5:30").toString());
    assertEquals("ABC5", SystemVTimeZone.parse("<ABC>5").toString());
    assertEquals("AAA3BBB,J60,300", SystemVTimeZone.parse("AAA3BBB,J060,0300").toString());
    assertEquals(
        "GMT0BST,M3.5.0/1,M10.5.0", SystemVTimeZone.parse("GMT0BST,M3.5.0/1,M10.5.0").toString());
  }

  @Test
  void testOffsetIsStandardOrDst() throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse("AEST-10AEDT,M10.1.0,M4.1.0/3");
    Instant t = Instant.parse("2019-01-01T00:00:00Z");
    Instant stop = Instant.parse("2022-01-01T00:00:00Z");
    while (t.isBefore(stop)) {
      boolean dst = tz.isDst(t);
      assertEquals(dst ? 39600 : 36000, tz.offset(t), t.toString());
      assertEquals(dst ? "AEDT" : "AEST", tz.abbreviation(t), t.toString());
      t = t.plus(1, ChronoUnit.HOURS);
    }
  }

  @Test
  void testAgreesWithZoneRules() throws TzException {
    assertAgrees(US_EASTERN, "America/New_York");
    assertAgrees("GMT0BST,M3.5.0/1,M10.5.0", "Europe/London");
    assertAgrees("AEST-10AEDT,M10.1.0,M4.1.0/3", "Australia/Sydney");
  }

  private static void assertAgrees(String recipe, String zoneId) throws TzException {
    SystemVTimeZone tz = SystemVTimeZone.parse(recipe);
    ZoneRules rules = ZoneId.of(zoneId).getRules();
    Instant t = Instant.parse("2010-01-01T00:00:00Z");
    Instant stop = Instant.parse("2030-01-01T00:00:00Z");
    while (t.isBefore(stop)) {
      assertEquals(rules.getOffset(t).getTotalSeconds(), tz.offset(t), recipe + " at " + t);
      t = t.plus(30, ChronoUnit.MINUTES);
    }
  }
}
