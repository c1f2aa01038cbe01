package io.sysvtz;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance.json on the test classpath. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode CASES;

  @BeforeAll
  static void loadCases() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance.json")) {
      assertNotNull(in, "conformance.json missing from test classpath");
      CASES = MAPPER.readTree(in);
    }
  }

  private static JsonNode tests(String section) {
    return CASES.get(section).get("tests");
  }

  // Parse tests

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : tests("parse")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String canonical = tc.get("canonical").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                SystemVTimeZone tz = SystemVTimeZone.parse(input);
                assertEquals(canonical, tz.toString(), "parse(" + input + ").toString()");
                assertEquals(input, tz.recipe());

                // Roundtrip test
                SystemVTimeZone tz2 = SystemVTimeZone.parse(canonical);
                assertEquals(
                    canonical, tz2.toString(), "roundtrip: parse(" + canonical + ").toString()");
                assertEquals(tz.descriptor().dst(), tz2.descriptor().dst());
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> parseErrorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : tests("parse_errors")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                TzException e =
                    assertThrows(
                        TzException.class,
                        () -> SystemVTimeZone.parse(input),
                        "expected parse error for: " + input);
                assertEquals(ErrorKind.INVALID_RECIPE, e.kind());
                assertFalse(SystemVTimeZone.validate(input));
              }));
    }
    return tests.stream();
  }

  // Eval tests

  @TestFactory
  Stream<DynamicTest> instantTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : tests("instants")) {
      String name = tc.get("name").asText();
      String recipe = tc.get("recipe").asText();
      Instant utc = Instant.parse(tc.get("utc").asText());
      int offset = tc.get("offset").asInt();
      boolean dst = tc.get("dst").asBoolean();
      String abbreviation = tc.get("abbreviation").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                SystemVTimeZone tz = SystemVTimeZone.parse(recipe);
                String context = recipe + " at " + utc;
                assertEquals(offset, tz.offset(utc), "offset: " + context);
                assertEquals(dst, tz.isDst(utc), "isDst: " + context);
                assertEquals(abbreviation, tz.abbreviation(utc), "abbreviation: " + context);
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> localTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : tests("local")) {
      String name = tc.get("name").asText();
      String recipe = tc.get("recipe").asText();
      LocalDateTime local = LocalDateTime.parse(tc.get("local").asText());

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                SystemVTimeZone tz = SystemVTimeZone.parse(recipe);
                if (tc.has("error")) {
                  TzException e =
                      assertThrows(
                          TzException.class,
                          () -> tz.offsetForLocal(local),
                          "expected error for " + local + " in " + recipe);
                  assertEquals(tc.get("error").asText(), e.kind().value());
                  return;
                }
                assertEquals(
                    tc.get("offset").asInt(),
                    tz.offsetForLocal(local),
                    "offsetForLocal: " + recipe + " at " + local);
              }));
    }
    return tests.stream();
  }
}
