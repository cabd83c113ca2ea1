package io.github.themoah.klimat.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Month;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Season.
 */
public class SeasonTest {

  @Test
  void fromLabel_acceptsDatasetLabels() {
    assertEquals(Season.WINTER, Season.fromLabel("winter"));
    assertEquals(Season.SPRING, Season.fromLabel("spring"));
    assertEquals(Season.SUMMER, Season.fromLabel("summer"));
    assertEquals(Season.AUTUMN, Season.fromLabel("autumn"));
  }

  @Test
  void fromLabel_ignoresCaseAndBlanks() {
    assertEquals(Season.SUMMER, Season.fromLabel("  Summer "));
  }

  @Test
  void fromLabel_unknownLabel_throws() {
    assertThrows(IllegalArgumentException.class, () -> Season.fromLabel("fall"));
    assertThrows(IllegalArgumentException.class, () -> Season.fromLabel(null));
  }

  @Test
  void ofMonth_decemberIsWinter() {
    assertEquals(Season.WINTER, Season.ofMonth(Month.DECEMBER));
    assertEquals(Season.WINTER, Season.ofMonth(Month.FEBRUARY));
    assertEquals(Season.SPRING, Season.ofMonth(Month.MARCH));
    assertEquals(Season.SUMMER, Season.ofMonth(Month.AUGUST));
    assertEquals(Season.AUTUMN, Season.ofMonth(Month.NOVEMBER));
  }

  @Test
  void declarationOrder_isEnumerationOrder() {
    assertEquals(List.of(Season.WINTER, Season.SPRING, Season.SUMMER, Season.AUTUMN), List.of(Season.values()));
  }

  @Test
  void partitionKey_toString() {
    assertEquals("Moscow:winter", new PartitionKey("Moscow", Season.WINTER).toString());
  }
}
