package io.github.themoah.klimat.model;

import java.time.Month;
import java.util.Locale;

/**
 * Meteorological season of an observation.
 *
 * <p>Declaration order is the partition enumeration order used by the scheduler.
 */
public enum Season {
  WINTER("winter"),
  SPRING("spring"),
  SUMMER("summer"),
  AUTUMN("autumn");

  private final String label;

  Season(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Parses a lowercase season label as it appears in the dataset.
   *
   * @param label one of winter, spring, summer, autumn (case-insensitive, surrounding blanks ignored)
   * @return the matching season
   * @throws IllegalArgumentException if the label is not a known season
   */
  public static Season fromLabel(String label) {
    if (label != null) {
      String normalized = label.trim().toLowerCase(Locale.ROOT);
      for (Season season : values()) {
        if (season.label.equals(normalized)) {
          return season;
        }
      }
    }
    throw new IllegalArgumentException("Unknown season: " + label);
  }

  /**
   * Maps a calendar month to its northern-hemisphere meteorological season.
   * December through February is winter.
   */
  public static Season ofMonth(Month month) {
    return switch (month) {
      case DECEMBER, JANUARY, FEBRUARY -> WINTER;
      case MARCH, APRIL, MAY -> SPRING;
      case JUNE, JULY, AUGUST -> SUMMER;
      case SEPTEMBER, OCTOBER, NOVEMBER -> AUTUMN;
    };
  }
}
