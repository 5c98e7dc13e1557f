package com.sitecam.timelapse.artifact_builder;

import static org.junit.jupiter.api.Assertions.*;

import com.sitecam.timelapse.exceptions.PartitionNameParseException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CalendarPartitionerTest {
  private final CalendarPartitioner calendarPartitioner = new CalendarPartitioner();

  @Test
  void testParseDate() {
    assertEquals(
        LocalDate.of(2025, 7, 14), calendarPartitioner.parseDate("TLST04A00879_250714_0600"));
    assertEquals(LocalDate.of(2025, 7, 14), calendarPartitioner.parseDate("X_250714"));
    assertEquals(LocalDate.of(2024, 2, 29), calendarPartitioner.parseDate("X_240229extra"));
  }

  @Test
  void testParseDateIsDeterministic() {
    String name = "TLST04A00879_250720_1800";
    assertEquals(calendarPartitioner.parseDate(name), calendarPartitioner.parseDate(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "nounderscore", "X_", "X_2507", "X_abcdef", "X_251301", "X_250230"})
  void testParseDateRejectsMalformedNames(String partitionName) {
    assertThrows(
        PartitionNameParseException.class, () -> calendarPartitioner.parseDate(partitionName));
  }

  @Test
  void testParseDateRejectsMissingName() {
    assertThrows(PartitionNameParseException.class, () -> calendarPartitioner.parseDate(null));
  }

  @Test
  void testWholeWeekMapsToSameMonday() {
    LocalDate monday = LocalDate.of(2025, 7, 14);
    for (int day = 14; day <= 20; day++) {
      LocalDate date = calendarPartitioner.parseDate(String.format("X_2507%02d_0600", day));
      assertEquals(monday, calendarPartitioner.weekAnchor(date));
    }
    assertEquals(
        LocalDate.of(2025, 7, 21),
        calendarPartitioner.weekAnchor(calendarPartitioner.parseDate("X_250721_0600")));
  }

  @Test
  void testWeekAnchorProperties() {
    Random random = new Random(42);
    LocalDate start = LocalDate.of(2020, 1, 1);
    for (int i = 0; i < 1000; i++) {
      LocalDate date = start.plusDays(random.nextInt(3650));
      LocalDate anchor = calendarPartitioner.weekAnchor(date);
      assertEquals(DayOfWeek.MONDAY, anchor.getDayOfWeek());
      assertFalse(anchor.isAfter(date));
      long offset = ChronoUnit.DAYS.between(anchor, date);
      assertTrue(offset >= 0 && offset <= 6);
    }
  }

  @Test
  void testWeekAnchorAcrossYearBoundary() {
    assertEquals(
        LocalDate.of(2024, 12, 30), calendarPartitioner.weekAnchor(LocalDate.of(2025, 1, 5)));
  }
}
