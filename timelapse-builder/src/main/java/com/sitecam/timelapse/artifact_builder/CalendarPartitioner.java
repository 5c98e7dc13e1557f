package com.sitecam.timelapse.artifact_builder;

import static com.sitecam.timelapse.constants.BuildConstants.CENTURY_BASE_YEAR;
import static com.sitecam.timelapse.constants.BuildConstants.DATE_TOKEN_LENGTH;
import static com.sitecam.timelapse.constants.BuildConstants.PARTITION_NAME_SEPARATOR;

import com.sitecam.timelapse.exceptions.PartitionNameParseException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.regex.Pattern;

public class CalendarPartitioner {
  private static final Pattern DATE_TOKEN_PATTERN =
      Pattern.compile("^[0-9]{" + DATE_TOKEN_LENGTH + "}");

  public LocalDate parseDate(String partitionName) {
    if (partitionName == null) {
      throw new PartitionNameParseException("Partition name is missing");
    }
    String[] parts = partitionName.split(Pattern.quote(PARTITION_NAME_SEPARATOR));
    if (parts.length < 2 || !DATE_TOKEN_PATTERN.matcher(parts[1]).find()) {
      throw new PartitionNameParseException(
          String.format("Partition name %s does not carry a YYMMDD date token", partitionName));
    }
    String dateToken = parts[1].substring(0, DATE_TOKEN_LENGTH);
    try {
      return LocalDate.of(
          CENTURY_BASE_YEAR + Integer.parseInt(dateToken.substring(0, 2)),
          Integer.parseInt(dateToken.substring(2, 4)),
          Integer.parseInt(dateToken.substring(4, 6)));
    } catch (DateTimeException e) {
      throw new PartitionNameParseException(
          String.format("Partition name %s carries an invalid date %s", partitionName, dateToken),
          e);
    }
  }

  public LocalDate weekAnchor(LocalDate date) {
    return date.minusDays(date.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue());
  }
}
