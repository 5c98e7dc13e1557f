package com.sitecam.timelapse.source;

import static com.sitecam.timelapse.constants.BuildConstants.PARTITION_NAME_SEPARATOR;

import com.sitecam.timelapse.artifact_builder.models.ItemRef;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.io.FilenameUtils;

public final class FrameOrdering {
  private static final Pattern LEADING_TOKEN = Pattern.compile("^\\S*");
  private static final Pattern NON_DIGITS = Pattern.compile("[^0-9]");

  public static final Comparator<ItemRef> BY_FRAME_NUMBER =
      Comparator.comparingLong((ItemRef itemRef) -> frameNumber(itemRef.getName()))
          .thenComparing(ItemRef::getName);

  private FrameOrdering() {}

  public static long frameNumber(String fileName) {
    String[] parts = FilenameUtils.getBaseName(fileName).split(PARTITION_NAME_SEPARATOR);
    if (parts.length < 2) {
      return 0L;
    }
    Matcher matcher = LEADING_TOKEN.matcher(parts[1].trim());
    if (!matcher.find()) {
      return 0L;
    }
    String digits = NON_DIGITS.matcher(matcher.group()).replaceAll("");
    if (digits.isEmpty()) {
      return 0L;
    }
    try {
      return Long.parseLong(digits);
    } catch (NumberFormatException e) {
      return 0L;
    }
  }
}
