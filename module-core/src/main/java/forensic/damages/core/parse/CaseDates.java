package forensic.damages.core.parse;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Case date parsing. Accepts {@code M/D/YYYY} (the entry format) and ISO {@code YYYY-MM-DD},
 * optionally followed by a time part which is ignored.
 */
public final class CaseDates {

  private static final Pattern US_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
  private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})(?:[T ].*)?$");

  private CaseDates() {
    throw new UnsupportedOperationException("Utility class");
  }

  public static Optional<LocalDate> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    Matcher us = US_DATE.matcher(value);
    if (us.matches()) {
      return date(us.group(3), us.group(1), us.group(2));
    }
    Matcher iso = ISO_DATE.matcher(value);
    if (iso.matches()) {
      return date(iso.group(1), iso.group(2), iso.group(3));
    }
    return Optional.empty();
  }

  private static Optional<LocalDate> date(String year, String month, String day) {
    try {
      return Optional.of(
          LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
