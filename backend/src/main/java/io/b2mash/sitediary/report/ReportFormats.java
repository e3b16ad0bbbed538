package io.b2mash.sitediary.report;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Value formatting shared by all report blocks. Locale-independent. */
final class ReportFormats {

  static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");
  static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  private ReportFormats() {}

  static String date(LocalDate date) {
    return date.format(DATE);
  }

  static String money(BigDecimal amount, String currencySymbol) {
    return String.format(Locale.ROOT, "%.2f %s", amount, currencySymbol);
  }

  static String hours(BigDecimal hours) {
    return String.format(Locale.ROOT, "%.1f h", hours);
  }

  static String temperature(BigDecimal celsius) {
    return String.format(Locale.ROOT, "%.1f°C", celsius);
  }
}
