package io.b2mash.sitediary.report;

import java.util.Locale;

/** Printed image size in centimetres. */
public record DisplaySize(double widthCm, double heightCm) {

  public String cssWidth() {
    return String.format(Locale.ROOT, "%.2fcm", widthCm);
  }

  public String cssHeight() {
    return String.format(Locale.ROOT, "%.2fcm", heightCm);
  }
}
