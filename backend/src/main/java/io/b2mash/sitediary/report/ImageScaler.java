package io.b2mash.sitediary.report;

import java.util.Locale;

/** Fits images into the report's photo box while keeping their aspect ratio. */
public final class ImageScaler {

  public static final double BOX_WIDTH_CM = 8.0;
  public static final double BOX_HEIGHT_CM = 6.0;

  private ImageScaler() {}

  public static DisplaySize fitPhotoBox(int widthPx, int heightPx) {
    return fitWithin(widthPx, heightPx, BOX_WIDTH_CM, BOX_HEIGHT_CM);
  }

  /**
   * Scales {@code width x height} so that it touches the box on one side: images wider than the
   * box's aspect ratio are clamped to the box width, all others to the box height.
   *
   * @throws IllegalArgumentException if any dimension is not positive
   */
  public static DisplaySize fitWithin(
      double width, double height, double boxWidth, double boxHeight) {
    if (width <= 0 || height <= 0 || boxWidth <= 0 || boxHeight <= 0) {
      throw new IllegalArgumentException(
          String.format(
              Locale.ROOT,
              "Dimensions must be positive: %sx%s in %sx%s",
              width,
              height,
              boxWidth,
              boxHeight));
    }
    double aspect = width / height;
    if (aspect > boxWidth / boxHeight) {
      return new DisplaySize(boxWidth, boxWidth / aspect);
    }
    return new DisplaySize(boxHeight * aspect, boxHeight);
  }
}
