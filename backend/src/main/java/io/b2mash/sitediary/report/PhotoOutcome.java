package io.b2mash.sitediary.report;

/**
 * Result of loading one photo for a report. A photo whose file is missing or unreadable yields
 * {@link Unavailable} instead of failing the whole document.
 */
public sealed interface PhotoOutcome permits PhotoOutcome.Loaded, PhotoOutcome.Unavailable {

  boolean loaded();

  /**
   * @param dataUri the image as a {@code data:} URI for embedding
   * @param size display size within the photo box
   */
  record Loaded(String dataUri, DisplaySize size) implements PhotoOutcome {

    @Override
    public boolean loaded() {
      return true;
    }
  }

  record Unavailable(String reason) implements PhotoOutcome {

    @Override
    public boolean loaded() {
      return false;
    }
  }
}
