package io.b2mash.sitediary.report;

import io.b2mash.sitediary.photo.Photo;

/** A photo paired with the outcome of loading its image. */
public record ResolvedPhoto(Photo photo, PhotoOutcome outcome) {}
