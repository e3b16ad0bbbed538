package io.b2mash.sitediary.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.b2mash.sitediary.photo.Photo;
import io.b2mash.sitediary.storage.StorageException;
import io.b2mash.sitediary.storage.StorageService;
import io.b2mash.sitediary.storage.StoredFileNotFoundException;
import io.b2mash.sitediary.testutil.TestData;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PhotoImageLoaderTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final LocalDate TAKEN = LocalDate.of(2024, 6, 1);

  @Mock private StorageService storageService;

  private PhotoImageLoader loader;

  @BeforeEach
  void setUp() {
    loader = new PhotoImageLoader(storageService);
  }

  @Test
  void pngFile_isEmbeddedWithScaledSize() {
    var photo = TestData.photo(PROJECT_ID, "wide.png", "wide.png", TAKEN);
    when(storageService.load("wide.png")).thenReturn(TestData.image(400, 100, "png"));

    var outcome = loader.resolve(photo).outcome();

    assertThat(outcome).isInstanceOf(PhotoOutcome.Loaded.class);
    var loaded = (PhotoOutcome.Loaded) outcome;
    assertThat(loaded.dataUri()).startsWith("data:image/png;base64,");
    assertThat(loaded.size().cssWidth()).isEqualTo("8.00cm");
    assertThat(loaded.size().cssHeight()).isEqualTo("2.00cm");
  }

  @Test
  void bmpFile_isReencodedAsPng() {
    var photo =
        new Photo(PROJECT_ID, "scan.bmp", "scan.bmp", null, TAKEN, 10L, "image/bmp");
    when(storageService.load("scan.bmp")).thenReturn(TestData.image(60, 80, "bmp"));

    var outcome = loader.resolve(photo).outcome();

    assertThat(outcome).isInstanceOf(PhotoOutcome.Loaded.class);
    assertThat(((PhotoOutcome.Loaded) outcome).dataUri()).startsWith("data:image/png;base64,");
  }

  @Test
  void missingFile_yieldsUnavailableAndKeepsPhoto() {
    var photo = TestData.photo(PROJECT_ID, "gone.png", "gone.png", TAKEN);
    when(storageService.load("gone.png")).thenThrow(new StoredFileNotFoundException("gone.png"));

    var resolved = loader.resolve(photo);

    assertThat(resolved.photo()).isSameAs(photo);
    assertThat(resolved.outcome()).isEqualTo(new PhotoOutcome.Unavailable("File not found"));
  }

  @Test
  void unreadableFile_yieldsUnavailable() {
    var photo = TestData.photo(PROJECT_ID, "locked.png", "locked.png", TAKEN);
    when(storageService.load("locked.png")).thenThrow(new StorageException("denied"));

    assertThat(loader.resolve(photo).outcome().loaded()).isFalse();
  }

  @Test
  void corruptBytes_yieldUnavailable() {
    var photo = TestData.photo(PROJECT_ID, "broken.png", "broken.png", TAKEN);
    when(storageService.load("broken.png"))
        .thenReturn("not an image".getBytes(StandardCharsets.UTF_8));

    assertThat(loader.resolve(photo).outcome())
        .isEqualTo(new PhotoOutcome.Unavailable("Unsupported or corrupt image"));
  }

  @Test
  void oneBadPhoto_doesNotAffectOthers() {
    var good = TestData.photo(PROJECT_ID, "good.png", "good.png", TAKEN);
    var bad = TestData.photo(PROJECT_ID, "bad.png", "bad.png", TAKEN);
    when(storageService.load("good.png")).thenReturn(TestData.image(10, 10, "png"));
    when(storageService.load("bad.png")).thenThrow(new StoredFileNotFoundException("bad.png"));

    var resolved = loader.resolveAll(List.of(bad, good));

    assertThat(resolved).extracting(r -> r.outcome().loaded()).containsExactly(false, true);
  }
}
