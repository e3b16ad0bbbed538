package io.b2mash.sitediary.photo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.sitediary.TestHttp;
import io.b2mash.sitediary.TestcontainersConfiguration;
import io.b2mash.sitediary.storage.StorageService;
import io.b2mash.sitediary.storage.StoredFileNotFoundException;
import io.b2mash.sitediary.testutil.TestData;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PhotoControllerTest {

  private static final byte[] PNG = TestData.image(40, 30, "png");

  @Autowired private MockMvc mockMvc;
  @Autowired private StorageService storageService;

  private String projectId;

  @BeforeAll
  void createProject() throws Exception {
    projectId = TestHttp.createProject(mockMvc, "{\"name\": \"Photo Test Project\"}");
  }

  @Test
  void shouldUploadPhotoAndServeContent() throws Exception {
    var result =
        mockMvc
            .perform(
                multipart("/api/projects/" + projectId + "/photos")
                    .file(new MockMultipartFile("file", "North Wall.png", "image/png", PNG))
                    .param("description", "North wall")
                    .param("date_taken", "2024-03-02"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.original_filename").value("North_Wall.png"))
            .andExpect(jsonPath("$.description").value("North wall"))
            .andExpect(jsonPath("$.date_taken").value("2024-03-02"))
            .andExpect(jsonPath("$.file_size").value(PNG.length))
            .andReturn();
    String photoId = TestHttp.extractId(result);

    assertThat(storageService.load(storedName(result))).containsExactly(PNG);
    mockMvc
        .perform(get("/api/projects/" + projectId + "/photos/" + photoId + "/content"))
        .andExpect(status().isOk())
        .andExpect(content().contentType("image/png"))
        .andExpect(content().bytes(PNG));
  }

  @Test
  void shouldRejectUnsupportedFileType() throws Exception {
    mockMvc
        .perform(
            multipart("/api/projects/" + projectId + "/photos")
                .file(new MockMultipartFile("file", "plan.pdf", "application/pdf", new byte[] {1})))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid file type"));
  }

  @Test
  void shouldShortenOverlongOriginalFilename() throws Exception {
    String longName = "a".repeat(300) + ".png";

    mockMvc
        .perform(
            multipart("/api/projects/" + projectId + "/photos")
                .file(new MockMultipartFile("file", longName, "image/png", PNG)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.original_filename").value("a".repeat(251) + ".png"));
  }

  @Test
  void shouldRejectMissingFile() throws Exception {
    mockMvc
        .perform(multipart("/api/projects/" + projectId + "/photos").param("description", "x"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("No file selected"));
  }

  @Test
  void shouldDeletePhotoAndFile() throws Exception {
    var result = upload("delete-me.png");
    String photoId = TestHttp.extractId(result);
    String storedName = storedName(result);

    mockMvc
        .perform(delete("/api/projects/" + projectId + "/photos/" + photoId))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/projects/" + projectId + "/photos/" + photoId))
        .andExpect(status().isNotFound());
    assertThatThrownBy(() -> storageService.load(storedName))
        .isInstanceOf(StoredFileNotFoundException.class);
  }

  @Test
  void shouldDeletePhotoWhoseFileIsAlreadyGone() throws Exception {
    var result = upload("vanished.png");
    String photoId = TestHttp.extractId(result);
    storageService.delete(storedName(result));

    mockMvc
        .perform(delete("/api/projects/" + projectId + "/photos/" + photoId))
        .andExpect(status().isNoContent());
  }

  @Test
  void shouldReturn404ForContentOfMissingFile() throws Exception {
    var result = upload("lost.png");
    String photoId = TestHttp.extractId(result);
    storageService.delete(storedName(result));

    mockMvc
        .perform(get("/api/projects/" + projectId + "/photos/" + photoId + "/content"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("File not found"));
  }

  @Test
  void shouldListPhotosNewestFirst() throws Exception {
    String listProject = TestHttp.createProject(mockMvc, "{\"name\": \"Photo Listing\"}");
    for (String date : new String[] {"2024-01-05", "2024-01-09", "2024-01-07"}) {
      mockMvc
          .perform(
              multipart("/api/projects/" + listProject + "/photos")
                  .file(new MockMultipartFile("file", date + ".png", "image/png", PNG))
                  .param("date_taken", date))
          .andExpect(status().isCreated());
    }

    mockMvc
        .perform(get("/api/projects/" + listProject + "/photos"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[0].date_taken").value("2024-01-09"))
        .andExpect(jsonPath("$[2].date_taken").value("2024-01-05"));
  }

  private MvcResult upload(String filename) throws Exception {
    return mockMvc
        .perform(
            multipart("/api/projects/" + projectId + "/photos")
                .file(new MockMultipartFile("file", filename, "image/png", PNG)))
        .andExpect(status().isCreated())
        .andReturn();
  }

  private static String storedName(MvcResult result) throws Exception {
    return JsonPath.read(result.getResponse().getContentAsString(), "$.filename");
  }
}
