package io.b2mash.sitediary;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/** Request helpers shared by the MockMvc integration tests. */
public final class TestHttp {

  private TestHttp() {}

  public static String createProject(MockMvc mockMvc, String json) throws Exception {
    var result =
        mockMvc
            .perform(post("/api/projects").contentType(MediaType.APPLICATION_JSON).content(json))
            .andExpect(status().isCreated())
            .andReturn();
    return extractId(result);
  }

  public static String createEntry(MockMvc mockMvc, String projectId, String json)
      throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects/" + projectId + "/entries")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json))
            .andExpect(status().isCreated())
            .andReturn();
    return extractId(result);
  }

  public static String extractId(MvcResult result) throws Exception {
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }
}
