package com.example.bullets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("BulletDocumentController")
class BulletDocumentControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  private String json(BulletBuildRequest request) throws Exception {
    return objectMapper.writeValueAsString(request);
  }

  private static MockMultipartFile upload(byte[] bytes) {
    return new MockMultipartFile(
        "file", "resume.docx", BulletDocumentController.DOCX.toString(), bytes);
  }

  @Test
  @DisplayName("Should answer the health check")
  void shouldAnswerHome() throws Exception {
    mockMvc
        .perform(get("/api/bullets/"))
        .andExpect(status().isOk())
        .andExpect(content().string("Bullet processor is running"));
  }

  @Test
  @DisplayName("Should return a docx with reconciliation headers")
  void shouldBuildDocx_withReportHeaders() throws Exception {
    BulletBuildRequest request =
        new BulletBuildRequest(
            "web-1",
            "en",
            false,
            List.of(
                new BulletBuildRequest.Item("experience", "• Led the migration", 0),
                new BulletBuildRequest.Item("skills", "Java", 0)));

    MvcResult result =
        mockMvc
            .perform(
                post("/api/bullets/build")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(request)))
            .andExpect(status().isOk())
            .andExpect(content().contentType(BulletDocumentController.DOCX))
            .andExpect(header().string("X-Document-Id", "web-1"))
            .andExpect(header().string("X-Bullets-Total", "2"))
            .andExpect(header().string("X-Bullets-Repaired", "0"))
            .andExpect(header().string("X-Bullets-Errors", "0"))
            .andReturn();

    byte[] docx = result.getResponse().getContentAsByteArray();
    XWPFDocument doc = DocxFixtures.load(docx);
    assertThat(doc.getParagraphs()).extracting(p -> p.getText()).contains("Led the migration");
  }

  @Test
  @DisplayName("Should surface a strict-mode rejection to the error handler")
  void shouldFail_whenStrictTextCarriesMarker() throws Exception {
    BulletBuildRequest request =
        new BulletBuildRequest(
            "web-2", null, true, List.of(new BulletBuildRequest.Item("experience", "• Did X", 0)));
    String body = json(request);

    assertThatThrownBy(
            () ->
                mockMvc.perform(
                    post("/api/bullets/build").contentType(MediaType.APPLICATION_JSON).content(body)))
        .isInstanceOf(ServletException.class)
        .hasRootCauseInstanceOf(BulletSanitizationException.class);
  }

  @Test
  @DisplayName("Should list no issues for an engine-built document")
  void shouldAnalyzeCleanDocument() throws Exception {
    BulletBuildRequest request =
        new BulletBuildRequest(
            "web-3", null, false, List.of(new BulletBuildRequest.Item("experience", "Shipped", 0)));
    byte[] docx =
        mockMvc
            .perform(
                post("/api/bullets/build")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(request)))
            .andReturn()
            .getResponse()
            .getContentAsByteArray();

    mockMvc
        .perform(multipart("/api/bullets/analyze").file(upload(docx)))
        .andExpect(status().isOk())
        .andExpect(content().json("[]"));
  }

  @Test
  @DisplayName("Should report an unreadable upload as data")
  void shouldAnalyzeGarbage_asUnparsable() throws Exception {
    mockMvc
        .perform(
            multipart("/api/bullets/analyze")
                .file(upload("not a docx".getBytes(StandardCharsets.UTF_8))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].kind").value("UNPARSABLE_PART"))
        .andExpect(jsonPath("$[0].severity").value("CRITICAL"))
        .andExpect(jsonPath("$[0].autoFixable").value(false));
  }

  @Test
  @DisplayName("Should repair fixable issues and count them in headers")
  void shouldRepair_andReportCounts() throws Exception {
    XWPFDocument doc = new XWPFDocument();
    new NumberingDefinitionRegistry().ensureDefinition(doc, 100, 100, LevelFormat.defaults());
    new StyleCollisionResolver(DocxFixtures.BULLET, () -> 999).ensureBulletStyle(doc, 100);
    DocxFixtures.numPr(DocxFixtures.bullet(doc, "No level"), "100", null);

    MvcResult result =
        mockMvc
            .perform(multipart("/api/bullets/repair").file(upload(DocxFixtures.bytes(doc))))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Repair-Actions", "1"))
            .andExpect(header().string("X-Repair-Repaired", "1"))
            .andExpect(header().string("X-Repair-Skipped", "0"))
            .andExpect(header().string("X-Repair-Failed", "0"))
            .andReturn();

    XWPFDocument repaired = DocxFixtures.load(result.getResponse().getContentAsByteArray());
    assertThat(repaired.getParagraphs().get(0).getNumIlvl()).isNotNull();
  }
}
