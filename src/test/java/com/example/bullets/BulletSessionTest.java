package com.example.bullets;

import static com.example.bullets.DocxFixtures.BULLET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;
import org.apache.poi.wp.usermodel.HeaderFooterType;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BulletSession")
class BulletSessionTest {

  private NumIdAllocator allocator;
  private BulletEngine engine;
  private XWPFDocument doc;

  @BeforeEach
  void setUp() {
    BulletEngineConfig config = BulletEngineConfig.defaults();
    allocator = new NumIdAllocator(config);
    engine = new BulletEngine(config, allocator);
    doc = new XWPFDocument();
  }

  @AfterEach
  void tearDown() throws Exception {
    doc.close();
  }

  @Test
  @DisplayName("Should build three sections of four bullets with a clean report")
  void shouldBuildSections_withCleanReconciliation() {
    try (BulletSession session = engine.openSession("resume-1", doc)) {
      for (String section : List.of("experience", "projects", "skills")) {
        for (int i = 0; i < 4; i++) {
          session.addBullet("• " + section + " achievement " + i, section);
        }
      }

      ReconciliationReport report = session.reconcile();

      assertThat(session.getBulletsAdded()).isEqualTo(12);
      assertThat(report.total).isEqualTo(12);
      assertThat(report.repaired).isZero();
      assertThat(report.isClean()).isTrue();
      assertThat(report.requestId).isEqualTo(session.getRequestId());
      assertThat(session.isSealed()).isTrue();
      assertThat(doc.getParagraphs())
          .allSatisfy(p -> assertThat(p.getText()).doesNotStartWith("•"));
    }
  }

  @Test
  @DisplayName("Should give each section its own numbering instance")
  void shouldUseDistinctNumIds_perSection() {
    try (BulletSession session = engine.openSession("resume-1", doc)) {
      XWPFParagraph first = session.addBullet("Led the team", "experience").get(0);
      XWPFParagraph second = session.addBullet("Built the app", "projects").get(0);
      XWPFParagraph third = session.addBullet("Shipped v2", "experience").get(0);

      assertThat(first.getNumID()).isNotEqualTo(second.getNumID());
      assertThat(third.getNumID()).isEqualTo(first.getNumID());
      assertThat(first.getNumID().intValue()).isNotEqualTo(session.getStyleNumId());
      assertThat(session.numberingFor("")).isEqualTo(session.numberingFor(null));
    }
  }

  @Test
  @DisplayName("Should split multi-line text into one paragraph per line")
  void shouldAddOneParagraphPerLine() {
    try (BulletSession session = engine.openSession("resume-1", doc)) {
      List<XWPFParagraph> added = session.addBullet("• Led team\n• Shipped product", "experience");

      assertThat(added).extracting(XWPFParagraph::getText).containsExactly("Led team", "Shipped product");
      assertThat(added).allSatisfy(p -> assertThat(p.getStyle()).isEqualTo(BULLET));
      assertThat(session.addBullet("   ", "experience")).isEmpty();
    }
  }

  @Test
  @DisplayName("Should keep the requested nesting level through reconciliation")
  void shouldPreserveLevel() {
    try (BulletSession session = engine.openSession("resume-1", doc)) {
      XWPFParagraph nested = session.addBullet("Mentored two juniors", "experience", 2).get(0);
      session.reconcile();

      assertThat(nested.getNumIlvl()).isEqualTo(BigInteger.valueOf(2));
    }
  }

  @Test
  @DisplayName("Should repair a paragraph whose numbering was stripped after binding")
  void shouldRepairStrippedParagraph_onReconcile() {
    try (BulletSession session = engine.openSession("resume-1", doc)) {
      XWPFParagraph p = session.addBullet("Lost its numbering", "experience", 1).get(0);
      p.getCTP().getPPr().unsetNumPr();

      ReconciliationReport report = session.reconcile();

      assertThat(report.repaired).isEqualTo(1);
      assertThat(report.repairsByCategory).containsEntry(BulletErrorCategory.MISSING_NUMPR, 1);
      assertThat(p.getNumID()).isEqualTo(BigInteger.valueOf(session.getStyleNumId()));
      assertThat(p.getNumIlvl()).isEqualTo(BigInteger.ZERO);
    }
  }

  @Test
  @DisplayName("Should repair table-cell and header bullets before the document is written")
  void shouldRepairCellAndHeaderBullets_thatSurviveWrite() {
    int styleNumId;
    try (BulletSession session = engine.openSession("resume-1", doc)) {
      styleNumId = session.getStyleNumId();
      XWPFParagraph cell = doc.createTable(1, 1).getRow(0).getCell(0).getParagraphs().get(0);
      DocxFixtures.numPr(DocxFixtures.bullet(cell, "Cell bullet"), "555", "1");
      XWPFParagraph header =
          DocxFixtures.bullet(doc.createHeader(HeaderFooterType.DEFAULT).createParagraph(), "Header bullet");
      DocxFixtures.numPr(header, "zz", "0");

      ReconciliationReport report = session.reconcile();

      assertThat(report.total).isEqualTo(2);
      assertThat(report.repaired).isEqualTo(2);
      assertThat(report.repairsByCategory)
          .containsEntry(BulletErrorCategory.INVALID_NUMID, 1)
          .containsEntry(BulletErrorCategory.CORRUPT_XML, 1);
    }

    XWPFDocument written = DocxFixtures.roundTrip(doc);
    XWPFParagraph cell = written.getTables().get(0).getRow(0).getCell(0).getParagraphs().get(0);
    XWPFParagraph header = written.getHeaderList().get(0).getParagraphs().get(0);
    assertThat(cell.getNumID()).isEqualTo(BigInteger.valueOf(styleNumId));
    assertThat(cell.getNumIlvl()).isEqualTo(BigInteger.ONE);
    assertThat(header.getNumID()).isEqualTo(BigInteger.valueOf(styleNumId));
    assertThat(header.getNumIlvl()).isEqualTo(BigInteger.ZERO);
  }

  @Test
  @DisplayName("Should bind a paragraph the caller built")
  void shouldBindCallerParagraph() {
    try (BulletSession session = engine.openSession("resume-1", doc)) {
      XWPFParagraph p = doc.createParagraph();
      p.createRun().setText("Hand-made");

      session.bind(p, "projects", 1);

      assertThat(p.getStyle()).isEqualTo(BULLET);
      assertThat(p.getNumID().intValue()).isEqualTo(session.numberingFor("projects"));
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("Should seal the session after reconciliation")
    void shouldRejectWrites_afterReconcile() {
      try (BulletSession session = engine.openSession("resume-1", doc)) {
        session.addBullet("Only one", "experience");
        session.reconcile();

        assertThatThrownBy(session::reconcile).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.addBullet("Late", "experience"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("sealed");
      }
    }

    @Test
    @DisplayName("Should release every allocation on close")
    void shouldReleaseAllocations_onClose() {
      BulletSession session = engine.openSession("resume-1", doc);
      session.addBullet("One", "experience");
      session.addBullet("Two", "skills");

      session.close();
      session.close();

      assertThat(allocator.recordsFor("resume-1"))
          .hasSize(3)
          .extracting(BulletAllocationRecord::getStatus)
          .containsOnly(BulletAllocationRecord.Status.RELEASED);
      assertThatThrownBy(() -> session.addBullet("After", "experience"))
          .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject a missing document id")
    void shouldThrow_whenDocumentIdBlank() {
      assertThatThrownBy(() -> engine.openSession(" ", doc))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> engine.openSession("resume-1", null))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Existing documents")
  class ExistingDocuments {

    @Test
    @DisplayName("Should allocate past numbering already in the document")
    void shouldSkipExistingNumId() {
      new NumberingDefinitionRegistry().ensureDefinition(doc, 100, 100, LevelFormat.defaults());

      try (BulletSession session = engine.openSession("resume-1", doc)) {
        assertThat(session.getStyleNumId()).isEqualTo(101);
        assertThat(doc.getNumbering().getNums()).hasSize(2);
      }
    }

    @Test
    @DisplayName("Should rename a foreign bullet style before creating its own")
    void shouldRenameForeignStyle() {
      XWPFDocument seed = new XWPFDocument();
      DocxFixtures.addStyle(seed, BULLET, null, false);
      DocxFixtures.bullet(seed, "Written by someone else");
      XWPFDocument existing = DocxFixtures.roundTrip(seed);

      try (BulletSession session = engine.openSession("resume-2", existing)) {
        session.addBullet("Ours", "experience");
        ReconciliationReport report = session.reconcile();

        assertThat(session.getRenamedStyle()).isEqualTo(BULLET + "__orig");
        assertThat(existing.getParagraphs().get(0).getStyle()).isEqualTo(BULLET + "__orig");
        assertThat(report.total).isEqualTo(1);
        assertThat(report.isClean()).isTrue();
      }
    }

    @Test
    @DisplayName("Should fail rather than hand out a numId it could not define")
    void shouldThrow_whenAbstractIdTakenAfterOpen() {
      try (BulletSession session = engine.openSession("resume-3", doc)) {
        int next = session.getStyleNumId() + 1;
        DocxFixtures.addAbstract(doc, next, true);

        assertThatThrownBy(() -> session.numberingFor("experience"))
            .isInstanceOf(BulletEngineException.class)
            .hasMessageContaining("abstractNumId " + next);
        assertThat(doc.getNumbering().numExist(BigInteger.valueOf(next))).isFalse();
      }
    }
  }

  @Nested
  @DisplayName("Strict mode")
  class StrictMode {

    @Test
    @DisplayName("Should refuse marked text and add nothing")
    void shouldThrow_andAddNothing_whenTextCarriesMarker() {
      try (BulletSession session = engine.openSession("resume-1", doc, "en", true)) {
        assertThatThrownBy(() -> session.addBullet("• Did X", "experience"))
            .isInstanceOf(BulletSanitizationException.class);

        assertThat(doc.getParagraphs()).isEmpty();
        assertThat(session.getBulletsAdded()).isZero();
      }
    }
  }
}
