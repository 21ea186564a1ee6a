package com.example.bullets;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;

@DisplayName("NumberingDefinitionRegistry")
class NumberingDefinitionRegistryTest {

  private final NumberingDefinitionRegistry registry = new NumberingDefinitionRegistry();
  private XWPFDocument doc;

  @BeforeEach
  void setUp() {
    doc = new XWPFDocument();
  }

  @Test
  @DisplayName("Should create a bullet abstract and a num on first touch without placeholders")
  void shouldCreateDefinition_whenNumberingPartMissing() {
    assertThat(doc.getNumbering()).isNull();

    assertThat(registry.ensureDefinition(doc, 100, 100, LevelFormat.defaults())).isTrue();

    XWPFNumbering numbering = doc.getNumbering();
    assertThat(numbering.getNums()).hasSize(1);
    assertThat(numbering.getAbstractNums()).hasSize(1);
    assertThat(registry.abstractIdFor(doc, 100)).isEqualTo(100);

    CTLvl lvl = numbering.getAbstractNum(BigInteger.valueOf(100)).getCTAbstractNum().getLvlArray(0);
    assertThat(lvl.getNumFmt().getVal()).isEqualTo(STNumberFormat.BULLET);
    assertThat(lvl.getLvlText().getVal()).isEqualTo("•");
    assertThat(WordXml.attr(lvl.getPPr().getInd(), WordXml.QN_W_LEFT)).isEqualTo("221");
    assertThat(WordXml.attr(lvl.getPPr().getInd(), WordXml.QN_W_HANGING)).isEqualTo("221");
  }

  @Test
  @DisplayName("Should be a no-op when the numId already exists")
  void shouldBeIdempotent_whenCalledTwice() {
    registry.ensureDefinition(doc, 100, 100, LevelFormat.defaults());

    assertThat(registry.ensureDefinition(doc, 100, 100, LevelFormat.defaults())).isTrue();
    assertThat(doc.getNumbering().getNums()).hasSize(1);
    assertThat(doc.getNumbering().getAbstractNums()).hasSize(1);
  }

  @Test
  @DisplayName("Should refuse to reuse an abstract id that is already taken")
  void shouldFail_whenAbstractIdTaken() {
    registry.ensureDefinition(doc, 100, 100, LevelFormat.defaults());

    assertThat(registry.ensureDefinition(doc, 101, 100, LevelFormat.defaults())).isFalse();
    assertThat(registry.exists(doc, 101)).isFalse();
  }

  @Test
  @DisplayName("Should synthesize deeper levels with growing indentation")
  void shouldCreateAllLevels_whenFormatHasSeveral() {
    LevelFormat format = new LevelFormat("▪", "Symbol", 360, 180, 3);

    registry.ensureDefinition(doc, 120, 120, format);

    CTAbstractNum abs = doc.getNumbering().getAbstractNum(BigInteger.valueOf(120)).getCTAbstractNum();
    assertThat(abs.sizeOfLvlArray()).isEqualTo(3);
    assertThat(abs.getLvlArray(2).getIlvl()).isEqualTo(BigInteger.valueOf(2));
    assertThat(WordXml.attr(abs.getLvlArray(2).getPPr().getInd(), WordXml.QN_W_LEFT)).isEqualTo("1080");
    assertThat(abs.getLvlArray(0).getRPr().getRFontsArray(0).getAscii()).isEqualTo("Symbol");
  }

  @Test
  @DisplayName("Should survive a save and reload and list existing ids")
  void shouldListExistingIds_afterRoundTrip() {
    registry.ensureDefinition(doc, 100, 100, LevelFormat.defaults());
    registry.ensureDefinition(doc, 101, 101, LevelFormat.defaults());

    XWPFDocument reloaded = DocxFixtures.roundTrip(doc);

    assertThat(registry.existingNumIds(reloaded)).containsExactly(100, 101);
    assertThat(registry.existingAbstractIds(reloaded)).containsExactly(100, 101);
    assertThat(registry.exists(reloaded, 101)).isTrue();
    assertThat(registry.existingNumIds(new XWPFDocument())).isEmpty();
  }
}
