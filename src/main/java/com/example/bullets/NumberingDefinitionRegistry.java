package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNum;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTInd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMultiLevelType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Set;

/** 把分配到的编号物化为 numbering part 中的 w:abstractNum + w:num */
@Slf4j
public class NumberingDefinitionRegistry {

    /**
     * numId 已存在时直接返回 true；abstractNumId 被占用时返回 false 且不写入。
     */
    public boolean ensureDefinition(XWPFDocument doc, int numId, int abstractNumId, LevelFormat format) {
        XWPFNumbering numbering = doc.createNumbering();   // 已有则返回现有 part
        BigInteger nid = BigInteger.valueOf(numId);
        if (numbering.numExist(nid)) {
            log.debug("Numbering definition {} already present", numId);
            return true;
        }
        BigInteger aid = BigInteger.valueOf(abstractNumId);
        if (numbering.getAbstractNum(aid) != null) {
            log.warn("abstractNumId {} already taken, not creating numId {}", abstractNumId, numId);
            return false;
        }

        numbering.addAbstractNum(new XWPFAbstractNum(buildAbstract(aid, format)));

        CTNum num = CTNum.Factory.newInstance();
        num.setNumId(nid);
        num.addNewAbstractNumId().setVal(aid);
        numbering.addNum(new XWPFNum(num, numbering));
        log.debug("Created numbering definition numId={} abstractNumId={} glyph='{}'", numId, abstractNumId, format.glyph);
        return true;
    }

    private CTAbstractNum buildAbstract(BigInteger abstractId, LevelFormat format) {
        CTAbstractNum abs = CTAbstractNum.Factory.newInstance();
        abs.setAbstractNumId(abstractId);
        abs.addNewMultiLevelType().setVal(format.levelCount > 1
                ? STMultiLevelType.HYBRID_MULTILEVEL : STMultiLevelType.SINGLE_LEVEL);
        for (int i = 0; i < format.levelCount; i++) {
            CTLvl lvl = abs.addNewLvl();
            lvl.setIlvl(BigInteger.valueOf(i));
            lvl.addNewStart().setVal(BigInteger.ONE);
            lvl.addNewNumFmt().setVal(STNumberFormat.BULLET);
            lvl.addNewLvlText().setVal(format.glyph);
            CTInd ind = lvl.addNewPPr().addNewInd();
            ind.setLeft(BigInteger.valueOf(format.leftFor(i)));
            ind.setHanging(BigInteger.valueOf(format.hangingTwips));
            if (format.glyphFont != null) {
                CTFonts fonts = lvl.addNewRPr().addNewRFonts();
                fonts.setAscii(format.glyphFont);
                fonts.setHAnsi(format.glyphFont);
            }
        }
        return abs;
    }

    public boolean exists(XWPFDocument doc, int numId) {
        XWPFNumbering numbering = doc.getNumbering();
        return numbering != null && numbering.numExist(BigInteger.valueOf(numId));
    }

    /** numId 指向的 abstractNumId；不存在返回 null */
    public Integer abstractIdFor(XWPFDocument doc, int numId) {
        XWPFNumbering numbering = doc.getNumbering();
        if (numbering == null) return null;
        XWPFNum num = numbering.getNum(BigInteger.valueOf(numId));
        if (num == null || num.getCTNum().getAbstractNumId() == null) return null;
        BigInteger v = num.getCTNum().getAbstractNumId().getVal();
        return v == null ? null : v.intValue();
    }

    public Set<Integer> existingNumIds(XWPFDocument doc) {
        Set<Integer> ids = new LinkedHashSet<>();
        XWPFNumbering numbering = doc.getNumbering();
        if (numbering == null) return ids;
        for (XWPFNum n : numbering.getNums()) {
            BigInteger v = n.getCTNum().getNumId();
            if (v != null) ids.add(v.intValue());
        }
        return ids;
    }

    public Set<Integer> existingAbstractIds(XWPFDocument doc) {
        Set<Integer> ids = new LinkedHashSet<>();
        XWPFNumbering numbering = doc.getNumbering();
        if (numbering == null) return ids;
        for (XWPFAbstractNum a : numbering.getAbstractNums()) {
            BigInteger v = a.getCTAbstractNum().getAbstractNumId();
            if (v != null) ids.add(v.intValue());
        }
        return ids;
    }
}
