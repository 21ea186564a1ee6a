package com.example.bullets;

/** 段落编号引用的校验结果 */
public enum NumberingCheck {
    OK,
    NEEDS_REPAIR,   // 缺 numPr / numId / ilvl，或 numId 没有定义
    MALFORMED       // 值不是数字
}
