package com.tripplanner.pojo.enums;

/**
 * 行程叙述文案的来源。
 */
public enum NarrationSource {
    /** 全部由外部文本生成能力给出 */
    AI,
    /** 部分天数使用了模板兜底 */
    PARTIAL_FALLBACK,
    /** 全部使用模板兜底 */
    FALLBACK
}
