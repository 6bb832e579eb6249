package com.tripplanner.server.narration;

/**
 * 外部文本生成能力：输入结构化行程，输出每天的叙述文案。
 * 不可信、尽力而为：返回 null 或抛出异常都视为失败，由 {@link NarrationBridge} 走模板兜底。
 */
public interface ItineraryNarrator {

    NarrationResult narrate(NarrationRequest request);
}
