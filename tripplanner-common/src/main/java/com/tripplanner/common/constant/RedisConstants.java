package com.tripplanner.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 候选项缓存前缀 cache:candidate:{category}:{normalizedQuery} */
    public static final String CACHE_CANDIDATE_KEY = "cache:candidate:";

    /** 空结果缓存 TTL（分钟），防止短时间内反复回源 */
    public static final long CACHE_EMPTY_TTL = 2L;

    /** 缓存 key 中各字段的分隔符 */
    public static final String KEY_SEPARATOR = ":";
}
