package com.tripplanner.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 外部旅行数据源配置：航班、住宿、景点/餐厅三个上游能力。
 * Upstream travel-data provider configuration (flight, lodging, points of interest).
 */
@Data
@ConfigurationProperties(prefix = "tripplanner.provider")
public class ProviderProperties {

    private Endpoint flight = new Endpoint();

    private Endpoint lodging = new Endpoint();

    private Endpoint poi = new Endpoint();

    /**
     * 连接超时（毫秒）。
     */
    private int connectTimeoutMs = 1000;

    /**
     * 单次上游请求超时（毫秒）。
     */
    private int requestTimeoutMs = 5000;

    /**
     * 最大尝试次数（含首次请求）。
     */
    private int maxAttempts = 3;

    /**
     * 指数退避的初始等待（毫秒）。
     */
    private long initialBackoffMs = 200;

    /**
     * 退避倍数。
     */
    private double backoffMultiplier = 2.0;

    /**
     * 单次退避等待上限（毫秒）。
     */
    private long maxBackoffMs = 2000;

    /**
     * 候选项缓存 TTL（分钟）。
     */
    private long cacheTtlMinutes = 60;

    /**
     * 每个品类最多保留的候选数量。
     */
    private int resultCap = 40;

    /**
     * 景点 price_level(0~4) 对应的人均估价，按请求币种计。
     * Estimated per-person price for each POI price level.
     */
    private List<Double> poiPriceLevels = new ArrayList<>(List.of(0.0, 15.0, 35.0, 70.0, 120.0));

    /**
     * 没有 price_level 的景点/餐厅的人均估价。
     */
    private double poiDefaultPrice = 20.0;

    /**
     * 景点类型 -> 兴趣标签，例如 museum -> culture。
     */
    private Map<String, String> typeTags = new HashMap<>(Map.ofEntries(
            Map.entry("museum", "culture"),
            Map.entry("art_gallery", "culture"),
            Map.entry("church", "culture"),
            Map.entry("hindu_temple", "culture"),
            Map.entry("tourist_attraction", "culture"),
            Map.entry("park", "nature"),
            Map.entry("zoo", "family"),
            Map.entry("aquarium", "family"),
            Map.entry("amusement_park", "adventure"),
            Map.entry("night_club", "nightlife"),
            Map.entry("bar", "nightlife"),
            Map.entry("shopping_mall", "shopping"),
            Map.entry("spa", "relaxation"),
            Map.entry("restaurant", "food"),
            Map.entry("cafe", "food")
    ));

    /**
     * 景点类型 -> 预计游览时长（分钟）。
     */
    private Map<String, Integer> typeDurations = new HashMap<>(Map.of(
            "museum", 150,
            "art_gallery", 90,
            "park", 90,
            "zoo", 180,
            "amusement_park", 240,
            "shopping_mall", 120,
            "restaurant", 60,
            "cafe", 45
    ));

    /**
     * 未配置类型时的默认游览时长（分钟）。
     */
    private int defaultDurationMinutes = 120;

    @Data
    public static class Endpoint {

        /**
         * 上游搜索接口地址。
         */
        private String baseUrl;

        /**
         * 上游 API Key，由外部配置层注入，这里只负责透传。
         */
        private String apiKey;

        /**
         * 写入候选项的数据源名称，例如 amadeus、google-places。
         */
        private String name;
    }
}
