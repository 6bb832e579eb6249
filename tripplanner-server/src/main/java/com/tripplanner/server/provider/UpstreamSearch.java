package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;

import java.time.Duration;

/**
 * 外部旅行数据能力：航班搜索、住宿搜索、景点/餐厅搜索。
 * 返回数据源原生报文，由 {@link PayloadNormalizer} 在适配器边界内归一化。
 */
public interface UpstreamSearch {

    /**
     * 数据源名称，会写入候选项的 provider 字段。
     */
    String name();

    boolean supports(Category category);

    JsonNode search(Category category, ProviderQuery query, Duration timeout) throws UpstreamCallException;
}
