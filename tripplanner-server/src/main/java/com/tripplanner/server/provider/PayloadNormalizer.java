package com.tripplanner.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripplanner.pojo.dto.ProviderQuery;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;

import java.util.List;

/**
 * 把数据源原生报文归一化为 {@link CandidateOption}，数据源特有字段不得越过这一层。
 */
public interface PayloadNormalizer {

    boolean supports(Category category);

    /**
     * @param provider 数据源名称
     * @throws UpstreamCallException 顶层结构不符合预期（报文格式错误）
     */
    List<CandidateOption> normalize(Category category, String provider, JsonNode payload, ProviderQuery query)
            throws UpstreamCallException;
}
