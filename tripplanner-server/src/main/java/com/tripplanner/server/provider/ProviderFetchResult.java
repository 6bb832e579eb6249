package com.tripplanner.server.provider;

import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 一次品类拉取的结果。
 * providerUnavailable = true 时 candidates 一定为空，含义是“没有数据”，而不是“零成本选项”。
 */
@Value
public class ProviderFetchResult {

    Category category;

    List<CandidateOption> candidates;

    boolean providerUnavailable;

    /** 不可用原因，例如 timeout / http_503 / malformed_payload */
    String reason;

    boolean fromCache;

    public static ProviderFetchResult available(Category category, List<CandidateOption> candidates, boolean fromCache) {
        return new ProviderFetchResult(category, List.copyOf(candidates), false, null, fromCache);
    }

    public static ProviderFetchResult unavailable(Category category, String reason) {
        return new ProviderFetchResult(category, Collections.emptyList(), true, reason, false);
    }
}
