package com.tripplanner.server.planner;

import com.tripplanner.common.properties.PlannerProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 单次规划的等待上限，调用方可以按次覆盖配置中的默认值。
 */
@Value
@Builder
public class PlanningTimeouts {

    /** 所有品类并发拉取的总等待时间 */
    Duration providerTimeout;

    /** 叙述生成的等待时间 */
    Duration narrationTimeout;

    public static PlanningTimeouts from(PlannerProperties properties) {
        return PlanningTimeouts.builder()
                .providerTimeout(Duration.ofMillis(properties.getProviderTimeoutMs()))
                .narrationTimeout(Duration.ofMillis(properties.getNarrationTimeoutMs()))
                .build();
    }
}
