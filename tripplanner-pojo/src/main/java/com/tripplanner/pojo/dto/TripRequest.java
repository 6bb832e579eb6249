package com.tripplanner.pojo.dto;

import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.Money;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 行程规划请求。
 * Trip planning request, built by the (excluded) request-handling layer from validated input.
 *
 * 提交给引擎后不可变。
 */
@Value
@Builder
public class TripRequest {

    /**
     * 出发城市/机场。
     */
    String origin;

    /**
     * 目的地城市。
     */
    String destination;

    LocalDate startDate;

    /**
     * 结束日期（含），不得早于开始日期。
     */
    LocalDate endDate;

    @Builder.Default
    int travelers = 1;

    /**
     * 总预算，金额必须大于 0。
     */
    Money totalBudget;

    /**
     * 兴趣标签，按用户给出的顺序。
     */
    @Singular
    List<String> interests;

    /**
     * 可选的分品类预算提示，只覆盖对应品类。
     */
    @Singular
    Map<Category, BigDecimal> budgetHints;

    /**
     * 用户明确不需要的品类（例如自行解决交通）。
     */
    @Singular("excludedCategory")
    Set<Category> excludedCategories;

    /**
     * 行程天数（含首尾两天）。
     */
    public int dayCount() {
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /**
     * 住宿晚数，当天往返也按一晚计。
     */
    public int nights() {
        return Math.max(1, dayCount() - 1);
    }

    public boolean excludes(Category category) {
        return excludedCategories.contains(category);
    }

    public String currency() {
        return totalBudget.getCurrency();
    }

    /**
     * 小写、去空白、去重后的兴趣标签，保持原有顺序。
     */
    public List<String> normalizedInterests() {
        Set<String> seen = new LinkedHashSet<>();
        for (String interest : interests) {
            if (interest != null && !interest.isBlank()) {
                seen.add(interest.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(seen);
    }
}
