package com.tripplanner.pojo.vo;

import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.enums.NarrationSource;
import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.Money;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 完整且已校验的行程。
 * Fully validated itinerary. Immutable; narration produces a copy via {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class Itinerary {

    /**
     * 由请求内容派生的稳定 ID，相同请求得到相同 ID。
     */
    String planId;

    TripRequest request;

    CandidateOption flight;

    CandidateOption lodging;

    /**
     * 备选住宿（排名靠后的几家），仅供展示。
     */
    @Singular
    List<CandidateOption> alternativeLodgings;

    @Singular
    List<ItineraryDay> days;

    BudgetAllocation allocation;

    @Singular("spend")
    Map<Category, Money> spendByCategory;

    Money totalCost;

    @Singular
    List<PlanNote> notes;

    String summary;

    NarrationSource narrationSource;

    public List<Integer> unplannedDayIndexes() {
        return days.stream()
                .filter(ItineraryDay::isUnplanned)
                .map(ItineraryDay::getDayIndex)
                .collect(Collectors.toList());
    }
}
