package com.tripplanner.server.planner;

import com.tripplanner.common.exception.PlanningException;
import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.Money;
import com.tripplanner.pojo.vo.PlanNote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 候选筛选与排序。
 *
 * <ul>
 *     <li>航班/住宿：价格不超过品类预算；</li>
 *     <li>活动/餐饮：价格不超过单个时段的合理份额（品类预算 / 预计时段数 * headroom）；</li>
 *     <li>分数 = interestWeight * 兴趣标签命中数 + 质量分，降序；同分按价格升序，再按数据源 ID 升序。</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateSelector {

    /** 每天的用餐时段：早餐、午餐、晚餐 */
    static final int MEALS_PER_DAY = 3;

    private final PlannerProperties plannerProperties;

    public SelectionResult select(TripRequest request,
                                  BudgetAllocation allocation,
                                  Map<Category, List<CandidateOption>> candidates) {
        PlannerProperties.Selection cfg = plannerProperties.getSelection();
        Set<String> interests = new HashSet<>(request.normalizedInterests());
        int days = request.dayCount();

        Map<Category, List<CandidateOption>> ranked = new EnumMap<>(Category.class);
        List<PlanNote> notes = new ArrayList<>();
        for (Category category : Category.values()) {
            if (request.excludes(category)) {
                ranked.put(category, Collections.emptyList());
                continue;
            }
            List<CandidateOption> pool = candidates.getOrDefault(category, Collections.emptyList());
            Money cap = priceCap(category, allocation, days);
            List<CandidateOption> affordable = new ArrayList<>();
            for (CandidateOption option : pool) {
                if (option.getPrice() == null || !option.getPrice().sameCurrency(cap)) {
                    continue;
                }
                if (option.getPrice().signum() >= 0 && !option.getPrice().exceeds(cap)) {
                    affordable.add(option);
                }
            }
            affordable.sort(ranking(interests, cfg.getInterestWeight()));
            int k = topK(category, days);
            List<CandidateOption> top = affordable.size() > k
                    ? new ArrayList<>(affordable.subList(0, k))
                    : affordable;
            ranked.put(category, Collections.unmodifiableList(top));

            if (top.isEmpty()) {
                if (category.isCore()) {
                    throw PlanningException.of(ErrorCode.INSUFFICIENT_CORE_OPTIONS,
                            "no %s option within %s (%d fetched)", category.getKey(), cap, pool.size());
                }
                notes.add(PlanNote.of(category, ErrorCode.NO_CANDIDATES_FOUND,
                        category.getKey() + " options within " + cap + " not found"));
            } else if (category == Category.LODGING && top.size() == 1) {
                notes.add(PlanNote.of(category, ErrorCode.NO_CANDIDATES_FOUND, "lodging options limited"));
            }
            log.debug("候选筛选: category={}, fetched={}, affordable={}, kept={}, cap={}",
                    category, pool.size(), affordable.size(), top.size(), cap);
        }
        return new SelectionResult(ranked, notes);
    }

    /**
     * 单项价格上限。
     */
    Money priceCap(Category category, BudgetAllocation allocation, int days) {
        Money amount = allocation.amountFor(category);
        if (!category.isPerSlot()) {
            return amount;
        }
        int slots = expectedSlots(category, days);
        BigDecimal share = amount.getAmount()
                .divide(BigDecimal.valueOf(slots), 4, RoundingMode.FLOOR)
                .multiply(BigDecimal.valueOf(plannerProperties.getSelection().getPerSlotHeadroom()))
                .min(amount.getAmount())
                .setScale(2, RoundingMode.FLOOR);
        return Money.of(share, amount.getCurrency());
    }

    int expectedSlots(Category category, int days) {
        int perDay = category == Category.MEAL
                ? MEALS_PER_DAY
                : plannerProperties.getSchedule().getMaxActivitiesPerDay();
        return Math.max(1, perDay * days);
    }

    int topK(Category category, int days) {
        PlannerProperties.Selection cfg = plannerProperties.getSelection();
        if (category.isCore()) {
            return Math.max(1, cfg.getCoreTopK());
        }
        return (int) Math.ceil(expectedSlots(category, days) * cfg.getSlotMargin());
    }

    double score(CandidateOption option, Set<String> interests, double interestWeight) {
        int overlap = 0;
        Set<String> seen = new HashSet<>();
        for (String tag : option.getTags()) {
            String t = tag.toLowerCase(Locale.ROOT);
            if (interests.contains(t) && seen.add(t)) {
                overlap++;
            }
        }
        return interestWeight * overlap + option.getQualityScore();
    }

    private Comparator<CandidateOption> ranking(Set<String> interests, double interestWeight) {
        Comparator<CandidateOption> byScore = Comparator.comparingDouble(
                (CandidateOption o) -> score(o, interests, interestWeight)).reversed();
        return byScore
                .thenComparing(o -> o.getPrice().getAmount())
                .thenComparing(CandidateOption::getProviderId, Comparator.nullsLast(Comparator.naturalOrder()));
    }
}
