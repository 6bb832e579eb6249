package com.tripplanner.server.planner;

import com.tripplanner.common.exception.PlanningException;
import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.model.Money;
import com.tripplanner.pojo.vo.PlanNote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 预算拆分器：把总预算拆到交通 / 住宿 / 活动 / 餐饮四个品类。
 *
 * 步骤：
 * 1. 基线比例 + 按兴趣标签向活动、餐饮倾斜（从其他品类按比例扣减）；
 * 2. 计算每个品类的下限 max(floorAmount, floorRatio * total) 与上限 ceilingRatio * total，
 *    下限之和超过总预算直接失败；
 * 3. 预算提示覆盖对应品类（低于下限时抬到下限），剩余预算在其他品类间按权重分配，
 *    反复把越界的品类钉在下限/上限上直到稳定；
 * 4. 金额向下取整到分，余数作为未分配的预留。
 *
 * 纯计算，无 I/O，相同输入得到相同结果。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BudgetAllocator {

    private static final int SCALE = 2;

    private static final int RATIO_SCALE = 8;

    private final PlannerProperties plannerProperties;

    public AllocationResult allocate(TripRequest request) {
        return allocate(request.getTotalBudget(), request.normalizedInterests(),
                request.getBudgetHints(), request.getExcludedCategories());
    }

    public AllocationResult allocate(Money total,
                                     List<String> interests,
                                     Map<Category, BigDecimal> hints,
                                     Set<Category> excluded) {
        if (total == null || total.signum() <= 0) {
            throw PlanningException.of(ErrorCode.INVALID_REQUEST, "total budget must be positive");
        }
        PlannerProperties.Budget cfg = plannerProperties.getBudget();
        BigDecimal totalAmount = total.getAmount();
        String currency = total.getCurrency();

        EnumSet<Category> active = EnumSet.allOf(Category.class);
        if (excluded != null) {
            active.removeAll(excluded);
        }

        Map<Category, BigDecimal> floors = new EnumMap<>(Category.class);
        Map<Category, BigDecimal> ceilings = new EnumMap<>(Category.class);
        BigDecimal floorSum = BigDecimal.ZERO;
        for (Category c : active) {
            PlannerProperties.CategoryBudget cb = budgetOf(c);
            BigDecimal floor = BigDecimal.valueOf(cb.getFloorAmount())
                    .max(totalAmount.multiply(BigDecimal.valueOf(cb.getFloorRatio())))
                    .setScale(SCALE, RoundingMode.CEILING);
            BigDecimal ceiling = totalAmount.multiply(BigDecimal.valueOf(cb.getCeilingRatio()))
                    .setScale(SCALE, RoundingMode.FLOOR)
                    .max(floor);
            floors.put(c, floor);
            ceilings.put(c, ceiling);
            floorSum = floorSum.add(floor);
        }
        if (floorSum.compareTo(totalAmount) > 0) {
            throw PlanningException.of(ErrorCode.BUDGET_INFEASIBLE,
                    "minimum spend %s %s exceeds total budget %s", currency, floorSum.toPlainString(), total);
        }

        Map<Category, Double> weights = weights(active, interests, cfg);

        List<PlanNote> notes = new ArrayList<>();
        Map<Category, BigDecimal> amounts = new EnumMap<>(Category.class);
        BigDecimal hintedSum = BigDecimal.ZERO;
        for (Category c : active) {
            BigDecimal hint = hints == null ? null : hints.get(c);
            if (hint == null) {
                continue;
            }
            if (hint.signum() < 0 || hint.compareTo(totalAmount) > 0) {
                notes.add(PlanNote.of(c, ErrorCode.INVALID_REQUEST,
                        "budget hint for " + c.getKey() + " ignored: outside 0.." + totalAmount.toPlainString()));
                continue;
            }
            BigDecimal value = hint.setScale(SCALE, RoundingMode.FLOOR).max(floors.get(c));
            BigDecimal othersFloor = BigDecimal.ZERO;
            for (Category other : active) {
                if (other != c && !amounts.containsKey(other)) {
                    othersFloor = othersFloor.add(floors.get(other));
                }
            }
            if (hintedSum.add(value).add(othersFloor).compareTo(totalAmount) > 0) {
                notes.add(PlanNote.of(c, ErrorCode.INVALID_REQUEST,
                        "budget hint for " + c.getKey() + " dropped: leaves too little for other categories"));
                continue;
            }
            if (value.compareTo(hint) > 0) {
                notes.add(PlanNote.of(c, ErrorCode.INVALID_REQUEST,
                        "budget hint for " + c.getKey() + " raised to minimum " + value.toPlainString()));
            }
            amounts.put(c, value);
            hintedSum = hintedSum.add(value);
        }

        EnumSet<Category> free = EnumSet.noneOf(Category.class);
        for (Category c : active) {
            if (!amounts.containsKey(c)) {
                free.add(c);
            }
        }
        distribute(totalAmount.subtract(hintedSum), free, weights, floors, ceilings, amounts);

        Map<Category, Money> allocations = new EnumMap<>(Category.class);
        for (Map.Entry<Category, BigDecimal> e : amounts.entrySet()) {
            allocations.put(e.getKey(), Money.of(e.getValue().setScale(SCALE, RoundingMode.FLOOR), currency));
        }
        BudgetAllocation allocation = new BudgetAllocation(total, allocations,
                excluded == null ? EnumSet.noneOf(Category.class) : excluded);
        log.debug("预算拆分完成: total={}, allocations={}, reserve={}", total, allocations, allocation.reserve());
        return new AllocationResult(allocation, notes);
    }

    /**
     * 剩余预算在未钉住的品类之间按权重分配；低于下限的钉在下限，高于上限的钉在上限，重复直到没有越界。
     */
    private void distribute(BigDecimal remaining,
                            EnumSet<Category> free,
                            Map<Category, Double> weights,
                            Map<Category, BigDecimal> floors,
                            Map<Category, BigDecimal> ceilings,
                            Map<Category, BigDecimal> amounts) {
        EnumSet<Category> open = free.clone();
        BigDecimal pool = remaining;
        while (!open.isEmpty()) {
            BigDecimal weightSum = BigDecimal.ZERO;
            for (Category c : open) {
                weightSum = weightSum.add(BigDecimal.valueOf(weights.getOrDefault(c, 0.0)));
            }
            Map<Category, BigDecimal> shares = new EnumMap<>(Category.class);
            for (Category c : open) {
                BigDecimal ratio = weightSum.signum() <= 0
                        ? BigDecimal.ONE.divide(BigDecimal.valueOf(open.size()), RATIO_SCALE, RoundingMode.HALF_UP)
                        : BigDecimal.valueOf(weights.getOrDefault(c, 0.0))
                        .divide(weightSum, RATIO_SCALE, RoundingMode.HALF_UP);
                shares.put(c, pool.multiply(ratio));
            }

            List<Category> belowFloor = new ArrayList<>();
            List<Category> aboveCeiling = new ArrayList<>();
            for (Category c : open) {
                if (shares.get(c).compareTo(floors.get(c)) < 0) {
                    belowFloor.add(c);
                } else if (shares.get(c).compareTo(ceilings.get(c)) > 0) {
                    aboveCeiling.add(c);
                }
            }
            if (belowFloor.isEmpty() && aboveCeiling.isEmpty()) {
                amounts.putAll(shares);
                return;
            }
            Collection<Category> pinned = belowFloor.isEmpty() ? aboveCeiling : belowFloor;
            Map<Category, BigDecimal> bounds = belowFloor.isEmpty() ? ceilings : floors;
            for (Category c : pinned) {
                amounts.put(c, bounds.get(c));
                pool = pool.subtract(bounds.get(c));
                open.remove(c);
            }
        }
    }

    /**
     * 基线权重 + 兴趣倾斜，排除的品类不参与。
     */
    Map<Category, Double> weights(Set<Category> active, List<String> interests, PlannerProperties.Budget cfg) {
        Map<Category, Double> weights = new EnumMap<>(Category.class);
        for (Category c : active) {
            weights.put(c, budgetOf(c).getBaselineRatio());
        }
        int activityHits = 0;
        int mealHits = 0;
        for (String interest : interests) {
            String tag = interest.toLowerCase(Locale.ROOT);
            if (containsIgnoreCase(cfg.getActivityTags(), tag)) {
                activityHits++;
            }
            if (containsIgnoreCase(cfg.getMealTags(), tag)) {
                mealHits++;
            }
        }
        shift(weights, Category.ACTIVITY, Math.min(cfg.getMaxShift(), activityHits * cfg.getActivityShiftPerTag()));
        shift(weights, Category.MEAL, Math.min(cfg.getMaxShift(), mealHits * cfg.getMealShiftPerTag()));
        return weights;
    }

    private void shift(Map<Category, Double> weights, Category target, double amount) {
        if (amount <= 0 || !weights.containsKey(target)) {
            return;
        }
        double donorSum = 0;
        for (Map.Entry<Category, Double> e : weights.entrySet()) {
            if (e.getKey() != target) {
                donorSum += e.getValue();
            }
        }
        if (donorSum <= 0) {
            return;
        }
        double taken = Math.min(amount, donorSum);
        for (Map.Entry<Category, Double> e : weights.entrySet()) {
            if (e.getKey() != target) {
                e.setValue(e.getValue() - taken * e.getValue() / donorSum);
            }
        }
        weights.put(target, weights.get(target) + taken);
    }

    private boolean containsIgnoreCase(List<String> tags, String tag) {
        for (String t : tags) {
            if (t.equalsIgnoreCase(tag)) {
                return true;
            }
        }
        return false;
    }

    private PlannerProperties.CategoryBudget budgetOf(Category category) {
        PlannerProperties.Budget cfg = plannerProperties.getBudget();
        return switch (category) {
            case FLIGHT -> cfg.getFlight();
            case LODGING -> cfg.getLodging();
            case ACTIVITY -> cfg.getActivity();
            case MEAL -> cfg.getMeal();
        };
    }
}
