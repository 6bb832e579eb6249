package com.tripplanner.pojo.model;

import com.tripplanner.pojo.enums.Category;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 各品类的预算拆分结果。
 * <p>不变量：各品类之和不超过总预算；未排除的品类不低于其下限。</p>
 */
@Value
public class BudgetAllocation {

    Money total;

    Map<Category, Money> allocations;

    Set<Category> excluded;

    public BudgetAllocation(Money total, Map<Category, Money> allocations, Set<Category> excluded) {
        this.total = total;
        this.allocations = Collections.unmodifiableMap(new EnumMap<>(allocations));
        this.excluded = excluded.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(excluded));
    }

    public Money amountFor(Category category) {
        Money m = allocations.get(category);
        return m == null ? Money.zero(total.getCurrency()) : m;
    }

    public boolean covers(Category category) {
        return !excluded.contains(category);
    }

    public Money allocatedSum() {
        Money sum = Money.zero(total.getCurrency());
        for (Money m : allocations.values()) {
            sum = sum.plus(m);
        }
        return sum;
    }

    /**
     * 未分配出去的余量（由于上限约束或取整）。
     */
    public Money reserve() {
        return total.minus(allocatedSum());
    }
}
