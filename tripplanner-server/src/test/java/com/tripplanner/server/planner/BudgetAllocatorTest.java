package com.tripplanner.server.planner;

import com.tripplanner.common.exception.PlanningException;
import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.model.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.tripplanner.server.support.PlanningFixtures.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetAllocatorTest {

    private PlannerProperties properties;
    private BudgetAllocator allocator;

    @BeforeEach
    void setUp() {
        properties = new PlannerProperties();
        allocator = new BudgetAllocator(properties);
    }

    @Test
    void allocate_shouldFail_whenFloorsExceedTotal() {
        properties.getBudget().getFlight().setFloorAmount(300);

        PlanningException e = assertThrows(PlanningException.class,
                () -> allocator.allocate(request(3, 50).build()));

        assertEquals(ErrorCode.BUDGET_INFEASIBLE, e.getErrorCode());
    }

    @Test
    void allocate_shouldUseBaselineSplit_withoutInterests() {
        BudgetAllocation allocation = allocator.allocate(request(4, 2000).build()).getAllocation();

        assertEquals(Money.of(700, "USD"), allocation.amountFor(Category.FLIGHT));
        assertEquals(Money.of(700, "USD"), allocation.amountFor(Category.LODGING));
        assertEquals(Money.of(300, "USD"), allocation.amountFor(Category.ACTIVITY));
        assertEquals(Money.of(300, "USD"), allocation.amountFor(Category.MEAL));
        assertEquals(Money.zero("USD"), allocation.reserve());
    }

    @Test
    void allocate_shouldShiftTowardActivities_forActivityInterests() {
        BudgetAllocation allocation = allocator.allocate(request(4, 2000)
                .interest("culture").interest("museum").interest("art")
                .build()).getAllocation();

        assertEquals(Money.of(480, "USD"), allocation.amountFor(Category.ACTIVITY));
        assertTrue(Money.of(700, "USD").exceeds(allocation.amountFor(Category.FLIGHT)));
        assertFalse(allocation.allocatedSum().exceeds(allocation.getTotal()));
    }

    @Test
    void allocate_shouldKeepSumWithinTotal_andEachCategoryWithinFloorAndCeiling() {
        for (double total : new double[]{333.33, 999.99, 1234.56, 7777.77}) {
            BudgetAllocation allocation = allocator.allocate(request(5, total)
                    .interest("food").interest("wine").interest("nature")
                    .build()).getAllocation();

            assertFalse(allocation.allocatedSum().exceeds(allocation.getTotal()), "sum within total " + total);
            assertTrue(allocation.reserve().signum() >= 0);
            for (Category c : Category.values()) {
                PlannerProperties.CategoryBudget cfg = budgetOf(c);
                BigDecimal amount = allocation.amountFor(c).getAmount();
                BigDecimal floor = BigDecimal.valueOf(Math.max(cfg.getFloorAmount(), cfg.getFloorRatio() * total));
                assertTrue(amount.compareTo(floor.subtract(new BigDecimal("0.01"))) >= 0,
                        c + " below floor for " + total);
            }
        }
    }

    @Test
    void allocate_shouldHonourHint_andRedistributeRemainder() {
        AllocationResult result = allocator.allocate(request(4, 2000)
                .budgetHint(Category.LODGING, new BigDecimal("1000"))
                .build());
        BudgetAllocation allocation = result.getAllocation();

        assertEquals(Money.of(1000, "USD"), allocation.amountFor(Category.LODGING));
        assertTrue(allocation.amountFor(Category.FLIGHT).exceeds(allocation.amountFor(Category.ACTIVITY)));
        assertFalse(allocation.allocatedSum().exceeds(allocation.getTotal()));
        assertTrue(result.getNotes().isEmpty());
    }

    @Test
    void allocate_shouldRaiseHintBelowFloor_andNoteIt() {
        AllocationResult result = allocator.allocate(request(4, 2000)
                .budgetHint(Category.ACTIVITY, new BigDecimal("10"))
                .build());

        assertEquals(Money.of(100, "USD"), result.getAllocation().amountFor(Category.ACTIVITY));
        assertEquals(1, result.getNotes().size());
        assertEquals(Category.ACTIVITY, result.getNotes().get(0).getCategory());
    }

    @Test
    void allocate_shouldDropHint_thatLeavesTooLittleForOtherCategories() {
        AllocationResult result = allocator.allocate(request(4, 2000)
                .budgetHint(Category.LODGING, new BigDecimal("1900"))
                .build());

        assertEquals(Money.of(700, "USD"), result.getAllocation().amountFor(Category.LODGING));
        assertEquals(1, result.getNotes().size());
    }

    @Test
    void allocate_shouldIgnoreHintAboveTotal() {
        AllocationResult result = allocator.allocate(request(4, 2000)
                .budgetHint(Category.MEAL, new BigDecimal("2500"))
                .build());

        assertEquals(Money.of(300, "USD"), result.getAllocation().amountFor(Category.MEAL));
        assertEquals(ErrorCode.INVALID_REQUEST, result.getNotes().get(0).getCode());
    }

    @Test
    void allocate_shouldLeaveExcludedCategoriesOut_andKeepCappedRemainderAsReserve() {
        BudgetAllocation allocation = allocator.allocate(request(4, 2000)
                .excludedCategory(Category.FLIGHT)
                .excludedCategory(Category.LODGING)
                .build()).getAllocation();

        assertFalse(allocation.covers(Category.FLIGHT));
        assertEquals(Money.zero("USD"), allocation.amountFor(Category.FLIGHT));
        assertEquals(Money.of(1000, "USD"), allocation.amountFor(Category.ACTIVITY));
        assertEquals(Money.of(700, "USD"), allocation.amountFor(Category.MEAL));
        assertEquals(Money.of(300, "USD"), allocation.reserve());
    }

    @Test
    void allocate_shouldRoundDownToCents() {
        BudgetAllocation allocation = allocator.allocate(request(2, 1000.01).build()).getAllocation();

        for (Category c : List.of(Category.values())) {
            assertEquals(2, allocation.amountFor(c).getAmount().scale());
        }
        assertFalse(allocation.allocatedSum().exceeds(allocation.getTotal()));
    }

    @Test
    void allocate_shouldBeDeterministic() {
        BudgetAllocation a = allocator.allocate(request(3, 1500).interest("food").build()).getAllocation();
        BudgetAllocation b = allocator.allocate(request(3, 1500).interest("food").build()).getAllocation();

        assertEquals(a.getAllocations(), b.getAllocations());
    }

    private PlannerProperties.CategoryBudget budgetOf(Category c) {
        PlannerProperties.Budget b = properties.getBudget();
        return switch (c) {
            case FLIGHT -> b.getFlight();
            case LODGING -> b.getLodging();
            case ACTIVITY -> b.getActivity();
            case MEAL -> b.getMeal();
        };
    }
}
