package com.tripplanner.server.planner;

import com.tripplanner.common.exception.PlanningException;
import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.Money;
import com.tripplanner.pojo.model.ScheduledSlot;
import com.tripplanner.pojo.vo.Itinerary;
import com.tripplanner.pojo.vo.ItineraryDay;
import com.tripplanner.pojo.vo.PlanNote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 组装并校验最终行程。
 *
 * 总花费按所有入选项价格精确求和；任何校验不通过都抛出致命错误，绝不返回违反不变量的行程：
 * 超预算为 BUDGET_EXCEEDED，其余为 ASSEMBLY_INVARIANT_VIOLATION。
 */
@Component
@Slf4j
public class ItineraryAssembler {

    public Itinerary assemble(String planId,
                              TripRequest request,
                              BudgetAllocation allocation,
                              CandidateOption flight,
                              CandidateOption lodging,
                              List<CandidateOption> alternativeLodgings,
                              List<ItineraryDay> days,
                              List<PlanNote> notes) {
        String currency = request.currency();
        Map<Category, Money> spend = new EnumMap<>(Category.class);
        for (Category c : Category.values()) {
            spend.put(c, Money.zero(currency));
        }
        addSpend(spend, flight, currency);
        addSpend(spend, lodging, currency);
        for (ItineraryDay day : days) {
            for (ScheduledSlot slot : day.getSlots()) {
                addSpend(spend, slot.getOption(), currency);
            }
        }
        Money total = Money.zero(currency);
        for (Money m : spend.values()) {
            total = total.plus(m);
        }

        Itinerary itinerary = Itinerary.builder()
                .planId(planId)
                .request(request)
                .flight(flight)
                .lodging(lodging)
                .alternativeLodgings(alternativeLodgings)
                .days(days)
                .allocation(allocation)
                .spendByCategory(spend)
                .totalCost(total)
                .notes(notes)
                .build();
        validate(itinerary);
        return itinerary;
    }

    /**
     * 校验行程不变量，失败时抛出 {@link PlanningException}。
     */
    public void validate(Itinerary itinerary) {
        TripRequest request = itinerary.getRequest();
        BudgetAllocation allocation = itinerary.getAllocation();

        if (itinerary.getTotalCost().exceeds(request.getTotalBudget())) {
            throw PlanningException.of(ErrorCode.BUDGET_EXCEEDED,
                    "total cost %s exceeds budget %s", itinerary.getTotalCost(), request.getTotalBudget());
        }

        checkCore(request, Category.FLIGHT, itinerary.getFlight());
        checkCore(request, Category.LODGING, itinerary.getLodging());

        for (Map.Entry<Category, Money> e : itinerary.getSpendByCategory().entrySet()) {
            Category c = e.getKey();
            if (e.getValue().signum() > 0 && !allocation.covers(c)) {
                throw violation("spend on excluded category %s", c.getKey());
            }
            if (e.getValue().exceeds(allocation.amountFor(c))) {
                throw violation("%s spend %s exceeds allocation %s", c.getKey(), e.getValue(), allocation.amountFor(c));
            }
        }

        List<ItineraryDay> days = itinerary.getDays();
        if (days.size() != request.dayCount()) {
            throw violation("itinerary has %d days, date range has %d", days.size(), request.dayCount());
        }
        Set<String> used = new HashSet<>();
        for (int i = 0; i < days.size(); i++) {
            ItineraryDay day = days.get(i);
            if (day.getDayIndex() != i || !request.getStartDate().plusDays(i).equals(day.getDate())) {
                throw violation("day %d has index %d and date %s", i, day.getDayIndex(), day.getDate());
            }
            ScheduledSlot prev = null;
            for (ScheduledSlot slot : day.getSlots()) {
                checkSlot(slot, i, prev);
                if (!used.add(slot.getOption().dedupKey())) {
                    throw violation("option %s scheduled more than once", slot.getOption().dedupKey());
                }
                prev = slot;
            }
        }
    }

    private void checkSlot(ScheduledSlot slot, int dayIndex, ScheduledSlot prev) {
        if (slot.getDayIndex() != dayIndex) {
            throw violation("slot %s is on day %d but filed under day %d",
                    slot.getOption().getName(), slot.getDayIndex(), dayIndex);
        }
        if (!slot.getEnd().isAfter(slot.getStart())) {
            throw violation("slot %s on day %d ends at %s before it starts at %s",
                    slot.getOption().getName(), dayIndex + 1, slot.getEnd(), slot.getStart());
        }
        if (slot.getOption().getOpeningHours() != null
                && !slot.getOption().getOpeningHours().covers(slot.getStart(), slot.getEnd())) {
            throw violation("slot %s on day %d (%s-%s) is outside opening hours",
                    slot.getOption().getName(), dayIndex + 1, slot.getStart(), slot.getEnd());
        }
        if (prev != null && (prev.overlaps(slot) || slot.getStart().isBefore(prev.getEnd()))) {
            throw violation("slots %s and %s overlap on day %d",
                    prev.getOption().getName(), slot.getOption().getName(), dayIndex + 1);
        }
    }

    private void checkCore(TripRequest request, Category category, CandidateOption option) {
        if (request.excludes(category)) {
            if (option != null) {
                throw violation("%s was excluded but an option was selected", category.getKey());
            }
        } else if (option == null) {
            throw violation("no %s option selected", category.getKey());
        }
    }

    private void addSpend(Map<Category, Money> spend, CandidateOption option, String currency) {
        if (option == null) {
            return;
        }
        if (!currency.equalsIgnoreCase(option.getPrice().getCurrency())) {
            throw violation("option %s is priced in %s, plan currency is %s",
                    option.dedupKey(), option.getPrice().getCurrency(), currency);
        }
        spend.put(option.getCategory(), spend.get(option.getCategory()).plus(option.getPrice()));
    }

    private PlanningException violation(String format, Object... args) {
        PlanningException e = PlanningException.of(ErrorCode.ASSEMBLY_INVARIANT_VIOLATION, format, args);
        log.error("行程校验未通过: {}", e.getMessage());
        return e;
    }
}
