package com.tripplanner.server.planner;

import com.tripplanner.common.exception.PlanningException;
import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.dto.TripRequest;
import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.enums.DayStatus;
import com.tripplanner.pojo.enums.SlotKind;
import com.tripplanner.pojo.model.BudgetAllocation;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.model.GeoPoint;
import com.tripplanner.pojo.model.Money;
import com.tripplanner.pojo.model.OpeningHours;
import com.tripplanner.pojo.model.ScheduledSlot;
import com.tripplanner.pojo.vo.ItineraryDay;
import com.tripplanner.pojo.vo.PlanNote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 逐天排布：每一天 EMPTY -> FILLING -> FULL | PARTIAL。
 *
 * 1. 先在早/午/晚三个用餐窗口放餐饮；
 * 2. 再按排名把活动贪心地塞进白天的空档，开始时间 = max(空档开始 + 从上一地点过来的交通时间, 开门时间)，
 *    结束时间加上去下一地点的交通时间不能超出空档，也不能晚于关门时间；
 * 3. 每个候选整趟行程最多用一次，活动/餐饮累计花费不超过各自预算，每天活动数不超过上限。
 *
 * 没有安排上任何活动的一天（不需要活动时为没有任何时段的一天）标记为未规划；所有天都未规划时规划失败。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DayScheduler {

    private final PlannerProperties plannerProperties;
    private final TravelTimeEstimator travelTimeEstimator;

    public ScheduleResult schedule(TripRequest request,
                                   BudgetAllocation allocation,
                                   CandidateOption lodging,
                                   List<CandidateOption> activities,
                                   List<CandidateOption> meals) {
        PlannerProperties.Schedule cfg = plannerProperties.getSchedule();
        boolean wantActivities = !request.excludes(Category.ACTIVITY);
        boolean wantMeals = !request.excludes(Category.MEAL);
        GeoPoint home = lodging == null ? null : lodging.getLocation();

        Map<Category, Money> spend = new EnumMap<>(Category.class);
        spend.put(Category.ACTIVITY, Money.zero(request.currency()));
        spend.put(Category.MEAL, Money.zero(request.currency()));
        Set<String> used = new HashSet<>();

        List<ItineraryDay> days = new ArrayList<>();
        List<PlanNote> notes = new ArrayList<>();
        for (int dayIndex = 0; dayIndex < request.dayCount(); dayIndex++) {
            LocalDate date = request.getStartDate().plusDays(dayIndex);
            DayPlan day = new DayPlan(dayIndex, home);

            if (wantMeals) {
                placeMeal(day, SlotKind.BREAKFAST, cfg.getBreakfast(), meals, allocation, spend, used);
                placeMeal(day, SlotKind.LUNCH, cfg.getLunch(), meals, allocation, spend, used);
                placeMeal(day, SlotKind.DINNER, cfg.getDinner(), meals, allocation, spend, used);
            }
            if (wantActivities) {
                while (day.activityCount < cfg.getMaxActivitiesPerDay()) {
                    if (!placeNextActivity(day, activities, allocation, spend, used)) {
                        break;
                    }
                }
            }

            boolean planned = wantActivities ? day.activityCount > 0 : !day.slots.isEmpty();
            day.status = planned ? DayStatus.FULL : DayStatus.PARTIAL;
            ItineraryDay built = ItineraryDay.builder()
                    .dayIndex(dayIndex)
                    .date(date)
                    .status(day.status)
                    .slots(day.finish())
                    .build();
            days.add(built);
            if (!planned) {
                notes.add(PlanNote.of(wantActivities ? Category.ACTIVITY : null, ErrorCode.NO_CANDIDATES_FOUND,
                        "day " + (dayIndex + 1) + " (" + date + ") unplanned: no activity could be placed"));
                log.info("第 {} 天未能安排活动: date={}, slots={}", dayIndex + 1, date, built.getSlots().size());
            }
        }

        boolean allUnplanned = days.stream().allMatch(ItineraryDay::isUnplanned);
        if ((wantActivities || wantMeals) && allUnplanned) {
            throw PlanningException.of(ErrorCode.SCHEDULE_INFEASIBLE,
                    "none of the %d days could be planned (%d activities, %d meals available)",
                    days.size(), activities.size(), meals.size());
        }
        return new ScheduleResult(days, spend, notes);
    }

    private void placeMeal(DayPlan day,
                           SlotKind kind,
                           PlannerProperties.MealWindow window,
                           List<CandidateOption> meals,
                           BudgetAllocation allocation,
                           Map<Category, Money> spend,
                           Set<String> used) {
        if (window == null || window.getStart() == null || window.getEnd() == null) {
            return;
        }
        int windowStart = minutesOf(window.getStart());
        int windowEnd = minutesOf(window.getEnd());
        int dayStart = minutesOf(plannerProperties.getSchedule().getDayStart());
        int dayEnd = minutesOf(plannerProperties.getSchedule().getDayEnd());

        ScheduledSlot prev = day.slots.isEmpty() ? null : day.slots.get(day.slots.size() - 1);
        int freeFrom = prev == null ? dayStart : minutesOf(prev.getEnd());
        GeoPoint from = prev == null ? day.home : prev.getOption().getLocation();

        for (CandidateOption meal : meals) {
            if (used.contains(meal.dedupKey()) || !affordable(meal, Category.MEAL, allocation, spend)) {
                continue;
            }
            int duration = durationOf(meal, plannerProperties.getSchedule().getDefaultMealMinutes());
            int start = Math.max(windowStart, freeFrom + travelTimeEstimator.minutesBetween(from, meal.getLocation()));
            OpeningHours hours = meal.getOpeningHours();
            if (hours != null) {
                start = Math.max(start, minutesOf(hours.getOpen()));
            }
            int end = start + duration;
            if (end > windowEnd || end > dayEnd || !withinHours(hours, start, end)) {
                continue;
            }
            day.add(slot(day, meal, kind, start, end), Category.MEAL);
            commit(meal, Category.MEAL, spend, used);
            return;
        }
    }

    /**
     * 按排名找第一个能放进某个空档的活动，放入后返回 true。
     */
    private boolean placeNextActivity(DayPlan day,
                                      List<CandidateOption> activities,
                                      BudgetAllocation allocation,
                                      Map<Category, Money> spend,
                                      Set<String> used) {
        PlannerProperties.Schedule cfg = plannerProperties.getSchedule();
        int dayStart = minutesOf(cfg.getDayStart());
        int dayEnd = minutesOf(cfg.getDayEnd());

        for (CandidateOption activity : activities) {
            if (used.contains(activity.dedupKey()) || !affordable(activity, Category.ACTIVITY, allocation, spend)) {
                continue;
            }
            int duration = durationOf(activity, cfg.getDefaultActivityMinutes());
            OpeningHours hours = activity.getOpeningHours();
            for (int gap = 0; gap <= day.slots.size(); gap++) {
                ScheduledSlot prev = gap == 0 ? null : day.slots.get(gap - 1);
                ScheduledSlot next = gap == day.slots.size() ? null : day.slots.get(gap);
                int gapStart = prev == null ? dayStart : minutesOf(prev.getEnd());
                int gapEnd = next == null ? dayEnd : minutesOf(next.getStart());
                GeoPoint from = prev == null ? day.home : prev.getOption().getLocation();

                int start = gapStart + travelTimeEstimator.minutesBetween(from, activity.getLocation());
                if (hours != null) {
                    start = Math.max(start, minutesOf(hours.getOpen()));
                }
                int end = start + duration;
                int onward = next == null ? 0
                        : travelTimeEstimator.minutesBetween(activity.getLocation(), next.getOption().getLocation());
                if (end + onward <= gapEnd && end <= dayEnd && withinHours(hours, start, end)) {
                    day.add(slot(day, activity, SlotKind.ACTIVITY, start, end), Category.ACTIVITY);
                    commit(activity, Category.ACTIVITY, spend, used);
                    return true;
                }
            }
        }
        return false;
    }

    private boolean affordable(CandidateOption option, Category category,
                               BudgetAllocation allocation, Map<Category, Money> spend) {
        Money after = spend.get(category).plus(option.getPrice());
        return !after.exceeds(allocation.amountFor(category));
    }

    private void commit(CandidateOption option, Category category, Map<Category, Money> spend, Set<String> used) {
        spend.put(category, spend.get(category).plus(option.getPrice()));
        used.add(option.dedupKey());
    }

    private ScheduledSlot slot(DayPlan day, CandidateOption option, SlotKind kind, int start, int end) {
        return ScheduledSlot.builder()
                .dayIndex(day.dayIndex)
                .start(timeOf(start))
                .end(timeOf(end))
                .option(option)
                .kind(kind)
                .build();
    }

    private boolean withinHours(OpeningHours hours, int start, int end) {
        return hours == null || hours.covers(timeOf(start), timeOf(end));
    }

    private static int durationOf(CandidateOption option, int fallback) {
        Integer d = option.getDurationMinutes();
        return d == null || d <= 0 ? fallback : d;
    }

    static int minutesOf(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    /**
     * 超过 23:59 的时间会被上面的 dayEnd 检查挡住，这里只做截断。
     */
    static LocalTime timeOf(int minutes) {
        int clamped = Math.max(0, Math.min(minutes, 23 * 60 + 59));
        return LocalTime.of(clamped / 60, clamped % 60);
    }

    /**
     * 单天排布的可变工作区。
     */
    private final class DayPlan {

        final int dayIndex;
        final GeoPoint home;
        final List<ScheduledSlot> slots = new ArrayList<>();
        DayStatus status = DayStatus.EMPTY;
        int activityCount;

        DayPlan(int dayIndex, GeoPoint home) {
            this.dayIndex = dayIndex;
            this.home = home;
        }

        void add(ScheduledSlot slot, Category category) {
            int i = 0;
            while (i < slots.size() && !slots.get(i).getStart().isAfter(slot.getStart())) {
                i++;
            }
            slots.add(i, slot);
            if (category == Category.ACTIVITY) {
                activityCount++;
            }
            status = DayStatus.FILLING;
        }

        /**
         * 按最终顺序重算每个时段从上一地点过来的交通时间。
         */
        List<ScheduledSlot> finish() {
            List<ScheduledSlot> ordered = new ArrayList<>(slots.size());
            GeoPoint from = home;
            for (ScheduledSlot s : slots) {
                int travel = travelTimeEstimator.minutesBetween(from, s.getOption().getLocation());
                ordered.add(ScheduledSlot.builder()
                        .dayIndex(s.getDayIndex())
                        .start(s.getStart())
                        .end(s.getEnd())
                        .option(s.getOption())
                        .kind(s.getKind())
                        .travelMinutes(travel)
                        .build());
                from = s.getOption().getLocation();
            }
            return ordered;
        }
    }
}
