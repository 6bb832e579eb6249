package com.tripplanner.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 规划引擎的可调参数：预算拆分、候选排序、日程排布、超时。
 * Tunable heuristics of the planning engine. All defaults are starting points, not ground truth.
 */
@Data
@ConfigurationProperties(prefix = "tripplanner.planner")
public class PlannerProperties {

    private Budget budget = new Budget();

    private Selection selection = new Selection();

    private Schedule schedule = new Schedule();

    /**
     * 单个品类拉取候选的等待上限（毫秒），调用方可按次覆盖。
     */
    private long providerTimeoutMs = 8000;

    /**
     * 叙述生成的等待上限（毫秒），超时后使用模板文案。
     */
    private long narrationTimeoutMs = 20000;

    /**
     * 规划线程池大小，即 submit() 同时执行的规划数。
     */
    private int executorThreads = 16;

    /**
     * 上游调用线程池大小（各品类拉取 + 叙述调用），与规划线程池分开。
     */
    private int upstreamThreads = 32;

    @Data
    public static class Budget {

        private CategoryBudget flight = new CategoryBudget(0.35, 100.0, 0.10, 0.60);

        private CategoryBudget lodging = new CategoryBudget(0.35, 50.0, 0.10, 0.60);

        private CategoryBudget activity = new CategoryBudget(0.15, 0.0, 0.05, 0.50);

        private CategoryBudget meal = new CategoryBudget(0.15, 0.0, 0.05, 0.35);

        /**
         * 每个与活动相关的兴趣标签向 activity 转移的预算比例。
         */
        private double activityShiftPerTag = 0.03;

        /**
         * 每个与美食相关的兴趣标签向 meal 转移的预算比例。
         */
        private double mealShiftPerTag = 0.04;

        /**
         * 单个品类因兴趣标签获得的最大转移比例。
         */
        private double maxShift = 0.15;

        private List<String> activityTags = new ArrayList<>(List.of(
                "culture", "adventure", "nature", "nightlife", "shopping", "beach",
                "mountain", "family", "history", "art", "museum", "sightseeing"));

        private List<String> mealTags = new ArrayList<>(List.of("food", "culinary", "gastronomy", "wine"));
    }

    @Data
    public static class CategoryBudget {

        /**
         * 基线拆分比例。
         */
        private double baselineRatio;

        /**
         * 最低预算（绝对金额，按请求币种计）。
         */
        private double floorAmount;

        /**
         * 最低预算占总预算比例。
         */
        private double floorRatio;

        /**
         * 最高预算占总预算比例。
         */
        private double ceilingRatio;

        public CategoryBudget() {
        }

        public CategoryBudget(double baselineRatio, double floorAmount, double floorRatio, double ceilingRatio) {
            this.baselineRatio = baselineRatio;
            this.floorAmount = floorAmount;
            this.floorRatio = floorRatio;
            this.ceilingRatio = ceilingRatio;
        }
    }

    @Data
    public static class Selection {

        /**
         * 兴趣标签每命中一个的加分。
         */
        private double interestWeight = 1.0;

        /**
         * 航班/住宿保留的候选数量。
         */
        private int coreTopK = 5;

        /**
         * 活动/餐饮候选数量 = 预计时段数 * margin。
         */
        private double slotMargin = 1.5;

        /**
         * 活动/餐饮单项价格上限 = 品类预算 / 预计时段数 * headroom。
         */
        private double perSlotHeadroom = 1.5;

        /**
         * 行程中附带的备选住宿数量。
         */
        private int alternativeLodgingCount = 3;
    }

    @Data
    public static class Schedule {

        private LocalTime dayStart = LocalTime.of(8, 0);

        private LocalTime dayEnd = LocalTime.of(21, 0);

        private MealWindow breakfast = new MealWindow(LocalTime.of(8, 0), LocalTime.of(9, 30));

        private MealWindow lunch = new MealWindow(LocalTime.of(12, 0), LocalTime.of(14, 0));

        private MealWindow dinner = new MealWindow(LocalTime.of(18, 30), LocalTime.of(20, 30));

        /**
         * 餐饮没有时长估计时的默认用餐时长（分钟）。
         */
        private int defaultMealMinutes = 60;

        /**
         * 活动没有时长估计时的默认游览时长（分钟）。
         */
        private int defaultActivityMinutes = 120;

        private int maxActivitiesPerDay = 3;

        /**
         * 估算交通时间使用的平均速度（km/h）。
         */
        private double travelSpeedKmh = 25.0;

        /**
         * 每次移动的固定开销（分钟），坐标未知时只计这一项。
         */
        private int transferOverheadMinutes = 10;
    }

    @Data
    public static class MealWindow {

        private LocalTime start;

        private LocalTime end;

        public MealWindow() {
        }

        public MealWindow(LocalTime start, LocalTime end) {
            this.start = start;
            this.end = end;
        }
    }
}
