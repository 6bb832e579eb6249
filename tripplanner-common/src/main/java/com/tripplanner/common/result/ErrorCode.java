package com.tripplanner.common.result;

/**
 * 行程规划引擎的错误码枚举。
 * <p>可恢复的错误（按品类降级）只记录为规划备注，致命错误会终止整次规划。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok", false),

    /** 请求参数不合法：预算非正、结束日期早于开始日期等 */
    INVALID_REQUEST(2001, "行程请求不合法", true),

    /** 某个品类的数据源不可用，该品类按“无数据”处理 */
    PROVIDER_UNAVAILABLE(2101, "数据源暂不可用", false),

    /** 某个品类过滤后没有候选项，该品类标记为未规划 */
    NO_CANDIDATES_FOUND(2102, "没有符合条件的候选项", false),

    /** 交通或住宿没有可用候选，无法组成有效行程 */
    INSUFFICIENT_CORE_OPTIONS(2201, "缺少可用的交通或住宿选项", true),

    /** 各品类最低预算之和超过总预算 */
    BUDGET_INFEASIBLE(2202, "总预算不足以覆盖最低开销", true),

    /** 所有天都无法安排任何项目 */
    SCHEDULE_INFEASIBLE(2203, "无法为任何一天安排行程", true),

    /** 组装后的总花费超过预算：上游计算缺陷 */
    BUDGET_EXCEEDED(2301, "行程总花费超出预算", true),

    /** 组装后的行程违反不变量：上游逻辑缺陷 */
    ASSEMBLY_INVARIANT_VIOLATION(2302, "行程校验未通过", true),

    /** 规划被调用方取消 */
    PLANNING_CANCELLED(2401, "规划已取消", true),

    /** 未预期的内部错误 */
    INTERNAL_ERROR(2500, "服务器内部错误，请稍后重试", true);

    private final int code;
    private final String msg;
    private final boolean fatal;

    ErrorCode(int code, String msg, boolean fatal) {
        this.code = code;
        this.msg = msg;
        this.fatal = fatal;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }

    /**
     * true 表示该错误会终止整次规划；false 表示只影响单个品类。
     */
    public boolean isFatal() {
        return fatal;
    }
}
