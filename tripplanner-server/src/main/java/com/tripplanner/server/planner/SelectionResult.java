package com.tripplanner.server.planner;

import com.tripplanner.pojo.enums.Category;
import com.tripplanner.pojo.model.CandidateOption;
import com.tripplanner.pojo.vo.PlanNote;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 各品类排序后的候选（已按分数降序），以及过滤过程中产生的备注。
 */
@Value
public class SelectionResult {

    Map<Category, List<CandidateOption>> ranked;

    List<PlanNote> notes;

    public List<CandidateOption> get(Category category) {
        List<CandidateOption> list = ranked.get(category);
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * 排名第一的候选，没有时返回 null。
     */
    public CandidateOption top(Category category) {
        List<CandidateOption> list = get(category);
        return list.isEmpty() ? null : list.get(0);
    }
}
