package com.tripplanner.pojo.vo;

import com.tripplanner.common.result.ErrorCode;
import com.tripplanner.pojo.enums.Category;
import lombok.Value;

/**
 * 规划备注：记录被吸收的品类级降级，例如“住宿选项有限”、“第 3 天未规划”。
 */
@Value
public class PlanNote {

    /** 关联的品类，可为空（例如未规划的天） */
    Category category;

    ErrorCode code;

    String message;

    public static PlanNote of(Category category, ErrorCode code, String message) {
        return new PlanNote(category, code, message);
    }
}
