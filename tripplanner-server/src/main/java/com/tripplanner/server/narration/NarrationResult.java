package com.tripplanner.server.narration;

import lombok.Value;

import java.util.Map;

@Value
public class NarrationResult {

    String summary;

    /** dayIndex(0 起) -> 当天叙述 */
    Map<Integer, String> dayTexts;
}
