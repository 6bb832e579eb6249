package com.tripplanner.server.narration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.server.utils.AiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * 基于 OpenAI 兼容接口的叙述生成。
 *
 * 要求模型输出 {"summary": "...", "days": [{"day": 1, "text": "..."}]}，day 从 1 开始。
 * 输出只被当作展示文本读取，不会反向影响任何规划数据。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiItineraryNarrator implements ItineraryNarrator {

    private static final String SYSTEM_PROMPT = "You are a travel writer. "
            + "Given a fixed, already validated day-by-day itinerary, write a short, friendly narrative "
            + "(2~4 sentences) for each day and a one-paragraph summary of the trip. "
            + "Do not add, remove, reorder or re-time any item, and do not mention prices that are not given. "
            + "Reply with a JSON object only: "
            + "{\"summary\": string, \"days\": [{\"day\": number starting at 1, \"text\": string}]}.";

    private final AiClient aiClient;
    private final ObjectMapper objectMapper;

    @Override
    public NarrationResult narrate(NarrationRequest request) {
        String content = aiClient.chat(SYSTEM_PROMPT, buildUserPrompt(request), true);
        if (!StringUtils.hasText(content)) {
            return null;
        }
        return parse(content);
    }

    String buildUserPrompt(NarrationRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Trip: ").append(request.getOrigin()).append(" -> ").append(request.getDestination())
                .append(", ").append(request.getStartDate()).append(" to ").append(request.getEndDate())
                .append(", travelers: ").append(request.getTravelers()).append("\n");
        if (!request.getInterests().isEmpty()) {
            sb.append("Traveler interests (style hint): ")
                    .append(String.join(", ", request.getInterests())).append("\n");
        }
        if (request.getFlight() != null) {
            sb.append("Flight: ").append(request.getFlight()).append("\n");
        }
        if (request.getLodging() != null) {
            sb.append("Stay: ").append(request.getLodging()).append("\n");
        }
        sb.append("Total cost: ").append(request.getTotalCost()).append("\n");
        for (NarrationRequest.DaySummary day : request.getDays()) {
            sb.append("Day ").append(day.getDayIndex() + 1).append(" (").append(day.getDate()).append(")");
            if (day.isUnplanned()) {
                sb.append(" [no sightseeing planned, suggest a relaxed free day]");
            }
            sb.append(":\n");
            for (String line : day.getLines()) {
                sb.append("- ").append(line).append("\n");
            }
        }
        return sb.toString();
    }

    NarrationResult parse(String content) {
        try {
            JsonNode root = objectMapper.readTree(stripCodeFence(content));
            String summary = root.hasNonNull("summary") ? root.get("summary").asText().trim() : null;
            Map<Integer, String> dayTexts = new HashMap<>();
            JsonNode days = root.get("days");
            if (days != null && days.isArray()) {
                for (JsonNode d : days) {
                    JsonNode dayNo = d.get("day");
                    JsonNode text = d.get("text");
                    if (dayNo == null || !dayNo.canConvertToInt() || text == null) {
                        continue;
                    }
                    dayTexts.put(dayNo.asInt() - 1, text.asText().trim());
                }
            }
            return new NarrationResult(summary, dayTexts);
        } catch (Exception e) {
            log.warn("叙述结果不是合法 JSON，丢弃: {}", e.getMessage());
            return null;
        }
    }

    private String stripCodeFence(String content) {
        String s = content.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            int lastFence = s.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return s.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return s;
    }
}
