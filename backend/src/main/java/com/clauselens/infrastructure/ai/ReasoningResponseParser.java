package com.clauselens.infrastructure.ai;

import com.clauselens.domain.analysis.service.ReasoningServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Binds JSON embedded in a model reply. Replies may wrap the payload in prose or
 * markdown fences, so the span from the first opening bracket to the last closing
 * bracket of the expected kind is parsed.
 */
@Component
@RequiredArgsConstructor
public class ReasoningResponseParser {

    private final ObjectMapper objectMapper;

    public <T> T parseObject(String reply, Class<T> type) {
        String json = extractBlock(reply, '{', '}');
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new ReasoningServiceException("Reasoning reply contained a null " + type.getSimpleName());
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceException("Failed to parse " + type.getSimpleName() + " from reasoning reply", e);
        }
    }

    public <T> List<T> parseArray(String reply, Class<T> elementType) {
        String json = extractBlock(reply, '[', ']');
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            List<T> values = objectMapper.readValue(json, listType);
            return values != null ? values : List.of();
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceException("Failed to parse " + elementType.getSimpleName() + " list from reasoning reply", e);
        }
    }

    static String extractBlock(String reply, char open, char close) {
        if (reply == null) {
            throw new ReasoningServiceException("Reasoning reply was empty");
        }
        int start = reply.indexOf(open);
        int end = reply.lastIndexOf(close);
        if (start < 0 || end <= start) {
            throw new ReasoningServiceException("No JSON " + open + close + " block found in reasoning reply");
        }
        return reply.substring(start, end + 1);
    }
}
