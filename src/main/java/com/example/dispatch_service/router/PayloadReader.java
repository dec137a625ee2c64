package com.example.dispatch_service.router;

import com.example.dispatch_service.exception.InvalidMessageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 메시지 data 를 요청 DTO 로 변환하고 Bean Validation 을 적용한다.
 */
@Component
@RequiredArgsConstructor
public class PayloadReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public <T> T read(JsonNode data, Class<T> type) {
        if (data == null || !data.isObject()) {
            throw new InvalidMessageException("data 는 JSON 객체여야 합니다.");
        }

        T payload;
        try {
            payload = objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("data 형식이 올바르지 않습니다: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw new InvalidMessageException("data 형식이 올바르지 않습니다: " + e.getMessage());
        }

        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                                       .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                                       .map(ConstraintViolation::getMessage)
                                       .collect(Collectors.joining(" "));
            throw new InvalidMessageException(message);
        }
        return payload;
    }
}
