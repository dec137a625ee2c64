package com.example.dispatch_service.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 클라이언트가 보내는 메시지 봉투. {@code data}는 타입별 핸들러가 해석한다.
 *
 * @param group echo.message 에서만 쓰이는 관리용 대상 그룹 (OWNER 전용)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InboundMessage(String type, JsonNode data, String group) {
}
