package com.example.dispatch_service.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateTripRequest(
        @NotBlank(message = "여정 ID는 필수입니다.")
        String id,

        @Pattern(regexp = ".*\\S.*", message = "출발지는 빈 값일 수 없습니다.")
        @Size(max = 255, message = "출발지는 255자 이하여야 합니다.")
        String pickup,

        @Pattern(regexp = ".*\\S.*", message = "도착지는 빈 값일 수 없습니다.")
        @Size(max = 255, message = "도착지는 255자 이하여야 합니다.")
        String dropoff,

        String status,

        String driver
) {}
