package com.example.dispatch_service.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTripRequest(
        @NotBlank(message = "출발지는 필수입니다.")
        @Size(max = 255, message = "출발지는 255자 이하여야 합니다.")
        String pickup,

        @NotBlank(message = "도착지는 필수입니다.")
        @Size(max = 255, message = "도착지는 255자 이하여야 합니다.")
        String dropoff,

        String rider
) {}
