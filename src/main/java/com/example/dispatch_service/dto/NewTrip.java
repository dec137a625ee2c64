package com.example.dispatch_service.dto;

public record NewTrip(String pickup, String dropoff, String riderId) {}
