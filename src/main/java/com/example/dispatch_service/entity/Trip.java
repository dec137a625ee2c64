package com.example.dispatch_service.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "trips")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Trip {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, unique = true, length = 36)
    private String tripId;

    @Column(nullable = false)
    private String pickup;

    @Column(nullable = false)
    private String dropoff;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TripStatus status;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "rider_id")
    private User rider;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "driver_id")
    private User driver;

    @Column(nullable = false, updatable = false, name = "created_at")
    private LocalDateTime createdAt;

    @Column(nullable = false, name = "updated_at")
    private LocalDateTime updatedAt;

    @Builder
    public Trip(String tripId, String pickup, String dropoff, User rider, User driver) {
        this.tripId = tripId;
        this.pickup = pickup;
        this.dropoff = dropoff;
        this.rider = rider;
        this.driver = driver;
        this.status = TripStatus.REQUESTED;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public void assignDriver(User driver) {
        this.driver = driver;
        touch();
    }

    public void changeRoute(String pickup, String dropoff) {
        if (pickup != null) {
            this.pickup = pickup;
        }
        if (dropoff != null) {
            this.dropoff = dropoff;
        }
        touch();
    }

    public void changeStatus(TripStatus status) {
        this.status = status;
        touch();
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
