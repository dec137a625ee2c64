package com.example.dispatch_service.repository;

import com.example.dispatch_service.entity.Trip;
import com.example.dispatch_service.entity.TripStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TripRepository extends JpaRepository<Trip, Long> {
    Optional<Trip> findByTripId(String tripId);

    // 동시성 제어 : 같은 여정에 대한 수정은 행 잠금으로 직렬화
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Trip t WHERE t.tripId = :tripId")
    Optional<Trip> findForUpdateByTripId(@Param("tripId") String tripId);

    @Query("SELECT t FROM Trip t " +
            "LEFT JOIN t.rider r " +
            "LEFT JOIN t.driver d " +
            "WHERE (r.id = :userId OR d.id = :userId) " +
            "AND t.status <> :excluded " +
            "ORDER BY t.createdAt ASC")
    List<Trip> findParticipatingTrips(@Param("userId") String userId,
                                      @Param("excluded") TripStatus excluded);
}
