package com.jedi.catalog.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface IrradianceSampleRepository extends JpaRepository<IrradianceSampleEntity, Long> {

    boolean existsBySampleTimeAndChannel(LocalDateTime sampleTime, String channel);

    @Query("SELECT s.channel FROM IrradianceSampleEntity s WHERE s.sampleTime = :sampleTime")
    List<String> findChannelsAt(@Param("sampleTime") LocalDateTime sampleTime);

    @Query("SELECT MIN(s.sampleTime) FROM IrradianceSampleEntity s")
    Optional<LocalDateTime> findMinSampleTime();

    @Query("SELECT MAX(s.sampleTime) FROM IrradianceSampleEntity s")
    Optional<LocalDateTime> findMaxSampleTime();

    /**
     * Samples in a time range, ordered by time and then insertion order.
     */
    @Query("SELECT s FROM IrradianceSampleEntity s WHERE s.sampleTime >= :startTime AND s.sampleTime <= :endTime " +
            "ORDER BY s.sampleTime ASC, s.id ASC")
    List<IrradianceSampleEntity> findSamplesBetween(@Param("startTime") LocalDateTime startTime,
                                                    @Param("endTime") LocalDateTime endTime);

    /**
     * Channel labels in order of first insertion.
     */
    @Query("SELECT s.channel FROM IrradianceSampleEntity s GROUP BY s.channel ORDER BY MIN(s.id) ASC")
    List<String> findChannelsInInsertionOrder();
}
