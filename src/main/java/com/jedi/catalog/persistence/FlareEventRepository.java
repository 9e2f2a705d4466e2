package com.jedi.catalog.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface FlareEventRepository extends JpaRepository<FlareEventEntity, LocalDateTime> {

    boolean existsByPeakTime(LocalDateTime peakTime);

    @Query("SELECT f FROM FlareEventEntity f ORDER BY f.peakTime ASC")
    List<FlareEventEntity> findAllOrderByPeakTimeAsc();
}
