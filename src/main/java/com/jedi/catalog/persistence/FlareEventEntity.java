package com.jedi.catalog.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * GOES flare event, keyed by its peak time.
 */
@Entity
@Table(name = "goes_flare_event")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlareEventEntity {

    @Id
    @Column(name = "peak_time")
    private LocalDateTime peakTime;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "goes_class", length = 10, nullable = false)
    private String goesClass;
}
