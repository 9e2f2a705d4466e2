package com.jedi.catalog.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One irradiance sample of one emission line channel. A null irradiance is a missing sample.
 */
@Entity
@Table(name = "eve_line_irradiance",
        uniqueConstraints = @UniqueConstraint(columnNames = {"sample_time", "channel"}),
        indexes = @Index(name = "idx_eve_line_irradiance_time", columnList = "sample_time"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IrradianceSampleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sample_time", nullable = false)
    private LocalDateTime sampleTime;

    // Channel label, e.g. the line's center wavelength in nm
    @Column(name = "channel", length = 32, nullable = false)
    private String channel;

    // W/m2
    @Column(name = "irradiance")
    private Double irradiance;
}
