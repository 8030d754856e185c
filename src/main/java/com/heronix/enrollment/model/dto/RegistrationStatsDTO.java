package com.heronix.enrollment.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statistics over all registrations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistrationStatsDTO {

    private long totalRegistrations;

    private long activeRegistrations;

    private long droppedRegistrations;

    /**
     * Active registrations as a percentage of all registrations (0 when there are none).
     */
    private double enrollmentRate;
}
