package com.palmid.palm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recognition details. {@code confidence} is {@code 1 - distance}: a display value,
 * not a calibrated probability, and it can fall outside [0, 1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecognitionData {
    private String identity;
    private double distance;
    private Double confidence;
    private double threshold;
}
