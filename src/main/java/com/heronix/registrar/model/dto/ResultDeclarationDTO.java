package com.heronix.registrar.model.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Marks submitted by staff when declaring a result.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResultDeclarationDTO {

    /**
     * Total marks; may be null when the candidate was absent or caught in malpractice.
     */
    @Min(0)
    private Integer marksObtained;

    @Min(0)
    private Integer internalMarks;

    /**
     * Defaults to marks obtained minus internal marks.
     */
    @Min(0)
    private Integer externalMarks;

    private boolean absent;

    private boolean malpractice;

    private String remarks;

    /**
     * Staff member declaring the result.
     */
    private Long staffId;
}
