package com.deepansh.billbot.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Per-request knobs. Everything is optional; nulls fall back to configuration. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchOptions {

    @Min(1) @Max(50)
    private Integer maxIterations;

    @Valid
    private SearchFilters searchFilters;

    private List<ContentType> contentTypes;

    /** hybrid | semantic | keyword */
    private String searchType;

    private Boolean generateAnswer;

    private String model;

    @DecimalMin("0.0") @DecimalMax("2.0")
    private Double temperature;

    public static SearchOptions defaults() {
        return new SearchOptions();
    }
}
