package com.blogview.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body shared by the analytics endpoints.
 *
 * Supports a relative range (day, week, month, year), explicit dates or a calendar year,
 * country inclusion/exclusion, author and blog filters, and an optional filter expression.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsFilterRequest {

    private String range;

    // ISO-8601 instant, offset date-time or plain date
    @JsonProperty("start_date")
    private String startDate;

    @JsonProperty("end_date")
    private String endDate;

    @Min(1970)
    @Max(9999)
    private Integer year;

    @JsonProperty("country_codes")
    private List<String> countryCodes;

    @JsonProperty("exclude_country_codes")
    private List<String> excludeCountryCodes;

    @JsonProperty("author_username")
    private String authorUsername;

    @Positive
    @JsonProperty("blog_id")
    private Long blogId;

    private JsonNode filter;
}
