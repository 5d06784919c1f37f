package com.retailsales.api;

import com.retailsales.domain.model.AgeRange;
import com.retailsales.domain.model.DateRange;
import com.retailsales.domain.model.SalesFilter;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.util.List;

/**
 * Filter query parameters shared by the read and stats endpoints.
 *
 * Multi-selects accept repeated parameters or comma-separated values.
 * A range only applies when both of its ends are given. Ages are never negative.
 */
@Data
public class SalesFilterParams {

    private List<String> regions;
    private List<String> genders;
    private List<String> categories;
    private List<String> tags;
    private List<String> paymentMethods;

    @Min(0)
    private Integer ageMin;

    @Min(0)
    private Integer ageMax;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate dateFrom;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate dateTo;

    public SalesFilter toFilter() {
        SalesFilter.SalesFilterBuilder builder = SalesFilter.builder();

        values(regions).forEach(builder::region);
        values(genders).forEach(builder::gender);
        values(categories).forEach(builder::category);
        values(tags).forEach(builder::tag);
        values(paymentMethods).forEach(builder::paymentMethod);

        if (ageMin != null && ageMax != null) {
            builder.ageRange(AgeRange.of(ageMin, ageMax));
        }
        if (dateFrom != null && dateTo != null) {
            builder.dateRange(DateRange.of(dateFrom, dateTo));
        }
        return builder.build();
    }

    private static List<String> values(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .toList();
    }
}
