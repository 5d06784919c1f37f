package com.retailsales.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Distinct values currently present, for building filter controls.
 */
@Value
@Builder
public class FilterOptions {

    List<String> regions;
    List<String> genders;
    List<String> categories;
    List<String> paymentMethods;
    AgeRange ageRange;
    List<String> tags;
}
