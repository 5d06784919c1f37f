package com.retailsales.domain.model;

import lombok.Value;
import org.springframework.data.domain.Sort;

/**
 * Sort field and direction.
 *
 * Unknown field: customerName ascending. Unknown direction: ascending.
 */
@Value
public class SortSpec {

    public static final SortSpec DEFAULT = new SortSpec(SortField.CUSTOMER_NAME, Sort.Direction.ASC);

    // Tiebreaker so offset pages stay stable when sort values repeat
    private static final String TIEBREAK_ATTRIBUTE = "transactionId";

    SortField field;
    Sort.Direction direction;

    public static SortSpec of(String sortBy, String sortOrder) {
        return SortField.fromParam(sortBy)
                .map(field -> new SortSpec(field,
                        Sort.Direction.fromOptionalString(sortOrder).orElse(Sort.Direction.ASC)))
                .orElse(DEFAULT);
    }

    public Sort toSort() {
        return Sort.by(direction, field.getAttribute())
                .and(Sort.by(Sort.Direction.ASC, TIEBREAK_ATTRIBUTE));
    }
}
