package com.retailsales.domain.service;

import com.retailsales.domain.model.SalesFilter;
import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a {@link SalesFilter} and a search term into one composable
 * {@link Specification}.
 *
 * Search Routing:
 * - blank: no search predicate
 * - 1 character: phone number prefix only
 * - 2+ digits: phone number prefix only
 * - otherwise: case-insensitive prefix on customer name, first word only
 *
 * Prefix matches stay index-friendly; multi-word names only match on their
 * first word.
 *
 * Tags match when the stored comma-separated string contains any requested
 * tag as a substring, so "VIP" also matches "VIP2".
 */
@Component
public class SalesPredicateBuilder {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char LIKE_ESCAPE = '\\';

    public Specification<SalesTransactionEntity> build(SalesFilter filter) {
        return build(filter, null);
    }

    public Specification<SalesTransactionEntity> build(SalesFilter filter, String search) {
        Specification<SalesTransactionEntity> spec = matchAll();

        Specification<SalesTransactionEntity> searchSpec = search(search);
        if (searchSpec != null) {
            spec = spec.and(searchSpec);
        }

        if (filter == null) {
            return spec;
        }

        if (!filter.getTags().isEmpty()) {
            spec = spec.and(anyTag(filter.getTags()));
        }
        if (!filter.getRegions().isEmpty()) {
            spec = spec.and(memberOf("customerRegion", filter.getRegions()));
        }
        if (!filter.getGenders().isEmpty()) {
            spec = spec.and(memberOf("gender", filter.getGenders()));
        }
        if (!filter.getCategories().isEmpty()) {
            spec = spec.and(memberOf("productCategory", filter.getCategories()));
        }
        if (!filter.getPaymentMethods().isEmpty()) {
            spec = spec.and(memberOf("paymentMethod", filter.getPaymentMethods()));
        }
        if (filter.getAgeRange().isPresent()) {
            int min = filter.getAgeRange().get().getMin();
            int max = filter.getAgeRange().get().getMax();
            spec = spec.and((root, query, cb) -> cb.between(root.<Integer>get("age"), min, max));
        }
        if (filter.getDateRange().isPresent()) {
            LocalDate from = filter.getDateRange().get().getFrom();
            LocalDate to = filter.getDateRange().get().getTo();
            spec = spec.and((root, query, cb) -> cb.between(root.<LocalDate>get("transactionDate"), from, to));
        }

        return spec;
    }

    static Specification<SalesTransactionEntity> matchAll() {
        return (root, query, cb) -> cb.conjunction();
    }

    /**
     * @return the search predicate, or null when the term is blank
     */
    static Specification<SalesTransactionEntity> search(String search) {
        String term = search == null ? "" : search.trim();

        if (term.isEmpty()) {
            return null;
        }

        if (term.length() == 1 || DIGITS.matcher(term).matches()) {
            String pattern = escapeLike(term) + "%";
            return (root, query, cb) -> cb.like(root.<String>get("phoneNumber"), pattern, LIKE_ESCAPE);
        }

        String firstWord = WHITESPACE.split(term)[0];
        String pattern = escapeLike(firstWord.toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.<String>get("customerName")), pattern, LIKE_ESCAPE);
    }

    private static Specification<SalesTransactionEntity> anyTag(Collection<String> tags) {
        return (root, query, cb) -> cb.or(tags.stream()
                .map(tag -> cb.like(root.<String>get("tags"), "%" + escapeLike(tag) + "%", LIKE_ESCAPE))
                .toArray(Predicate[]::new));
    }

    private static Specification<SalesTransactionEntity> memberOf(String attribute, Collection<String> values) {
        return (root, query, cb) -> root.<String>get(attribute).in(values);
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
