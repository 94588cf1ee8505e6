package com.orderdesk.orderservice.repository.specification;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;

import java.util.Locale;

/** Case-insensitive "contains" predicates in which {@code %} and {@code _} match literally. */
final class SearchTerms {

  static final char ESCAPE = '\\';

  private SearchTerms() {}

  static String containsPattern(String term) {
    StringBuilder pattern = new StringBuilder("%");
    for (char c : term.trim().toLowerCase(Locale.ROOT).toCharArray()) {
      if (c == '%' || c == '_' || c == ESCAPE) {
        pattern.append(ESCAPE);
      }
      pattern.append(c);
    }
    return pattern.append('%').toString();
  }

  static Predicate contains(CriteriaBuilder cb, Expression<String> field, String term) {
    return cb.like(cb.lower(field), containsPattern(term), ESCAPE);
  }

  static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
