/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * Keyword classification of the natural-language question, in English and Russian. The first
 * matching strategy wins in the order count, maximum, sort/limit; anything else is a plain join.
 */
@UtilityClass
public class QueryIntentClassifier {

  private static final Pattern COUNT = pattern("count|how many|сколько");

  private static final Pattern MAX =
      pattern("max|maximum|highest|biggest|largest|most|самый большой|максимальный");

  private static final Pattern SORT_LIMIT =
      pattern("sort|order|limit|top|best|sorted|сортировка|порядок|лучший|топ");

  private static final Pattern AMOUNT = pattern("amount|sum|deposit|money|сумм|деньг|депозит");

  private static final Pattern QUANTITY = pattern("count|number|quantity|число|количество");

  private static final Pattern DATE = pattern("date|time|when|дат|время|когда");

  private static final Pattern NAME = pattern("name|user|имя|пользовате");

  private static final Pattern ASCENDING = pattern("asc|least|smallest|минимал|наимен");

  public static AggregationStrategy classify(String question) {
    String text = normalize(question);
    if (COUNT.matcher(text).find()) {
      return AggregationStrategy.COUNT;
    }
    if (MAX.matcher(text).find()) {
      return AggregationStrategy.MAX;
    }
    if (SORT_LIMIT.matcher(text).find()) {
      return AggregationStrategy.SORT_LIMIT;
    }
    return AggregationStrategy.JOIN;
  }

  /** Fields that may hold the maximum the question asks for, most plausible first. */
  public static List<String> maxFields(String question) {
    String text = normalize(question);
    List<String> fields = new ArrayList<>();
    if (AMOUNT.matcher(text).find()) {
      fields.add("amount");
    }
    if (QUANTITY.matcher(text).find()) {
      fields.add("count");
    }
    if (DATE.matcher(text).find()) {
      fields.addAll(List.of("createdAt", "created_at", "date"));
    }
    if (fields.isEmpty()) {
      fields.addAll(List.of("amount", "count", "id"));
    }
    return fields;
  }

  /** Fields to sort by, most plausible first. */
  public static List<String> sortFields(String question) {
    String text = normalize(question);
    List<String> fields = new ArrayList<>();
    if (AMOUNT.matcher(text).find()) {
      fields.add("amount");
    }
    if (DATE.matcher(text).find()) {
      fields.addAll(List.of("createdAt", "created_at", "date"));
    }
    if (NAME.matcher(text).find()) {
      fields.addAll(List.of("name", "username", "user_name"));
    }
    if (fields.isEmpty()) {
      fields.addAll(List.of("id", "amount", "createdAt", "created_at"));
    }
    return fields;
  }

  /** Descending unless the question asks for the least or smallest values. */
  public static boolean isDescending(String question) {
    return !ASCENDING.matcher(normalize(question)).find();
  }

  private static String normalize(String question) {
    return question == null ? "" : question.toLowerCase(Locale.ROOT);
  }

  private static Pattern pattern(String regex) {
    return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
