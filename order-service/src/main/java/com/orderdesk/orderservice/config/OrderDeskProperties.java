package com.orderdesk.orderservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables bound from the {@code orderdesk.*} prefix:
 *
 * <pre>
 * orderdesk.orders.edit-window=24h
 * orderdesk.orders.order-number-attempts=3
 * orderdesk.orders.recent-limit=50
 * orderdesk.statistics.top-n=5
 * orderdesk.search.min-term-length=2
 * orderdesk.search.max-results=20
 * </pre>
 *
 * Missing or non-positive values fall back to the defaults shown above.
 */
@ConfigurationProperties(prefix = "orderdesk")
public record OrderDeskProperties(Orders orders, Statistics statistics, Search search) {

  public OrderDeskProperties {
    if (orders == null) {
      orders = new Orders(null, 0, 0);
    }
    if (statistics == null) {
      statistics = new Statistics(0);
    }
    if (search == null) {
      search = new Search(0, 0);
    }
  }

  /**
   * @param editWindow how long after creation an order and its items may still be changed
   * @param orderNumberAttempts attempts at inserting an order before a number collision is fatal
   * @param recentLimit cap on the recent-orders listing
   */
  public record Orders(Duration editWindow, int orderNumberAttempts, int recentLimit) {
    public Orders {
      if (editWindow == null || editWindow.isNegative() || editWindow.isZero()) {
        editWindow = Duration.ofHours(24);
      }
      if (orderNumberAttempts <= 0) {
        orderNumberAttempts = 3;
      }
      if (recentLimit <= 0) {
        recentLimit = 50;
      }
    }
  }

  public record Statistics(int topN) {
    public Statistics {
      if (topN <= 0) {
        topN = 5;
      }
    }
  }

  public record Search(int minTermLength, int maxResults) {
    public Search {
      if (minTermLength <= 0) {
        minTermLength = 2;
      }
      if (maxResults <= 0) {
        maxResults = 20;
      }
    }
  }
}
