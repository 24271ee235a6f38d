/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.domain;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One line of an order.
 *
 * @param id of the line within the order
 * @param quantity of portions
 * @param menuItemId the line refers to
 * @param name of the menu item at the time of ordering
 */
public record OrderLineItem(String id, int quantity, String menuItemId, String name) {
  public OrderLineItem {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Order line item ID cannot be blank");
    }

    if (quantity <= 0) {
      throw new IllegalArgumentException("Order line item quantity must be positive");
    }

    if (menuItemId == null || menuItemId.isBlank()) {
      throw new IllegalArgumentException("Order line item menu item ID cannot be blank");
    }
  }

  /**
   * @param lineItems to check
   * @return the first line item ID which occurs more than once, if any
   */
  static Optional<String> findDuplicateId(final List<OrderLineItem> lineItems) {
    final Set<String> seen = new HashSet<>();
    return lineItems.stream().map(OrderLineItem::id).filter(id -> !seen.add(id)).findFirst();
  }
}
