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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A single position of the restaurant menu.
 *
 * @param menuItemId unique within the menu
 * @param name to display
 * @param price of one portion, always kept with two decimal places
 */
public record MenuItem(String menuItemId, String name, BigDecimal price) {
  public MenuItem {
    if (menuItemId == null || menuItemId.isBlank()) {
      throw new IllegalArgumentException("Menu item ID cannot be blank");
    }

    if (price == null || price.signum() < 0) {
      throw new IllegalArgumentException("Menu item price must be zero or positive");
    }

    price = price.setScale(2, RoundingMode.HALF_EVEN);
  }
}
