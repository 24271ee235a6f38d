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
import java.util.UUID;

/**
 * Menu of a restaurant. Replaced as a whole whenever it changes.
 *
 * @param menuItems offered by the restaurant, in display order
 * @param menuId identifies this version of the menu
 * @param cuisine of the menu
 */
public record RestaurantMenu(List<MenuItem> menuItems, UUID menuId, RestaurantMenuCuisine cuisine) {
  public RestaurantMenu {
    menuItems = menuItems == null ? List.of() : List.copyOf(menuItems);

    if (menuId == null) {
      throw new IllegalArgumentException("Menu ID cannot be null");
    }

    if (cuisine == null) {
      cuisine = RestaurantMenuCuisine.GENERAL;
    }
  }

  /**
   * @param menuItems to offer
   * @return a new {@link RestaurantMenuCuisine#GENERAL} menu with a random identifier
   */
  public static RestaurantMenu of(final List<MenuItem> menuItems) {
    return new RestaurantMenu(menuItems, UUID.randomUUID(), RestaurantMenuCuisine.GENERAL);
  }

  /**
   * @param cuisine to assign
   * @return a copy of this menu with another cuisine
   */
  public RestaurantMenu withCuisine(final RestaurantMenuCuisine cuisine) {
    return new RestaurantMenu(menuItems, menuId, cuisine);
  }

  /**
   * @return the first menu item ID which occurs more than once, if any
   */
  Optional<String> findDuplicateMenuItemId() {
    final Set<String> seen = new HashSet<>();
    return menuItems.stream().map(MenuItem::menuItemId).filter(id -> !seen.add(id)).findFirst();
  }

  /**
   * @param menuItemId to look for
   * @return {@code true} if this menu offers the item
   */
  public boolean offers(final String menuItemId) {
    return menuItems.stream().anyMatch(menuItem -> menuItem.menuItemId().equals(menuItemId));
  }
}
