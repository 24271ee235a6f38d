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

package io.github.suppierk.eventsourcing.jooq;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;

/**
 * Tables created by the scripts under {@code sql/}.
 *
 * <p>Fields are always qualified with the table name, so they can be used in joins as they are.
 */
public final class EventSourcingTables {
  private EventSourcingTables() {}

  /** Append-only event chains of every aggregate. */
  public static final class Events {
    public static final Table<Record> TABLE = table(name("events"));

    public static final Field<String> AGGREGATE_TYPE =
        field(name("events", "aggregate_type"), SQLDataType.VARCHAR);
    public static final Field<String> AGGREGATE_ID =
        field(name("events", "aggregate_id"), SQLDataType.VARCHAR);
    public static final Field<String> EVENT_TYPE =
        field(name("events", "event_type"), SQLDataType.VARCHAR);
    public static final Field<String> DATA = field(name("events", "data"), SQLDataType.VARCHAR);
    public static final Field<UUID> EVENT_ID = field(name("events", "event_id"), SQLDataType.UUID);
    public static final Field<UUID> COMMAND_ID =
        field(name("events", "command_id"), SQLDataType.UUID);
    public static final Field<UUID> PREVIOUS_ID =
        field(name("events", "previous_id"), SQLDataType.UUID);
    public static final Field<Boolean> FINAL = field(name("events", "final"), SQLDataType.BOOLEAN);
    public static final Field<OffsetDateTime> CREATED_AT =
        field(name("events", "created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
    public static final Field<Long> OFFSET = field(name("events", "offset"), SQLDataType.BIGINT);

    /** Stored instead of a missing previous ID, so that the first event is unique as well. */
    public static final UUID ROOT = new UUID(0L, 0L);

    private Events() {}
  }

  /** Consumer groups. */
  public static final class Views {
    public static final Table<Record> TABLE = table(name("views"));

    public static final Field<String> VIEW = field(name("views", "view"), SQLDataType.VARCHAR);
    public static final Field<Long> POLLING_DELAY_MS =
        field(name("views", "polling_delay_ms"), SQLDataType.BIGINT);
    public static final Field<OffsetDateTime> START_AT =
        field(name("views", "start_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
    public static final Field<OffsetDateTime> CREATED_AT =
        field(name("views", "created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
    public static final Field<OffsetDateTime> UPDATED_AT =
        field(name("views", "updated_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

    private Views() {}
  }

  /** Progress and leases of every view per aggregate. */
  public static final class Locks {
    public static final Table<Record> TABLE = table(name("locks"));

    public static final Field<String> VIEW = field(name("locks", "view"), SQLDataType.VARCHAR);
    public static final Field<String> AGGREGATE_ID =
        field(name("locks", "aggregate_id"), SQLDataType.VARCHAR);
    public static final Field<Long> OFFSET = field(name("locks", "offset"), SQLDataType.BIGINT);
    public static final Field<Long> LAST_OFFSET =
        field(name("locks", "last_offset"), SQLDataType.BIGINT);
    public static final Field<OffsetDateTime> LOCKED_UNTIL =
        field(name("locks", "locked_until"), SQLDataType.TIMESTAMPWITHTIMEZONE);
    public static final Field<Boolean> OFFSET_FINAL =
        field(name("locks", "offset_final"), SQLDataType.BOOLEAN);
    public static final Field<OffsetDateTime> CREATED_AT =
        field(name("locks", "created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);
    public static final Field<OffsetDateTime> UPDATED_AT =
        field(name("locks", "updated_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

    private Locks() {}
  }

  public static final class Restaurants {
    public static final Table<Record> TABLE = table(name("restaurant"));

    public static final Field<UUID> ID = field(name("restaurant", "id"), SQLDataType.UUID);
    public static final Field<String> NAME =
        field(name("restaurant", "name"), SQLDataType.VARCHAR);
    public static final Field<UUID> MENU_ID =
        field(name("restaurant", "menu_id"), SQLDataType.UUID);
    public static final Field<String> CUISINE =
        field(name("restaurant", "cuisine"), SQLDataType.VARCHAR);

    private Restaurants() {}
  }

  public static final class MenuItems {
    public static final Table<Record> TABLE = table(name("menu_item"));

    public static final Field<UUID> RESTAURANT_ID =
        field(name("menu_item", "restaurant_id"), SQLDataType.UUID);
    public static final Field<String> MENU_ITEM_ID =
        field(name("menu_item", "menu_item_id"), SQLDataType.VARCHAR);
    public static final Field<Integer> POSITION =
        field(name("menu_item", "position"), SQLDataType.INTEGER);
    public static final Field<String> NAME = field(name("menu_item", "name"), SQLDataType.VARCHAR);
    public static final Field<BigDecimal> PRICE =
        field(name("menu_item", "price"), SQLDataType.NUMERIC(19, 2));

    private MenuItems() {}
  }

  public static final class Orders {
    public static final Table<Record> TABLE = table(name("restaurant_order"));

    public static final Field<UUID> ID = field(name("restaurant_order", "id"), SQLDataType.UUID);
    public static final Field<UUID> RESTAURANT_ID =
        field(name("restaurant_order", "restaurant_id"), SQLDataType.UUID);
    public static final Field<String> STATUS =
        field(name("restaurant_order", "status"), SQLDataType.VARCHAR);

    private Orders() {}
  }

  public static final class OrderItems {
    public static final Table<Record> TABLE = table(name("restaurant_order_item"));

    public static final Field<UUID> ORDER_ID =
        field(name("restaurant_order_item", "order_id"), SQLDataType.UUID);
    public static final Field<String> ID =
        field(name("restaurant_order_item", "id"), SQLDataType.VARCHAR);
    public static final Field<Integer> POSITION =
        field(name("restaurant_order_item", "position"), SQLDataType.INTEGER);
    public static final Field<Integer> QUANTITY =
        field(name("restaurant_order_item", "quantity"), SQLDataType.INTEGER);
    public static final Field<String> MENU_ITEM_ID =
        field(name("restaurant_order_item", "menu_item_id"), SQLDataType.VARCHAR);
    public static final Field<String> NAME =
        field(name("restaurant_order_item", "name"), SQLDataType.VARCHAR);

    private OrderItems() {}
  }
}
