package io.github.suppierk.test;

import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Events;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Locks;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.MenuItems;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.OrderItems;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Orders;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Restaurants;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Views;
import io.github.suppierk.eventsourcing.jooq.SchemaInitializer;
import java.util.UUID;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;

/** Private in-memory H2 database in PostgreSQL mode with the whole schema created. */
public final class TestDatabase implements AutoCloseable {
  private final JdbcConnectionPool pool;
  private final DSLContext dsl;

  private TestDatabase() {
    pool =
        JdbcConnectionPool.create(
            ("jdbc:h2:mem:%s;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
                    + "DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1")
                .formatted(UUID.randomUUID()),
            "sa",
            "");
    pool.setMaxConnections(32);
    dsl = DSL.using(pool, SQLDialect.H2);
    new SchemaInitializer().initialize(dsl);
  }

  public static TestDatabase create() {
    return new TestDatabase();
  }

  public DSLContext dsl() {
    return dsl;
  }

  public void clear() {
    dsl.deleteFrom(Events.TABLE).execute();
    dsl.deleteFrom(Locks.TABLE).execute();
    dsl.deleteFrom(Views.TABLE).execute();
    dsl.deleteFrom(MenuItems.TABLE).execute();
    dsl.deleteFrom(Restaurants.TABLE).execute();
    dsl.deleteFrom(OrderItems.TABLE).execute();
    dsl.deleteFrom(Orders.TABLE).execute();
  }

  @Override
  public void close() {
    dsl.execute("SHUTDOWN");
    pool.dispose();
  }
}
