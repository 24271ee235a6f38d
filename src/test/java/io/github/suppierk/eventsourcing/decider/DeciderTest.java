package io.github.suppierk.eventsourcing.decider;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DeciderTest {
  sealed interface Cmd permits Increment, Append {}

  record Increment(int by) implements Cmd {}

  record Append(String text) implements Cmd {}

  sealed interface Evt permits Incremented, Appended, Unrelated {}

  record Incremented(int by) implements Evt {}

  record Appended(String text) implements Evt {}

  record Unrelated() implements Evt {}

  static final class Counter implements Decider<Increment, Integer, Incremented> {
    @Override
    public Integer initialState() {
      return 0;
    }

    @Override
    public List<Incremented> decide(Increment command, Integer state) {
      if (command.by() <= 0) {
        throw new ValidationException("Only positive increments");
      }
      return List.of(new Incremented(command.by()));
    }

    @Override
    public Integer evolve(Integer state, Incremented event) {
      return state + event.by();
    }
  }

  static final class Text implements Decider<Append, String, Appended> {
    @Override
    public String initialState() {
      return "";
    }

    @Override
    public List<Appended> decide(Append command, String state) {
      return List.of(new Appended(command.text()));
    }

    @Override
    public String evolve(String state, Appended event) {
      return state + event.text();
    }
  }

  static final Decider<Cmd, Pair<Integer, String>, Evt> COMBINED =
      Decider.combine(
          Increment.class,
          Incremented.class,
          new Counter(),
          Append.class,
          Appended.class,
          new Text());

  @Test
  void fold_applies_events_in_order_from_initial_state() {
    final var text = new Text();

    assertEquals("", text.fold(List.of()));
    assertEquals(
        "abc", text.fold(List.of(new Appended("a"), new Appended("b"), new Appended("c"))));
  }

  @Test
  void decide_output_folded_onto_state_is_consistent_with_evolve() {
    final var counter = new Counter();
    final var state = counter.fold(List.of(new Incremented(2)));

    final var events = counter.decide(new Increment(3), state);
    var next = state;
    for (Incremented event : events) {
      next = counter.evolve(next, event);
    }

    assertEquals(5, next);
  }

  @Nested
  class Combined {
    @Test
    void initial_state_is_a_pair_of_initial_states() {
      assertEquals(new Pair<>(0, ""), COMBINED.initialState());
    }

    @Test
    void commands_are_routed_to_the_owning_decider() {
      final var state = COMBINED.initialState();

      assertEquals(List.of(new Incremented(1)), COMBINED.decide(new Increment(1), state));
      assertEquals(List.of(new Appended("x")), COMBINED.decide(new Append("x"), state));
    }

    @Test
    void events_change_only_the_owning_side_of_the_state() {
      final var state = new Pair<>(5, "abc");

      assertEquals(new Pair<>(7, "abc"), COMBINED.evolve(state, new Incremented(2)));
      assertEquals(new Pair<>(5, "abcd"), COMBINED.evolve(state, new Appended("d")));
    }

    @Test
    void events_without_owner_leave_the_state_unchanged() {
      final var state = new Pair<>(5, "abc");

      assertSame(state, COMBINED.evolve(state, new Unrelated()));
    }

    @Test
    void rejection_of_sub_decider_is_propagated() {
      final var state = COMBINED.initialState();

      assertThrows(ValidationException.class, () -> COMBINED.decide(new Increment(0), state));
    }

    @Test
    void fold_is_deterministic() {
      final List<Evt> events =
          List.of(new Incremented(1), new Appended("a"), new Unrelated(), new Incremented(2));

      assertEquals(new Pair<>(3, "a"), COMBINED.fold(events));
      assertEquals(COMBINED.fold(events), COMBINED.fold(events));
    }

    @Test
    void null_components_are_rejected() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              Decider.combine(
                  Increment.class,
                  Incremented.class,
                  null,
                  Append.class,
                  Appended.class,
                  new Text()));
    }
  }
}
