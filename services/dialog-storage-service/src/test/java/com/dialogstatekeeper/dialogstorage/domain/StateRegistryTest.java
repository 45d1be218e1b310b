package com.dialogstatekeeper.dialogstorage.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class StateRegistryTest {

  private final StatesGroup main = StatesGroup.of("Main", "step1", "step2");
  private final StateRegistry registry = StateRegistry.of(main, StatesGroup.of("Settings", "root"));

  @Test
  void resolve_returnsRegisteredInstance() {
    State step1 = main.states().get(0);

    assertThat(registry.resolve("Main:step1")).isSameAs(step1);
    assertThat(registry.resolve("Main:step2")).isSameAs(main.states().get(1));
  }

  @Test
  void resolve_unknownMember_failsWithFullIdentifier() {
    assertThatThrownBy(() -> registry.resolve("Main:step9"))
        .isInstanceOf(UnknownStateException.class)
        .hasMessage("Unknown state Main:step9");
  }

  @Test
  void resolve_unknownGroup_failsWithGroupName() {
    assertThatThrownBy(() -> registry.resolve("Other:step1"))
        .isInstanceOf(UnknownStateException.class)
        .hasMessage("Unknown state group Other");
  }

  @Test
  void resolve_groupWithoutLocalPart_isLookedUpAsGroup() {
    assertThatThrownBy(() -> registry.resolve("Main"))
        .isInstanceOf(UnknownStateException.class)
        .hasMessage("Unknown state Main");
    assertThatThrownBy(() -> registry.resolve("Nope"))
        .isInstanceOf(UnknownStateException.class)
        .hasMessage("Unknown state group Nope");
  }

  @Test
  void resolve_splitsOnFirstSeparatorOnly() {
    StateRegistry nested = StateRegistry.of(StatesGroup.of("Wizard", "page:1"));

    assertThat(nested.resolve("Wizard:page:1").name()).isEqualTo("page:1");
  }

  @Test
  void of_rejectsDuplicateGroups() {
    assertThatThrownBy(() -> StateRegistry.of(main, StatesGroup.of("Main", "other")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Main");
  }

  @Test
  void statesGroup_rejectsForeignState() {
    assertThatThrownBy(() -> new StatesGroup("Main", List.of(new State("Other", "step1"))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void groups_keepDeclarationOrder() {
    assertThat(registry.groups()).extracting(StatesGroup::name).containsExactly("Main", "Settings");
    assertThat(registry.group("Settings").state("root")).isPresent();
    assertThat(StateRegistry.empty().size()).isZero();
  }
}
