/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class DisabledVotersTest {

  @Test
  void toggleFlipsMembership() {
    DisabledVoters voters = new DisabledVoters();

    assertTrue(voters.toggle(5L));
    assertTrue(voters.contains(5L));
    assertFalse(voters.toggle(5L));
    assertFalse(voters.contains(5L));
  }

  @Test
  void idsAreSortedAndLoadReplaces() {
    DisabledVoters voters = new DisabledVoters();
    voters.toggle(1L);

    voters.load(List.of(9L, 3L));

    assertEquals(List.of(3L, 9L), voters.ids());
    assertFalse(voters.contains(1L));
  }
}
