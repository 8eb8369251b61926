package ca.gc.cra.courier.domain.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DestinationClassTest {

  @Test
  void parsesConstantAndDisplayNames() {
    assertEquals(DestinationClass.MBAPPE, DestinationClass.fromString("mbappe"));
    assertEquals(DestinationClass.HAALAND, DestinationClass.fromString(" Haaland "));
    assertEquals(DestinationClass.UNRESOLVED, DestinationClass.fromString("Unknown"));
    assertThrows(IllegalArgumentException.class, () -> DestinationClass.fromString("Pele"));
    assertThrows(IllegalArgumentException.class, () -> DestinationClass.fromString(" "));
  }

  @Test
  void namedSetExcludesUnresolved() {
    assertEquals(5, DestinationClass.named().size());
    assertFalse(DestinationClass.named().contains(DestinationClass.UNRESOLVED));
    assertFalse(DestinationClass.UNRESOLVED.isNamed());
  }

  @Test
  void unresolvedResultHasInfiniteDistance() {
    ClassificationResult result = ClassificationResult.unresolved();

    assertTrue(result.isUnresolved());
    assertEquals(Double.POSITIVE_INFINITY, result.score(), 0.0);
  }
}
