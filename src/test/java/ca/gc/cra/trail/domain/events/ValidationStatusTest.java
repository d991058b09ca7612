package ca.gc.cra.trail.domain.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ValidationStatusTest {

  @Test
  void normalizeMapsAliases() {
    assertEquals(ValidationStatus.PASS, ValidationStatus.normalize("Passed"));
    assertEquals(ValidationStatus.PASS, ValidationStatus.normalize(true));
    assertEquals(ValidationStatus.FAIL, ValidationStatus.normalize(" error "));
    assertEquals(ValidationStatus.FAIL, ValidationStatus.normalize(Boolean.FALSE));
    assertEquals(ValidationStatus.WARNING, ValidationStatus.normalize("warn"));
  }

  @Test
  void unknownAndNullBecomeSkipped() {
    assertEquals(ValidationStatus.SKIPPED, ValidationStatus.normalize(null));
    assertEquals(ValidationStatus.SKIPPED, ValidationStatus.normalize("maybe"));
  }

  @Test
  void fromWireAcceptsOnlyCanonicalNames() {
    assertEquals(Optional.of(ValidationStatus.WARNING), ValidationStatus.fromWire("WARNING"));
    assertTrue(ValidationStatus.fromWire("passed").isEmpty());
  }
}
