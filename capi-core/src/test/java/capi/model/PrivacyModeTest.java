package capi.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PrivacyModeTest {

  @Test
  void parsesKnownNames() {
    assertEquals(PrivacyMode.STANDARD, PrivacyMode.parse("standard"));
    assertEquals(PrivacyMode.STANDARD, PrivacyMode.parse(" Balanced "));
    assertEquals(PrivacyMode.CONSERVATIVE, PrivacyMode.parse("conservative"));
  }

  @Test
  void unknownOrMissingFallsBackToConservative() {
    assertEquals(PrivacyMode.CONSERVATIVE, PrivacyMode.parse(null));
    assertEquals(PrivacyMode.CONSERVATIVE, PrivacyMode.parse("aggressive"));
  }

  @Test
  void storageNameIsLowercase() {
    assertEquals("standard", PrivacyMode.STANDARD.storageName());
  }
}
