package capi.privacy;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ClickIdsTest {

  @Test
  void acceptsKnownClickIdShapes() {
    assertTrue(ClickIds.isValid("fb_fb.1.1700000000.AbCdEf"));
    assertTrue(ClickIds.isValid("fb_IwY2xjawExample"));
    assertTrue(ClickIds.isValid("fb_PAZXh0bgNhZW0"));
    assertTrue(ClickIds.isValid("fb_abcdefghijklmno123"));
  }

  @Test
  void rejectsProcessorTrackingCodesAndShortIds() {
    assertFalse(ClickIds.isValid("ab_1234567890abcdef"));
    assertFalse(ClickIds.isValid("fb_short"));
    assertFalse(ClickIds.isValid("fb_has spaces in the id"));
    assertFalse(ClickIds.isValid(null));
  }

  @Test
  void extractStripsRedirectPrefix() {
    assertEquals(Optional.of("fb.1.1700000000.AbCdEf"), ClickIds.extract("fb_fb.1.1700000000.AbCdEf"));
    assertEquals(Optional.empty(), ClickIds.extract("ab_1234567890abcdef"));
  }
}
