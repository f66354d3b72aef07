package capi.event;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventIdsTest {

  @Test
  void enrichmentIdIsDeterministic() {
    assertEquals(EventIds.enrichment("org-1", "txn-42"), EventIds.enrichment("org-1", "txn-42"));
  }

  @Test
  void enrichmentIdIsSha256OfTaggedMaterial() {
    String id = EventIds.enrichment("org-1", "txn-42");

    assertTrue(id.matches("[0-9a-f]{64}"));
    assertNotEquals(id, EventIds.enrichment("org-2", "txn-42"));
    assertNotEquals(id, EventIds.enrichment("org-1", "txn-43"));
  }

  @Test
  void primaryIdsAreUniqueUlids() {
    String first = EventIds.primary();
    String second = EventIds.primary();

    assertNotEquals(first, second);
    assertEquals(26, first.length());
    assertTrue(first.compareTo(second) < 0);
  }

  @Test
  void dedupeKeyJoinsNameTenantAndSource() {
    assertEquals("Purchase:org-1:txn-42", EventIds.dedupeKey("Purchase", "org-1", "txn-42"));
  }
}
