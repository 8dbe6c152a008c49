package io.ctxsync.core.merge;

import io.ctxsync.core.SourceSystem;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldAuthorityTest {

    @Test
    void exact_rule_beats_prefix_and_longest_prefix_wins() {
        var auth = FieldAuthority.of(Map.of(
                "crm_*", "B",
                "crm_owner*", "A",
                "crm_ownerId", "B"));

        assertEquals(Optional.of(SourceSystem.B), auth.ownerOf("crm_stage"));
        assertEquals(Optional.of(SourceSystem.A), auth.ownerOf("crm_ownerName"));
        assertEquals(Optional.of(SourceSystem.B), auth.ownerOf("crm_ownerId"));
        assertEquals(Optional.empty(), auth.ownerOf("title"));
    }

    @Test
    void merged_is_not_a_valid_owner() {
        assertThrows(IllegalArgumentException.class, () -> FieldAuthority.of(Map.of("x", "merged")));
        assertThrows(IllegalArgumentException.class, () -> FieldAuthority.of(Map.of("*", "A")));
    }

    @Test
    void empty_rules_assign_no_owner() {
        assertTrue(FieldAuthority.of(Map.of()).isEmpty());
        assertTrue(FieldAuthority.none().ownerOf("anything").isEmpty());
    }
}
