package hrl.java.store;

import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;
import hrl.core.model.Limit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the bucket wire encoding and key layout.
 */
class BucketCodecTest {

    private static final long T0 = 1_700_000_000_000L;

    private static CompositeBucket bucket() {
        return new CompositeBucket("team-a", "gpt-4", T0, "org-1", true, List.of(
            BucketState.fromLimit("team-a", "gpt-4", Limit.perMinute("rpm", 100), T0),
            BucketState.fromLimit("team-a", "gpt-4", Limit.perMinute("tpm", 10_000, 15_000), T0)));
    }

    @Test
    void testEncode_flatAttributesAndIndexes() {
        Item item = BucketCodec.encode("ns1", bucket(), null);

        assertEquals("ns1/BUCKET#team-a#gpt-4#0", item.getString(Item.PK));
        assertEquals(Schema.SK_STATE, item.getString(Item.SK));
        assertEquals(100_000L, item.getLong("b_rpm_tk", 0L));
        assertEquals(15_000_000L, item.getLong("b_tpm_bx", 0L));
        assertEquals(60_000L, item.getLong("b_tpm_rp", 0L));
        assertEquals(0L, item.getLong("b_rpm_tc", -1L));
        assertEquals(T0, item.getLong("rf", 0L));
        assertEquals("org-1", item.getString("parent_id"));
        assertTrue(item.getBoolean("cascade", false));
        assertEquals("ns1/RESOURCE#gpt-4", item.getString("GSI2PK"));
        assertEquals("BUCKET#team-a#0", item.getString("GSI2SK"));
        assertEquals("ns1/ENTITY#team-a", item.getString("GSI4PK"));
        assertEquals("BUCKET#gpt-4#0", item.getString("GSI4SK"));
        assertFalse(item.has("ttl"));
    }

    @Test
    void testDecode_matchesEncoded() {
        CompositeBucket decoded = BucketCodec.decode(BucketCodec.encode("ns1", bucket(), 42L));

        assertEquals(bucket(), decoded);
        assertEquals(Set.of("rpm", "tpm"), decoded.limitNames());
    }

    @Test
    void testDecode_skipsIncompleteLimit() {
        Item item = BucketCodec.encode("ns1", bucket(), null).toBuilder()
            .remove(BucketCodec.attr("tpm", BucketCodec.REFILL_PERIOD))
            .build();

        CompositeBucket decoded = BucketCodec.decode(item);

        assertEquals(List.of("rpm"), List.copyOf(decoded.limitNames()));
    }

    @Test
    void testDecode_fallsBackToPartitionKey() {
        Item item = BucketCodec.encode("ns1", bucket(), null).toBuilder()
            .remove(Schema.ATTR_ENTITY_ID)
            .remove(Schema.ATTR_RESOURCE)
            .build();

        CompositeBucket decoded = BucketCodec.decode(item);

        assertEquals("team-a", decoded.entityId());
        assertEquals("gpt-4", decoded.resource());
    }

    @Test
    void testIsBucket() {
        assertTrue(BucketCodec.isBucket(BucketCodec.encode("ns1", bucket(), null)));
        assertFalse(BucketCodec.isBucket(Item.builder().key(Schema.entityKey("ns1", "team-a")).build()));
        assertFalse(BucketCodec.isBucket(null));
    }

    @Test
    void testParseBucketPartition() {
        Schema.BucketPartition parsed = Schema.parseBucketPartition("abc/BUCKET#user-1#gpt-4#0");

        assertEquals(new Schema.BucketPartition("abc", "user-1", "gpt-4", 0), parsed);
        assertNull(Schema.parseBucketPartition("abc/ENTITY#user-1"));
        assertNull(Schema.parseBucketPartition("abc/BUCKET#user-1#gpt-4#x"));
        assertNull(Schema.parseBucketPartition("no-slash"));
    }

    @Test
    void testKeysArePrefixedByNamespace() {
        assertEquals("ns1/ENTITY#user-1", Schema.entityKey("ns1", "user-1").partition());
        assertEquals("#CONFIG#gpt-4", Schema.entityConfigKey("ns1", "user-1", "gpt-4").sort());
        assertEquals("ns1/SYSTEM#", Schema.systemConfigKey("ns1").partition());
        assertEquals("_/SYSTEM#", Schema.namespaceKey("prod").partition());
        assertEquals("#USAGE#gpt-4#hourly#2024-01-01T00:00:00Z",
            Schema.usageKey("ns1", "user-1", "gpt-4", "hourly", "2024-01-01T00:00:00Z").sort());
    }
}
