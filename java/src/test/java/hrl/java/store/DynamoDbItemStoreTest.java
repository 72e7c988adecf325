package hrl.java.store;

import hrl.core.model.Amounts;
import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;
import hrl.core.model.Limit;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.OperationType;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.Record;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ReturnValuesOnConditionCheckFailure;
import software.amazon.awssdk.services.dynamodb.model.StreamRecord;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the DynamoDB adapter without a network: request rendering, error
 * translation against a stubbed client, and stream record conversion.
 */
class DynamoDbItemStoreTest {

    private static final String TABLE = "rate_limits";
    private static final ItemKey KEY = Schema.bucketKey("ns1", "user-1", "gpt-4");

    /** Client whose calls are answered by the overridden methods; anything else is unsupported. */
    private abstract static class StubClient implements DynamoDbClient {
        @Override
        public String serviceName() {
            return SERVICE_NAME;
        }

        @Override
        public void close() {
        }
    }

    @Test
    void testUpdateRequest_rendersPlaceholders() {
        UpdateRequest update = UpdateRequest.builder(KEY)
            .condition(Condition.equalTo("rf", 100L))
            .condition(Condition.atLeast("b_rpm_tk", 1_000))
            .condition(Condition.notExists("b_tpm_tk"))
            .set("rf", 200L)
            .setIfAbsent("name", "x")
            .add("b_rpm_tk", -1_000)
            .remove("ttl")
            .returnNew()
            .returnOldOnFailure()
            .build();

        UpdateItemRequest request = DynamoDbItemStore.toUpdateItemRequest(TABLE, update);

        assertEquals(TABLE, request.tableName());
        assertEquals("SET #a0 = :v0, #a1 = if_not_exists(#a1, :v1) ADD #a2 :v2 REMOVE #a3", request.updateExpression());
        assertEquals("#a0 = :v3 AND #a2 >= :v4 AND attribute_not_exists(#a4)", request.conditionExpression());
        assertEquals(Map.of("#a0", "rf", "#a1", "name", "#a2", "b_rpm_tk", "#a3", "ttl", "#a4", "b_tpm_tk"),
            request.expressionAttributeNames());
        assertEquals("-1000", request.expressionAttributeValues().get(":v2").n());
        assertEquals("100", request.expressionAttributeValues().get(":v3").n());
        assertEquals(ReturnValue.ALL_NEW, request.returnValues());
        assertEquals(ReturnValuesOnConditionCheckFailure.ALL_OLD, request.returnValuesOnConditionCheckFailure());
        assertEquals("ns1/BUCKET#user-1#gpt-4#0", request.key().get(Item.PK).s());
    }

    @Test
    void testUpdateRequest_fromRetryShape() {
        UpdateRequest retry = new BucketRepository(new InMemoryItemStore(), "ns1")
            .buildRetry("user-1", "gpt-4", Amounts.of("rpm", 2_000));

        UpdateItemRequest request = DynamoDbItemStore.toUpdateItemRequest(TABLE, retry);

        assertEquals(ReturnValue.NONE, request.returnValues());
        assertNull(request.returnValuesOnConditionCheckFailure());
        assertTrue(request.conditionExpression().startsWith("attribute_exists("));
        assertTrue(request.updateExpression().startsWith("ADD "));
    }

    @Test
    void testUpdateRequest_fromCreateShape() {
        CompositeBucket bucket = new CompositeBucket("user-1", "gpt-4", 1_700_000_000_000L, null, false,
            List.of(BucketState.fromLimit("user-1", "gpt-4", Limit.perMinute("rpm", 100), 1_700_000_000_000L)));
        UpdateRequest create = new BucketRepository(new InMemoryItemStore(), "ns1").buildCreate(bucket, null);

        UpdateItemRequest request = DynamoDbItemStore.toUpdateItemRequest(TABLE, create);

        assertTrue(request.conditionExpression().startsWith("attribute_not_exists("));
        assertTrue(request.updateExpression().startsWith("SET "));
        // Key attributes go in the key, never in the update expression
        assertFalse(request.expressionAttributeNames().containsValue(Item.PK));
        assertFalse(request.expressionAttributeNames().containsValue(Item.SK));
        assertTrue(request.expressionAttributeNames().containsValue("rf"));
    }

    @Test
    void testAttributeValues_roundTripTypes() {
        Item item = Item.builder().key(KEY)
            .put("s", "text")
            .put("n", 42L)
            .put("b", true)
            .put("m", Map.of("k", "v"))
            .build();

        Map<String, AttributeValue> values = DynamoDbItemStore.toAttributeValues(item);

        assertEquals("42", values.get("n").n());
        assertTrue(values.get("b").bool());
        assertEquals("v", values.get("m").m().get("k").s());
        assertEquals(item, DynamoDbItemStore.fromAttributeValues(values));
    }

    @Test
    void testGet_translatesSdkFailure() {
        DynamoDbItemStore store = new DynamoDbItemStore(new StubClient() {
            @Override
            public GetItemResponse getItem(GetItemRequest request) {
                throw SdkClientException.create("connection refused");
            }
        }, TABLE);

        StoreException e = assertThrows(StoreException.class, () -> store.get(KEY));
        assertInstanceOf(SdkClientException.class, e.getCause());
    }

    @Test
    void testGet_usesConsistentReads() {
        AtomicReference<GetItemRequest> seen = new AtomicReference<>();
        DynamoDbItemStore store = new DynamoDbItemStore(new StubClient() {
            @Override
            public GetItemResponse getItem(GetItemRequest request) {
                seen.set(request);
                return GetItemResponse.builder().build();
            }
        }, TABLE);

        assertTrue(store.get(KEY).isEmpty());
        assertTrue(seen.get().consistentRead());
    }

    @Test
    void testUpdate_conditionFailureCarriesOldImage() {
        Item old = BucketCodec.encode("ns1", new CompositeBucket("user-1", "gpt-4", 5L, null, false,
            List.of(BucketState.fromLimit("user-1", "gpt-4", Limit.perMinute("rpm", 10), 5L))), null);
        DynamoDbItemStore store = new DynamoDbItemStore(new StubClient() {
            @Override
            public UpdateItemResponse updateItem(UpdateItemRequest request) {
                throw ConditionalCheckFailedException.builder()
                    .item(DynamoDbItemStore.toAttributeValues(old))
                    .message("The conditional request failed")
                    .build();
            }
        }, TABLE);
        UpdateRequest update = UpdateRequest.builder(KEY)
            .condition(Condition.equalTo("rf", 1L))
            .set("rf", 2L)
            .returnOldOnFailure()
            .build();

        ConditionFailedException e = assertThrows(ConditionFailedException.class, () -> store.write(update));
        assertEquals(old, e.oldImage().orElseThrow());
    }

    @Test
    void testPut_createUsesNotExistsCondition() {
        AtomicReference<PutItemRequest> seen = new AtomicReference<>();
        DynamoDbItemStore store = new DynamoDbItemStore(new StubClient() {
            @Override
            public PutItemResponse putItem(PutItemRequest request) {
                seen.set(request);
                if (request.conditionExpression() != null) {
                    throw ConditionalCheckFailedException.builder().message("exists").build();
                }
                return PutItemResponse.builder().build();
            }
        }, TABLE);
        Item item = Item.builder().key(KEY).put("v", 1L).build();

        store.write(PutRequest.overwrite(item));
        assertNull(seen.get().conditionExpression());
        assertThrows(ConditionFailedException.class, () -> store.write(PutRequest.create(item)));
        assertEquals("attribute_not_exists(#pk)", seen.get().conditionExpression());
    }

    private static BatchGetItemResponse batchResponse(List<Map<String, AttributeValue>> items,
                                                      List<Map<String, AttributeValue>> unprocessed) {
        BatchGetItemResponse.Builder b = BatchGetItemResponse.builder().responses(Map.of(TABLE, items));
        if (!unprocessed.isEmpty()) {
            b.unprocessedKeys(Map.of(TABLE, KeysAndAttributes.builder().keys(unprocessed).build()));
        }
        return b.build();
    }

    @Test
    void testBatchGet_resendsUnprocessedKeys() {
        ItemKey other = Schema.bucketKey("ns1", "user-2", "gpt-4");
        Item first = Item.builder().key(KEY).put("rf", 1L).build();
        Item second = Item.builder().key(other).put("rf", 2L).build();
        List<Integer> requestSizes = new ArrayList<>();
        DynamoDbItemStore store = new DynamoDbItemStore(new StubClient() {
            @Override
            public BatchGetItemResponse batchGetItem(BatchGetItemRequest request) {
                List<Map<String, AttributeValue>> keys = request.requestItems().get(TABLE).keys();
                requestSizes.add(keys.size());
                if (requestSizes.size() == 1) {
                    return batchResponse(List.of(DynamoDbItemStore.toAttributeValues(first)), List.of(keys.get(1)));
                }
                return batchResponse(List.of(DynamoDbItemStore.toAttributeValues(second)), List.of());
            }
        }, TABLE);

        List<Item> found = store.batchGet(List.of(KEY, other));

        assertEquals(List.of(first, second), found);
        assertEquals(List.of(2, 1), requestSizes);
    }

    @Test
    void testBatchGet_givesUpAfterBoundedAttempts() {
        AtomicInteger calls = new AtomicInteger();
        DynamoDbItemStore store = new DynamoDbItemStore(new StubClient() {
            @Override
            public BatchGetItemResponse batchGetItem(BatchGetItemRequest request) {
                calls.incrementAndGet();
                return batchResponse(List.of(), request.requestItems().get(TABLE).keys());
            }
        }, TABLE);

        StoreException e = assertThrows(StoreException.class, () -> store.batchGet(List.of(KEY)));

        assertEquals(5, calls.get());
        assertTrue(e.getMessage().contains("unprocessed"));
    }

    @Test
    void testToChangeEvent() {
        Map<String, AttributeValue> keys = DynamoDbItemStore.keyOf(KEY);
        Map<String, AttributeValue> before = Map.of(Item.PK, AttributeValue.fromS(KEY.partition()),
            Item.SK, AttributeValue.fromS(KEY.sort()), "b_rpm_tk", AttributeValue.fromN("5000"));
        Map<String, AttributeValue> after = Map.of(Item.PK, AttributeValue.fromS(KEY.partition()),
            Item.SK, AttributeValue.fromS(KEY.sort()), "b_rpm_tk", AttributeValue.fromN("4000"));

        ChangeEvent modify = DynamoDbItemStore.toChangeEvent(Record.builder()
            .eventName(OperationType.MODIFY)
            .dynamodb(StreamRecord.builder().keys(keys).oldImage(before).newImage(after).build())
            .build());
        ChangeEvent insert = DynamoDbItemStore.toChangeEvent(Record.builder()
            .eventName(OperationType.INSERT)
            .dynamodb(StreamRecord.builder().keys(keys).newImage(after).build())
            .build());

        assertEquals(ChangeEvent.Type.MODIFY, modify.type());
        assertEquals(KEY, modify.key());
        assertEquals(5000L, modify.oldImage().getLong("b_rpm_tk", 0L));
        assertEquals(4000L, modify.newImage().getLong("b_rpm_tk", 0L));
        assertEquals(ChangeEvent.Type.INSERT, insert.type());
        assertTrue(insert.before().isEmpty());
    }
}
