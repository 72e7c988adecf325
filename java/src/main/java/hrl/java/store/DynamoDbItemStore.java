package hrl.java.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.OperationType;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.Record;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ReturnValuesOnConditionCheckFailure;
import software.amazon.awssdk.services.dynamodb.model.StreamRecord;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ItemStore} over a DynamoDB table (AWS SDK v2).
 *
 * <p>The table has string keys {@code PK}/{@code SK}, the secondary indexes named
 * by {@link Index}, TTL on the {@code ttl} attribute and a stream with new and old
 * images. Provisioning the table is outside this class.
 *
 * <p>{@link ConditionalCheckFailedException} becomes {@link ConditionFailedException}
 * (with the old image when requested); every other SDK failure becomes
 * {@link StoreException}.
 */
public final class DynamoDbItemStore implements ItemStore {

    private static final Logger log = LoggerFactory.getLogger(DynamoDbItemStore.class);

    private static final int MAX_BATCH_GET = 100;
    private static final int MAX_BATCH_GET_ATTEMPTS = 5;
    private static final long BATCH_GET_BACKOFF_MS = 20;

    private final DynamoDbClient client;
    private final String tableName;

    public DynamoDbItemStore(DynamoDbClient client, String tableName) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("tableName cannot be empty");
        }
        this.client = client;
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public Optional<Item> get(ItemKey key) {
        try {
            GetItemResponse response = client.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(keyOf(key))
                .consistentRead(true)
                .build());
            return response.hasItem() && !response.item().isEmpty()
                ? Optional.of(fromAttributeValues(response.item()))
                : Optional.empty();
        } catch (SdkException e) {
            throw new StoreException("GetItem failed for " + key, e);
        }
    }

    @Override
    public List<Item> batchGet(List<ItemKey> keys) {
        List<Item> found = new ArrayList<>();
        for (int start = 0; start < keys.size(); start += MAX_BATCH_GET) {
            List<Map<String, AttributeValue>> pending = new ArrayList<>();
            for (ItemKey key : keys.subList(start, Math.min(keys.size(), start + MAX_BATCH_GET))) {
                pending.add(keyOf(key));
            }
            for (int attempt = 1; !pending.isEmpty(); attempt++) {
                if (attempt > 1) {
                    backOff(attempt, pending.size());
                }
                BatchGetItemResponse response;
                try {
                    response = client.batchGetItem(BatchGetItemRequest.builder()
                        .requestItems(Map.of(tableName, KeysAndAttributes.builder()
                            .keys(pending)
                            .consistentRead(true)
                            .build()))
                        .build());
                } catch (SdkException e) {
                    throw new StoreException("BatchGetItem failed", e);
                }
                for (Map<String, AttributeValue> item : response.responses().getOrDefault(tableName, List.of())) {
                    found.add(fromAttributeValues(item));
                }
                KeysAndAttributes unprocessed = response.unprocessedKeys().get(tableName);
                pending = unprocessed == null ? List.of() : new ArrayList<>(unprocessed.keys());
                if (!pending.isEmpty() && attempt >= MAX_BATCH_GET_ATTEMPTS) {
                    throw new StoreException("BatchGetItem left " + pending.size() + " keys unprocessed after "
                        + attempt + " attempts");
                }
            }
        }
        return found;
    }

    /** Sleeps before re-sending unprocessed keys, doubling per attempt. */
    private static void backOff(int attempt, int unprocessed) {
        long delayMs = BATCH_GET_BACKOFF_MS << (attempt - 2);
        log.debug("BatchGetItem returned {} unprocessed keys, retrying in {} ms", unprocessed, delayMs);
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("interrupted retrying BatchGetItem", e);
        }
    }

    @Override
    public Optional<Item> write(WriteRequest request) {
        if (request instanceof PutRequest) {
            put((PutRequest) request);
            return Optional.empty();
        }
        return update((UpdateRequest) request);
    }

    private void put(PutRequest put) {
        PutItemRequest.Builder b = PutItemRequest.builder()
            .tableName(tableName)
            .item(toAttributeValues(put.item()));
        if (put.ifNotExists()) {
            b.conditionExpression("attribute_not_exists(#pk)").expressionAttributeNames(Map.of("#pk", Item.PK));
        }
        try {
            client.putItem(b.build());
        } catch (ConditionalCheckFailedException e) {
            throw new ConditionFailedException(put.key(), null);
        } catch (SdkException e) {
            throw new StoreException("PutItem failed for " + put.key(), e);
        }
    }

    private Optional<Item> update(UpdateRequest update) {
        UpdateItemRequest request = toUpdateItemRequest(tableName, update);
        try {
            UpdateItemResponse response = client.updateItem(request);
            if (update.returnNew() && response.hasAttributes()) {
                return Optional.of(fromAttributeValues(response.attributes()));
            }
            return Optional.empty();
        } catch (ConditionalCheckFailedException e) {
            Map<String, AttributeValue> image = e.item();
            Item old = image != null && !image.isEmpty() ? fromAttributeValues(image) : null;
            throw new ConditionFailedException(update.key(), old);
        } catch (SdkException e) {
            throw new StoreException("UpdateItem failed for " + update.key(), e);
        }
    }

    static UpdateItemRequest toUpdateItemRequest(String tableName, UpdateRequest update) {
        DynamoDbExpressions expressions = new DynamoDbExpressions();
        String updateExpression = expressions.update(update);
        String conditionExpression = expressions.condition(update.conditions());

        UpdateItemRequest.Builder b = UpdateItemRequest.builder()
            .tableName(tableName)
            .key(keyOf(update.key()))
            .updateExpression(updateExpression)
            .expressionAttributeNames(expressions.names())
            .returnValues(update.returnNew() ? ReturnValue.ALL_NEW : ReturnValue.NONE);
        if (!expressions.values().isEmpty()) {
            b.expressionAttributeValues(expressions.values());
        }
        if (conditionExpression != null) {
            b.conditionExpression(conditionExpression);
        }
        if (update.returnOldOnFailure()) {
            b.returnValuesOnConditionCheckFailure(ReturnValuesOnConditionCheckFailure.ALL_OLD);
        }
        return b.build();
    }

    @Override
    public void delete(ItemKey key) {
        try {
            client.deleteItem(DeleteItemRequest.builder().tableName(tableName).key(keyOf(key)).build());
        } catch (SdkException e) {
            throw new StoreException("DeleteItem failed for " + key, e);
        }
    }

    @Override
    public List<Item> query(String partition, String sortPrefix) {
        return runQuery(null, Item.PK, Item.SK, partition, sortPrefix);
    }

    @Override
    public List<Item> queryIndex(Index index, String partition, String sortPrefix) {
        return runQuery(index.indexName(), index.partitionAttribute(), index.sortAttribute(), partition, sortPrefix);
    }

    private List<Item> runQuery(String indexName, String pkAttribute, String skAttribute,
                                String partition, String sortPrefix) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();
        names.put("#pk", pkAttribute);
        values.put(":pk", AttributeValue.fromS(partition));
        String keyCondition = "#pk = :pk";
        if (sortPrefix != null && !sortPrefix.isEmpty()) {
            names.put("#sk", skAttribute);
            values.put(":sk", AttributeValue.fromS(sortPrefix));
            keyCondition += " AND begins_with(#sk, :sk)";
        }
        QueryRequest.Builder b = QueryRequest.builder()
            .tableName(tableName)
            .keyConditionExpression(keyCondition)
            .expressionAttributeNames(names)
            .expressionAttributeValues(values);
        if (indexName != null) {
            b.indexName(indexName);
        } else {
            b.consistentRead(true);
        }
        List<Item> found = new ArrayList<>();
        try {
            for (Map<String, AttributeValue> item : client.queryPaginator(b.build()).items()) {
                found.add(fromAttributeValues(item));
            }
        } catch (SdkException e) {
            throw new StoreException("Query failed for " + partition, e);
        }
        return found;
    }

    @Override
    public void close() {
        client.close();
    }

    /**
     * Converts a DynamoDB stream record into a {@link ChangeEvent}.
     */
    public static ChangeEvent toChangeEvent(Record record) {
        StreamRecord stream = record.dynamodb();
        Item oldImage = stream.hasOldImage() ? fromAttributeValues(stream.oldImage()) : null;
        Item newImage = stream.hasNewImage() ? fromAttributeValues(stream.newImage()) : null;
        Item keys = fromAttributeValues(stream.keys());
        ChangeEvent.Type type;
        OperationType operation = record.eventName();
        if (operation == OperationType.INSERT) {
            type = ChangeEvent.Type.INSERT;
        } else if (operation == OperationType.REMOVE) {
            type = ChangeEvent.Type.REMOVE;
        } else {
            type = ChangeEvent.Type.MODIFY;
        }
        return new ChangeEvent(type, keys.key(), oldImage, newImage);
    }

    static Map<String, AttributeValue> keyOf(ItemKey key) {
        Map<String, AttributeValue> map = new HashMap<>();
        map.put(Item.PK, AttributeValue.fromS(key.partition()));
        map.put(Item.SK, AttributeValue.fromS(key.sort()));
        return map;
    }

    static Map<String, AttributeValue> toAttributeValues(Item item) {
        Map<String, AttributeValue> map = new LinkedHashMap<>();
        item.asMap().forEach((name, value) -> map.put(name, toAttributeValue(value)));
        return map;
    }

    static AttributeValue toAttributeValue(Object value) {
        if (value instanceof String) return AttributeValue.fromS((String) value);
        if (value instanceof Number) return AttributeValue.fromN(Long.toString(((Number) value).longValue()));
        if (value instanceof Boolean) return AttributeValue.fromBool((Boolean) value);
        if (value instanceof Map) {
            Map<String, AttributeValue> m = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> m.put(String.valueOf(k), AttributeValue.fromS(String.valueOf(v))));
            return AttributeValue.fromM(m);
        }
        throw new IllegalArgumentException("Unsupported attribute value: " + value);
    }

    static Item fromAttributeValues(Map<String, AttributeValue> attributes) {
        Item.Builder b = Item.builder();
        attributes.forEach((name, value) -> b.put(name, fromAttributeValue(value)));
        return b.build();
    }

    private static Object fromAttributeValue(AttributeValue value) {
        if (value.s() != null) return value.s();
        if (value.n() != null) return Long.parseLong(value.n());
        if (value.bool() != null) return value.bool();
        if (value.hasM()) {
            Map<String, String> m = new LinkedHashMap<>();
            value.m().forEach((k, v) -> m.put(k, v.s() != null ? v.s() : v.n()));
            return m;
        }
        return null;
    }
}
