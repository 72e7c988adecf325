package hrl.java.store;

/**
 * Secondary indexes over the item table.
 */
public enum Index {
    /** Children of a parent entity. */
    PARENT("GSI1"),
    /** Buckets and usage snapshots of a resource. */
    RESOURCE("GSI2"),
    /** Entities with custom limits on a resource. */
    ENTITY_CONFIG("GSI3"),
    /** Buckets of an entity, across resources. */
    ENTITY_BUCKETS("GSI4");

    private final String indexName;

    Index(String indexName) {
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }

    public String partitionAttribute() {
        return indexName + "PK";
    }

    public String sortAttribute() {
        return indexName + "SK";
    }
}
