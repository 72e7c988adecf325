package hrl.java.store;

import hrl.core.error.NamespaceNotFoundException;
import hrl.core.error.ValidationException;
import hrl.core.model.Identifiers;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps namespace names to the opaque ids that prefix every key of the namespace.
 *
 * <p>Both directions are stored in the reserved namespace, so a tenant's data can
 * be found from its id alone. Registration is idempotent.
 */
public final class NamespaceRegistry {

    static final String ATTR_NAMESPACE = "namespace";
    static final String ATTR_NAMESPACE_ID = "namespace_id";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ItemStore store;

    public NamespaceRegistry(ItemStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * Registers {@code name}, returning its id. Registering an existing name
     * returns the id it already has.
     */
    public String register(String name) {
        Identifiers.namespace(name);
        if (Schema.SYSTEM_NAMESPACE.equals(name)) {
            throw new ValidationException("namespace", name, "is reserved");
        }
        String existing = lookup(name);
        if (existing != null) return existing;

        String id = newId();
        Item forward = Item.builder()
            .key(Schema.namespaceKey(name))
            .put(ATTR_NAMESPACE, name)
            .put(ATTR_NAMESPACE_ID, id)
            .build();
        try {
            store.write(PutRequest.create(forward));
        } catch (ConditionFailedException raced) {
            String winner = lookup(name);
            if (winner != null) return winner;
            throw raced;
        }
        Item reverse = Item.builder()
            .key(Schema.namespaceIdKey(id))
            .put(ATTR_NAMESPACE, name)
            .put(ATTR_NAMESPACE_ID, id)
            .build();
        store.write(PutRequest.overwrite(reverse));
        return id;
    }

    /**
     * @throws NamespaceNotFoundException if {@code name} was never registered
     */
    public String resolve(String name) {
        String id = lookup(name);
        if (id == null) throw new NamespaceNotFoundException(name);
        return id;
    }

    /** Registered namespaces, name to id, ordered by name. */
    public Map<String, String> list() {
        Map<String, String> namespaces = new LinkedHashMap<>();
        for (Item item : store.query(Schema.systemPartition(Schema.SYSTEM_NAMESPACE), Schema.SK_NAMESPACE_PREFIX)) {
            namespaces.put(item.getString(ATTR_NAMESPACE), item.getString(ATTR_NAMESPACE_ID));
        }
        return namespaces;
    }

    /** Name registered for {@code id}. */
    public String nameOf(String id) {
        return store.get(Schema.namespaceIdKey(id))
            .map(item -> item.getString(ATTR_NAMESPACE))
            .orElseThrow(() -> new NamespaceNotFoundException(id));
    }

    private String lookup(String name) {
        return store.get(Schema.namespaceKey(name)).map(item -> item.getString(ATTR_NAMESPACE_ID)).orElse(null);
    }

    /** 64 random bits, URL-safe base64 without padding: 11 characters. */
    static String newId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
