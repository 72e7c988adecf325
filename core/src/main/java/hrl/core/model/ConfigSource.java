package hrl.core.model;

/** Level of the configuration hierarchy limits were resolved from. */
public enum ConfigSource {
    ENTITY,
    ENTITY_DEFAULT,
    RESOURCE,
    SYSTEM,
    OVERRIDE
}
