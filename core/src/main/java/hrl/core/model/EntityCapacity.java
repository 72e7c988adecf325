package hrl.core.model;

public record EntityCapacity(String entityId, long capacity, long available, double utilizationPct) {
}
