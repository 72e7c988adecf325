package hrl.core.model;

import java.util.List;

/**
 * Effective limits for an (entity, resource) pair.
 *
 * @param onUnavailable stored failure mode, or {@code null} to use the engine default
 */
public record LimitResolution(List<Limit> limits, FailureMode onUnavailable, ConfigSource source) {
    public LimitResolution {
        limits = List.copyOf(limits);
    }
}
