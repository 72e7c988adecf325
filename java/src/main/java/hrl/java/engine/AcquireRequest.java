package hrl.java.engine;

import hrl.core.error.ValidationException;
import hrl.core.model.Amounts;
import hrl.core.model.FailureMode;
import hrl.core.model.Identifiers;
import hrl.core.model.Limit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parameters of one {@link RateLimiterEngine#acquire(AcquireRequest)} call.
 * Identifiers and amounts are validated when the request is built, before any
 * store access.
 */
public final class AcquireRequest {

    private final String entityId;
    private final String resource;
    private final Amounts consume;
    private final List<Limit> limits;
    private final boolean useStoredLimits;
    private final FailureMode failureMode;
    private final String principal;
    private final Boolean cascade;

    private AcquireRequest(Builder b) {
        this.entityId = b.entityId;
        this.resource = b.resource;
        this.consume = b.consume;
        this.limits = List.copyOf(b.limits);
        this.useStoredLimits = b.useStoredLimits != null ? b.useStoredLimits : b.limits.isEmpty();
        this.failureMode = b.failureMode;
        this.principal = b.principal;
        this.cascade = b.cascade;
    }

    public static Builder builder(String entityId, String resource) {
        return new Builder(entityId, resource);
    }

    public String entityId() {
        return entityId;
    }

    public String resource() {
        return resource;
    }

    /** Whole tokens to take per limit name. */
    public Amounts consume() {
        return consume;
    }

    /** Caller-supplied limits: used directly, or as the fallback when stored limits are used. */
    public List<Limit> limits() {
        return limits;
    }

    public boolean useStoredLimits() {
        return useStoredLimits;
    }

    /** Per-call failure mode, or {@code null} for the stored or engine default. */
    public FailureMode failureMode() {
        return failureMode;
    }

    public String principal() {
        return principal;
    }

    /** Cascade override, or {@code null} to follow the entity's own setting. */
    public Boolean cascade() {
        return cascade;
    }

    public static final class Builder {
        private final String entityId;
        private final String resource;
        private Amounts consume = Amounts.empty();
        private final List<Limit> limits = new ArrayList<>();
        private Boolean useStoredLimits;
        private FailureMode failureMode;
        private String principal;
        private Boolean cascade;

        private Builder(String entityId, String resource) {
            this.entityId = entityId;
            this.resource = resource;
        }

        public Builder consume(Amounts amounts) {
            this.consume = amounts;
            return this;
        }

        public Builder consume(String limitName, long amount) {
            this.consume = consume.plus(Amounts.of(limitName, amount));
            return this;
        }

        public Builder consume(Map<String, ? extends Number> amounts) {
            this.consume = Amounts.copyOf(amounts);
            return this;
        }

        public Builder limits(List<Limit> limits) {
            this.limits.clear();
            this.limits.addAll(limits);
            return this;
        }

        public Builder limits(Limit... limits) {
            return limits(Arrays.asList(limits));
        }

        /**
         * Resolve limits from stored configuration, falling back to {@link #limits}.
         * Defaults to true exactly when no limits are supplied.
         */
        public Builder useStoredLimits(boolean useStored) {
            this.useStoredLimits = useStored;
            return this;
        }

        public Builder failureMode(FailureMode mode) {
            this.failureMode = mode;
            return this;
        }

        public Builder principal(String principal) {
            this.principal = principal;
            return this;
        }

        public Builder cascade(boolean cascade) {
            this.cascade = cascade;
            return this;
        }

        /**
         * @throws ValidationException on a malformed identifier, a negative amount
         *                             or duplicate limit names
         */
        public AcquireRequest build() {
            Identifiers.entityId(entityId);
            Identifiers.resource(resource);
            if (principal != null) {
                Identifiers.principal(principal);
            }
            if (consume == null) {
                throw new ValidationException("consume", null, "cannot be null");
            }
            consume.asMap().forEach((name, amount) -> {
                if (amount < 0) {
                    throw new ValidationException("consume", name, "amount must be >= 0");
                }
            });
            checkUniqueNames(limits);
            return new AcquireRequest(this);
        }
    }

    static void checkUniqueNames(List<Limit> limits) {
        Set<String> seen = new HashSet<>();
        for (Limit limit : limits) {
            if (!seen.add(limit.name())) {
                throw new ValidationException("limits", limit.name(), "duplicate limit name");
            }
        }
    }
}
