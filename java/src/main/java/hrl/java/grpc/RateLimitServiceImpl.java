package hrl.java.grpc;

import hrl.core.error.RateLimitExceededException;
import hrl.core.error.RateLimiterUnavailableException;
import hrl.core.error.ValidationException;
import hrl.core.model.Limit;
import hrl.core.model.LimitStatus;
import hrl.java.engine.AcquireRequest;
import hrl.java.engine.RateLimiterEngine;
import hrl.proto.AvailableRequest;
import hrl.proto.AvailableResponse;
import hrl.proto.CheckRateLimitRequest;
import hrl.proto.CheckRateLimitResponse;
import hrl.proto.HealthCheckRequest;
import hrl.proto.HealthCheckResponse;
import hrl.proto.LimitCheck;
import hrl.proto.LimitDefinition;
import hrl.proto.RateLimitServiceGrpc;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * gRPC service over {@link RateLimiterEngine}.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>Malformed requests: INVALID_ARGUMENT</li>
 *   <li>Limit exceeded: OK with {@code allowed=false} and per-limit detail</li>
 *   <li>Store unreachable under fail-closed: UNAVAILABLE</li>
 *   <li>Anything else: INTERNAL</li>
 * </ul>
 *
 * <p>Thread-safety: stateless; the engine handles concurrent RPCs.
 */
public final class RateLimitServiceImpl extends RateLimitServiceGrpc.RateLimitServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(RateLimitServiceImpl.class);

    private final RateLimiterEngine engine;

    /**
     * @throws IllegalArgumentException if engine is null
     */
    public RateLimitServiceImpl(RateLimiterEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    @Override
    public void checkRateLimit(
        CheckRateLimitRequest request,
        StreamObserver<CheckRateLimitResponse> responseObserver
    ) {
        try {
            // protobuf strings are never null, only empty
            if (request.getEntityId().isEmpty()) {
                responseObserver.onError(invalid("entity_id must not be empty"));
                return;
            }
            if (request.getResource().isEmpty()) {
                responseObserver.onError(invalid("resource must not be empty"));
                return;
            }
            for (Map.Entry<String, Long> e : request.getConsumeMap().entrySet()) {
                if (e.getValue() < 0) {
                    responseObserver.onError(invalid("consume[" + e.getKey() + "] must be >= 0, got: " + e.getValue()));
                    return;
                }
            }

            AcquireRequest.Builder acquire = AcquireRequest.builder(request.getEntityId(), request.getResource())
                .consume(request.getConsumeMap())
                .limits(toLimits(request.getLimitsList()));
            if (request.getUseStoredLimits()) {
                acquire.useStoredLimits(true);
            }

            CheckRateLimitResponse response;
            try {
                engine.acquire(acquire.build()).commit();
                response = CheckRateLimitResponse.newBuilder().setAllowed(true).build();
            } catch (RateLimitExceededException e) {
                response = rejected(e);
            }

            responseObserver.onNext(response);
            responseObserver.onCompleted();

        } catch (ValidationException | IllegalArgumentException e) {
            responseObserver.onError(invalid(e));
        } catch (RateLimiterUnavailableException e) {
            responseObserver.onError(unavailable(e));
        } catch (Exception e) {
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void available(AvailableRequest request, StreamObserver<AvailableResponse> responseObserver) {
        try {
            if (request.getEntityId().isEmpty()) {
                responseObserver.onError(invalid("entity_id must not be empty"));
                return;
            }
            if (request.getResource().isEmpty()) {
                responseObserver.onError(invalid("resource must not be empty"));
                return;
            }

            Map<String, Long> available = engine.available(
                request.getEntityId(), request.getResource(), toLimits(request.getLimitsList()));

            responseObserver.onNext(AvailableResponse.newBuilder().putAllAvailable(available).build());
            responseObserver.onCompleted();

        } catch (ValidationException | IllegalArgumentException e) {
            responseObserver.onError(invalid(e));
        } catch (RateLimiterUnavailableException e) {
            responseObserver.onError(unavailable(e));
        } catch (Exception e) {
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    /**
     * Zero burst or refill amount default to the capacity.
     *
     * @throws IllegalArgumentException if a definition is out of range
     */
    static List<Limit> toLimits(List<LimitDefinition> definitions) {
        List<Limit> limits = new ArrayList<>(definitions.size());
        for (LimitDefinition d : definitions) {
            long burst = d.getBurst() == 0 ? d.getCapacity() : d.getBurst();
            long refillAmount = d.getRefillAmount() == 0 ? d.getCapacity() : d.getRefillAmount();
            limits.add(new Limit(d.getName(), d.getCapacity(), burst, refillAmount, d.getRefillPeriodSeconds()));
        }
        return limits;
    }

    private static CheckRateLimitResponse rejected(RateLimitExceededException e) {
        CheckRateLimitResponse.Builder response = CheckRateLimitResponse.newBuilder()
            .setAllowed(false)
            .setRetryAfterMs(e.retryAfterMillis());
        for (LimitStatus s : e.statuses()) {
            response.addLimits(LimitCheck.newBuilder()
                .setEntityId(s.entityId())
                .setLimitName(s.limitName())
                .setAvailable(s.available())
                .setRequested(s.requested())
                .setExceeded(s.exceeded())
                .setRetryAfterMs(Math.round(s.retryAfterSeconds() * 1000)));
        }
        return response.build();
    }

    private static StatusRuntimeException invalid(String description) {
        return Status.INVALID_ARGUMENT
            .withDescription(description)
            .asRuntimeException();
    }

    private static StatusRuntimeException invalid(Exception e) {
        return Status.INVALID_ARGUMENT
            .withDescription(e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }

    private static StatusRuntimeException unavailable(RateLimiterUnavailableException e) {
        log.atWarn()
            .addKeyValue("entity_id", e.entityId())
            .addKeyValue("resource", e.resource())
            .log("Rejecting RPC, store unavailable");
        return Status.UNAVAILABLE
            .withDescription(e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }

    private static StatusRuntimeException internal(Exception e) {
        log.error("Unexpected error serving RPC", e);
        return Status.INTERNAL
            .withDescription("Internal error: " + e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }
}
