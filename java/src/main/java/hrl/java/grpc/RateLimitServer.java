package hrl.java.grpc;

import hrl.core.clock.SystemClock;
import hrl.java.engine.RateLimiterEngine;
import hrl.java.reconcile.ReconciliationLoop;
import hrl.java.reconcile.ReconciliationWorker;
import hrl.java.reconcile.WorkerConfig;
import hrl.java.store.DynamoDbItemStore;
import hrl.java.store.InMemoryItemStore;
import hrl.java.store.ItemStore;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the rate limiting service.
 *
 * <p>Options, all optional:
 * <pre>
 * --port=9090
 * --namespace=default
 * --table=rate_limits
 * --region=us-east-1
 * --dynamodb-endpoint=http://localhost:8000
 * </pre>
 *
 * <p>With {@code --table} the server runs against DynamoDB, otherwise against
 * an in-memory store whose change stream is reconciled in-process.
 */
public final class RateLimitServer {

    private static final Logger log = LoggerFactory.getLogger(RateLimitServer.class);

    private static final int DEFAULT_PORT = 9090;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final Duration RECONCILE_INTERVAL = Duration.ofSeconds(1);
    private static final int RECONCILE_BATCH_SIZE = 100;

    private final Server server;
    private final RateLimiterEngine engine;
    private final ItemStore store;
    private final ReconciliationLoop reconciliation;

    /**
     * Creates a server with a caller-owned engine (useful for testing).
     */
    public RateLimitServer(int port, RateLimiterEngine engine) {
        this(port, engine, null, null);
    }

    private RateLimitServer(int port, RateLimiterEngine engine, ItemStore store, ReconciliationLoop reconciliation) {
        this.engine = engine;
        this.store = store;
        this.reconciliation = reconciliation;
        this.server = ServerBuilder.forPort(port)
            .addService(new RateLimitServiceImpl(engine))
            .build();
    }

    /**
     * @throws IOException if the server fails to bind
     */
    public void start() throws IOException {
        server.start();
        if (reconciliation != null) {
            reconciliation.start();
        }
        log.info("RateLimitServer started on port {} (namespace {})", server.getPort(), engine.namespace());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)");
            try {
                RateLimitServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted", e);
            }
        }));
    }

    /**
     * Stops accepting RPCs, then releases the engine and anything the server created.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (reconciliation != null) {
            reconciliation.close();
        }
        if (store != null) {
            engine.close();
            store.close();
        }
        log.info("RateLimitServer stopped");
    }

    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    /** Parsed command line. */
    record Options(int port, String namespace, String table, String region, String endpoint) {

        static Options parse(String[] args) {
            int port = DEFAULT_PORT;
            String namespace = "default";
            String table = null;
            String region = null;
            String endpoint = null;
            for (String arg : args) {
                int eq = arg.indexOf('=');
                if (!arg.startsWith("--") || eq < 0) {
                    throw new IllegalArgumentException("Expected --name=value, got: " + arg);
                }
                String name = arg.substring(2, eq);
                String value = arg.substring(eq + 1);
                switch (name) {
                    case "port":
                        try {
                            port = Integer.parseInt(value);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid port: " + value, e);
                        }
                        break;
                    case "namespace":
                        namespace = value;
                        break;
                    case "table":
                        table = value;
                        break;
                    case "region":
                        region = value;
                        break;
                    case "dynamodb-endpoint":
                        endpoint = value;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: --" + name);
                }
            }
            if (endpoint != null && table == null) {
                throw new IllegalArgumentException("--dynamodb-endpoint requires --table");
            }
            return new Options(port, namespace, table, region, endpoint);
        }
    }

    static RateLimitServer create(Options options) {
        if (options.table() != null) {
            DynamoDbItemStore store = new DynamoDbItemStore(dynamoDbClient(options), options.table());
            RateLimiterEngine engine = RateLimiterEngine.builder(store).namespace(options.namespace()).build();
            log.info("Using DynamoDB table {}", options.table());
            return new RateLimitServer(options.port(), engine, store, null);
        }
        InMemoryItemStore store = new InMemoryItemStore(true);
        RateLimiterEngine engine = RateLimiterEngine.builder(store).namespace(options.namespace()).build();
        ReconciliationWorker worker = new ReconciliationWorker(store, SystemClock.instance(), WorkerConfig.defaults());
        ReconciliationLoop loop = new ReconciliationLoop(store, worker, RECONCILE_INTERVAL, RECONCILE_BATCH_SIZE);
        log.info("Using in-memory store");
        return new RateLimitServer(options.port(), engine, store, loop);
    }

    private static DynamoDbClient dynamoDbClient(Options options) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder();
        if (options.region() != null) {
            builder.region(Region.of(options.region()));
        }
        if (options.endpoint() != null) {
            builder.endpointOverride(URI.create(options.endpoint()));
        }
        return builder.build();
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            System.exit(1);
            return;
        }

        RateLimitServer server = create(options);
        server.start();
        server.blockUntilShutdown();
    }
}
