package io.lightchain.core.node;

import io.lightchain.core.chain.ChainRegistry;
import io.lightchain.core.chain.ChunkFetcher;
import io.lightchain.core.consensus.NetworkParameters;
import io.lightchain.core.rpc.ChainServer;
import io.lightchain.core.rpc.ElectrumChainServer;
import io.lightchain.core.rpc.JsonRpcSession;
import io.lightchain.core.sync.Synchronizer;
import io.lightchain.core.verifier.SpvVerifier;
import io.lightchain.core.wallet.WalletLedger;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the header chain, the proof verifier and the synchronizer to one server.
 * Call {@link #start()} once; a job failure stops both jobs and is reported to the failure listener.
 */
public final class SpvClient implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SpvClient.class.getName());

    private final SpvConfig config;
    private final NetworkParameters params;
    private final WalletLedger ledger;
    private final ChainRegistry registry;
    private final ChunkFetcher chunks;
    private final SpvVerifier verifier;
    private final Synchronizer synchronizer;

    private volatile Consumer<Throwable> failureListener = t -> {};
    private JsonRpcSession session;
    private ScheduledExecutorService headerFollower;
    private volatile ChainServer server;

    public SpvClient(SpvConfig config, NetworkParameters params, WalletLedger ledger) {
        this.config = Objects.requireNonNull(config, "config");
        this.params = Objects.requireNonNull(params, "params");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        params.requireUsable();
        this.registry = ChainRegistry.open(params, config.dataDir);
        this.chunks = new ChunkFetcher(registry);
        Semaphore requestSlots = new Semaphore(config.maxConcurrentRequests);
        this.verifier = new SpvVerifier(registry, ledger, chunks, requestSlots,
                config.skipMerkleCheck, config.scanIntervalMillis);
        this.synchronizer = new Synchronizer(ledger, params, requestSlots,
                config.networkTimeoutMillis, config.scanIntervalMillis, verifier::isUpToDate);
        verifier.setFailureListener(this::onJobFailure);
        synchronizer.setFailureListener(this::onJobFailure);
    }

    public void setFailureListener(Consumer<Throwable> listener) {
        this.failureListener = listener == null ? t -> {} : listener;
    }

    /** Connects to the configured server and starts following it. */
    public synchronized void start() throws InterruptedException {
        session = new JsonRpcSession(config.serverHost, config.serverPort, config.tls, config.networkTimeoutMillis);
        session.connect();
        start(new ElectrumChainServer(session));
    }

    /** Starts against an already connected server. */
    public synchronized void start(ChainServer server) throws InterruptedException {
        this.server = Objects.requireNonNull(server, "server");
        LOG.info(() -> "Starting " + params.name() + " client, local height " + registry.bestChain().height());
        chunks.catchUp(server);
        verifier.start(server);
        synchronizer.start(server);
        headerFollower = startHeaderFollower();
    }

    private ScheduledExecutorService startHeaderFollower() {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lightchain-headers");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                chunks.catchUp(server);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Header catch-up failed", e);
            }
        };
        long period = Math.max(1_000L, config.networkTimeoutMillis / 3);
        executor.scheduleWithFixedDelay(task, period, period, TimeUnit.MILLISECONDS);
        return executor;
    }

    private void onJobFailure(Throwable t) {
        LOG.log(Level.WARNING, "Stopping client after job failure", t);
        stopJobs();
        failureListener.accept(t);
    }

    private synchronized void stopJobs() {
        if (headerFollower != null) {
            headerFollower.shutdownNow();
            headerFollower = null;
        }
        synchronizer.stop();
        verifier.stop();
    }

    /** True when every watched item is subscribed, every history fetched and every proof settled. */
    public boolean isUpToDate() {
        return synchronizer.isUpToDate();
    }

    public ChainRegistry registry() { return registry; }
    public WalletLedger ledger() { return ledger; }
    public SpvVerifier verifier() { return verifier; }
    public Synchronizer synchronizer() { return synchronizer; }
    public NetworkParameters params() { return params; }

    @Override
    public synchronized void close() {
        stopJobs();
        if (session != null) {
            session.close();
            session = null;
        }
    }
}
