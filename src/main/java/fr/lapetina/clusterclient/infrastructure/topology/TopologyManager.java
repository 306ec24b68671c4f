package fr.lapetina.clusterclient.infrastructure.topology;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.domain.strategy.NodeSelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Keeps the latest cluster topology and selects nodes from it.
 *
 * A single poller thread refreshes the configuration periodically and on demand,
 * so polls never overlap. Readers see the latest published snapshot without
 * locking. A snapshot replaces the current one only if its revision is higher.
 *
 * Providers are tried in order of preference: once the active provider reports
 * that the cluster does not support it, the manager moves to the next one for good.
 */
public final class TopologyManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    private final AtomicReference<TopologySnapshot> current = new AtomicReference<>();
    private final List<TopologyProvider> providers;
    private final AtomicInteger activeProvider = new AtomicInteger(0);
    private final NodeSelectionStrategy strategy;
    private final Duration pollPeriod;
    private final Duration pollTimeout;
    private final Duration minRefreshInterval;

    private final List<TopologyListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<CompletableFuture<TopologySnapshot>> firstWaiters = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<TopologySnapshot>> refreshWaiters = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean refreshQueued = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ScheduledExecutorService poller;

    private volatile long lastPollNanos = 0;

    public TopologyManager(
            List<TopologyProvider> providers,
            NodeSelectionStrategy strategy,
            Duration pollPeriod,
            Duration pollTimeout,
            Duration minRefreshInterval
    ) {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one topology provider is required");
        }
        this.providers = List.copyOf(providers);
        this.strategy = strategy;
        this.pollPeriod = pollPeriod;
        this.pollTimeout = pollTimeout;
        this.minRefreshInterval = minRefreshInterval;
        this.poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "topology-poller");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts periodic polling, beginning with an immediate fetch.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        poller.scheduleWithFixedDelay(this::poll, 0, pollPeriod.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Topology manager started: providers={}, pollPeriodMs={}",
                providers.stream().map(TopologyProvider::getName).toList(), pollPeriod.toMillis());
    }

    /**
     * Latest published snapshot, or null before the first configuration arrived.
     */
    public TopologySnapshot current() {
        return current.get();
    }

    /**
     * Publishes a snapshot if it is newer than the current one.
     *
     * @return true if the snapshot became current
     */
    public boolean publish(TopologySnapshot snapshot) {
        TopologySnapshot previous;
        do {
            previous = current.get();
            if (previous != null && snapshot.revision() <= previous.revision()) {
                log.trace("Ignoring topology: rev={} not newer than current rev={}", snapshot.revision(), previous.revision());
                return false;
            }
        } while (!current.compareAndSet(previous, snapshot));

        log.info("Topology published: rev={}, nodes={}, source={}, previousRev={}",
                snapshot.revision(), snapshot.nodeIds(), snapshot.source(),
                previous != null ? previous.revision() : "none");

        for (TopologyListener listener : listeners) {
            try {
                listener.onTopologyChanged(previous, snapshot);
            } catch (Exception e) {
                log.error("Error notifying topology listener", e);
            }
        }
        completeAll(firstWaiters, snapshot);
        return true;
    }

    /**
     * Asks for an immediate poll. Requests arriving while one is queued, or within
     * the minimum refresh interval of the last poll, are coalesced.
     */
    public void requestRefresh() {
        if (!running.get()) {
            return;
        }
        if (!refreshQueued.compareAndSet(false, true)) {
            return;
        }
        long sinceLastPoll = System.nanoTime() - lastPollNanos;
        long delayNanos = Math.max(0, minRefreshInterval.toNanos() - sinceLastPoll);
        try {
            poller.schedule(() -> {
                refreshQueued.set(false);
                poll();
            }, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RuntimeException e) {
            refreshQueued.set(false);
            log.debug("Refresh request rejected, poller stopped", e);
        }
    }

    /**
     * Completes once the next poll starting after this call finished, with the snapshot
     * current at that time (possibly unchanged, possibly null).
     */
    public CompletableFuture<TopologySnapshot> awaitNextRefresh() {
        CompletableFuture<TopologySnapshot> waiter = new CompletableFuture<>();
        if (!running.get()) {
            waiter.completeExceptionally(new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE, "Topology manager is not running"));
            return waiter;
        }
        refreshWaiters.add(waiter);
        waiter.whenComplete((snapshot, error) -> refreshWaiters.remove(waiter));
        return waiter;
    }

    /**
     * Completes with the first published snapshot, immediately if there is one.
     */
    public CompletableFuture<TopologySnapshot> awaitFirstTopology() {
        TopologySnapshot snapshot = current.get();
        if (snapshot != null) {
            return CompletableFuture.completedFuture(snapshot);
        }
        CompletableFuture<TopologySnapshot> waiter = new CompletableFuture<>();
        firstWaiters.add(waiter);
        waiter.whenComplete((s, error) -> firstWaiters.remove(waiter));

        // A snapshot published between the check and the add would not complete us
        snapshot = current.get();
        if (snapshot != null) {
            waiter.complete(snapshot);
        }
        return waiter;
    }

    /**
     * Selects a node for one attempt.
     *
     * The preferred node is tried first, then the strategy picks among the other
     * candidates except the avoided node, which is only used when nothing else is admitted.
     *
     * @param preferredNodeId node to try first, may be null
     * @param avoidNodeId     node to use only as a last resort, may be null
     * @param admission       breaker admission, tested at most once per node
     */
    public Optional<ClusterNode> selectNode(
            ServiceType service,
            String preferredNodeId,
            String avoidNodeId,
            Predicate<ClusterNode> admission
    ) {
        TopologySnapshot snapshot = current.get();
        if (snapshot == null) {
            return Optional.empty();
        }
        List<ClusterNode> candidates = snapshot.nodesFor(service);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        if (preferredNodeId != null) {
            Optional<ClusterNode> preferred = find(candidates, preferredNodeId);
            if (preferred.isPresent() && admission.test(preferred.get())) {
                return preferred;
            }
        }

        List<ClusterNode> others = new ArrayList<>(candidates.size());
        for (ClusterNode node : candidates) {
            if (!node.getId().equals(preferredNodeId) && !node.getId().equals(avoidNodeId)) {
                others.add(node);
            }
        }
        Optional<ClusterNode> selected = strategy.selectNode(others, service, admission);
        if (selected.isPresent()) {
            return selected;
        }

        if (avoidNodeId != null && !avoidNodeId.equals(preferredNodeId)) {
            Optional<ClusterNode> avoided = find(candidates, avoidNodeId);
            if (avoided.isPresent() && admission.test(avoided.get())) {
                return avoided;
            }
        }
        return Optional.empty();
    }

    public Optional<ClusterNode> selectNode(ServiceType service) {
        return selectNode(service, null, null, node -> true);
    }

    public void addListener(TopologyListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TopologyListener listener) {
        listeners.remove(listener);
    }

    public TopologyProvider getActiveProvider() {
        return providers.get(activeProvider.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Number of operations parked until the next refresh or the first topology.
     */
    public int waiterCount() {
        return firstWaiters.size() + refreshWaiters.size();
    }

    /**
     * Runs one poll on the calling thread.
     */
    void poll() {
        // Waiters registered while this poll runs wait for a fetch that starts after them
        List<CompletableFuture<TopologySnapshot>> served = new ArrayList<>(refreshWaiters);
        try {
            TopologySnapshot known = current.get();
            while (true) {
                TopologyProvider provider = providers.get(activeProvider.get());
                try {
                    TopologySnapshot fetched = fetch(provider, known);
                    publish(fetched);
                    return;
                } catch (UnsupportedConfigProtocolException e) {
                    if (!fallBack(provider, e)) {
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Topology poll failed, keeping rev={}: {}",
                    current.get() != null ? current.get().revision() : "none", e.getMessage());
        } finally {
            lastPollNanos = System.nanoTime();
            TopologySnapshot snapshot = current.get();
            for (CompletableFuture<TopologySnapshot> waiter : served) {
                waiter.complete(snapshot);
            }
        }
    }

    private TopologySnapshot fetch(TopologyProvider provider, TopologySnapshot known) throws Exception {
        CompletableFuture<TopologySnapshot> future = provider.fetch(known);
        try {
            return future.get(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE,
                    provider.getName() + " fetch timed out after " + pollTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UnsupportedConfigProtocolException unsupported) {
                throw unsupported;
            }
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private boolean fallBack(TopologyProvider provider, UnsupportedConfigProtocolException e) {
        int index = activeProvider.get();
        if (index + 1 >= providers.size()) {
            log.error("Cluster does not serve configurations through {} and no fallback is configured: {}",
                    provider.getName(), e.getMessage());
            return false;
        }
        if (activeProvider.compareAndSet(index, index + 1)) {
            log.warn("Falling back from {} to {} for cluster configurations: {}",
                    provider.getName(), providers.get(index + 1).getName(), e.getMessage());
        }
        return true;
    }

    private static Optional<ClusterNode> find(List<ClusterNode> nodes, String nodeId) {
        for (ClusterNode node : nodes) {
            if (node.getId().equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    private static void completeAll(Set<CompletableFuture<TopologySnapshot>> waiters, TopologySnapshot snapshot) {
        for (CompletableFuture<TopologySnapshot> waiter : new ArrayList<>(waiters)) {
            waiter.complete(snapshot);
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            poller.shutdownNow();
            return;
        }
        poller.shutdownNow();
        try {
            poller.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        OperationException closed = new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE, "Topology manager closed");
        for (CompletableFuture<TopologySnapshot> waiter : new ArrayList<>(firstWaiters)) {
            waiter.completeExceptionally(closed);
        }
        completeAll(refreshWaiters, current.get());
        log.info("Topology manager stopped");
    }
}
