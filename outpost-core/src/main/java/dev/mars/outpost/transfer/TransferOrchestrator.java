/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.outpost.transfer;

import dev.mars.outpost.config.TransferSettings;
import dev.mars.outpost.core.FailureReason;
import dev.mars.outpost.core.TransferSnapshot;
import dev.mars.outpost.core.TransferStatus;
import dev.mars.outpost.core.exceptions.AgentBusyException;
import dev.mars.outpost.core.exceptions.AgentNotConnectedException;
import dev.mars.outpost.core.exceptions.InvalidTransitionException;
import dev.mars.outpost.core.exceptions.TransferNotFoundException;
import dev.mars.outpost.protocol.CancelMessage;
import dev.mars.outpost.protocol.DownloadRequestMessage;
import dev.mars.outpost.protocol.ErrorMessage;
import dev.mars.outpost.protocol.FileChunkMessage;
import dev.mars.outpost.registry.AgentConnection;
import dev.mars.outpost.registry.ConnectionListener;
import dev.mars.outpost.registry.ConnectionRegistry;
import dev.mars.outpost.storage.ArtifactPaths;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the lifecycle of every transfer.
 *
 * <p>A transfer moves {@code PENDING -> DISPATCHED -> IN_PROGRESS -> COMPLETED}, or to
 * {@code FAILED} from any non-terminal state. All mutations run on a single Vert.x context
 * captured at construction, so events for the same transfer are applied in the order they were
 * submitted and no two mutations ever interleave. Reads ({@link #find(String)},
 * {@link #list()}) see the last published snapshot without taking a lock.</p>
 *
 * <p>The orchestrator listens to the {@link ConnectionRegistry}: when an agent disconnects, or
 * reconnects on a new connection, every in-flight transfer bound to the old connection fails.
 * A periodic sweep fails transfers that have gone quiet for longer than the inactivity
 * timeout.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class TransferOrchestrator implements ConnectionListener {

    private static final Logger logger = LoggerFactory.getLogger(TransferOrchestrator.class);

    private final Vertx vertx;
    private final Context context;
    private final ConnectionRegistry registry;
    private final TransferSettings settings;
    private final Clock clock;
    private final Map<String, TransferSession> transfers = new ConcurrentHashMap<>();

    private long sweepTimerId = -1;

    public TransferOrchestrator(Vertx vertx, ConnectionRegistry registry, TransferSettings settings) {
        this(vertx, registry, settings, Clock.systemUTC());
    }

    public TransferOrchestrator(Vertx vertx, ConnectionRegistry registry, TransferSettings settings, Clock clock) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.context = vertx.getOrCreateContext();
    }

    /**
     * Subscribes to registry events and starts the inactivity sweep.
     */
    public void start() {
        registry.addListener(this);
        long interval = Math.max(1, settings.getSweepInterval().toMillis());
        sweepTimerId = vertx.setPeriodic(interval, id -> expireInactive()
                .onFailure(err -> logger.error("Inactivity sweep failed", err)));
        logger.info("Transfer orchestrator started: {}", settings);
    }

    /**
     * Stops the sweep and fails whatever is still in flight. Completes once every open artifact
     * has been closed.
     */
    public Future<Void> stop() {
        if (sweepTimerId >= 0) {
            vertx.cancelTimer(sweepTimerId);
            sweepTimerId = -1;
        }
        registry.removeListener(this);
        return execute(() -> {
            List<Future<Void>> closing = new ArrayList<>();
            for (TransferSession session : transfers.values()) {
                if (!session.snapshot.isTerminal()) {
                    fail(session, FailureReason.AGENT_DISCONNECTED, "agent disconnected: server shutting down");
                }
                closing.add(session.reassembler.abort());
            }
            return closing;
        }).compose(closing -> Future.all(closing)).mapEmpty();
    }

    // ---------------------------------------------------------------------------------------
    // Operator operations
    // ---------------------------------------------------------------------------------------

    /**
     * Creates a transfer for {@code sourcePath} on {@code agentId} and sends the download
     * request over the agent's connection.
     *
     * <p>The returned future fails with {@link AgentNotConnectedException} if the agent has no
     * live connection, in which case no record is created, or with {@link AgentBusyException}
     * when concurrent transfers per agent are disabled and the agent already has one. Otherwise
     * it completes with the snapshot as it stands after the send: {@code DISPATCHED}, or
     * {@code FAILED} if the request could not be written.</p>
     */
    public Future<TransferSnapshot> create(String agentId, String sourcePath) {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(sourcePath, "sourcePath cannot be null");

        return execute(() -> {
            AgentConnection connection = registry.lookup(agentId)
                    .orElseThrow(() -> new AgentNotConnectedException(agentId));
            if (!settings.isConcurrentTransfersPerAgent()) {
                Optional<TransferSession> active = transfers.values().stream()
                        .filter(s -> s.agentId().equals(agentId) && !s.snapshot.isTerminal())
                        .findFirst();
                if (active.isPresent()) {
                    throw new AgentBusyException(agentId, active.get().transferId());
                }
            }

            String transferId = UUID.randomUUID().toString();
            Instant now = clock.instant();
            Path artifactPath = ArtifactPaths.resolve(settings.getDownloadDirectory(), agentId, transferId,
                    sourcePath, now);
            TransferSnapshot snapshot = TransferSnapshot.pending(transferId, agentId, sourcePath, artifactPath, now);
            ChunkReassembler reassembler = new ChunkReassembler(vertx.fileSystem(), transferId, artifactPath,
                    settings.getChunkSize());
            TransferSession session = new TransferSession(snapshot, connection, reassembler);
            transfers.put(transferId, session);
            logger.info("Download {} created: client={}, path={}", transferId, agentId, sourcePath);
            return session;
        }).compose(this::dispatch);
    }

    /**
     * @throws TransferNotFoundException if no transfer has that identifier
     */
    public TransferSnapshot status(String transferId) throws TransferNotFoundException {
        return find(transferId).orElseThrow(() -> new TransferNotFoundException(transferId));
    }

    public Optional<TransferSnapshot> find(String transferId) {
        if (transferId == null) {
            return Optional.empty();
        }
        TransferSession session = transfers.get(transferId);
        return session == null ? Optional.empty() : Optional.of(session.snapshot);
    }

    /**
     * All transfers, newest first.
     */
    public List<TransferSnapshot> list() {
        List<TransferSnapshot> snapshots = new ArrayList<>(transfers.size());
        for (TransferSession session : transfers.values()) {
            snapshots.add(session.snapshot);
        }
        snapshots.sort(Comparator.comparing(TransferSnapshot::createdAt).reversed()
                .thenComparing(TransferSnapshot::transferId));
        return snapshots;
    }

    public long activeCount() {
        return transfers.values().stream().filter(s -> !s.snapshot.isTerminal()).count();
    }

    /**
     * Fails a non-terminal transfer as cancelled and tells the agent to stop streaming.
     *
     * @return a future failed with {@link TransferNotFoundException}, or with
     *         {@link InvalidTransitionException} if the transfer is already terminal
     */
    public Future<TransferSnapshot> cancel(String transferId) {
        return execute(() -> {
            TransferSession session = transfers.get(transferId);
            if (session == null) {
                throw new TransferNotFoundException(transferId);
            }
            TransferSnapshot current = session.snapshot;
            if (current.isTerminal()) {
                throw new InvalidTransitionException(transferId, current.status(), TransferStatus.FAILED);
            }
            fail(session, FailureReason.CANCELLED, null);
            return session.snapshot;
        });
    }

    // ---------------------------------------------------------------------------------------
    // Agent events
    // ---------------------------------------------------------------------------------------

    /**
     * Applies a chunk received on {@code from}.
     *
     * <p>Chunks for unknown or terminal transfers, or arriving on a connection the transfer is
     * not bound to, are rejected without changing anything. A chunk out of sequence, oversized,
     * or ending the stream short fails the transfer with a protocol violation. The last chunk
     * puts the transfer into finalization; it reaches {@code COMPLETED} only once the artifact
     * has been flushed and closed.</p>
     *
     * @return a future completing with the result once the chunk has been applied or rejected;
     *         {@link ChunkResult#persisted()} then tracks the write
     */
    public Future<ChunkResult> onChunk(AgentConnection from, FileChunkMessage chunk) {
        return execute(() -> applyChunk(from, chunk));
    }

    /**
     * Fails the transfer named by an agent's error message with the message verbatim.
     *
     * @return a future completing with {@code true} if a transfer was failed
     */
    public Future<Boolean> onAgentError(AgentConnection from, ErrorMessage error) {
        return execute(() -> {
            TransferSession session = transfers.get(error.downloadId());
            if (session == null || !session.isBoundTo(from)) {
                logger.warn("Ignoring error for unknown download {} from client {}: {}",
                        error.downloadId(), from.agentId(), error.message());
                return false;
            }
            return fail(session, FailureReason.AGENT_ERROR, error.message());
        });
    }

    /**
     * Fails a transfer whose frame could not be decoded.
     */
    public Future<Boolean> onProtocolViolation(AgentConnection from, String transferId, String detail) {
        return execute(() -> {
            TransferSession session = transfers.get(transferId);
            if (session == null || !session.isBoundTo(from)) {
                return false;
            }
            return fail(session, FailureReason.PROTOCOL_VIOLATION, "protocol violation: " + detail);
        });
    }

    @Override
    public void onConnectionReplaced(String agentId, AgentConnection previous, AgentConnection current) {
        execute(() -> failBoundTo(previous, FailureReason.CONNECTION_REPLACED))
                .onFailure(err -> logger.error("Failed to process replaced connection for client {}", agentId, err));
    }

    @Override
    public void onAgentDeregistered(String agentId, AgentConnection connection) {
        execute(() -> failBoundTo(connection, FailureReason.AGENT_DISCONNECTED))
                .onFailure(err -> logger.error("Failed to process disconnect of client {}", agentId, err));
    }

    /**
     * Fails every in-flight transfer that has seen no chunk for longer than the inactivity
     * timeout. Runs periodically once {@link #start()} has been called.
     *
     * @return the number of transfers failed
     */
    public Future<Integer> expireInactive() {
        return execute(() -> {
            Instant now = clock.instant();
            Duration timeout = settings.getInactivityTimeout();
            int expired = 0;
            for (TransferSession session : transfers.values()) {
                TransferSnapshot current = session.snapshot;
                if (!current.status().isInFlight() || session.finalizing) {
                    continue;
                }
                if (session.lastActivity.plus(timeout).isBefore(now)) {
                    if (fail(session, FailureReason.INACTIVITY_TIMEOUT,
                            "inactivity timeout: no data for " + timeout.toSeconds() + "s")) {
                        expired++;
                    }
                }
            }
            return expired;
        });
    }

    // ---------------------------------------------------------------------------------------
    // Internals, all running on the orchestrator context
    // ---------------------------------------------------------------------------------------

    private Future<TransferSnapshot> dispatch(TransferSession session) {
        DownloadRequestMessage request = new DownloadRequestMessage(session.transferId(), session.snapshot.sourcePath());
        return session.connection.send(request)
                .transform(ar -> execute(() -> afterDispatch(session, ar)));
    }

    private TransferSnapshot afterDispatch(TransferSession session, AsyncResult<Void> sent) {
        if (sent.failed()) {
            fail(session, FailureReason.DISPATCH_FAILED,
                    "failed to send download request: " + sent.cause().getMessage());
        } else if (session.snapshot.status() == TransferStatus.PENDING) {
            session.snapshot = session.snapshot.withStatus(TransferStatus.DISPATCHED);
            session.lastActivity = clock.instant();
            logger.debug("Download {} dispatched to client {}", session.transferId(), session.agentId());
        }
        return session.snapshot;
    }

    private ChunkResult applyChunk(AgentConnection from, FileChunkMessage chunk) {
        TransferSession session = transfers.get(chunk.downloadId());
        if (session == null) {
            logger.warn("Ignoring chunk {} for unknown download {} from client {}",
                    chunk.chunkNum(), chunk.downloadId(), from.agentId());
            return ChunkResult.rejected("unknown download " + chunk.downloadId());
        }
        if (!session.isBoundTo(from)) {
            logger.warn("Ignoring chunk {} for download {}: sent on connection {} of client {}, not the owning connection",
                    chunk.chunkNum(), chunk.downloadId(), from.connectionId(), from.agentId());
            return ChunkResult.rejected("download " + chunk.downloadId() + " is not bound to this connection");
        }
        TransferSnapshot current = session.snapshot;
        if (current.isTerminal()) {
            logger.debug("Ignoring chunk {} for {} download {}", chunk.chunkNum(), current.status(), chunk.downloadId());
            return ChunkResult.rejected("download is already " + current.status());
        }
        if (session.finalizing) {
            return ChunkResult.rejected("end of stream already received");
        }

        ChunkResult result = session.reassembler.accept(chunk);
        if (!result.applied()) {
            if (session.reassembler.writeFailed()) {
                fail(session, FailureReason.ARTIFACT_WRITE_FAILURE, result.reason());
            } else {
                fail(session, FailureReason.PROTOCOL_VIOLATION, "protocol violation: " + result.reason());
            }
            return result;
        }

        if (current.status() == TransferStatus.PENDING) {
            current = current.withStatus(TransferStatus.DISPATCHED);
        }
        session.snapshot = current.withChunk(chunk.payloadSize());
        session.lastActivity = clock.instant();
        if (chunk.last()) {
            session.finalizing = true;
        }
        result.persisted().onComplete(ar -> execute(() -> afterPersist(session, chunk, ar))
                .onFailure(err -> logger.error("Failed to finish chunk {} of download {}",
                        chunk.chunkNum(), chunk.downloadId(), err)));
        return result;
    }

    private Void afterPersist(TransferSession session, FileChunkMessage chunk, AsyncResult<Void> written) {
        if (written.failed()) {
            fail(session, FailureReason.ARTIFACT_WRITE_FAILURE,
                    "artifact write failed: " + written.cause().getMessage());
            return null;
        }
        if (chunk.last() && !session.snapshot.isTerminal()) {
            session.snapshot = session.snapshot.completed(clock.instant());
            logger.info("Download {} completed: {} chunks, {} bytes written to {}", session.transferId(),
                    session.snapshot.chunksReceived(), session.snapshot.bytesReceived(),
                    session.snapshot.artifactPath());
        }
        return null;
    }

    private int failBoundTo(AgentConnection connection, FailureReason reason) {
        int failed = 0;
        for (TransferSession session : transfers.values()) {
            if (session.isBoundTo(connection) && !session.finalizing && fail(session, reason, null)) {
                failed++;
            }
        }
        return failed;
    }

    /**
     * Moves a non-terminal transfer to {@code FAILED} and releases its artifact.
     *
     * @return {@code false} if the transfer was already terminal
     */
    private boolean fail(TransferSession session, FailureReason reason, String detail) {
        TransferSnapshot current = session.snapshot;
        if (current.isTerminal()) {
            return false;
        }
        session.snapshot = current.failed(reason, detail, clock.instant());
        logger.warn("Download {} for client {} failed [{}]: {}", session.transferId(), session.agentId(),
                reason.getCode(), session.snapshot.error());
        session.reassembler.abort();
        if (notifiesAgent(reason)) {
            session.connection.send(new CancelMessage(session.transferId(), session.snapshot.error()))
                    .onFailure(err -> logger.debug("Could not notify client {} of failed download {}: {}",
                            session.agentId(), session.transferId(), err.getMessage()));
        }
        return true;
    }

    /**
     * Failures the agent may not know about yet, so it should stop streaming.
     */
    private static boolean notifiesAgent(FailureReason reason) {
        switch (reason) {
            case PROTOCOL_VIOLATION:
            case INACTIVITY_TIMEOUT:
            case ARTIFACT_WRITE_FAILURE:
            case CANCELLED:
                return true;
            default:
                return false;
        }
    }

    private <T> Future<T> execute(Callable<T> action) {
        Promise<T> promise = Promise.promise();
        context.runOnContext(v -> {
            try {
                promise.complete(action.call());
            } catch (Exception e) {
                promise.fail(e);
            }
        });
        return promise.future();
    }
}
