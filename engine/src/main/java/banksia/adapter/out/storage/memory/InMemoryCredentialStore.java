package banksia.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import banksia.core.model.token.Credential;
import banksia.core.model.token.RedemptionOutcome;
import banksia.core.model.token.TokenType;
import banksia.core.port.out.CredentialStore;
import banksia.core.util.SecureHash;

/**
 * In-memory implementation of credential storage.
 *
 * <p>All three keyspaces share one reentrant lock, which doubles as the
 * exclusive section. Credentials are lost on restart and not shared across
 * instances.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<TokenType, Map<String, Credential>> credentials = new EnumMap<>(TokenType.class);
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryCredentialStore(Duration cleanupInterval) {
        this(cleanupInterval, Clock.systemUTC());
    }

    public InMemoryCredentialStore(Duration cleanupInterval, Clock clock) {
        this.clock = clock;
        for (final var type : TokenType.values()) {
            credentials.put(type, new HashMap<>());
        }

        if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            this.cleanupExecutor = null;
            LOG.info("Initialized in-memory credential store (expiry sweep disabled)");
            return;
        }

        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "credential-store-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var millis = cleanupInterval.toMillis();
        cleanupExecutor.scheduleAtFixedRate(this::sweepExpired, millis, millis, TimeUnit.MILLISECONDS);
        LOG.infof("Initialized in-memory credential store (expiry sweep every %s)", cleanupInterval);
    }

    @Override
    public void put(TokenType type, String signature, Credential credential) {
        if (type == null || signature == null || signature.isEmpty() || credential == null) {
            throw new IllegalArgumentException("Type, signature and credential are required");
        }
        if (credential.type() != type) {
            throw new IllegalArgumentException(
                    "Credential of type " + credential.type() + " cannot be stored as " + type);
        }
        if (credential.isExpired(clock.instant())) {
            throw new IllegalArgumentException("Credential is already expired");
        }
        lock.lock();
        try {
            credentials.get(type).put(signature, credential);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Credential> get(TokenType type, String signature) {
        lock.lock();
        try {
            return Optional.ofNullable(credentials.get(type).get(signature));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(TokenType type, String signature) {
        lock.lock();
        try {
            return credentials.get(type).remove(signature) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RedemptionOutcome markUsed(String codeSignature) {
        lock.lock();
        try {
            final var codes = credentials.get(TokenType.AUTHORIZATION_CODE);
            final var code = codes.get(codeSignature);
            if (code == null) {
                return RedemptionOutcome.NOT_FOUND;
            }
            if (code.used()) {
                final var revoked = revokeDerived(codeSignature);
                LOG.warnf(
                        "Replayed authorization code %s: revoked %d derived credentials",
                        SecureHash.fingerprint(codeSignature), revoked);
                return RedemptionOutcome.REPLAYED;
            }
            codes.put(codeSignature, code.markUsed());
            return RedemptionOutcome.MARKED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int revokeDerived(String codeSignature) {
        lock.lock();
        try {
            int removed = 0;
            for (final var type : new TokenType[] {TokenType.ACCESS_TOKEN, TokenType.REFRESH_TOKEN}) {
                final var entries = credentials.get(type);
                final var before = entries.size();
                entries.values().removeIf(credential -> credential.derivedFrom(codeSignature));
                removed += before - entries.size();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int count(TokenType type) {
        lock.lock();
        try {
            return credentials.get(type).size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop expired credentials.
     *
     * <p>A used authorization code is kept past its expiry while any token
     * derived from it is still stored, so a late replay still revokes them.
     *
     * @return number of entries removed
     */
    int sweepExpired() {
        final var now = clock.instant();
        lock.lock();
        try {
            int removed = 0;
            for (final var type : new TokenType[] {TokenType.ACCESS_TOKEN, TokenType.REFRESH_TOKEN}) {
                final var entries = credentials.get(type);
                final var before = entries.size();
                entries.values().removeIf(credential -> credential.isExpired(now));
                removed += before - entries.size();
            }

            final var codes = credentials.get(TokenType.AUTHORIZATION_CODE);
            final var before = codes.size();
            codes.entrySet().removeIf(entry -> entry.getValue().isExpired(now)
                    && (!entry.getValue().used() || !hasDerived(entry.getKey())));
            removed += before - codes.size();

            if (removed > 0) {
                LOG.debugf("Cleaned up %d expired credentials", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private boolean hasDerived(String codeSignature) {
        return credentials.get(TokenType.ACCESS_TOKEN).values().stream().anyMatch(c -> c.derivedFrom(codeSignature))
                || credentials.get(TokenType.REFRESH_TOKEN).values().stream()
                        .anyMatch(c -> c.derivedFrom(codeSignature));
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        lock.lock();
        try {
            credentials.values().forEach(Map::clear);
        } finally {
            lock.unlock();
        }
    }
}
