package tw.gc.auto.lifecycle.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import tw.gc.auto.lifecycle.config.LifecycleProperties;
import tw.gc.auto.lifecycle.exceptions.StoreUnavailableException;

import java.util.function.Supplier;

/**
 * Retries a whole transactional call on transient store failures (connection loss, lock and
 * optimistic-version conflicts) and surfaces persistent ones as {@link StoreUnavailableException}.
 * The supplier must start its own transaction so a failed attempt leaves nothing behind.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreRetryTemplate {

    private final LifecycleProperties properties;

    public <T> T execute(String operation, Supplier<T> call) {
        int maxAttempts = Math.max(1, properties.getStore().getMaxAttempts());
        long backoffMs = properties.getStore().getBackoff().toMillis();
        int attempt = 0;

        while (true) {
            try {
                attempt++;
                return call.get();
            } catch (TransientDataAccessException | DataAccessResourceFailureException
                     | CannotCreateTransactionException e) {
                if (attempt >= maxAttempts) {
                    log.error("🚨 Store unavailable for {} after {} attempts", operation, attempt, e);
                    throw new StoreUnavailableException(operation, attempt, e);
                }
                log.warn("⚠️ Transient store failure in {} (attempt {}/{}): {}",
                    operation, attempt, maxAttempts, e.getMessage());

                // Linear backoff: 1x, 2x, 3x
                try {
                    Thread.sleep(backoffMs * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreUnavailableException(operation, attempt, e);
                }
            }
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }
}
