package fun.fengwk.brickhub.core.service.cache;

import lombok.extern.slf4j.Slf4j;

import java.io.InterruptedIOException;
import java.util.concurrent.Semaphore;

/**
 * Bounded pool of download permits with FIFO waiters.
 *
 * <p>Releasing more permits than were taken never raises the pool above its maximum.
 *
 * @author fengwk
 */
@Slf4j
public class DownloadPermitPool {

    private final int maxPermits;
    private final Semaphore semaphore;
    private final Object releaseLock = new Object();

    public DownloadPermitPool(int maxPermits) {
        if (maxPermits <= 0) {
            throw new IllegalArgumentException("maxPermits must be positive");
        }
        this.maxPermits = maxPermits;
        this.semaphore = new Semaphore(maxPermits, true);
    }

    public void acquire() throws InterruptedIOException {
        try {
            semaphore.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("interrupted while waiting for a download permit");
            interrupted.initCause(ex);
            throw interrupted;
        }
    }

    public void release() {
        synchronized (releaseLock) {
            if (semaphore.availablePermits() >= maxPermits) {
                log.warn("ignore surplus permit release, maxPermits={}", maxPermits);
                return;
            }
            semaphore.release();
        }
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

}
