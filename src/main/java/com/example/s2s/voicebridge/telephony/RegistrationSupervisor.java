/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.example.s2s.voicebridge.telephony;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the gateway registered.
 *
 * Runs on its own thread: creates an engine, registers it and waits for the registration to
 * succeed, retrying with a fixed delay on failure. Once registered it checks the engine
 * periodically and starts over with a fresh engine when registration is lost.
 */
public class RegistrationSupervisor {
    private static final Logger LOG = LoggerFactory.getLogger(RegistrationSupervisor.class);

    private static final long REGISTRATION_POLL_MS = 100;

    private final TelephonyEngineFactory engineFactory;
    private final CallEventListener callListener;
    private final SipIdentity identity;
    private final Duration retryDelay;
    private final int maxRetries;
    private final Duration registrationTimeout;
    private final Duration monitorInterval;

    private final AtomicInteger attempts = new AtomicInteger();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean shutdownRequested;
    private volatile TelephonyEngine engine;
    private volatile Thread thread;

    /**
     * @param retryDelay pause between failed attempts, negative values count as zero
     * @param maxRetries attempts per registration cycle, 0 for no limit
     * @param registrationTimeout how long one attempt may take
     * @param monitorInterval how often a registered engine is checked
     */
    public RegistrationSupervisor(TelephonyEngineFactory engineFactory, CallEventListener callListener,
                                  SipIdentity identity, Duration retryDelay, int maxRetries,
                                  Duration registrationTimeout, Duration monitorInterval) {
        this.engineFactory = engineFactory;
        this.callListener = callListener;
        this.identity = identity;
        this.retryDelay = retryDelay.isNegative() ? Duration.ZERO : retryDelay;
        this.maxRetries = Math.max(0, maxRetries);
        this.registrationTimeout = registrationTimeout;
        this.monitorInterval = monitorInterval;
    }

    /**
     * Starts supervising on a background thread.
     */
    public synchronized void start() {
        if (thread != null) {
            LOG.warn("Registration supervisor already running");
            return;
        }
        thread = new Thread(this::supervise, "Registration-Supervisor");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stops supervising and shuts the current engine down.
     */
    public void shutdown() {
        if (shutdownRequested) {
            return;
        }
        LOG.info("Stopping registration supervisor...");
        shutdownRequested = true;
        Thread current = thread;
        if (current != null) {
            current.interrupt();
        }
        shutdownEngine();
    }

    /**
     * Waits until supervision has ended, either after {@link #shutdown()} or because the
     * retry bound was exhausted.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRegistered() {
        TelephonyEngine current = engine;
        return current != null && current.isRegistered();
    }

    /**
     * @return total registration attempts made so far
     */
    public int getAttemptCount() {
        return attempts.get();
    }

    private void supervise() {
        try {
            while (!shutdownRequested) {
                if (!registerWithRetries()) {
                    break;
                }
                monitorRegistration();
                if (!shutdownRequested) {
                    LOG.warn("Lost registration, attempting to reconnect...");
                }
            }
        } finally {
            finished.countDown();
            LOG.info("Registration supervisor finished");
        }
    }

    private boolean registerWithRetries() {
        int cycleAttempt = 0;
        while (!shutdownRequested) {
            cycleAttempt++;
            if (maxRetries > 0 && cycleAttempt > maxRetries) {
                LOG.error("Max registration retries ({}) exceeded", maxRetries);
                return false;
            }
            if (cycleAttempt > 1) {
                LOG.info("Registration attempt {}...", cycleAttempt);
            }
            if (tryRegister()) {
                LOG.info("============================================================");
                LOG.info("Voice bridge gateway is READY");
                LOG.info("Address of record: {}", identity.getAddressOfRecord());
                LOG.info("Waiting for incoming calls...");
                LOG.info("============================================================");
                return true;
            }
            if (shutdownRequested) {
                break;
            }
            LOG.warn("Registration failed. Retrying in {} seconds...", retryDelay.toSeconds());
            if (!sleep(retryDelay)) {
                break;
            }
        }
        return false;
    }

    private boolean tryRegister() {
        attempts.incrementAndGet();
        shutdownEngine();
        try {
            TelephonyEngine created = engineFactory.create(callListener);
            engine = created;
            created.register(identity, (status, reason) -> {
                if (status == 200) {
                    LOG.info("Registration accepted: {} {}", status, reason);
                } else {
                    LOG.warn("Registration rejected: {} {}", status, reason);
                }
            });

            long deadline = System.nanoTime() + registrationTimeout.toNanos();
            while (!shutdownRequested) {
                if (created.isRegistered()) {
                    return true;
                }
                if (System.nanoTime() >= deadline) {
                    break;
                }
                if (!sleep(Duration.ofMillis(REGISTRATION_POLL_MS))) {
                    return false;
                }
            }
            return created.isRegistered();
        } catch (RuntimeException e) {
            LOG.error("Registration attempt failed: {}", e.getMessage(), e);
            return false;
        }
    }

    private void monitorRegistration() {
        while (!shutdownRequested && isRegistered()) {
            if (!sleep(monitorInterval)) {
                return;
            }
        }
    }

    private void shutdownEngine() {
        TelephonyEngine previous = engine;
        engine = null;
        if (previous != null) {
            try {
                previous.shutdown();
            } catch (RuntimeException e) {
                LOG.debug("Engine cleanup error: {}", e.getMessage());
            }
        }
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
