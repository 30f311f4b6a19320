////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspproxy;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspproxy.util.MdcSessionContext;

/**
 * Thread management for one proxy session.
 *
 * <ul>
 *   <li><b>Pump pool</b>: exactly two threads, one per forwarding loop.
 *       Nothing else runs on it, so neither direction can be starved by the
 *       other. Hooks run on the thread of the direction they intercept.</li>
 *   <li><b>Scheduling pool</b>: a single thread for the periodic
 *       pending-request eviction sweep and the process-exit grace timer.</li>
 * </ul>
 *
 * <p>All threads are daemon threads, and every task inherits the SLF4J MDC
 * context of the thread that submitted it. Call {@link #shutdownAll()} when
 * the session ends.</p>
 */
public class ProxyExecutors {

    private static final Logger logger = LoggerFactory.getLogger(ProxyExecutors.class);

    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger();

    private final ExecutorService pumpPool;
    private final ScheduledExecutorService schedulingPool;

    public ProxyExecutors() {
        String prefix = "lspproxy-" + SESSION_COUNTER.incrementAndGet();
        this.pumpPool = new MdcThreadPoolExecutor(2, daemonThreads(prefix + "-pump-"));
        this.schedulingPool = new MdcScheduledThreadPoolExecutor(daemonThreads(prefix + "-scheduler-"));
    }

    /** Runs the two forwarding loops. */
    public ExecutorService getPumpPool() {
        return pumpPool;
    }

    /** Runs periodic maintenance such as the eviction sweep. */
    public ScheduledExecutorService getSchedulingPool() {
        return schedulingPool;
    }

    /**
     * Stops both pools without waiting. Forwarding threads still blocked in a
     * read leave as soon as their source is closed.
     */
    public void shutdownAll() {
        logger.debug("Shutting down proxy executors");
        schedulingPool.shutdownNow();
        pumpPool.shutdown();
    }

    /**
     * Waits for the forwarding threads to finish.
     *
     * @return {@code true} if both loops returned within the timeout
     */
    public boolean awaitPumps(long timeout, TimeUnit unit) throws InterruptedException {
        return pumpPool.awaitTermination(timeout, unit);
    }

    private static ThreadFactory daemonThreads(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, namePrefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> ctx = MdcSessionContext.snapshot();
        return () -> {
            Map<String, String> prev = MdcSessionContext.snapshot();
            MdcSessionContext.restore(ctx);
            try {
                return task.call();
            } finally {
                MdcSessionContext.restore(prev);
            }
        };
    }

    /**
     * Fixed-size pool whose tasks run with the submitter's MDC. {@code submit}
     * goes through {@link #execute(Runnable)}, so it is covered too.
     */
    private static final class MdcThreadPoolExecutor extends ThreadPoolExecutor {

        MdcThreadPoolExecutor(int threads, ThreadFactory threadFactory) {
            super(threads, threads, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), threadFactory);
        }

        @Override
        public void execute(Runnable command) {
            super.execute(MdcSessionContext.wrap(command));
        }
    }

    /**
     * Single-thread scheduler whose tasks run with the submitter's MDC.
     * {@code execute} and {@code submit} delegate to the {@code schedule}
     * methods overridden here.
     */
    private static final class MdcScheduledThreadPoolExecutor extends ScheduledThreadPoolExecutor {

        MdcScheduledThreadPoolExecutor(ThreadFactory threadFactory) {
            super(1, threadFactory);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return super.schedule(MdcSessionContext.wrap(command), delay, unit);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            return super.schedule(wrapCallable(callable), delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period,
                TimeUnit unit) {
            return super.scheduleAtFixedRate(MdcSessionContext.wrap(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay,
                TimeUnit unit) {
            return super.scheduleWithFixedDelay(MdcSessionContext.wrap(command), initialDelay, delay, unit);
        }
    }
}
