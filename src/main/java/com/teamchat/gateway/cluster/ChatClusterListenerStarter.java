package com.teamchat.gateway.cluster;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Redis 不可用时不阻断启动：监听容器在后台按退避重试启动。期间只有本机投递。
 */
@Slf4j
public class ChatClusterListenerStarter implements SmartLifecycle {

    private final ScheduledExecutorService retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "chat-cluster-listener-retry");
        t.setDaemon(true);
        return t;
    });

    private final RedisMessageListenerContainer container;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger attempt = new AtomicInteger(0);

    public ChatClusterListenerStarter(RedisMessageListenerContainer container) {
        this.container = container;
    }

    @Override
    public void start() {
        if (started.compareAndSet(false, true)) {
            scheduleStart(0);
        }
    }

    private void scheduleStart(long delayMs) {
        retryScheduler.schedule(() -> {
            if (!started.get()) {
                return;
            }
            try {
                container.start();
                attempt.set(0);
                log.info("chat cluster listener started");
            } catch (Exception e) {
                int n = attempt.incrementAndGet();
                log.warn("chat cluster listener start failed (attempt={}): {}", n, e.toString());
                scheduleStart(backoffMs(n));
            }
        }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    }

    static long backoffMs(int attempt) {
        if (attempt <= 0) {
            return 200;
        }
        long v = 200L * (1L << Math.min(6, attempt - 1));
        return Math.min(5000L, v);
    }

    @Override
    public void stop() {
        started.set(false);
        try {
            container.stop();
        } catch (Exception e) {
            log.debug("stop chat cluster listener failed: {}", e.toString());
        }
        retryScheduler.shutdownNow();
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
