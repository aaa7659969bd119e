package cn.bafuka.notioncache.dataplane.impl;

import cn.bafuka.notioncache.core.CacheStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 过期条目后台清理器
 * 只负责回收内存，读取时的过期判定不依赖它
 */
@Slf4j
public class ExpirySweeper implements AutoCloseable {

    private final CacheStore<?> cacheStore;

    private final Duration interval;

    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "notioncache-expiry-sweep");
                thread.setDaemon(true);
                return thread;
            });

    private volatile boolean started = false;

    public ExpirySweeper(CacheStore<?> cacheStore, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive: " + interval);
        }
        this.cacheStore = cacheStore;
        this.interval = interval;
    }

    public synchronized void start() {
        if (started) {
            log.debug("过期清理器已经启动，跳过");
            return;
        }
        long periodMs = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        started = true;
        log.info("过期清理器已启动: namespace={}, interval={}", cacheStore.getNamespace(), interval);
    }

    /**
     * 执行一次清理
     *
     * @return 清理的条目数
     */
    public int sweep() {
        try {
            return cacheStore.removeExpired();
        } catch (RuntimeException e) {
            // 调度线程上抛出的异常会终止后续调度，这里记录后继续
            log.error("过期清理失败: namespace={}", cacheStore.getNamespace(), e);
            return 0;
        }
    }

    public void shutdown() {
        scheduler.shutdownNow();
        log.info("过期清理器已关闭: namespace={}", cacheStore.getNamespace());
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isStarted() {
        return started;
    }
}
