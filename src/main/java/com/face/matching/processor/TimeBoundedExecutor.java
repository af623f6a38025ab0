package com.face.matching.processor;

import com.face.matching.exception.BatchExecutionException;
import com.face.matching.model.Summary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * 限时执行器
 * 每次调用在独立的工作线程上执行批处理，调用方只等待到截止时间。
 * 超时后立即返回超时结果，工作线程不会被中断，其结果被丢弃。
 */
public class TimeBoundedExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(TimeBoundedExecutor.class);

    private final AtomicLong workerCounter = new AtomicLong(0);
    private final ThreadFactory threadFactory = runnable -> {
        Thread t = new Thread(runnable, "batch-worker-" + workerCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    };

    /**
     * 限时执行
     *
     * @param task         批处理任务
     * @param deadline     截止时长，null或非正数表示不限时
     * @param totalImages  超时时用于填充图像总数
     */
    public Summary runWithDeadline(Callable<Summary> task, Duration deadline, IntSupplier totalImages) {
        ExecutorService worker = Executors.newSingleThreadExecutor(threadFactory);
        try {
            Future<Summary> future = worker.submit(task);
            if (deadline == null || deadline.isZero() || deadline.isNegative()) {
                return future.get();
            }
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            int total = safeCount(totalImages);
            LOG.warn("Batch exceeded deadline of {} ms, returning timeout result (total images: {})",
                    deadline.toMillis(), total);
            return Summary.timedOut(total);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new BatchExecutionException("Batch failed: " + cause.getMessage(), cause);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchExecutionException("Interrupted while waiting for batch", e);

        } finally {
            // 不强制中断，正在写出的文件允许在后台完成
            worker.shutdown();
        }
    }

    private int safeCount(IntSupplier totalImages) {
        if (totalImages == null) {
            return 0;
        }
        try {
            return totalImages.getAsInt();
        } catch (RuntimeException e) {
            LOG.warn("Failed to count images for timeout result: {}", e.getMessage());
            return 0;
        }
    }
}
