/*
 * Copyright (c) 2025-2025 Huawei Technologies Co.,Ltd.
 *
 * openGauss is licensed under Mulan PSL v2.
 * You can use this software according to the terms and conditions of the Mulan PSL v2.
 * You may obtain a copy of Mulan PSL v2 at:
 *
 *           http://license.coscl.org.cn/MulanPSL2
 *
 * THIS SOFTWARE IS PROVIDED ON AN "AS IS" BASIS, WITHOUT WARRANTIES OF ANY KIND,
 * EITHER EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO NON-INFRINGEMENT,
 * MERCHANTABILITY OR FIT FOR A PARTICULAR PURPOSE.
 * See the Mulan PSL v2 for more details.
 */

package org.mysql2pg.coordinator;

import org.mysql2pg.constants.CommonConstants;
import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.model.load.ExecutionResult;
import org.mysql2pg.model.load.LoadResult;
import org.mysql2pg.model.load.LoadSummary;
import org.mysql2pg.model.load.LoadTask;
import org.mysql2pg.target.LoadExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads files with a fixed pool of workers pulling from a shared queue. A failed file is retried
 * on the same worker until the attempt bound is reached; failures never stop the other files.
 *
 * @since 2025-04-18
 */
public class LoadOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoadOrchestrator.class);

    private final LoadExecutor executor;
    private final int workerNum;
    private final int maxAttempts;

    /**
     * Constructor
     *
     * @param executor executor
     * @param workerNum number of workers
     * @param maxAttempts attempts per file, at least 1
     */
    public LoadOrchestrator(LoadExecutor executor, int workerNum, int maxAttempts) {
        if (workerNum < 1 || maxAttempts < 1) {
            throw new IllegalArgumentException("workerNum and maxAttempts must be at least 1");
        }
        this.executor = executor;
        this.workerNum = workerNum;
        this.maxAttempts = maxAttempts;
    }

    /**
     * run, returns once every file has been loaded or has used up its attempts
     *
     * @param files files in order
     * @return LoadSummary with results in the order of files
     */
    public LoadSummary run(List<Path> files) {
        long startTime = System.currentTimeMillis();
        if (files.isEmpty()) {
            return new LoadSummary(Collections.emptyList(), 0L);
        }
        TaskQueue<LoadTask> taskQueue = new TaskQueue<>();
        for (int i = 0; i < files.size(); i++) {
            taskQueue.putToQueue(new LoadTask(i + 1, files.get(i)));
        }
        taskQueue.setReadFinished(true);
        Map<Integer, LoadResult> results = new ConcurrentHashMap<>();
        AtomicInteger finished = new AtomicInteger();
        int threadNum = Math.min(workerNum, files.size());
        ThreadPoolExecutor loadPool = new ThreadPoolExecutor(threadNum, threadNum, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), getThreadFactory(CommonConstants.LOADER_THREAD_PREFIX));
        LOGGER.info("start to load {} files with {} workers, at most {} attempts per file.", files.size(),
            threadNum, maxAttempts);
        for (int i = 0; i < threadNum; i++) {
            loadPool.execute(() -> work(taskQueue, results, finished, files.size()));
        }
        waitThreadsTerminated(loadPool);
        List<LoadResult> ordered = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            LoadResult result = results.get(i + 1);
            ordered.add(result != null ? result
                : new LoadResult(files.get(i).toString(), false, 0, "not executed"));
        }
        LoadSummary summary = new LoadSummary(ordered, System.currentTimeMillis() - startTime);
        LOGGER.info("load finished, {} succeeded, {} failed, cost {} ms.", summary.getSucceeded(),
            summary.getFailed(), summary.getCostTime());
        return summary;
    }

    private void work(TaskQueue<LoadTask> taskQueue, Map<Integer, LoadResult> results, AtomicInteger finished,
        int total) {
        while (!taskQueue.isQueuePollEnd() && !Thread.currentThread().isInterrupted()) {
            LoadTask task = taskQueue.pollQueue();
            if (task == null) {
                continue;
            }
            results.put(task.getSequence(), load(task));
            LOGGER.info("load progress {}/{}", finished.incrementAndGet(), total);
        }
    }

    private LoadResult load(LoadTask task) {
        Path file = task.getFile();
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ExecutionResult result;
            try {
                result = executor.execute(file);
            } catch (RuntimeException e) {
                result = ExecutionResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (result.isSuccess()) {
                return new LoadResult(file.toString(), true, attempt, null);
            }
            lastError = result.getMessage();
            LOGGER.warn("attempt {}/{} to load {} failed: {}", attempt, maxAttempts, file.getFileName(), lastError);
        }
        LOGGER.error("{}give up loading {} after {} attempts, last error: {}", ErrorCode.LOAD_EXCEPTION,
            file.getFileName(), maxAttempts, lastError);
        return new LoadResult(file.toString(), false, maxAttempts, lastError);
    }

    private void waitThreadsTerminated(ThreadPoolExecutor threadPool) {
        threadPool.shutdown();
        try {
            while (!threadPool.awaitTermination(1, TimeUnit.SECONDS)) {
                LOGGER.debug("waiting for {} active load workers.", threadPool.getActiveCount());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            threadPool.shutdownNow();
            LOGGER.error("{}interrupted while waiting for load workers, error message:{}",
                ErrorCode.THREAD_INTERRUPTED_EXCEPTION, e.getMessage());
        }
    }

    private ThreadFactory getThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadCount = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadCount.getAndIncrement());
                thread.setUncaughtExceptionHandler((t, e) -> LOGGER.error("{}Thread {} threw an uncaught exception",
                    ErrorCode.UNKNOWN, t.getName(), e));
                return thread;
            }
        };
    }
}
