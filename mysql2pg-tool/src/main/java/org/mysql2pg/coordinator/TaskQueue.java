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

import org.mysql2pg.enums.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TaskQueue, work queue shared by the load workers of one run
 *
 * @param <T> element type
 * @since 2025-04-18
 */
public class TaskQueue<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskQueue.class);

    private final BlockingQueue<T> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean isReadFinished = new AtomicBoolean(false);

    /**
     * putToQueue
     *
     * @param object object
     */
    public void putToQueue(T object) {
        try {
            queue.put(object);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("{}put object to queue has occurred an exception, error message:{}",
                ErrorCode.THREAD_INTERRUPTED_EXCEPTION, e.getMessage());
        }
    }

    /**
     * pollQueue
     *
     * @return head of the queue, or null when nothing arrived within one second
     */
    public T pollQueue() {
        try {
            return queue.poll(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("{}take object from queue has occurred an exception, error message:{}",
                ErrorCode.THREAD_INTERRUPTED_EXCEPTION, e.getMessage());
        }
        return null;
    }

    /**
     * isQueuePollEnd
     *
     * @return true when no more elements will arrive and the queue is drained
     */
    public boolean isQueuePollEnd() {
        return isReadFinished.get() && queue.isEmpty();
    }

    /**
     * setReadFinished
     *
     * @param isFinished isFinished
     */
    public void setReadFinished(boolean isFinished) {
        isReadFinished.set(isFinished);
    }

    /**
     * size
     *
     * @return number of queued elements
     */
    public int size() {
        return queue.size();
    }
}
