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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.mysql2pg.model.load.ExecutionResult;
import org.mysql2pg.model.load.LoadResult;
import org.mysql2pg.model.load.LoadSummary;
import org.mysql2pg.target.LoadExecutor;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LoadOrchestratorTest
 *
 * @since 2025-04-18
 */
public class LoadOrchestratorTest {
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    @Test
    public void testFailingFileUsesAllAttemptsOthersSucceed() {
        LoadExecutor executor = file -> {
            String name = record(file);
            return name.startsWith("bad") ? ExecutionResult.failure("relation does not exist")
                : ExecutionResult.success();
        };
        List<Path> files = files("p1.sql", "bad.sql", "p3.sql", "p4.sql", "p5.sql");

        LoadSummary summary = new LoadOrchestrator(executor, 3, 3).run(files);

        assertEquals(5, summary.getTotal());
        assertEquals(4, summary.getSucceeded());
        assertEquals(1, summary.getFailed());
        assertFalse(summary.isAllSuccess());
        assertEquals(3, attempts.get("bad.sql").get());
        assertEquals(1, attempts.get("p1.sql").get());
        assertEquals(1, attempts.get("p5.sql").get());
        LoadResult failed = summary.getFailedResults().get(0);
        assertEquals(Paths.get("bad.sql").toString(), failed.getFile());
        assertEquals(3, failed.getAttempts());
        assertEquals("relation does not exist", failed.getLastError());
        for (int i = 0; i < files.size(); i++) {
            assertEquals(files.get(i).toString(), summary.getResults().get(i).getFile());
        }
    }

    @Test
    public void testTransientFailureIsRetried() {
        LoadExecutor flaky = file -> {
            record(file);
            return attempts.get(file.getFileName().toString()).get() < 2 ? ExecutionResult.failure("deadlock")
                : ExecutionResult.success();
        };

        LoadSummary summary = new LoadOrchestrator(flaky, 2, 3).run(files("flaky.sql"));

        assertTrue(summary.isAllSuccess());
        LoadResult result = summary.getResults().get(0);
        assertEquals(2, result.getAttempts());
        assertNull(result.getLastError());
    }

    @Test
    public void testExceptionCountsAsFailedAttempt() {
        LoadExecutor executor = file -> {
            record(file);
            throw new IllegalStateException("boom");
        };

        LoadSummary summary = new LoadOrchestrator(executor, 1, 2).run(files("x.sql"));

        assertEquals(1, summary.getFailed());
        assertEquals(2, attempts.get("x.sql").get());
        assertEquals("IllegalStateException: boom", summary.getResults().get(0).getLastError());
    }

    @Test
    public void testWorkersRunConcurrentlyWithinBound() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        LoadExecutor executor = file -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(50L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return ExecutionResult.success();
        };
        List<Path> files = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            files.add(Paths.get("chunk_" + i + ".sql"));
        }

        LoadSummary summary = new LoadOrchestrator(executor, 4, 1).run(files);

        assertTrue(summary.isAllSuccess());
        assertEquals(12, summary.getSucceeded());
        assertTrue(peak.get() <= 4);
    }

    @Test
    public void testEmptyInput() {
        LoadSummary summary = new LoadOrchestrator(file -> ExecutionResult.success(), 2, 1)
            .run(Collections.emptyList());

        assertEquals(0, summary.getTotal());
        assertTrue(summary.isAllSuccess());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAttemptsMustBePositive() {
        new LoadOrchestrator(file -> ExecutionResult.success(), 1, 0);
    }

    private String record(Path file) {
        String name = file.getFileName().toString();
        attempts.computeIfAbsent(name, key -> new AtomicInteger()).incrementAndGet();
        return name;
    }

    private static List<Path> files(String... names) {
        List<Path> files = new ArrayList<>();
        for (String name : names) {
            files.add(Paths.get(name));
        }
        return files;
    }
}
