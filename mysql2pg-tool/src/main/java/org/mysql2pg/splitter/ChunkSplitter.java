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

package org.mysql2pg.splitter;

import org.mysql2pg.model.data.ChunkFile;
import org.mysql2pg.model.data.InsertStatement;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.translator.warning.WarningKind;
import org.mysql2pg.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Writes rewritten statements into size bounded chunk files that can each be loaded on their own.
 * A chunk is closed as soon as its statement bytes reach the budget.
 *
 * @since 2025-04-18
 */
public class ChunkSplitter {
    /**
     * session setting that keeps triggers and foreign key checks from firing during the load
     */
    public static final String DISABLE_TRIGGERS = "SET session_replication_role = 'replica';";

    /**
     * restores the session setting changed by DISABLE_TRIGGERS
     */
    public static final String ENABLE_TRIGGERS = "SET session_replication_role = 'origin';";

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkSplitter.class);
    private static final String HEADER = "-- mysql2pg data chunk %d (%s)";
    private static final String CLIENT_ENCODING = "SET client_encoding = 'UTF8';";
    private static final String ASYNC_COMMIT = "SET synchronous_commit = OFF;";

    private final Path outDir;
    private final String prefix;
    private final long budget;
    private final boolean isDisableTriggers;
    private final ConversionWarnings warnings;

    /**
     * Constructor
     *
     * @param outDir outDir
     * @param prefix chunk file name prefix
     * @param budget budget in bytes
     * @param isDisableTriggers isDisableTriggers
     * @param warnings warnings
     */
    public ChunkSplitter(Path outDir, String prefix, long budget, boolean isDisableTriggers,
        ConversionWarnings warnings) {
        if (budget <= 0) {
            throw new IllegalArgumentException("chunk budget must be positive: " + budget);
        }
        this.outDir = outDir;
        this.prefix = prefix;
        this.budget = budget;
        this.isDisableTriggers = isDisableTriggers;
        this.warnings = warnings;
    }

    /**
     * split. When the statement source fails the unfinished chunk is deleted, closed chunks stay
     * and the failure is rethrown.
     *
     * @param statements statements in source order
     * @return closed chunks in order
     * @throws IOException IOException
     */
    public List<ChunkFile> split(Iterator<InsertStatement> statements) throws IOException {
        List<ChunkFile> chunks = new ArrayList<>();
        ChunkWriter current = null;
        try {
            while (statements.hasNext()) {
                InsertStatement statement = statements.next();
                long size = statement.getText().getBytes(StandardCharsets.UTF_8).length + 1L;
                if (size > budget) {
                    warnings.warn(WarningKind.OVERSIZED_STATEMENT, "statement " + statement.getIndex(),
                        String.format(Locale.ROOT, "statement of %d bytes exceeds the chunk budget of %d bytes and "
                            + "gets its own chunk", size, budget));
                    if (current != null) {
                        chunks.add(current.close());
                        current = null;
                    }
                }
                if (current == null) {
                    current = new ChunkWriter(chunks.size() + 1);
                }
                current.append(statement, size);
                if (current.byteSize >= budget) {
                    chunks.add(current.close());
                    current = null;
                }
            }
            if (current != null) {
                chunks.add(current.close());
                current = null;
            }
        } catch (RuntimeException | IOException e) {
            if (current != null) {
                current.discard();
            }
            LOGGER.error("fail to split statements into chunks, {} chunks were closed before the error.",
                chunks.size());
            throw e;
        }
        LOGGER.info("split data into {} chunks under {}.", chunks.size(), outDir);
        return chunks;
    }

    private class ChunkWriter {
        private final int sequence;
        private final Path path;
        private final BufferedWriter writer;
        private int statementCount;
        private long byteSize;
        private long firstIndex = -1;
        private long lastIndex = -1;

        ChunkWriter(int sequence) throws IOException {
            this.sequence = sequence;
            this.path = FileUtils.getChunkFilePath(outDir, prefix, sequence);
            this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
            FileUtils.modifyFilePermission(path);
            writer.write(String.format(Locale.ROOT, HEADER, sequence, path.getFileName()));
            writer.write('\n');
            writer.write(CLIENT_ENCODING);
            writer.write('\n');
            if (isDisableTriggers) {
                writer.write(DISABLE_TRIGGERS);
                writer.write('\n');
                writer.write(ASYNC_COMMIT);
                writer.write('\n');
            }
        }

        void append(InsertStatement statement, long size) throws IOException {
            writer.write(statement.getText());
            writer.write('\n');
            if (firstIndex < 0) {
                firstIndex = statement.getIndex();
            }
            lastIndex = statement.getIndex();
            statementCount++;
            byteSize += size;
        }

        ChunkFile close() throws IOException {
            if (isDisableTriggers) {
                writer.write(ENABLE_TRIGGERS);
                writer.write('\n');
            }
            writer.close();
            LOGGER.debug("closed chunk {} with {} statements, {} bytes.", path, statementCount, byteSize);
            return new ChunkFile(sequence, path, statementCount, byteSize, firstIndex, lastIndex);
        }

        void discard() {
            try {
                writer.close();
                Files.deleteIfExists(path);
                LOGGER.warn("deleted unfinished chunk {}.", path);
            } catch (IOException e) {
                LOGGER.error("fail to delete unfinished chunk {}, error message:{}", path, e.getMessage());
            }
        }
    }
}
