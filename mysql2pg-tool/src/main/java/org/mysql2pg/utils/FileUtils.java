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

package org.mysql2pg.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileUtils
 *
 * @since 2025-04-18
 */
public class FileUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileUtils.class);
    private static final String CHUNK_FILE_FORMAT = "%s_part_%03d.sql";

    /**
     * writeToFile
     *
     * @param file file
     * @param content content
     */
    public static void writeToFile(File file, String content) {
        if (file.exists()) {
            try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
                writer.write(content + System.lineSeparator());
            } catch (IOException exp) {
                LOGGER.warn("IO exception occurred while writing file {}, content is not saved", file, exp);
            }
        }
    }

    /**
     * initFile
     *
     * @param path path
     * @return File
     */
    public static File initFile(String path) {
        File file = new File(path);
        try {
            if (!file.exists()) {
                Files.createFile(Paths.get(path));
            }
        } catch (IOException exp) {
            LOGGER.warn("Failed to create file, please check file path.", exp);
        }
        return file;
    }

    /**
     * createDir
     *
     * @param path path
     * @return true when the directory exists afterwards
     */
    public static boolean createDir(String path) {
        try {
            Path dirPath = Paths.get(path);
            if (Files.isDirectory(dirPath)) {
                return true;
            }
            Files.createDirectories(dirPath);
            modifyDirPermission(dirPath);
            LOGGER.info("success to create dir: {}", dirPath.toAbsolutePath());
            return true;
        } catch (IOException e) {
            LOGGER.error("failed to create dir: {}, error message:{}", path, e.getMessage());
            return false;
        }
    }

    /**
     * set file permission 640
     *
     * @param filePath filePath
     * @throws IOException IOException
     */
    public static void modifyFilePermission(Path filePath) throws IOException {
        try {
            Set<PosixFilePermission> perms = Set.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE,
                PosixFilePermission.GROUP_READ);
            Files.setPosixFilePermissions(filePath, perms);
        } catch (UnsupportedOperationException e) {
            filePath.toFile().setReadable(true, true);
            filePath.toFile().setWritable(true, true);
            filePath.toFile().setExecutable(false, false);
        }
    }

    /**
     * set directory permission 750
     *
     * @param path path
     * @throws IOException IOException
     */
    public static void modifyDirPermission(Path path) throws IOException {
        try {
            Set<PosixFilePermission> perms = Set.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE,
                PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_EXECUTE);
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException e) {
            File dir = path.toFile();
            dir.setReadable(true, true);
            dir.setWritable(true, true);
            dir.setExecutable(true, true);
        }
    }

    /**
     * getChunkFilePath
     *
     * @param outDir outDir
     * @param prefix prefix
     * @param sequence sequence, starting at 1
     * @return path of the chunk file
     */
    public static Path getChunkFilePath(Path outDir, String prefix, int sequence) {
        return outDir.resolve(String.format(Locale.ROOT, CHUNK_FILE_FORMAT, prefix, sequence));
    }

    /**
     * listChunkFiles
     *
     * @param outDir outDir
     * @param prefix prefix
     * @return chunk files ordered by their part number
     * @throws IOException IOException
     */
    public static List<Path> listChunkFiles(Path outDir, String prefix) throws IOException {
        Pattern pattern = Pattern.compile("^" + Pattern.quote(prefix) + "_part_(\\d+)\\.sql$");
        try (Stream<Path> files = Files.list(outDir)) {
            return files.filter(file -> pattern.matcher(file.getFileName().toString()).matches())
                .sorted(Comparator.comparingLong(file -> partNumber(pattern, file)))
                .collect(Collectors.toList());
        }
    }

    private static long partNumber(Pattern pattern, Path file) {
        Matcher matcher = pattern.matcher(file.getFileName().toString());
        return matcher.matches() ? Long.parseLong(matcher.group(1)) : Long.MAX_VALUE;
    }

    /**
     * deleteChunkFiles, removes chunk files left by an earlier run
     *
     * @param outDir outDir
     * @param prefix prefix
     * @throws IOException IOException
     */
    public static void deleteChunkFiles(Path outDir, String prefix) throws IOException {
        for (Path file : listChunkFiles(outDir, prefix)) {
            Files.deleteIfExists(file);
            LOGGER.debug("deleted old chunk file: {}", file);
        }
    }
}
