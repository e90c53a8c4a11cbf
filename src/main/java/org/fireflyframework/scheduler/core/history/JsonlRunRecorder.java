/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.scheduler.core.history;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.model.JobRun;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable recorder writing one newline-delimited JSON file per job,
 * {@code <logDir>/<job>.job.jsonl}. Files are only ever appended to.
 *
 * <p>{@link #readLast(String, int)} scans the file backwards in fixed-size blocks and
 * stops as soon as enough records are collected, so memory use depends on the number
 * of requested records and not on the file size.
 */
@Slf4j
public class JsonlRunRecorder implements RunRecorder {

    public static final String FILE_SUFFIX = ".job.jsonl";

    static final int BLOCK_SIZE = 4096;

    private final Path logDir;
    private final RunSerializer serializer;
    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public JsonlRunRecorder(Path logDir, RunSerializer serializer) {
        this.logDir = logDir;
        this.serializer = serializer;
    }

    public JsonlRunRecorder(Path logDir) {
        this(logDir, new RunSerializer());
    }

    public Path pathFor(String jobName) {
        return logDir.resolve(jobName + FILE_SUFFIX);
    }

    @Override
    public Mono<Void> record(JobRun run) {
        return Mono.<Void>fromRunnable(() -> append(run))
                .subscribeOn(Schedulers.boundedElastic());
    }

    void append(JobRun run) {
        Path file = pathFor(run.name());
        String line = serializer.serialize(run) + "\n";
        synchronized (locks.computeIfAbsent(run.name(), k -> new Object())) {
            try {
                Files.createDirectories(logDir);
                Files.writeString(file, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                log.warn("[run-recorder] could not append run job={} file={} error={}", run.name(), file, e.toString());
            }
        }
    }

    @Override
    public Mono<List<JobRun>> readLast(String jobName, int n) {
        return Mono.fromCallable(() -> tail(jobName, n))
                .subscribeOn(Schedulers.boundedElastic());
    }

    List<JobRun> tail(String jobName, int n) throws IOException {
        Path file = pathFor(jobName);
        if (n <= 0 || !Files.isRegularFile(file)) {
            return List.of();
        }
        List<JobRun> newestFirst = new ArrayList<>(n);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long pos = channel.size();
            byte[] carry = new byte[0];
            while (pos > 0 && newestFirst.size() < n) {
                int len = (int) Math.min(BLOCK_SIZE, pos);
                pos -= len;
                ByteBuffer block = ByteBuffer.allocate(len);
                while (block.hasRemaining()) {
                    if (channel.read(block, pos + block.position()) < 0) break;
                }
                byte[] buf = new byte[len + carry.length];
                System.arraycopy(block.array(), 0, buf, 0, len);
                System.arraycopy(carry, 0, buf, len, carry.length);

                int end = buf.length;
                for (int i = buf.length - 1; i >= 0 && newestFirst.size() < n; i--) {
                    if (buf[i] == '\n') {
                        collect(jobName, buf, i + 1, end, newestFirst);
                        end = i;
                    }
                }
                carry = Arrays.copyOf(buf, end);
            }
            if (pos == 0 && newestFirst.size() < n && carry.length > 0) {
                collect(jobName, carry, 0, carry.length, newestFirst);
            }
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    private void collect(String jobName, byte[] buf, int from, int to, List<JobRun> into) {
        String line = new String(buf, from, to - from, StandardCharsets.UTF_8).strip();
        if (line.isEmpty()) {
            return;
        }
        try {
            into.add(serializer.deserialize(line));
        } catch (IllegalStateException e) {
            log.warn("[run-recorder] skipping unreadable run line job={} error={}", jobName, e.getMessage());
        }
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.fromCallable(() -> !Files.exists(logDir) || Files.isWritable(logDir))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
