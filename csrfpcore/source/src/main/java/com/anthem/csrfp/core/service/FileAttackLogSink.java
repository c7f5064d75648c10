package com.anthem.csrfp.core.service;

import com.anthem.csrfp.core.exception.LogSinkUnavailableException;
import com.anthem.csrfp.core.model.AttackLogRecord;
import com.anthem.csrfp.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Writes newline-delimited JSON to one file per calendar month
 * ({@code MM-yyyy.log}) under the log directory.
 */
public class FileAttackLogSink implements AttackLogSink {

    private static final Logger log = LoggerFactory.getLogger(FileAttackLogSink.class);

    private static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("MM-yyyy");

    private final Path logDirectory;
    private final Clock clock;

    public FileAttackLogSink(Path logDirectory) {
        this(logDirectory, Clock.systemDefaultZone());
    }

    public FileAttackLogSink(Path logDirectory, Clock clock) {
        this.logDirectory = logDirectory;
        this.clock = clock;
    }

    // One open-append-close at a time per sink; the line goes out in a single write.
    @Override
    public synchronized void append(AttackLogRecord record) {
        if (!Files.isDirectory(logDirectory)) {
            throw new LogSinkUnavailableException("Log directory not found: " + logDirectory);
        }
        Path logFile = currentLogFile();
        byte[] line = (JsonUtils.toJson(record) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            Files.write(logFile, line,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Unable to write attack log: file={}", logFile, e);
            throw new LogSinkUnavailableException("Unable to write to the log file " + logFile, e);
        }
    }

    public Path currentLogFile() {
        return logDirectory.resolve(LocalDate.now(clock).format(FILE_NAME_FORMAT) + ".log");
    }
}
