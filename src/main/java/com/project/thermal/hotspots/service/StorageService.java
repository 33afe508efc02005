package com.project.thermal.hotspots.service;

import com.project.thermal.hotspots.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Keeps each analysis run in its own directory under the upload root: the uploaded CSV and the
 * generated images and export, served back under {@code /uploads/<runId>/}.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final Pattern RUN_ID = Pattern.compile("\\d{8}_\\d{6}_\\d{3}_[0-9a-f]{8}");
    private static final Pattern FILENAME = Pattern.compile("[a-zA-Z0-9._-]+");

    private final Path rootDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public String newRunId() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return RUN_ID_FORMAT.format(LocalDateTime.now()) + "_" + suffix;
    }

    /** Stores the uploaded thermal export in the run directory. */
    public StoredFile store(String runId, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload.csv" : file.getOriginalFilename());
        if (!isCsv(original, file.getContentType())) {
            throw new StorageException("Only CSV uploads are allowed (received: " + file.getContentType() + ")");
        }
        String safeBase = original.replaceAll("[^a-zA-Z0-9._-]", "_");
        Path target = runDir(runId).resolve("input_" + safeBase);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            return stored(runId, target);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /** Writes a generated artifact (PNG, CSV) into the run directory. */
    public StoredFile storeRunFile(String runId, String filename, byte[] content) {
        requireFilename(filename);
        Path target = runDir(runId).resolve(filename);
        try {
            Files.write(target, content);
            return stored(runId, target);
        } catch (IOException e) {
            throw new StorageException("Failed to store " + filename, e);
        }
    }

    public Optional<byte[]> readRunFile(String runId, String filename) {
        if (!RUN_ID.matcher(runId).matches() || !FILENAME.matcher(filename).matches()) {
            return Optional.empty();
        }
        Path file = rootDir.resolve(runId).resolve(filename);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + filename + " of run " + runId, e);
        }
    }

    static boolean isCsv(String filename, String contentType) {
        String name = filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv") || name.endsWith(".txt")) {
            return true;
        }
        return contentType != null && (contentType.startsWith("text/csv") || contentType.startsWith("text/plain"));
    }

    private Path runDir(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new StorageException("Invalid run id: " + runId);
        }
        Path dir = rootDir.resolve(runId);
        try {
            Files.createDirectories(dir);
            return dir;
        } catch (IOException e) {
            throw new StorageException("Cannot create run directory: " + dir, e);
        }
    }

    private static void requireFilename(String filename) {
        if (filename == null || !FILENAME.matcher(filename).matches()) {
            throw new StorageException("Invalid file name: " + filename);
        }
    }

    private static StoredFile stored(String runId, Path target) {
        String filename = target.getFileName().toString();
        return new StoredFile(target, filename, "uploads/" + runId + "/" + filename);
    }
}
