package com.example.reportsync.store;

import com.example.reportsync.entity.ReportFile;
import com.example.reportsync.repository.ReportFileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Attachment metadata from the database, bytes from the local storage directory.
 */
@Component
@Slf4j
public class LocalFileStore implements FileStore {

    private final ReportFileRepository reportFileRepository;
    private final Path root;

    public LocalFileStore(ReportFileRepository reportFileRepository,
                          @Value("${report-sync.storage.root:./data/uploads}") String root) {
        this.reportFileRepository = reportFileRepository;
        this.root = Path.of(root).toAbsolutePath().normalize();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReportFile> findByReport(String reportId) {
        return reportFileRepository.findByReportIdOrderByCreatedAtAsc(reportId);
    }

    @Override
    public byte[] read(ReportFile file) throws IOException {
        Path resolved = resolve(file);
        log.debug("Reading attachment {} for reportId={}", resolved, file.getReportId());
        return Files.readAllBytes(resolved);
    }

    Path resolve(ReportFile file) throws IOException {
        Path resolved = (file.getPath() != null && !file.getPath().isBlank())
                ? root.resolve(file.getPath()).normalize()
                : root.resolve(file.getReportId()).resolve(file.getFilename()).normalize();
        if (!resolved.startsWith(root)) {
            throw new IOException("Attachment path escapes storage root: " + file.getPath());
        }
        return resolved;
    }
}
