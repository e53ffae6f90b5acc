package com.example.reportsync.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Attachment metadata of a report. Bytes are held by the file store.
 */
@Entity
@Table(name = "report_files", indexes = {
        @Index(name = "idx_report_files_report_id", columnList = "report_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportFile extends BaseEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "report_id", nullable = false, length = 64)
    private String reportId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private FileType type;

    @Column(name = "filename", nullable = false)
    private String filename;

    @Column(name = "path", nullable = false, length = 1000)
    private String path;

    @Column(name = "mime_type", length = 100)
    private String mimeType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;
}
