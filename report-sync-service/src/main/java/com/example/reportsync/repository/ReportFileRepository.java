package com.example.reportsync.repository;

import com.example.reportsync.entity.ReportFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReportFileRepository extends JpaRepository<ReportFile, String> {

    List<ReportFile> findByReportIdOrderByCreatedAtAsc(String reportId);
}
