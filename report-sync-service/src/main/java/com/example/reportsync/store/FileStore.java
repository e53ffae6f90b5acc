package com.example.reportsync.store;

import com.example.reportsync.entity.ReportFile;

import java.io.IOException;
import java.util.List;

public interface FileStore {

    List<ReportFile> findByReport(String reportId);

    byte[] read(ReportFile file) throws IOException;
}
