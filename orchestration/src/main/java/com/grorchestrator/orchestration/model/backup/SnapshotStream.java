package com.grorchestrator.orchestration.model.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.File;
import java.io.InputStream;

/**
 * Running snapshot tool. Stream must be fully consumed before awaiting completion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotStream {
    private InputStream inputStream;
    private Process process;
    private File logFile;
}
