package io.subrelay.async;

import io.subrelay.model.JobRecord;

/**
 * Hands a job over to something that runs independently of the caller. No handle comes back:
 * once launched, the job can be neither queried nor cancelled, and its only output is the
 * completion payload at {@link JobRecord#resultPath()}.
 */
@FunctionalInterface
public interface JobLauncher {
    /**
     * @throws java.io.UncheckedIOException when the hand-off itself fails
     */
    void launch(JobRecord job);
}
