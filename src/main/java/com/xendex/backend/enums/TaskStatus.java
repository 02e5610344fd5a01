package com.xendex.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ABORTED,
    FAILED;

    public static final Set<TaskStatus> FINISHED = EnumSet.of(COMPLETED, ABORTED, FAILED);

    public boolean isFinished() {
        return FINISHED.contains(this);
    }
}
