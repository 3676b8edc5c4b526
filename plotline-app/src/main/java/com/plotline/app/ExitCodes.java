package com.plotline.app;

import com.plotline.result.ResultStatus;

/**
 * Process exit codes. A partial run exits 0; the warning is logged.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int FAILED = 1;
    public static final int USAGE = 2;

    private ExitCodes() {
    }

    public static int forStatus(ResultStatus status) {
        return status != null && status.isProductive() ? SUCCESS : FAILED;
    }
}
