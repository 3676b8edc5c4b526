package com.plotline.result;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultTest {

    @Test
    void create_startsAsSuccessWithEmptyLists() {
        Result result = Result.create("run_pipeline");

        assertEquals("run_pipeline", result.getName());
        assertEquals(ResultStatus.SUCCESS, result.getStatus());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getWarnings().isEmpty());
        assertTrue(result.getPhaseResults().isEmpty());
        assertNotNull(result.getStartedAt());
    }

    @Test
    void addError_forcesFailedAndKeepsOrder() {
        Result result = Result.create("load")
                .addError("first")
                .addError("second");

        assertEquals(ResultStatus.FAILED, result.getStatus());
        assertEquals(List.of("first", "second"), result.getErrors());
    }

    @Test
    void setStatus_neverImprovesDegradedResult() {
        Result result = Result.create("plots").setStatus(ResultStatus.PARTIAL, "one module failed");

        result.setStatus(ResultStatus.SUCCESS, "all good");

        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertEquals("all good", result.getMessage());
    }

    @Test
    void setStatus_cannotLeaveFailed() {
        Result result = Result.create("plots").addError("boom");

        result.setStatus(ResultStatus.PARTIAL, "retry");

        assertEquals(ResultStatus.FAILED, result.getStatus());
    }

    @Test
    void setStatus_rejectsFailed() {
        Result result = Result.create("plots");

        assertThrows(IllegalArgumentException.class, () -> result.setStatus(ResultStatus.FAILED, "nope"));
        assertEquals(ResultStatus.SUCCESS, result.getStatus());
    }

    @Test
    void addRecoverableError_degradesToPartialOnly() {
        Result result = Result.create("plots").addRecoverableError(ErrorKind.MODULE_LOAD.format("bad module"));

        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertEquals(List.of("[MODULE] bad module"), result.getErrors());

        result.addError("fatal");
        result.addRecoverableError("later");
        assertEquals(ResultStatus.FAILED, result.getStatus());
    }

    @Test
    void addWarning_leavesStatusUntouched() {
        Result result = Result.create("reports").addWarning("renderer unavailable");

        assertEquals(ResultStatus.SUCCESS, result.getStatus());
        assertEquals(1, result.getWarnings().size());
    }

    @Test
    void finish_isOneShot() {
        Result result = Result.create("run").finish();

        assertTrue(result.isFinished());
        assertTrue(result.getDurationMillis() >= 0);
        assertThrows(IllegalStateException.class, result::finish);
    }

    @Test
    void worse_ordersBySeverity() {
        assertEquals(ResultStatus.PARTIAL, ResultStatus.worse(ResultStatus.SUCCESS, ResultStatus.PARTIAL));
        assertEquals(ResultStatus.FAILED, ResultStatus.worse(ResultStatus.FAILED, ResultStatus.PARTIAL));
        assertEquals(ResultStatus.SUCCESS, ResultStatus.worse(null, null));
    }

    @Test
    void fromValue_isLenient() {
        assertEquals(ResultStatus.PARTIAL, ResultStatus.fromValue(" partial "));
        assertEquals(ResultStatus.FAILED, ResultStatus.fromValue("unknown"));
        assertEquals("success", ResultStatus.SUCCESS.toValue());
    }

    @Test
    void errorKind_onlyDataLoadIsFatal() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertEquals(kind == ErrorKind.DATA_LOAD, kind.isFatal(), kind.name());
        }
    }
}
