package com.stockanalysis.exception;

public class ReportWriteException extends BaseException {

    public ReportWriteException(String message, Throwable cause) {
        super(ErrorCode.REPORT_WRITE_FAILED, message, cause);
    }
}
