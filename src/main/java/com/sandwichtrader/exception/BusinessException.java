package com.sandwichtrader.exception;

/** A well-formed request the service refuses to act on, such as a paper spot in LIVE mode. */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message, null, null);
    }
}
