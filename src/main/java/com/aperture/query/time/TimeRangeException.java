package com.aperture.query.time;

import com.aperture.query.ErrorKind;
import com.aperture.query.QueryValidationException;

public class TimeRangeException extends QueryValidationException {

    public TimeRangeException(String message) {
        super(ErrorKind.INVALID_TIME_RANGE, message);
    }

    public TimeRangeException(String message, Throwable cause) {
        super(ErrorKind.INVALID_TIME_RANGE, message, cause);
    }
}
