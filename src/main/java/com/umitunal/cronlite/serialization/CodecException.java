package com.umitunal.cronlite.serialization;

import com.umitunal.cronlite.core.CronLiteException;

public class CodecException extends CronLiteException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
