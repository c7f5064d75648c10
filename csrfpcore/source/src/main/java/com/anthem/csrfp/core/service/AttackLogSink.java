package com.anthem.csrfp.core.service;

import com.anthem.csrfp.core.model.AttackLogRecord;

/**
 * Append-only destination for records of denied requests.
 */
public interface AttackLogSink {

    /**
     * @throws com.anthem.csrfp.core.exception.LogSinkUnavailableException if the record could not be stored
     */
    void append(AttackLogRecord record);
}
