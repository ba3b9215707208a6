package com.example.shortsbot_backend.engine.Interfaces;

import com.example.shortsbot_backend.engine.MediaCommand;
import com.example.shortsbot_backend.engine.ProcessResult;
import com.example.shortsbot_backend.exception.ExternalToolException;

public interface ProcessRunner {

    /**
     * Runs the command to completion or until its timeout elapses.
     *
     * @throws ExternalToolException when the process cannot be started.
     */
    ProcessResult run(MediaCommand command);

    /**
     * Runs the command and fails on a non-zero exit or a timeout.
     *
     * @throws ExternalToolException carrying the captured stderr.
     */
    default ProcessResult runChecked(MediaCommand command) {
        ProcessResult result = run(command);
        if (!result.succeeded()) {
            throw new ExternalToolException(command.label(), result.exitCode(), result.timedOut(), result.stderr());
        }
        return result;
    }
}
