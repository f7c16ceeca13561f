package com.corvus.engine.executor;

import com.corvus.core.exception.OperationException;

/**
 * A resolved, ready-to-run filesystem or process action.
 */
@FunctionalInterface
public interface Operation {

    /**
     * Perform the action once.
     *
     * @throws OperationException if the action fails; the message becomes the task's failure reason
     */
    void perform() throws OperationException;
}
