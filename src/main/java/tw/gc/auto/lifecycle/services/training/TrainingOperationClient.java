package tw.gc.auto.lifecycle.services.training;

import tw.gc.auto.lifecycle.exceptions.TrainingOperationException;

/**
 * Boundary to the long-running external training computation. Every call returns promptly;
 * progress is observed by polling or through the completion callback.
 */
public interface TrainingOperationClient {

    /**
     * @return opaque handle identifying the dispatched run
     */
    String submitTraining(TrainingRequest request) throws TrainingOperationException;

    TrainingStatus pollStatus(String handle) throws TrainingOperationException;

    /**
     * Best-effort request to stop a run.
     */
    void cancel(String handle) throws TrainingOperationException;
}
