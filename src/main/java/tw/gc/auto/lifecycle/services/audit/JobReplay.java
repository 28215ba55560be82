package tw.gc.auto.lifecycle.services.audit;

import tw.gc.auto.lifecycle.enums.TrainingJobState;

import java.util.List;

public record JobReplay(String jobId, TrainingJobState finalState, int runningAttempts, List<TrainingJobState> path) {
}
