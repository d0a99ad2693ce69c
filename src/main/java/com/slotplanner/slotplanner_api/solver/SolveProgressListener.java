package com.slotplanner.slotplanner_api.solver;

@FunctionalInterface
public interface SolveProgressListener {

    void onProgress(SolveProgress progress);

    static SolveProgressListener none() {
        return progress -> { };
    }
}
