/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.celldegradation.ensemble;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import com.amazon.celldegradation.detector.AnomalyDetector;
import com.amazon.celldegradation.features.FeatureMatrix;

/**
 * Runs the detectors on a private thread pool. The feature matrix is shared
 * read-only by all of them.
 */
public class ParallelEnsembleExecutor extends AbstractEnsembleExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelEnsembleExecutor(List<AnomalyDetector> detectors, int threadPoolSize) {
        super(detectors);
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public List<DetectorRun> execute(FeatureMatrix features) {
        return submitAndJoin(() -> detectors.parallelStream().map(detector -> DetectorRun.of(detector, features))
                .collect(Collectors.toList()));
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}
