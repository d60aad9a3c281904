/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.weave.workflow;

import dev.mars.weave.workflow.observability.WorkflowMetrics;
import dev.mars.weave.workflow.store.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts finished workflow instances once their retention window has passed.
 * Running instances are never evicted.
 */
public class InstanceSweeper {

    private static final Logger logger = LoggerFactory.getLogger(InstanceSweeper.class);

    private final InstanceStore instanceStore;
    private final Duration retention;
    private final boolean includeCancelled;
    private final WorkflowMetrics metrics;
    private ScheduledFuture<?> sweepTask;

    public InstanceSweeper(InstanceStore instanceStore, Duration retention, boolean includeCancelled,
                           WorkflowMetrics metrics) {
        this.instanceStore = Objects.requireNonNull(instanceStore, "Instance store cannot be null");
        this.retention = Objects.requireNonNull(retention, "Retention cannot be null");
        this.includeCancelled = includeCancelled;
        this.metrics = metrics;
    }

    /**
     * Schedules sweeps at a fixed interval on the given scheduler. Calling start again is a no-op.
     */
    public synchronized void start(ScheduledExecutorService scheduler, Duration interval) {
        if (sweepTask != null) {
            return;
        }
        long periodMs = Math.max(1, interval.toMillis());
        sweepTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sweep(Instant.now());
            } catch (RuntimeException e) {
                logger.warn("Error in instance sweeper: {}", e.getMessage());
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Instance sweeper started: interval={} ms, retention={} ms, includeCancelled={}",
                periodMs, retention.toMillis(), includeCancelled);
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
            logger.info("Instance sweeper stopped");
        }
    }

    public synchronized boolean isRunning() {
        return sweepTask != null;
    }

    /**
     * Evicts every eligible instance.
     *
     * @param now the reference time for the retention window
     * @return number of instances evicted
     */
    public int sweep(Instant now) {
        int evicted = 0;
        for (WorkflowInstance instance : instanceStore.list()) {
            if (isEligible(instance, now) && instanceStore.delete(instance.getId())) {
                evicted++;
                logger.debug("Evicted workflow instance {} ({}, ended {})", instance.getId(),
                        instance.getStatus(), instance.getEndTime());
            }
        }
        if (evicted > 0) {
            logger.info("Swept {} finished workflow instance(s)", evicted);
            if (metrics != null) {
                metrics.recordInstancesSwept(evicted);
            }
        }
        return evicted;
    }

    boolean isEligible(WorkflowInstance instance, Instant now) {
        WorkflowStatus status = instance.getStatus();
        if (!status.isTerminal()) {
            return false;
        }
        if (status == WorkflowStatus.CANCELLED && !includeCancelled) {
            return false;
        }
        Instant endTime = instance.getEndTime();
        return endTime != null && endTime.plus(retention).isBefore(now);
    }
}
