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

import dev.mars.weave.config.WeaveConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testAttemptsAreRetriesPlusOne() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(100), null);

        assertEquals(3, policy.getMaxAttempts());
        assertTrue(policy.hasAttemptsRemaining(1));
        assertTrue(policy.hasAttemptsRemaining(2));
        assertFalse(policy.hasAttemptsRemaining(3));
    }

    @Test
    void testZeroRetriesMeansSingleAttempt() {
        RetryPolicy policy = new RetryPolicy(0, Duration.ofMillis(100), Duration.ZERO);

        assertEquals(1, policy.getMaxAttempts());
        assertFalse(policy.hasAttemptsRemaining(1));
        assertFalse(policy.hasTimeout());
    }

    @Test
    void testLinearBackoffIsNonDecreasing() {
        RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(250), null);

        assertEquals(Duration.ofMillis(250), policy.delayBeforeRetry(0));
        assertEquals(Duration.ofMillis(500), policy.delayBeforeRetry(1));
        assertEquals(Duration.ofMillis(750), policy.delayBeforeRetry(2));

        Duration previous = Duration.ZERO;
        for (int i = 0; i < policy.getMaxRetries(); i++) {
            Duration delay = policy.delayBeforeRetry(i);
            assertTrue(delay.compareTo(previous) >= 0);
            previous = delay;
        }
    }

    @Test
    void testNegativeRetriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ZERO, null));
    }

    @Test
    void testTaskSettingsOverrideConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(WeaveConfiguration.TASK_MAX_RETRIES, "5");
        properties.setProperty(WeaveConfiguration.TASK_RETRY_DELAY_MS, "2000");
        properties.setProperty(WeaveConfiguration.TASK_TIMEOUT_MS, "30000");
        WeaveConfiguration configuration = new WeaveConfiguration(properties);

        TaskSpec defaults = TaskSpec.builder().id("a").type(TaskType.AGENT).build();
        RetryPolicy fromConfig = RetryPolicy.forTask(defaults, configuration);
        assertEquals(5, fromConfig.getMaxRetries());
        assertEquals(Duration.ofSeconds(2), fromConfig.getBaseDelay());
        assertEquals(Duration.ofSeconds(30), fromConfig.getTimeout());
        assertTrue(fromConfig.hasTimeout());

        TaskSpec explicit = TaskSpec.builder()
                .id("b")
                .type(TaskType.AGENT)
                .maxRetries(1)
                .retryDelay(Duration.ofMillis(10))
                .timeout(Duration.ofSeconds(1))
                .build();
        RetryPolicy fromTask = RetryPolicy.forTask(explicit, configuration);
        assertEquals(1, fromTask.getMaxRetries());
        assertEquals(Duration.ofMillis(10), fromTask.getBaseDelay());
        assertEquals(Duration.ofSeconds(1), fromTask.getTimeout());
    }
}
