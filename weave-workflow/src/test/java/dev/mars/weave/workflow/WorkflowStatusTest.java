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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the WorkflowStatus state machine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 */
class WorkflowStatusTest {

    @ParameterizedTest
    @EnumSource(value = WorkflowStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void testRunningMayEndInAnyTerminalState(WorkflowStatus target) {
        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(target));
        assertTrue(target.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void testTerminalStatesAreFinal(WorkflowStatus terminal) {
        for (WorkflowStatus target : WorkflowStatus.values()) {
            assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
        }
        assertEquals(0, terminal.getValidTransitions().length);
    }

    @Test
    void testRunningCannotReenterRunning() {
        assertFalse(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.RUNNING));
        assertEquals(3, WorkflowStatus.RUNNING.getValidTransitions().length);
    }

    @Test
    void testOnlyCompletedIsSuccessful() {
        assertTrue(WorkflowStatus.COMPLETED.isSuccessful());
        assertFalse(WorkflowStatus.FAILED.isSuccessful());
        assertFalse(WorkflowStatus.CANCELLED.isSuccessful());
        assertFalse(WorkflowStatus.RUNNING.isSuccessful());
        assertFalse(WorkflowStatus.RUNNING.isTerminal());
    }
}
