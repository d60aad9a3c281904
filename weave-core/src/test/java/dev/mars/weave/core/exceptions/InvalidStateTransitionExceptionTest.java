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

package dev.mars.weave.core.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InvalidStateTransitionException.
 */
class InvalidStateTransitionExceptionTest {

    private enum Lifecycle { RUNNING, COMPLETED, FAILED, CANCELLED }

    @Test
    void constructor_withEntityId_formatsMessage() {
        Lifecycle[] validTransitions = {Lifecycle.COMPLETED, Lifecycle.FAILED};

        InvalidStateTransitionException ex = new InvalidStateTransitionException(
                "wf-123", Lifecycle.RUNNING, Lifecycle.RUNNING, validTransitions);

        assertTrue(ex.getMessage().contains("wf-123"));
        assertTrue(ex.getMessage().contains("RUNNING -> RUNNING"));
        assertTrue(ex.getMessage().contains("[COMPLETED, FAILED]"));
        assertEquals("wf-123", ex.getEntityId());
        assertEquals(Lifecycle.RUNNING, ex.getCurrentState());
        assertEquals(Lifecycle.RUNNING, ex.getRequestedState());
        assertEquals(2, ex.getValidTransitions().length);
    }

    @Test
    void constructor_withEmptyTransitions_formatsEmptyArray() {
        InvalidStateTransitionException ex = new InvalidStateTransitionException(
                "wf-456", Lifecycle.COMPLETED, Lifecycle.CANCELLED, new Lifecycle[0]);

        assertTrue(ex.getMessage().endsWith("Valid targets: []"));
        assertEquals(0, ex.getValidTransitions().length);
    }

    @Test
    void constructor_withNullTransitions_formatsEmptyArray() {
        InvalidStateTransitionException ex = new InvalidStateTransitionException(
                "wf-789", Lifecycle.FAILED, Lifecycle.CANCELLED, null);

        assertTrue(ex.getMessage().contains("[]"));
        assertNull(ex.getValidTransitions());
    }

    @Test
    void extendsWeaveException() {
        InvalidStateTransitionException ex = new InvalidStateTransitionException(
                "wf-1", Lifecycle.COMPLETED, Lifecycle.CANCELLED, new Lifecycle[0]);

        assertInstanceOf(WeaveException.class, ex);
        assertInstanceOf(Exception.class, ex);
    }
}
