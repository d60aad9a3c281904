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


package dev.mars.weave.workflow.store;

import dev.mars.weave.workflow.TaskSpec;
import dev.mars.weave.workflow.TaskType;
import dev.mars.weave.workflow.WorkflowInstance;
import dev.mars.weave.workflow.WorkflowTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryInstanceStoreTest {

    private InMemoryInstanceStore store;
    private WorkflowTemplate template;

    @BeforeEach
    void setUp() {
        store = new InMemoryInstanceStore();
        template = WorkflowTemplate.builder()
                .id("flow")
                .name("Flow")
                .task(TaskSpec.builder().id("a").type(TaskType.AGENT).build())
                .build();
    }

    @Test
    void testSaveIfAbsentKeepsFirstInstance() {
        WorkflowInstance first = instance("wf-1", "ada");
        WorkflowInstance second = instance("wf-1", "grace");

        assertTrue(store.saveIfAbsent(first));
        assertFalse(store.saveIfAbsent(second));

        assertSame(first, store.find("wf-1").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void testConcurrentSaveIfAbsentAdmitsExactlyOne() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch gate = new CountDownLatch(1);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                WorkflowInstance candidate = instance("wf-race", "user-" + i);
                attempts.add(pool.submit(() -> {
                    gate.await();
                    return store.saveIfAbsent(candidate);
                }));
            }
            gate.countDown();

            int admitted = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertEquals(1, admitted);
            assertEquals(1, store.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testFindListAndDelete() {
        store.save(instance("wf-1", "ada"));
        store.save(instance("wf-2", "ada"));

        assertEquals(2, store.list().size());
        assertTrue(store.find(null).isEmpty());
        assertTrue(store.delete("wf-1"));
        assertFalse(store.delete("wf-1"));
        assertFalse(store.delete(null));
        assertEquals(1, store.size());
    }

    private WorkflowInstance instance(String id, String userId) {
        return new WorkflowInstance(id, template, Map.of(), userId, null, 2, Instant.now());
    }
}
