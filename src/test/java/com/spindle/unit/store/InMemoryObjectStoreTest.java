/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.unit.store;

import com.spindle.protocol.DataResponse;
import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StatusException;
import com.spindle.protocol.message.GetRequest;
import com.spindle.protocol.message.GetResponse;
import com.spindle.protocol.message.InitRequest;
import com.spindle.protocol.message.PrepRuntimeEnvRequest;
import com.spindle.protocol.message.PutRequest;
import com.spindle.protocol.message.PutResponse;
import com.spindle.store.InMemoryObjectStore;
import com.spindle.utils.LoggerUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryObjectStore")
class InMemoryObjectStoreTest {

    private InMemoryObjectStore store;

    @BeforeEach
    void setUp() {
        LoggerUtil.setSilent(true);
        store = new InMemoryObjectStore(Map.of("working_dir", "/srv"));
    }

    @AfterEach
    void tearDown() {
        LoggerUtil.setSilent(false);
    }

    private String putFor(String clientId, String text) {
        PutResponse resp = store.putObject(new PutRequest(text.getBytes(StandardCharsets.UTF_8), null), clientId);
        assertTrue(resp.valid());
        return resp.id();
    }

    @Nested
    @DisplayName("put / get")
    class PutGet {

        @Test
        @DisplayName("should store an object under a 32-hex id")
        void shouldStoreObject() {
            String id = putFor("c1", "hello");

            assertTrue(id.matches("[0-9a-f]{32}"));
            assertTrue(store.contains(id));
        }

        @Test
        @DisplayName("should return stored bytes")
        void shouldGetStoredBytes() {
            String id = putFor("c1", "hello");

            GetResponse resp = store.getObject(new GetRequest(List.of(id), 0, false), "c1");

            assertTrue(resp.valid());
            assertEquals("hello", new String(resp.data().get(0), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("should fail a get for a missing object after the timeout")
        void shouldFailMissingObject() {
            GetResponse resp = store.getObject(new GetRequest(List.of("missing"), 0.05, false), "c1");

            assertFalse(resp.valid());
            assertTrue(resp.error().contains("missing"));
        }

        @Test
        @DisplayName("should reject a put without data")
        void shouldRejectEmptyPut() {
            assertFalse(store.putObject(new PutRequest(null, null), "c1").valid());
        }

        @Test
        @DisplayName("should wake a waiting get when the object arrives")
        void shouldWakeBlockedGet() throws Exception {
            CompletableFuture<GetResponse> waiting = CompletableFuture.supplyAsync(
                    () -> store.getObject(new GetRequest(List.of("ref-1"), 5, false), "c2"));
            Thread.sleep(50);

            store.putObject(new PutRequest(new byte[]{7}, null, "ref-1"), "c1");

            GetResponse resp = waiting.get(2, TimeUnit.SECONDS);
            assertTrue(resp.valid());
            assertArrayEquals(new byte[]{7}, resp.data().get(0));
        }

        @Test
        @DisplayName("should keep waiting under a huge timeout instead of failing at once")
        void shouldWaitUnderHugeTimeout() throws Exception {
            CompletableFuture<GetResponse> waiting = CompletableFuture.supplyAsync(
                    () -> store.getObject(new GetRequest(List.of("ref-2"), Double.MAX_VALUE, false), "c2"));
            Thread.sleep(150);
            assertFalse(waiting.isDone());

            store.putObject(new PutRequest(new byte[]{9}, null, "ref-2"), "c1");

            GetResponse resp = waiting.get(2, TimeUnit.SECONDS);
            assertTrue(resp.valid());
            assertArrayEquals(new byte[]{9}, resp.data().get(0));
        }

        @Test
        @DisplayName("should refuse a client ref id that is already stored")
        void shouldRejectDuplicateRefId() {
            store.putObject(new PutRequest(new byte[]{1}, null, "dup"), "c1");

            PutResponse second = store.putObject(new PutRequest(new byte[]{2}, null, "dup"), "c1");

            assertFalse(second.valid());
            assertTrue(second.error().contains("already exists"));
        }
    }

    @Nested
    @DisplayName("async get")
    class AsyncGet {

        @Test
        @DisplayName("should answer at once when every object exists")
        void shouldAnswerImmediately() {
            String id = putFor("c1", "now");
            List<DataResponse> delivered = new ArrayList<>();

            GetResponse resp = store.asyncGetObject(new GetRequest(List.of(id), 0, true), "c1", 4, delivered::add);

            assertNotNull(resp);
            assertTrue(delivered.isEmpty());
        }

        @Test
        @DisplayName("should park the get and deliver it once the last object is put")
        void shouldDeliverAfterPut() {
            List<DataResponse> delivered = new ArrayList<>();
            GetRequest get = new GetRequest(List.of("ref-a", "ref-b"), 0, true);

            assertNull(store.asyncGetObject(get, "c1", 4, delivered::add));
            assertEquals(1, store.pendingGetCount());

            store.putObject(new PutRequest(new byte[]{1}, null, "ref-a"), "c1");
            assertTrue(delivered.isEmpty());

            store.putObject(new PutRequest(new byte[]{2}, null, "ref-b"), "c1");
            assertEquals(1, delivered.size());
            assertEquals(4, delivered.get(0).reqId());
            GetResponse resp = (GetResponse) delivered.get(0).payload();
            assertTrue(resp.valid());
            assertEquals(2, resp.data().size());
            assertEquals(0, store.pendingGetCount());
        }

        @Test
        @DisplayName("should not complete a parked get on an unrelated put")
        void shouldIgnoreUnrelatedPut() {
            List<DataResponse> delivered = new ArrayList<>();
            store.asyncGetObject(new GetRequest(List.of("ref-x"), 0, true), "c1", 4, delivered::add);

            putFor("c1", "other");

            assertTrue(delivered.isEmpty());
            assertEquals(1, store.pendingGetCount());
        }

        @Test
        @DisplayName("should drop parked gets on releaseAll")
        void shouldDropParkedGetsOnReleaseAll() {
            store.asyncGetObject(new GetRequest(List.of("x"), 0, true), "c1", 1, r -> fail("should not deliver"));

            store.releaseAll("c1");

            assertEquals(0, store.pendingGetCount());
        }
    }

    @Nested
    @DisplayName("reference counting")
    class References {

        @Test
        @DisplayName("should delete an object when its only reference is released")
        void shouldDeleteOnLastRelease() {
            String id = putFor("c1", "x");

            assertTrue(store.release("c1", id));

            assertFalse(store.contains(id));
        }

        @Test
        @DisplayName("should return false when the client holds no reference")
        void shouldRejectForeignRelease() {
            String id = putFor("c1", "x");

            assertFalse(store.release("c2", id));
            assertTrue(store.contains(id));
        }

        @Test
        @DisplayName("should keep an object another client still references")
        void shouldKeepSharedObject() {
            String id = putFor("c1", "x");
            store.getObject(new GetRequest(List.of(id), 0, false), "c2");

            store.releaseAll("c1");

            assertTrue(store.contains(id));
            store.releaseAll("c2");
            assertFalse(store.contains(id));
        }

        @Test
        @DisplayName("should credit the owner named in the put")
        void shouldCreditOwner() {
            String id = store.putObject(new PutRequest(new byte[]{1}, "owner"), "c1").id();

            assertFalse(store.release("c1", id));
            assertTrue(store.release("owner", id));
        }
    }

    @Nested
    @DisplayName("init / runtime env / shutdown")
    class Lifecycle {

        @Test
        @DisplayName("should store the job config")
        void shouldStoreJobConfig() {
            assertTrue(store.init(new InitRequest(Map.of("ns", "prod"), 5), "c1").ok());
            assertEquals("prod", store.jobConfigOf("c1").get("ns"));
        }

        @Test
        @DisplayName("should reject a negative grace period")
        void shouldRejectNegativeGracePeriod() {
            StatusException e = assertThrows(StatusException.class,
                    () -> store.init(new InitRequest(Map.of(), -1), "c1"));
            assertEquals(StatusCode.INVALID_ARGUMENT, e.getCode());
        }

        @Test
        @DisplayName("should merge the runtime env over configured defaults")
        void shouldMergeRuntimeEnv() {
            Map<String, String> prepared = store.prepRuntimeEnv(
                    new PrepRuntimeEnvRequest(Map.of("env_vars.MODE", "fast"))).preparedRuntimeEnv();

            assertEquals("/srv", prepared.get("working_dir"));
            assertEquals("fast", prepared.get("env_vars.MODE"));
        }

        @Test
        @DisplayName("should let the request override a default")
        void shouldOverrideDefault() {
            Map<String, String> prepared = store.prepRuntimeEnv(
                    new PrepRuntimeEnvRequest(Map.of("working_dir", "/tmp"))).preparedRuntimeEnv();

            assertEquals("/tmp", prepared.get("working_dir"));
        }

        @Test
        @DisplayName("should reject an empty environment variable name")
        void shouldRejectEmptyEnvVarName() {
            StatusException e = assertThrows(StatusException.class,
                    () -> store.prepRuntimeEnv(new PrepRuntimeEnvRequest(Map.of("env_vars.", "x"))));
            assertEquals(StatusCode.INVALID_ARGUMENT, e.getCode());
        }

        @Test
        @DisplayName("should drop everything on shutdown")
        void shouldClearOnShutdown() {
            putFor("c1", "x");
            store.asyncGetObject(new GetRequest(List.of("y"), 0, true), "c1", 1, r -> { });

            store.shutdown();

            assertEquals(0, store.objectCount());
            assertEquals(0, store.pendingGetCount());
        }
    }
}
