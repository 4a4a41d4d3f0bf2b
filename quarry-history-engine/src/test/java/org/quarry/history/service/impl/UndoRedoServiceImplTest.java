package org.quarry.history.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quarry.history.config.UndoProperties;
import org.quarry.history.dto.request.UndoStackInput;
import org.quarry.history.dto.response.UndoRedoResult;
import org.quarry.history.dto.response.UndoStackInfo;
import org.quarry.history.entity.UndoMetadata;
import org.quarry.history.entity.UndoStackEntry;
import org.quarry.history.enums.AuditTargetType;
import org.quarry.history.support.H2HistoryStore;
import org.quarry.history.support.RecordingApplyStateHandler;
import org.quarry.history.support.RecordingApplyStateHandler.Mode;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UndoRedoServiceImplTest {

    private static final String SESSION = "session-1";

    private RecordingApplyStateHandler handler;
    private UndoProperties properties;
    private UndoRedoServiceImpl service;

    @BeforeEach
    void setUp() {
        H2HistoryStore store = H2HistoryStore.create();
        handler = new RecordingApplyStateHandler(AuditTargetType.STRAND, AuditTargetType.WEAVE);
        properties = new UndoProperties();
        service = new UndoRedoServiceImpl(store.undoStackDAO(), new ApplyStateHandlerRegistry(List.of(handler)),
                properties);
    }

    private static JsonNode title(String value) {
        return JsonNodeFactory.instance.objectNode().put("title", value);
    }

    private String push(String targetId, String before, String after) {
        return service.pushUndoableAction(SESSION, UndoStackInput.builder()
                .targetType(AuditTargetType.STRAND)
                .targetId(targetId)
                .beforeState(title(before))
                .afterState(title(after))
                .build()).block();
    }

    private UndoStackInfo info() {
        return service.getUndoStackInfo(SESSION).block();
    }

    @Test
    void pushes_makeEveryEntryActive_withCursorOnTheLast() {
        for (int i = 0; i < 4; i++) {
            assertNotNull(push("strand_" + i, "v" + i, "v" + (i + 1)));
        }

        UndoStackInfo info = info();
        assertEquals(4, info.totalEntries());
        assertEquals(4, info.activeEntries());
        assertEquals(3, info.currentPosition());
        assertTrue(info.canUndo());
        assertFalse(info.canRedo());
    }

    @Test
    void undoThenRedo_restoresStackAndDocument() {
        push("strand_1", "Old", "New");

        StepVerifier.create(service.undo(SESSION))
                .assertNext(result -> {
                    assertTrue(result.success());
                    assertEquals(title("Old"), result.appliedState());
                    assertFalse(result.entry().active());
                })
                .verifyComplete();
        assertEquals(title("Old"), handler.document("strand_1"));
        assertEquals(UndoStackInfo.NO_POSITION, info().currentPosition());

        StepVerifier.create(service.redo(SESSION))
                .assertNext(result -> {
                    assertTrue(result.success());
                    assertEquals(title("New"), result.appliedState());
                    assertTrue(result.entry().active());
                })
                .verifyComplete();
        assertEquals(title("New"), handler.document("strand_1"));
        assertEquals(new UndoStackInfo(1, 1, 0), info());
    }

    @Test
    void strandRenameScenario() {
        push("strand_1", "Old", "New");

        UndoRedoResult undone = service.undo(SESSION).block();
        assertNotNull(undone);
        assertTrue(undone.success());
        assertEquals(List.of("undo:strand_1"), handler.calls());
        assertEquals(new UndoStackInfo(1, 0, -1), info());

        UndoRedoResult redone = service.redo(SESSION).block();
        assertNotNull(redone);
        assertTrue(redone.success());
        assertEquals(List.of("undo:strand_1", "redo:strand_1"), handler.calls());
        assertEquals(new UndoStackInfo(1, 1, 0), info());

        assertEquals(UndoRedoResult.NOTHING_TO_REDO, service.redo(SESSION).block().error());
    }

    @Test
    void undo_onEmptyStack_failsWithoutChangingAnything() {
        StepVerifier.create(service.undo(SESSION))
                .assertNext(result -> {
                    assertFalse(result.success());
                    assertEquals(UndoRedoResult.NOTHING_TO_UNDO, result.error());
                    assertNull(result.entry());
                })
                .verifyComplete();
        StepVerifier.create(service.redo(SESSION))
                .assertNext(result -> assertEquals(UndoRedoResult.NOTHING_TO_REDO, result.error()))
                .verifyComplete();
        assertEquals(UndoStackInfo.empty(), info());
        assertTrue(handler.calls().isEmpty());
    }

    @Test
    void undo_walksBackwardsAndRedo_forwards() {
        push("strand_1", "a", "b");
        push("strand_1", "b", "c");
        push("strand_1", "c", "d");

        service.undo(SESSION).block();
        service.undo(SESSION).block();
        assertEquals(title("b"), handler.document("strand_1"));
        assertEquals(new UndoStackInfo(3, 1, 0), info());

        service.redo(SESSION).block();
        assertEquals(title("c"), handler.document("strand_1"));
        assertEquals(new UndoStackInfo(3, 2, 1), info());
    }

    @Test
    void push_afterUndo_discardsRedoBranch() {
        push("strand_1", "a", "b");
        push("strand_1", "b", "c");
        push("strand_1", "c", "d");
        service.undo(SESSION).block();
        service.undo(SESSION).block();

        push("strand_1", "b", "x");

        assertEquals(new UndoStackInfo(2, 2, 1), info());
        StepVerifier.create(service.getStack(SESSION).map(UndoStackEntry::afterState))
                .expectNext(title("b"), title("x"))
                .verifyComplete();
        assertEquals(UndoRedoResult.NOTHING_TO_REDO, service.redo(SESSION).block().error());
    }

    @Test
    void push_afterUndoingEverything_restartsAtPositionZero() {
        push("strand_1", "a", "b");
        service.undo(SESSION).block();

        push("strand_1", "a", "c");

        assertEquals(new UndoStackInfo(1, 1, 0), info());
    }

    @Test
    void undo_whenHandlerRejects_leavesStackUnchanged() {
        push("strand_1", "Old", "New");
        handler.setMode(Mode.REJECT);

        StepVerifier.create(service.undo(SESSION))
                .assertNext(result -> {
                    assertFalse(result.success());
                    assertNotNull(result.error());
                })
                .verifyComplete();
        assertEquals(new UndoStackInfo(1, 1, 0), info());
    }

    @Test
    void redo_whenHandlerErrors_leavesStackUnchanged() {
        push("strand_1", "Old", "New");
        service.undo(SESSION).block();
        handler.setMode(Mode.FAIL);

        StepVerifier.create(service.redo(SESSION))
                .assertNext(result -> assertFalse(result.success()))
                .verifyComplete();
        assertEquals(new UndoStackInfo(1, 0, -1), info());
    }

    @Test
    void undo_withoutHandlerForTargetType_fails() {
        service.pushUndoableAction(SESSION, UndoStackInput.builder()
                .targetType(AuditTargetType.QUIZ)
                .targetId("quiz_1")
                .beforeState(title("a"))
                .afterState(title("b"))
                .build()).block();

        StepVerifier.create(service.undo(SESSION))
                .assertNext(result -> {
                    assertFalse(result.success());
                    assertTrue(result.error().contains("quiz"));
                })
                .verifyComplete();
        assertEquals(new UndoStackInfo(1, 1, 0), info());
    }

    @Test
    void push_beyondMaxStackSize_evictsOldestEntries() {
        properties.setMaxStackSize(3);
        for (int i = 0; i < 5; i++) {
            push("strand_1", "v" + i, "v" + (i + 1));
        }

        UndoStackInfo info = info();
        assertEquals(3, info.totalEntries());
        assertEquals(3, info.activeEntries());
        assertEquals(4, info.currentPosition());
        StepVerifier.create(service.getStack(SESSION).map(UndoStackEntry::stackPosition))
                .expectNext(2, 3, 4)
                .verifyComplete();

        service.undo(SESSION).block();
        service.undo(SESSION).block();
        service.undo(SESSION).block();
        assertEquals(UndoRedoResult.NOTHING_TO_UNDO, service.undo(SESSION).block().error());
        assertEquals(title("v2"), handler.document("strand_1"));
    }

    @Test
    void push_storesMetadata() {
        String id = service.pushUndoableAction(SESSION, UndoStackInput.builder()
                .targetType(AuditTargetType.WEAVE)
                .targetId("weave_1")
                .metadata(Map.of("origin", "editor", "reason", "rename"))
                .build()).block();

        StepVerifier.create(service.getMetadata(id).map(UndoMetadata::value))
                .expectNext("editor", "rename")
                .verifyComplete();
    }

    @Test
    void push_withoutTarget_isIgnored() {
        StepVerifier.create(service.pushUndoableAction(SESSION, UndoStackInput.builder().build()))
                .verifyComplete();
        assertEquals(UndoStackInfo.empty(), info());
    }

    @Test
    void reads_withNullIds_returnEmptyResults() {
        StepVerifier.create(service.getUndoStackInfo(null))
                .expectNext(UndoStackInfo.empty())
                .verifyComplete();
        StepVerifier.create(service.getStack(null))
                .verifyComplete();
        StepVerifier.create(service.getMetadata(null))
                .verifyComplete();
    }

    @Test
    void clearStack_removesEverything_andSucceedsOnEmptyStack() {
        push("strand_1", "a", "b");
        push("strand_1", "b", "c");

        StepVerifier.create(service.clearStack(SESSION))
                .expectNext(true)
                .verifyComplete();
        assertEquals(UndoStackInfo.empty(), info());

        StepVerifier.create(service.clearStack(SESSION))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void sessions_areIndependent() {
        push("strand_1", "a", "b");
        service.pushUndoableAction("session-2", UndoStackInput.builder()
                .targetType(AuditTargetType.STRAND)
                .targetId("strand_2")
                .build()).block();

        service.undo("session-2").block();

        assertEquals(new UndoStackInfo(1, 1, 0), info());
        assertEquals(new UndoStackInfo(1, 0, -1), service.getUndoStackInfo("session-2").block());
    }

    @Test
    void concurrentPushes_onOneSession_getDistinctPositions() {
        List<String> ids = Flux.range(0, 10)
                .flatMap(i -> service.pushUndoableAction(SESSION, UndoStackInput.builder()
                        .targetType(AuditTargetType.STRAND)
                        .targetId("strand_" + i)
                        .build()))
                .collectList()
                .block();

        assertNotNull(ids);
        assertEquals(10, ids.size());
        assertEquals(new UndoStackInfo(10, 10, 9), info());
    }
}
