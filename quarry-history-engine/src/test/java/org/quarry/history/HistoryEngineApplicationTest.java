package org.quarry.history;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quarry.history.dto.request.AuditLogInput;
import org.quarry.history.dto.request.AuditLogQuery;
import org.quarry.history.entity.AuditLogEntry;
import org.quarry.history.enums.AuditActionType;
import org.quarry.history.enums.AuditSource;
import org.quarry.history.enums.AuditTargetType;
import org.quarry.history.repository.HistorySchema;
import org.quarry.history.scheduler.AuditRetentionScheduler;
import org.quarry.history.scheduler.SessionExpiryScheduler;
import org.quarry.history.service.AuditLogService;
import org.quarry.history.service.HistoryService;
import org.quarry.history.support.RecordingApplyStateHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class HistoryEngineApplicationTest {

    @TestConfiguration
    static class HandlerConfig {

        @Bean
        RecordingApplyStateHandler strandHandler() {
            return new RecordingApplyStateHandler(AuditTargetType.STRAND);
        }
    }

    @Autowired private HistorySchema historySchema;
    @Autowired private HistoryService historyService;
    @Autowired private AuditLogService auditLogService;
    @Autowired private RecordingApplyStateHandler strandHandler;
    @Autowired private ApplicationContext context;

    @BeforeEach
    void setUp() {
        historySchema.initialize().block();
    }

    @Test
    void schedulers_areSwitchedOffByConfiguration() {
        assertTrue(context.getBeansOfType(AuditRetentionScheduler.class).isEmpty());
        assertTrue(context.getBeansOfType(SessionExpiryScheduler.class).isEmpty());
    }

    @Test
    void recordUndoThenRedo_appliesStatesAndLeavesAuditTrail() {
        String session = UUID.randomUUID().toString();
        AuditLogInput rename = AuditLogInput.builder()
                .actionType(AuditActionType.CONTENT)
                .actionName("rename")
                .targetType(AuditTargetType.STRAND)
                .targetId("strand_1")
                .targetPath("weaves/intro/strand_1")
                .oldValue(JsonNodeFactory.instance.objectNode().put("title", "Old"))
                .newValue(JsonNodeFactory.instance.objectNode().put("title", "New"))
                .build();

        StepVerifier.create(historyService.recordUndoableAction(session, rename, null))
                .expectNextCount(1)
                .verifyComplete();

        StepVerifier.create(historyService.undo(session))
                .assertNext(result -> assertTrue(result.success()))
                .verifyComplete();
        assertEquals("Old", strandHandler.document("strand_1").get("title").asText());

        StepVerifier.create(historyService.redo(session))
                .assertNext(result -> assertTrue(result.success()))
                .verifyComplete();
        assertEquals("New", strandHandler.document("strand_1").get("title").asText());

        StepVerifier.create(historyService.getStackInfo(session))
                .assertNext(info -> {
                    assertEquals(1, info.totalEntries());
                    assertEquals(0, info.currentPosition());
                })
                .verifyComplete();

        List<AuditLogEntry> trail = auditLogService.query(AuditLogQuery.builder().sessionId(session).build())
                .collectList().block();
        assertNotNull(trail);
        assertEquals(List.of(AuditSource.REDO, AuditSource.UNDO, AuditSource.USER),
                trail.stream().map(AuditLogEntry::source).toList());
        assertTrue(trail.get(2).undoable());
        assertEquals("rename", trail.get(1).actionName());
    }
}
