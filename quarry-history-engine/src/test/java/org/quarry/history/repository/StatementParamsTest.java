package org.quarry.history.repository;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementParamsTest {

    @Test
    void bind_keepsInsertionOrderAndValueType() {
        StatementParams params = StatementParams.of("sessionId", "s1").bind("position", 4);

        assertEquals(List.of("sessionId", "position"), List.copyOf(params.asMap().keySet()));
        assertEquals(Integer.class, params.asMap().get("position").type());
        assertFalse(params.asMap().get("sessionId").isNull());
    }

    @Test
    void bind_withNull_isRejected() {
        StatementParams params = StatementParams.empty();

        NullPointerException ex = assertThrows(NullPointerException.class, () -> params.bind("targetId", null));
        assertTrue(ex.getMessage().contains("targetId"));
    }

    @Test
    void bindNullable_carriesDeclaredType() {
        StatementParams params = StatementParams.empty().bindNullable("durationMs", null, Long.class);

        StatementParams.Param param = params.asMap().get("durationMs");
        assertTrue(param.isNull());
        assertEquals(Long.class, param.type());
    }
}
