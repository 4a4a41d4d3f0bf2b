package org.quarry.history.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quarry.history.exception.StorageException;
import org.quarry.history.repository.HistorySchema;
import reactor.core.publisher.Mono;
import reactor.test.publisher.PublisherProbe;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaInitializerTest {

    @Mock private HistorySchema historySchema;

    @InjectMocks private SchemaInitializer schemaInitializer;

    @Test
    void initializeSchema_waitsForTheDdlToComplete() {
        PublisherProbe<Void> ddl = PublisherProbe.empty();
        when(historySchema.initialize()).thenReturn(ddl.mono());

        schemaInitializer.initializeSchema();

        ddl.assertWasSubscribed();
        ddl.assertWasNotCancelled();
    }

    @Test
    void initializeSchema_whenDdlFails_failsStartup() {
        when(historySchema.initialize()).thenReturn(Mono.error(new StorageException("permission denied for schema public")));

        StorageException e = assertThrows(StorageException.class, schemaInitializer::initializeSchema);
        assertEquals("permission denied for schema public", e.getMessage());
    }
}
