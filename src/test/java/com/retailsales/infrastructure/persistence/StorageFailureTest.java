package com.retailsales.infrastructure.persistence;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class StorageFailureTest {

    @Test
    void testClassify_Timeouts() {
        assertEquals(StorageFailure.TIMEOUT, StorageFailure.classify(new TimeoutException()));
        assertEquals(StorageFailure.TIMEOUT, StorageFailure.classify(new QueryTimeoutException("slow")));
        assertEquals(StorageFailure.TIMEOUT,
                StorageFailure.classify(new ExecutionException(new QueryTimeoutException("slow"))));
    }

    @Test
    void testClassify_Connectivity() {
        assertEquals(StorageFailure.CONNECTIVITY, StorageFailure.classify(
                new CannotGetJdbcConnectionException("pool exhausted",
                        new SQLTransientConnectionException("refused"))));
        assertEquals(StorageFailure.CONNECTIVITY, StorageFailure.classify(
                new CompletionException(new RuntimeException("wrapped", new SQLTransientConnectionException()))));
    }

    @Test
    void testClassify_EverythingElseIsFatal() {
        assertEquals(StorageFailure.FATAL, StorageFailure.classify(new DataIntegrityViolationException("bad row")));
        assertEquals(StorageFailure.FATAL, StorageFailure.classify(new IllegalStateException("timeout in message")));
    }

    @Test
    void testOf_CarriesOperationAndKind() {
        StorageAccessException e = StorageAccessException.of("count",
                new ExecutionException(new TimeoutException()));

        assertTrue(e.isTimeout());
        assertEquals("count", e.getOperation());
        assertInstanceOf(TimeoutException.class, e.getCause());
    }
}
