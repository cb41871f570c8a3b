package me.golemcore.support.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolInvocationTest {

    @Test
    void of_usesErrorTextForFailures() {
        ToolInvocation invocation = ToolInvocation.of("get_customer_info", Map.of("customer_email", "a@b.com"),
                ToolResult.failure(ToolFailureKind.NOT_FOUND, "No customer found with email: a@b.com"));

        assertFalse(invocation.isSuccess());
        assertEquals(ToolFailureKind.NOT_FOUND, invocation.getFailureKind());
        assertEquals("No customer found with email: a@b.com", invocation.getResultPreview());
    }

    @Test
    void of_truncatesLongOutput() {
        ToolInvocation invocation = ToolInvocation.of("search_knowledge_base", Map.of(),
                ToolResult.success("x".repeat(1000)));

        assertTrue(invocation.isSuccess());
        assertEquals(303, invocation.getResultPreview().length());
        assertTrue(invocation.getResultPreview().endsWith("..."));
    }
}
