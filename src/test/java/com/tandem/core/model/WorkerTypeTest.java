package com.tandem.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkerTypeTest {

    @Test
    @DisplayName("fromTag resolves plan tags")
    void resolvesTags() {
        assertEquals(WorkerType.EXPLORE, WorkerType.fromTag("explore"));
        assertEquals(WorkerType.RESEARCH_LEAD, WorkerType.fromTag("research-lead"));
        assertEquals(WorkerType.DOCUMENT_WRITER, WorkerType.fromTag("document_writer"));
    }

    @Test
    @DisplayName("fromTag ignores case and treats - and _ alike")
    void lenientMatching() {
        assertEquals(WorkerType.CODE_REVIEWER, WorkerType.fromTag("CODE_REVIEWER"));
        assertEquals(WorkerType.DOCUMENT_WRITER, WorkerType.fromTag("Document-Writer"));
        assertEquals(WorkerType.IMPLEMENTATION_LEAD, WorkerType.fromTag(" implementation_lead "));
    }

    @Test
    @DisplayName("Unknown or blank tags are rejected")
    void rejectsUnknown() {
        var e = assertThrows(IllegalArgumentException.class, () -> WorkerType.fromTag("wizard"));
        assertTrue(e.getMessage().contains("wizard"));
        assertThrows(IllegalArgumentException.class, () -> WorkerType.fromTag(" "));
        assertThrows(IllegalArgumentException.class, () -> WorkerType.fromTag(null));
    }

    @Test
    @DisplayName("Each worker type carries a cost tier")
    void costTiers() {
        assertEquals(CostTier.CHEAP, WorkerType.EXPLORE.costTier());
        assertEquals(CostTier.MEDIUM, WorkerType.FRONTEND.costTier());
        assertEquals(CostTier.EXPENSIVE, WorkerType.DELPHI.costTier());
    }

    @Test
    @DisplayName("TaskSpec validates id and worker type and copies dependencies")
    void taskSpecValidation() {
        assertThrows(IllegalArgumentException.class, () -> TaskSpec.of(" ", WorkerType.EXPLORE, "x"));
        assertThrows(IllegalArgumentException.class, () -> new TaskSpec("a", null, "x", null));

        var spec = new TaskSpec("a", WorkerType.EXPLORE, null, null);
        assertEquals("", spec.description());
        assertTrue(spec.dependencies().isEmpty());
    }
}
