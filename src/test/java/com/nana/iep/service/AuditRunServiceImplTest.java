package com.nana.iep.service;

import com.nana.iep.domain.MasterRow;
import com.nana.iep.domain.MasterTable;
import com.nana.iep.domain.RawExtractRow;
import com.nana.iep.domain.StudentSummary;
import com.nana.iep.repository.MasterTableRepository;
import com.nana.iep.repository.MasterTableRepository.RepositoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditRunServiceImplTest {

    @Mock
    private MasterTableRepository mockRepository;

    @Mock
    private AuditPipeline mockPipeline;

    private AuditRunServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new AuditRunServiceImpl(mockRepository,
                new AuditPipeline(ExtractFormat.defaults(), ReconcilePolicy.defaults()));
    }

    private static RawExtractRow row(String code, String compiled) {
        return new RawExtractRow(2, code, compiled, Map.of());
    }

    @Test
    @DisplayName("constructor rejects null collaborators")
    void constructor_nulls() {
        assertThrows(IllegalArgumentException.class, () -> new AuditRunServiceImpl(null, mockPipeline));
        assertThrows(IllegalArgumentException.class, () -> new AuditRunServiceImpl(mockRepository, null));
    }

    @Test
    @DisplayName("runBatch saves the reconciled table when rows were appended")
    void runBatch_savesOnChange() throws Exception {
        when(mockRepository.load()).thenReturn(MasterTable.empty());

        ChangeSummary changes = service.runBatch(List.of(row("S1", "S|2025-01-01|Maths")), List.of());

        ArgumentCaptor<MasterTable> saved = ArgumentCaptor.forClass(MasterTable.class);
        verify(mockRepository).save(saved.capture());
        assertEquals(1, saved.getValue().size());
        assertEquals(1, changes.getAppended());
    }

    @Test
    @DisplayName("runBatch does not save when nothing changed")
    void runBatch_noChange_noSave() throws Exception {
        StudentSummary s1 = new StudentSummary.Builder("S1").build();
        when(mockRepository.load()).thenReturn(MasterTable.of(List.of(new MasterRow(null, s1))));

        ChangeSummary changes = service.runBatch(List.of(row("S1", "")), List.of());

        verify(mockRepository, never()).save(any());
        assertFalse(changes.hasChanges());
    }

    @Test
    @DisplayName("runBatch does not save when reconciliation fails")
    void runBatch_fatal_noSave() throws Exception {
        AuditRunServiceImpl failing = new AuditRunServiceImpl(mockRepository, mockPipeline);
        when(mockRepository.load()).thenReturn(MasterTable.empty());
        when(mockPipeline.run(anyList(), eq(MasterTable.empty()), anyList()))
                .thenThrow(new ReconciliationException("S1", "duplicate"));

        assertThrows(ReconciliationException.class,
                () -> failing.runBatch(List.of(row("S1", "S|2025-01-01|Maths")), List.of()));
        verify(mockRepository, never()).save(any());
    }

    @Test
    @DisplayName("storage failures propagate as RepositoryException")
    void runBatch_storageFailure_propagates() {
        when(mockRepository.load()).thenReturn(MasterTable.empty());
        doThrow(new RepositoryException("disk full")).when(mockRepository).save(any());

        assertThrows(RepositoryException.class,
                () -> service.runBatch(List.of(row("S1", "S|2025-01-01|Maths")), List.of()));
    }

    @Test
    @DisplayName("currentTable delegates to the repository")
    void currentTable_delegates() {
        when(mockRepository.load()).thenReturn(MasterTable.empty());
        assertTrue(service.currentTable().isEmpty());
    }
}
