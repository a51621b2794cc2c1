package in.questkeeper.service.access;

import in.questkeeper.application.port.output.EncounterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ErrorKind;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static in.questkeeper.support.Fixtures.ENCOUNTER_ID;
import static in.questkeeper.support.Fixtures.OWNER;
import static in.questkeeper.support.Fixtures.STRANGER;
import static in.questkeeper.support.Fixtures.VIEWER;
import static in.questkeeper.support.Fixtures.encounter;
import static in.questkeeper.support.Fixtures.participant;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Encounter Loader")
class EncounterLoaderTest {

    @Mock
    private EncounterRepository repository;

    private EncounterLoader loader;

    @BeforeEach
    void setUp() {
        loader = new EncounterLoader(repository, new PermissionGuard());
    }

    @Test
    @DisplayName("Malformed ids are rejected before the store is touched")
    void testInvalidId() {
        ServiceResult<Encounter> result = loader.load("not-an-id");

        assertTrue(result.error().is(ErrorCode.ENCOUNTER_VALIDATION_ERROR));
        assertEquals("encounterId", result.error().details().get(0).field());
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Missing encounters map to ENCOUNTER_NOT_FOUND")
    void testNotFound() {
        when(repository.findById(ENCOUNTER_ID)).thenReturn(Optional.empty());

        ServiceResult<Encounter> result = loader.load(ENCOUNTER_ID);

        assertTrue(result.error().is(ErrorCode.ENCOUNTER_NOT_FOUND));
        assertEquals(404, result.error().statusCode());
    }

    @Test
    @DisplayName("Store failures come back as DATABASE_ERROR")
    void testStoreFailure() {
        when(repository.findById(ENCOUNTER_ID)).thenThrow(new StorageException("connection refused", null));

        ServiceResult<Encounter> result = loader.load(ENCOUNTER_ID);

        assertTrue(result.error().is(ErrorCode.DATABASE_ERROR));
        assertTrue(result.error().is(ErrorKind.STORAGE));
        assertTrue(result.error().message().contains("connection refused"));
    }

    @Test
    @DisplayName("Shared users read, only the owner modifies")
    void testAccessLevels() {
        Encounter stored = encounter(participant(1, "Aria"));
        when(repository.findById(ENCOUNTER_ID)).thenReturn(Optional.of(stored));

        assertTrue(loader.loadForRead(ENCOUNTER_ID, VIEWER, "view").success());
        assertTrue(loader.loadForOwner(ENCOUNTER_ID, OWNER, "update").success());

        ServiceResult<Encounter> denied = loader.loadForOwner(ENCOUNTER_ID, VIEWER, "update");
        assertTrue(denied.error().is(ErrorCode.INSUFFICIENT_PERMISSIONS));
        assertEquals("Only the owner can update this encounter", denied.error().message());

        ServiceResult<Encounter> stranger = loader.loadForRead(ENCOUNTER_ID, STRANGER, "export");
        assertEquals("You do not have permission to export this encounter", stranger.error().message());
    }

    @Test
    @DisplayName("Version conflicts on save report the caller's failure code")
    void testSaveConflict() {
        when(repository.update(any())).thenThrow(StorageException.conflict(ENCOUNTER_ID, 1));

        ServiceResult<Encounter> result = loader.save(encounter(), ErrorCode.ENCOUNTER_SAVE_FAILED);

        assertTrue(result.error().is(ErrorCode.ENCOUNTER_SAVE_FAILED));
    }
}
