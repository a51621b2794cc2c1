package in.questkeeper.service.export;

import in.questkeeper.application.port.output.CharacterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.InitiativeEntry;
import in.questkeeper.domain.export.CharacterSheetPayload;
import in.questkeeper.domain.export.CombatStatePayload;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.domain.export.ExportOptions;
import in.questkeeper.domain.export.ParticipantPayload;
import in.questkeeper.infrastructure.persistence.InMemoryEncounterRepository;
import in.questkeeper.service.access.EncounterLoader;
import in.questkeeper.service.access.PermissionGuard;
import in.questkeeper.service.combat.CombatStateMachine;
import in.questkeeper.service.combat.InitiativeRoller;
import in.questkeeper.support.SequentialIds;
import in.questkeeper.support.TestClock;
import in.questkeeper.util.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static in.questkeeper.support.Fixtures.ENCOUNTER_ID;
import static in.questkeeper.support.Fixtures.OWNER;
import static in.questkeeper.support.Fixtures.STRANGER;
import static in.questkeeper.support.Fixtures.VIEWER;
import static in.questkeeper.support.Fixtures.encounter;
import static in.questkeeper.support.Fixtures.id;
import static in.questkeeper.support.Fixtures.participant;
import static in.questkeeper.support.Fixtures.sheet;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Export Builder")
class ExportBuilderTest {

    private static final String A = id(1);
    private static final String B = id(2);

    @Mock
    private CharacterRepository characters;

    private TestClock clock;
    private InMemoryEncounterRepository repository;
    private ExportBuilder builder;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        repository = new InMemoryEncounterRepository(clock);
        repository.insert(encounter(
            participant(1, "Aria", 18).withNotes("secretly a doppelganger"),
            participant(2, "Brom", 12)));
        builder = new ExportBuilder(new EncounterLoader(repository, new PermissionGuard()), characters,
            new SequentialIds(0xAAA000), clock, "2.4.0");
    }

    private ExportEnvelope export(String user, ExportOptions options) {
        return builder.prepareExport(ENCOUNTER_ID, user, ExportFormat.JSON, options).orElseThrow();
    }

    @Test
    @DisplayName("Users without access get nothing and no character lookup happens")
    void testDeniedBeforeCharacterLookup() {
        ServiceResult<ExportEnvelope> result = builder.prepareExport(ENCOUNTER_ID, STRANGER, ExportFormat.XML,
            ExportOptions.complete());

        assertTrue(result.error().is(ErrorCode.INSUFFICIENT_PERMISSIONS));
        assertEquals("You do not have permission to export this encounter", result.error().message());
        verifyNoInteractions(characters);
    }

    @Test
    @DisplayName("Shared users may export")
    void testSharedUserExports() {
        ExportEnvelope envelope = export(VIEWER, ExportOptions.defaults());

        assertEquals(VIEWER, envelope.metadata().exportedBy());
        assertEquals("2.4.0", envelope.metadata().appVersion());
        assertEquals(ExportEnvelope.SCHEMA_VERSION, envelope.metadata().version());
        assertEquals(clock.instant().toString(), envelope.metadata().exportedAt());
        assertEquals("Goblin Ambush", envelope.encounter().name());
        assertNull(envelope.encounter().characterSheets());
        assertNull(envelope.encounter().combatState());
    }

    @Test
    @DisplayName("Character sheets come from a single batched lookup")
    @SuppressWarnings("unchecked")
    void testSheetsFetchedOnce() {
        when(characters.findByIds(anyCollection())).thenReturn(List.of(sheet(1, "Aria"), sheet(2, "Brom")));

        ExportEnvelope envelope = export(OWNER, ExportOptions.complete());

        ArgumentCaptor<Collection<String>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(characters, times(1)).findByIds(captor.capture());
        assertEquals(Set.of(A, B), Set.copyOf(captor.getValue()));
        assertEquals(2, envelope.encounter().characterSheets().size());
        assertEquals(A, envelope.encounter().characterSheets().get(0).id());
    }

    @Test
    @DisplayName("Without includeIds no real id leaks and every section agrees on the temporary ids")
    void testTemporaryIdsAreConsistent() throws Exception {
        when(characters.findByIds(anyCollection())).thenReturn(List.of(sheet(1, "Aria"), sheet(2, "Brom")));
        Encounter started = new CombatStateMachine(clock, new InitiativeRoller())
            .start(repository.findById(ENCOUNTER_ID).orElseThrow(), Map.of()).orElseThrow();
        repository.update(started);

        ExportEnvelope envelope = export(OWNER, new ExportOptions(true, false, false, false));

        String json = Json.newMapper().writeValueAsString(envelope);
        assertFalse(json.contains(A));
        assertFalse(json.contains(B));
        assertFalse(json.contains(ENCOUNTER_ID));

        List<String> participantIds = envelope.encounter().participants().stream()
            .map(ParticipantPayload::id).collect(Collectors.toList());
        List<String> sheetIds = envelope.encounter().characterSheets().stream()
            .map(CharacterSheetPayload::id).collect(Collectors.toList());
        List<String> orderIds = envelope.encounter().combatState().initiativeOrder().stream()
            .map(InitiativeEntry::participantId).collect(Collectors.toList());

        assertEquals(2, Set.copyOf(participantIds).size());
        assertEquals(participantIds, sheetIds);
        assertEquals(participantIds, orderIds);
    }

    @Test
    @DisplayName("Private notes need includePrivateNotes and are dropped by stripPersonalData")
    void testNotesRedaction() {
        assertEquals("", export(OWNER, ExportOptions.defaults()).encounter().participants().get(0).notes());

        ExportOptions withNotes = new ExportOptions(false, true, true, false);
        assertEquals("secretly a doppelganger", export(OWNER, withNotes).encounter().participants().get(0).notes());

        ExportOptions stripped = new ExportOptions(false, true, true, true);
        assertEquals("", export(OWNER, stripped).encounter().participants().get(0).notes());
    }

    @Test
    @DisplayName("Character sheet notes follow includePrivateNotes")
    void testSheetNotesRedaction() {
        when(characters.findByIds(anyCollection())).thenReturn(List.of(sheet(1, "Aria")));

        CharacterSheetPayload hidden = export(OWNER, new ExportOptions(true, false, true, false))
            .encounter().characterSheets().get(0);
        assertEquals("", hidden.notes());
        assertEquals("Raised in a tower", hidden.backstory());

        CharacterSheetPayload shown = export(OWNER, new ExportOptions(true, true, true, false))
            .encounter().characterSheets().get(0);
        assertEquals("Owes the guild 20 gp", shown.notes());
    }

    @Test
    @DisplayName("stripPersonalData blanks backstory and notes on sheets")
    void testStripPersonalDataOnSheets() {
        when(characters.findByIds(anyCollection())).thenReturn(List.of(sheet(1, "Aria")));

        ExportEnvelope envelope = export(OWNER, new ExportOptions(true, false, true, true));

        CharacterSheetPayload s = envelope.encounter().characterSheets().get(0);
        assertEquals("", s.backstory());
        assertEquals("", s.notes());
        assertEquals("Magic Missile", s.spells().get(0).name());
    }

    @Test
    @DisplayName("Combat duration includes the running stretch")
    void testRunningCombatDuration() {
        Encounter started = new CombatStateMachine(clock, new InitiativeRoller())
            .start(repository.findById(ENCOUNTER_ID).orElseThrow(), Map.of()).orElseThrow();
        repository.update(started);
        clock.advance(Duration.ofSeconds(90));

        CombatStatePayload combat = export(OWNER, new ExportOptions(false, true, true, false)).encounter().combatState();

        assertTrue(combat.isActive());
        assertEquals(1, combat.currentRound());
        assertEquals(90_000L, combat.totalDuration());
        assertEquals(started.combatState().startedAt().toString(), combat.startedAt());
    }

    @Test
    @DisplayName("Character store failure becomes an export failure")
    void testCharacterStoreFailure() {
        when(characters.findByIds(any())).thenThrow(new StorageException("timeout", null));

        ServiceResult<ExportEnvelope> result = builder.prepareExport(ENCOUNTER_ID, OWNER, ExportFormat.JSON,
            ExportOptions.complete());

        assertTrue(result.error().is(ErrorCode.ENCOUNTER_EXPORT_FAILED));
    }
}
