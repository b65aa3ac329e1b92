package com.codematch.core.engine;

import com.codematch.core.assembly.CandidateAssembler;
import com.codematch.core.config.CodematchProperties;
import com.codematch.core.error.AmbiguousContractException;
import com.codematch.core.error.CapacityExceededException;
import com.codematch.core.error.IncompleteCandidateException;
import com.codematch.core.error.InvalidRequestException;
import com.codematch.core.error.NotFoundException;
import com.codematch.core.error.VerificationTransportException;
import com.codematch.core.gate.VerifiabilityGate;
import com.codematch.core.http.RemoteFileFetcher;
import com.codematch.core.lookup.BatchAddressLookup;
import com.codematch.core.metrics.CodematchMetrics;
import com.codematch.core.model.AddressStatus;
import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.Match;
import com.codematch.core.model.SessionSnapshot;
import com.codematch.core.model.SourceFile;
import com.codematch.core.orchestration.VerificationOrchestrator;
import com.codematch.core.session.InMemorySessionStore;
import com.codematch.core.target.TargetValidator;
import com.codematch.matching.VerificationService;
import com.codematch.validation.CheckedFiles;
import com.codematch.validation.ValidationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class VerificationEngineTest {

    private static final String SESSION = "session-1";
    private static final String ADDRESS = "0x" + "ab".repeat(20);
    private static final String DEPLOYER = "0x" + "cd".repeat(20);
    private static final String SALT = "0x" + "00".repeat(31) + "01";
    private static final String METADATA = "{\"compiler\":{\"version\":\"0.8.19\"}}";

    private ValidationService validationService;
    private VerificationService verificationService;
    private RemoteFileFetcher remoteFileFetcher;
    private InMemorySessionStore sessionStore;
    private SimpleMeterRegistry registry;
    private VerificationEngine engine;

    @BeforeEach
    void setUp() {
        validationService = mock(ValidationService.class);
        when(validationService.isValid(any(), anyBoolean())).thenCallRealMethod();
        verificationService = mock(VerificationService.class);
        when(verificationService.findConfirmedMatches(anyString(), any())).thenReturn(List.of());
        remoteFileFetcher = mock(RemoteFileFetcher.class);

        var properties = new CodematchProperties();
        properties.getSession().setMaxSizeBytes(200);
        registry = new SimpleMeterRegistry();
        var metrics = new CodematchMetrics(registry);
        var gate = new VerifiabilityGate();
        sessionStore = new InMemorySessionStore(properties);

        engine = new VerificationEngine(
                sessionStore,
                new CandidateAssembler(validationService, metrics),
                new VerificationOrchestrator(validationService, verificationService, gate, metrics),
                gate,
                new BatchAddressLookup(verificationService, metrics),
                new TargetValidator(properties),
                validationService,
                verificationService,
                remoteFileFetcher,
                metrics);
    }

    private static ContractCandidate token(Map<String, String> resolved, List<String> missing) {
        return new ContractCandidate("Token", "contracts/Token.sol", "0.8.19", METADATA, resolved, missing, List.of());
    }

    private static List<SourceFile> files(String... pathsAndContents) {
        var list = new java.util.ArrayList<SourceFile>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            list.add(SourceFile.ofText(pathsAndContents[i], pathsAndContents[i + 1]));
        }
        return list;
    }

    @Nested
    @DisplayName("session flow")
    class SessionFlow {

        @Test
        @DisplayName("upload, complete, target and verify a candidate across several requests")
        void endToEnd() {
            when(validationService.checkFiles(anyList()))
                    .thenReturn(new CheckedFiles(
                            List.of(token(Map.of("contracts/Token.sol", "t"), List.of("contracts/Lib.sol"))),
                            List.of()))
                    .thenReturn(new CheckedFiles(
                            List.of(token(Map.of("contracts/Token.sol", "t", "contracts/Lib.sol", "l"), List.of())),
                            List.of()));
            when(verificationService.verify(eq(ADDRESS), eq("1"), any()))
                    .thenReturn(new Match(CandidateStatus.PERFECT, ADDRESS, "1", null, null));

            var first = engine.uploadFiles(SESSION, files("metadata.json", METADATA, "contracts/Token.sol", "t"));
            assertEquals(2, first.newFiles());
            SessionSnapshot.CandidateSummary summary = first.snapshot().candidates().get(0);
            assertEquals(List.of("contracts/Lib.sol"), summary.missing());
            assertEquals(CandidateStatus.PENDING, summary.status());

            engine.uploadFiles(SESSION, files("contracts/Lib.sol", "l"));
            SessionSnapshot afterSecond = engine.getSessionSnapshot(SESSION);
            assertTrue(afterSecond.candidates().get(0).missing().isEmpty());
            assertEquals(CandidateStatus.PENDING, afterSecond.candidates().get(0).status());
            verify(verificationService, never()).verify(any(), any(), any());

            CandidateStatus status = engine.attachTargetAndVerify(
                    SESSION, summary.verificationId(), ADDRESS.toUpperCase().replace("0X", "0x"), "1");

            assertEquals(CandidateStatus.PERFECT, status);
            SessionSnapshot last = engine.getSessionSnapshot(SESSION);
            assertEquals(ADDRESS, last.candidates().get(0).address());
            assertEquals(CandidateStatus.PERFECT, last.candidates().get(0).status());
        }

        @Test
        @DisplayName("re-uploading the same files changes nothing and skips assembly")
        void idempotentUpload() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(
                    List.of(token(Map.of("contracts/Token.sol", "t"), List.of())), List.of()));
            var batch = files("metadata.json", METADATA, "contracts/Token.sol", "t");

            SessionSnapshot before = engine.uploadFiles(SESSION, batch).snapshot();
            var again = engine.uploadFiles(SESSION, batch);

            assertEquals(0, again.newFiles());
            assertEquals(before, again.snapshot());
            verify(validationService, times(1)).checkFiles(anyList());
        }

        @Test
        @DisplayName("upload over the size cap is rejected and the session is unchanged")
        void capacityExceeded() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(), List.of("a.txt")));
            engine.uploadFiles(SESSION, files("a.txt", "x".repeat(150)));

            assertThrows(CapacityExceededException.class,
                    () -> engine.uploadFiles(SESSION, files("b.txt", "y".repeat(60))));

            assertEquals(List.of("a.txt"), engine.getSessionSnapshot(SESSION).unusedFiles());
            assertEquals(1.0, registry.find("codematch.files.capacity_rejections").counter().count());
        }

        @Test
        @DisplayName("empty upload is an invalid request")
        void emptyUpload() {
            assertThrows(InvalidRequestException.class, () -> engine.uploadFiles(SESSION, List.of()));
        }

        @Test
        @DisplayName("targeting an unknown candidate is not found")
        void unknownCandidate() {
            assertThrows(NotFoundException.class,
                    () -> engine.attachTargetAndVerify(SESSION, "nope", ADDRESS, "1"));

            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(), List.of()));
            engine.uploadFiles(SESSION, files("a.txt", "a"));
            var ex = assertThrows(NotFoundException.class,
                    () -> engine.attachTargetAndVerify(SESSION, "nope", ADDRESS, "1"));
            assertEquals("Unknown contract: nope", ex.getMessage());
        }

        @Test
        @DisplayName("verifyCandidates verifies only candidates that pass the gate")
        void verifyCandidates() {
            ContractCandidate complete = new ContractCandidate("A", "A.sol", "0.8.19", "{\"a\":1}",
                    Map.of("A.sol", "a"), List.of(), List.of());
            ContractCandidate incomplete = new ContractCandidate("B", "B.sol", "0.8.19", "{\"b\":1}",
                    Map.of(), List.of("B.sol"), List.of());
            when(validationService.checkFiles(anyList()))
                    .thenReturn(new CheckedFiles(List.of(complete, incomplete), List.of()));
            when(verificationService.verify(eq(ADDRESS), eq("5"), any()))
                    .thenReturn(new Match(CandidateStatus.PARTIAL, ADDRESS, "5", null, null));
            engine.uploadFiles(SESSION, files("a.json", "{\"a\":1}", "b.json", "{\"b\":1}", "A.sol", "a"));

            SessionSnapshot snapshot = engine.verifyCandidates(SESSION, List.of(
                    new VerificationEngine.TargetAssignment(complete.getId(), ADDRESS, "5"),
                    new VerificationEngine.TargetAssignment(incomplete.getId(), ADDRESS, "5"),
                    new VerificationEngine.TargetAssignment("unknown", ADDRESS, "5")));

            assertEquals(CandidateStatus.PARTIAL, snapshot.candidates().get(0).status());
            assertEquals(CandidateStatus.PENDING, snapshot.candidates().get(1).status());
            assertEquals(ADDRESS, snapshot.candidates().get(1).address());
            verify(verificationService, times(1)).verify(any(), any(), any());
        }

        @Test
        @DisplayName("verifyCandidates without a session is an invalid request")
        void verifyCandidatesWithoutSession() {
            assertThrows(InvalidRequestException.class, () -> engine.verifyCandidates(SESSION,
                    List.of(new VerificationEngine.TargetAssignment("x", ADDRESS, "1"))));
        }

        @Test
        @DisplayName("a later upload leaves a perfect candidate alone when the matching service is down")
        void laterUploadKeepsPerfect() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(
                    List.of(token(Map.of("contracts/Token.sol", "t"), List.of())), List.of()));
            when(verificationService.verify(eq(ADDRESS), eq("1"), any()))
                    .thenReturn(new Match(CandidateStatus.PERFECT, ADDRESS, "1", null, null));
            String id = engine.uploadFiles(SESSION, files("metadata.json", METADATA, "contracts/Token.sol", "t"))
                    .snapshot().candidates().get(0).verificationId();
            assertEquals(CandidateStatus.PERFECT, engine.attachTargetAndVerify(SESSION, id, ADDRESS, "1"));

            when(verificationService.findConfirmedMatches(anyString(), any()))
                    .thenThrow(new VerificationTransportException("matching down"));
            SessionSnapshot after = engine.uploadFiles(SESSION, files("README.md", "notes")).snapshot();

            assertEquals(CandidateStatus.PERFECT, after.candidates().get(0).status());
            verify(verificationService, times(1)).verify(any(), any(), any());
        }

        @Test
        @DisplayName("uploading by url stores the fetched file")
        void uploadFromUrl() {
            when(remoteFileFetcher.fetch("https://example.org/Token.sol"))
                    .thenReturn(SourceFile.ofText("Token.sol", "contract Token {}"));
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(), List.of("Token.sol")));

            var result = engine.uploadFromUrl(SESSION, "https://example.org/Token.sol");

            assertEquals(1, result.newFiles());
            assertEquals(List.of("Token.sol"), result.snapshot().unusedFiles());
        }

        @Test
        @DisplayName("a url that cannot be fetched leaves the session untouched")
        void uploadFromUrlFailure() {
            when(remoteFileFetcher.fetch(anyString()))
                    .thenThrow(new InvalidRequestException("Fetching x returned HTTP 404"));

            assertThrows(InvalidRequestException.class,
                    () -> engine.uploadFromUrl(SESSION, "https://example.org/missing.sol"));
            assertEquals(SessionSnapshot.empty(SESSION), engine.getSessionSnapshot(SESSION));
        }

        @Test
        @DisplayName("reset discards the session")
        void reset() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(), List.of("a.txt")));
            engine.uploadFiles(SESSION, files("a.txt", "a"));

            engine.resetSession(SESSION);

            assertEquals(SessionSnapshot.empty(SESSION), engine.getSessionSnapshot(SESSION));
        }
    }

    @Nested
    @DisplayName("direct verification")
    class Direct {

        @Test
        @DisplayName("stored match is returned without touching the files")
        void storedMatch() {
            Match stored = new Match(CandidateStatus.PERFECT, ADDRESS, "1", null, null);
            when(verificationService.findConfirmedMatches(ADDRESS, "1")).thenReturn(List.of(stored));

            assertEquals(stored, engine.verifyDirect(ADDRESS, "1", List.of(), null));
            verifyNoInteractions(validationService);
        }

        @Test
        @DisplayName("no stored match and no files is not found")
        void noFiles() {
            var ex = assertThrows(NotFoundException.class, () -> engine.verifyDirect(ADDRESS, "1", null, null));
            assertEquals(VerificationEngine.NOT_YET_VERIFIED, ex.getMessage());
        }

        @Test
        @DisplayName("several contracts without a choice are ambiguous")
        void ambiguous() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(
                    new ContractCandidate("A", "A.sol", "0.8.19", "{\"a\":1}", Map.of(), List.of(), List.of()),
                    new ContractCandidate("B", "B.sol", "0.8.19", "{\"b\":1}", Map.of(), List.of(), List.of())),
                    List.of()));

            var ex = assertThrows(AmbiguousContractException.class,
                    () -> engine.verifyDirect(ADDRESS, "1", files("x", "y"), null));
            assertEquals(2, ex.getChoices().size());
            assertEquals("B", ex.getChoices().get(1).name());
        }

        @Test
        @DisplayName("chosen contract is verified with the supplied files")
        void chosenContract() {
            ContractCandidate b = new ContractCandidate("B", "B.sol", "0.8.19", "{\"b\":1}",
                    Map.of("B.sol", "b"), List.of(), List.of());
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(
                    new ContractCandidate("A", "A.sol", "0.8.19", "{\"a\":1}", Map.of(), List.of(), List.of()), b),
                    List.of()));
            when(verificationService.verify(ADDRESS, "1", b))
                    .thenReturn(new Match(CandidateStatus.PARTIAL, ADDRESS, "1", null, null));

            Match match = engine.verifyDirect(ADDRESS, "1", files("B.sol", "b"), 1);

            assertEquals(CandidateStatus.PARTIAL, match.status());
        }

        @Test
        @DisplayName("chosen contract index out of range is an invalid request")
        void chosenOutOfRange() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(
                    List.of(token(Map.of(), List.of())), List.of()));

            assertThrows(InvalidRequestException.class,
                    () -> engine.verifyDirect(ADDRESS, "1", files("x", "y"), 3));
        }

        @Test
        @DisplayName("missing sources that cannot be fetched make the candidate incomplete")
        void incomplete() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(
                    List.of(token(Map.of(), List.of("contracts/Lib.sol"))), List.of()));

            var ex = assertThrows(IncompleteCandidateException.class,
                    () -> engine.verifyDirect(ADDRESS, "1", files("x", "y"), null));
            assertEquals("Missing sources: contracts/Lib.sol", ex.getMessage());
            verify(validationService).fetchMissingSources(any());
        }

        @Test
        @DisplayName("files without metadata are incomplete")
        void noMetadata() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(), List.of("x")));

            assertThrows(IncompleteCandidateException.class,
                    () -> engine.verifyDirect(ADDRESS, "1", files("x", "y"), null));
        }
    }

    @Nested
    @DisplayName("CREATE2 verification")
    class Create2 {

        @Test
        @DisplayName("the chosen candidate is sent with normalized deployer and salt")
        void verifiesCandidate() {
            ContractCandidate candidate = token(Map.of("contracts/Token.sol", "t"), List.of());
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(candidate), List.of()));
            Match computed = new Match(CandidateStatus.PERFECT, ADDRESS, null, null, null);
            when(verificationService.verifyCreate2(candidate, DEPLOYER, SALT, List.of())).thenReturn(computed);

            Match match = engine.verifyCreate2(DEPLOYER.toUpperCase().replace("0X", "0x"), SALT, null,
                    files("contracts/Token.sol", "t"), null);

            assertEquals(computed, match);
            verify(verificationService, never()).findConfirmedMatches(anyString(), any());
            assertTrue(engine.getSessionSnapshot(SESSION).candidates().isEmpty());
        }

        @Test
        @DisplayName("constructor arguments are passed through in order")
        void constructorArgs() {
            ContractCandidate candidate = token(Map.of("contracts/Token.sol", "t"), List.of());
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(candidate), List.of()));
            when(verificationService.verifyCreate2(any(), anyString(), anyString(), anyList()))
                    .thenReturn(new Match(CandidateStatus.PARTIAL, ADDRESS, null, null, null));

            engine.verifyCreate2(DEPLOYER, SALT, List.of("0x01", "0x02"), files("contracts/Token.sol", "t"), null);

            verify(verificationService).verifyCreate2(candidate, DEPLOYER, SALT, List.of("0x01", "0x02"));
        }

        @Test
        @DisplayName("a malformed salt or deployer is an invalid request")
        void invalidInput() {
            var batch = files("contracts/Token.sol", "t");
            assertThrows(InvalidRequestException.class,
                    () -> engine.verifyCreate2(DEPLOYER, "salty", null, batch, null));
            assertThrows(InvalidRequestException.class,
                    () -> engine.verifyCreate2("0x1234", SALT, null, batch, null));
            verifyNoInteractions(validationService);
        }

        @Test
        @DisplayName("no files is an invalid request")
        void noFiles() {
            var ex = assertThrows(InvalidRequestException.class,
                    () -> engine.verifyCreate2(DEPLOYER, SALT, null, List.of(), null));
            assertEquals("There should be files in the <files> field", ex.getMessage());
        }

        @Test
        @DisplayName("missing sources that cannot be fetched make the candidate incomplete")
        void incomplete() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(
                    List.of(token(Map.of(), List.of("contracts/Lib.sol"))), List.of()));

            var ex = assertThrows(IncompleteCandidateException.class,
                    () -> engine.verifyCreate2(DEPLOYER, SALT, null, files("x", "y"), null));
            assertEquals("Missing sources: contracts/Lib.sol", ex.getMessage());
            verify(verificationService, never()).verifyCreate2(any(), any(), any(), any());
        }

        @Test
        @DisplayName("metadata without a compiler version is incomplete")
        void noCompilerVersion() {
            when(validationService.checkFiles(anyList())).thenReturn(new CheckedFiles(List.of(
                    new ContractCandidate("Token", "Token.sol", null, "{}", Map.of("Token.sol", "t"),
                            List.of(), List.of())), List.of()));

            var ex = assertThrows(IncompleteCandidateException.class,
                    () -> engine.verifyCreate2(DEPLOYER, SALT, null, files("x", "y"), null));
            assertEquals("Metadata file not specifying a compiler version.", ex.getMessage());
        }
    }

    @Test
    @DisplayName("batchStatus validates input and reports per address")
    void batchStatus() {
        when(verificationService.findConfirmedMatches(ADDRESS, "1"))
                .thenReturn(List.of(new Match(CandidateStatus.PERFECT, ADDRESS, "1", null, null)));

        Map<String, AddressStatus> result = engine.batchStatus(List.of(ADDRESS), List.of("1", "5"));

        assertEquals(CandidateStatus.PERFECT, result.get(ADDRESS).status());
        assertThrows(InvalidRequestException.class, () -> engine.batchStatus(List.of("bad"), List.of("1")));
        verifyNoInteractions(validationService);
    }
}
