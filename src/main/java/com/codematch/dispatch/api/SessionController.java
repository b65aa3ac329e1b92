package com.codematch.dispatch.api;

import com.codematch.core.engine.VerificationEngine;
import com.codematch.core.error.InvalidRequestException;
import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.SourceFile;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST controller for session-scoped verification. The servlet session id keys the
 * verification session.
 */
@RestController
@RequestMapping("/api/v1/session")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final VerificationEngine engine;

    public SessionController(VerificationEngine engine) {
        this.engine = engine;
    }

    /**
     * GET /api/v1/session/data: Current candidates and unused files.
     */
    @GetMapping("/data")
    public ResponseEntity<SessionResponse> getSessionData(HttpSession session) {
        return ResponseEntity.ok(SessionResponse.from(engine.getSessionSnapshot(session.getId())));
    }

    /**
     * POST /api/v1/session/input-files: Multipart upload, one part per file.
     */
    @PostMapping(value = "/input-files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SessionResponse> uploadMultipart(
            @RequestParam(value = "files", required = false) List<MultipartFile> files,
            HttpSession session) throws IOException {
        List<SourceFile> sourceFiles = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                String path = file.getOriginalFilename() != null && !file.getOriginalFilename().isBlank()
                        ? file.getOriginalFilename()
                        : file.getName();
                sourceFiles.add(new SourceFile(path, file.getBytes()));
            }
        }
        return upload(session, sourceFiles);
    }

    /**
     * POST /api/v1/session/input-files: JSON upload of {@code {files: {path: content}}}.
     */
    @PostMapping(value = "/input-files", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SessionResponse> uploadJson(@RequestBody InputFilesRequest request,
                                                      HttpSession session) {
        List<SourceFile> sourceFiles = new ArrayList<>();
        if (request.files() != null) {
            request.files().forEach((path, content) ->
                    sourceFiles.add(SourceFile.ofText(path, content != null ? content : "")));
        }
        return upload(session, sourceFiles);
    }

    /**
     * POST /api/v1/session/input-files?url=...: Downloads one file and adds it to the session.
     */
    @PostMapping(value = "/input-files", params = "url")
    public ResponseEntity<SessionResponse> uploadFromUrl(@RequestParam String url, HttpSession session) {
        VerificationEngine.UploadResult result = engine.uploadFromUrl(session.getId(), url);
        log.debug("Upload from {} for session {} admitted {} new files", url, session.getId(), result.newFiles());
        return ResponseEntity.ok(SessionResponse.from(result.snapshot(), result.newFiles()));
    }

    /**
     * POST /api/v1/session/clear: Discards the verification session.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clear(HttpSession session) {
        String sessionId = session.getId();
        engine.resetSession(sessionId);
        session.invalidate();
        return ResponseEntity.ok(Map.of("message", "Session cleared"));
    }

    /**
     * POST /api/v1/session/verify-validated: Assigns targets to several candidates and
     * verifies those that became verifiable.
     */
    @PostMapping("/verify-validated")
    public ResponseEntity<SessionResponse> verifyValidated(@RequestBody VerifyValidatedRequest request,
                                                           HttpSession session) {
        if (request.contracts() == null || request.contracts().isEmpty()) {
            throw new InvalidRequestException("There should be contracts in the <contracts> field");
        }
        List<VerificationEngine.TargetAssignment> assignments = request.contracts().stream()
                .map(c -> new VerificationEngine.TargetAssignment(c.verificationId(), c.address(), c.chainId()))
                .toList();
        return ResponseEntity.ok(SessionResponse.from(engine.verifyCandidates(session.getId(), assignments)));
    }

    /**
     * POST /api/v1/session/contracts/{id}/verify: Assigns a target to one candidate and verifies it.
     */
    @PostMapping("/contracts/{id}/verify")
    public ResponseEntity<Map<String, String>> verifyContract(@PathVariable String id,
                                                              @RequestBody TargetRequest request,
                                                              HttpSession session) {
        CandidateStatus status = engine.attachTargetAndVerify(
                session.getId(), id, request.address(), request.chainId());
        return ResponseEntity.ok(Map.of(
                "verificationId", id,
                "status", status.wireValue()));
    }

    private ResponseEntity<SessionResponse> upload(HttpSession session, List<SourceFile> files) {
        VerificationEngine.UploadResult result = engine.uploadFiles(session.getId(), files);
        log.debug("Upload for session {} admitted {} new files", session.getId(), result.newFiles());
        return ResponseEntity.ok(SessionResponse.from(result.snapshot(), result.newFiles()));
    }
}
