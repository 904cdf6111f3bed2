package com.example.securechat.api;

import com.example.securechat.api.dto.ChatMessageDto;
import com.example.securechat.api.dto.ChatSessionDto;
import com.example.securechat.api.dto.CreateSessionRequest;
import com.example.securechat.api.dto.SessionDataDto;
import com.example.securechat.api.dto.SessionHistoryDto;
import com.example.securechat.api.dto.UpdateTitleRequest;
import com.example.securechat.crypto.Base64Fields;
import com.example.securechat.error.SessionAccessDeniedException;
import com.example.securechat.service.ChatTurnService;
import com.example.securechat.store.SessionData;
import com.example.securechat.store.SessionStore;
import com.example.securechat.store.SessionSummary;
import com.example.securechat.web.OwnerIdResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Owner-scoped session management. A session that is missing and one that
 * belongs to another user both answer 403.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionApiController {

    private final SessionStore sessionStore;
    private final ChatTurnService chatTurnService;
    private final OwnerIdResolver ownerIdResolver;

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody(required = false) CreateSessionRequest body,
                                                      HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        UUID id = sessionStore.createSession(ownerId, body == null ? null : body.title());
        SessionSummary created = sessionStore.getSession(id, ownerId)
                .orElseThrow(() -> new SessionAccessDeniedException(id));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("session_id", id.toString());
        out.put("title", created.title());
        return ResponseEntity.ok(out);
    }

    @GetMapping
    public List<ChatSessionDto> list(@RequestParam(name = "limit", defaultValue = "50") int limit,
                                     @RequestParam(name = "offset", defaultValue = "0") int offset,
                                     HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        return sessionStore.listSessions(ownerId, limit, offset).stream()
                .map(ChatSessionDto::from)
                .toList();
    }

    @GetMapping("/{sessionId}")
    public ChatSessionDto get(@PathVariable("sessionId") String sessionId, HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        UUID id = SessionIds.parse(sessionId);
        return sessionStore.getSession(id, ownerId)
                .map(ChatSessionDto::from)
                .orElseThrow(() -> new SessionAccessDeniedException(id));
    }

    @GetMapping("/{sessionId}/history")
    public SessionHistoryDto history(@PathVariable("sessionId") String sessionId, HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        UUID id = SessionIds.parse(sessionId);
        List<ChatMessageDto> history = chatTurnService.history(id, ownerId).stream()
                .map(ChatMessageDto::from)
                .toList();
        return new SessionHistoryDto(id.toString(), history);
    }

    @PutMapping("/{sessionId}/title")
    public Map<String, Object> updateTitle(@PathVariable("sessionId") String sessionId,
                                           @RequestBody @Valid UpdateTitleRequest body,
                                           HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        UUID id = SessionIds.parse(sessionId);
        if (!sessionStore.updateTitle(id, ownerId, body.title())) {
            throw new SessionAccessDeniedException(id);
        }
        return Map.of("ok", true);
    }

    @DeleteMapping("/{sessionId}")
    public Map<String, Object> delete(@PathVariable("sessionId") String sessionId, HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        UUID id = SessionIds.parse(sessionId);
        if (!sessionStore.deleteSession(id, ownerId)) {
            throw new SessionAccessDeniedException(id);
        }
        return Map.of("ok", true);
    }

    @PutMapping("/{sessionId}/data")
    public Map<String, Object> putData(@PathVariable("sessionId") String sessionId,
                                       @RequestBody @Valid SessionDataDto body,
                                       HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        UUID id = SessionIds.parse(sessionId);
        byte[] data = Base64Fields.decode("encrypted_session_data", body.encryptedSessionData());
        if (!sessionStore.updateSessionData(id, ownerId, data, body.sessionEncryptionMetadata())) {
            throw new SessionAccessDeniedException(id);
        }
        return Map.of("ok", true);
    }

    @GetMapping("/{sessionId}/data")
    public SessionDataDto getData(@PathVariable("sessionId") String sessionId, HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        UUID id = SessionIds.parse(sessionId);
        SessionData data = sessionStore.getSessionData(id, ownerId)
                .orElseThrow(() -> new SessionAccessDeniedException(id));
        return new SessionDataDto(Base64Fields.encode(data.encryptedData()), data.metadata());
    }
}
