package com.example.securechat.api;

import com.example.securechat.api.dto.ChatRequestDto;
import com.example.securechat.api.dto.ChatResponseDto;
import com.example.securechat.crypto.Base64Fields;
import com.example.securechat.service.ChatTurnCommand;
import com.example.securechat.service.ChatTurnResult;
import com.example.securechat.service.ChatTurnService;
import com.example.securechat.web.OwnerIdResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Encrypted chat turn endpoint. The body carries ciphertext only; the reply is
 * encrypted under the same key id.
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatApiController {

    private final ChatTurnService chatTurnService;
    private final OwnerIdResolver ownerIdResolver;

    @PostMapping
    public ResponseEntity<ChatResponseDto> chat(@RequestBody @Valid ChatRequestDto req,
                                                HttpServletRequest request) {
        String ownerId = ownerIdResolver.resolveOwnerId(request);
        ChatTurnCommand command = new ChatTurnCommand(
                ownerId,
                SessionIds.parseOptional(req.sessionId()),
                Base64Fields.decode("encrypted_message", req.encryptedMessage()),
                req.encryptionMetadata(),
                req.contentHash());
        log.debug("Chat turn from {} (session={})", ownerId, command.sessionId());
        ChatTurnResult result = chatTurnService.handleTurn(command);
        return ResponseEntity.ok(ChatResponseDto.from(result));
    }
}
