package com.voxelagent.trigger.http;

import com.voxelagent.api.dto.SessionCloseResponseDTO;
import com.voxelagent.api.dto.SessionStartRequestDTO;
import com.voxelagent.api.dto.SessionStartResponseDTO;
import com.voxelagent.api.response.Response;
import com.voxelagent.trigger.application.command.SessionCommandService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 会话生命周期 API。
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionCommandService sessionCommandService;

    public SessionController(SessionCommandService sessionCommandService) {
        this.sessionCommandService = sessionCommandService;
    }

    @PostMapping
    public Response<SessionStartResponseDTO> startSession(@RequestBody(required = false) SessionStartRequestDTO request) {
        return Response.success(sessionCommandService.startSession(request));
    }

    @DeleteMapping("/{sessionId}")
    public Response<SessionCloseResponseDTO> closeSession(@PathVariable("sessionId") String sessionId) {
        return Response.success(sessionCommandService.closeSession(sessionId));
    }
}
