package com.voxelagent.trigger.http;

import com.voxelagent.api.dto.CommandCounterResetResponseDTO;
import com.voxelagent.api.dto.CommandIssueRequestDTO;
import com.voxelagent.api.dto.CommandIssueResponseDTO;
import com.voxelagent.api.dto.CommandLineageDTO;
import com.voxelagent.api.response.Response;
import com.voxelagent.trigger.application.command.CommandDispatchCommandService;
import com.voxelagent.trigger.application.query.CommandLineageQueryService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 命令 ID 签发、计数器重置与血缘查询 API。
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
public class CommandController {

    private final CommandDispatchCommandService commandDispatchCommandService;
    private final CommandLineageQueryService commandLineageQueryService;

    public CommandController(CommandDispatchCommandService commandDispatchCommandService,
                             CommandLineageQueryService commandLineageQueryService) {
        this.commandDispatchCommandService = commandDispatchCommandService;
        this.commandLineageQueryService = commandLineageQueryService;
    }

    @PostMapping("/plans/{planId}/commands")
    public Response<CommandIssueResponseDTO> issueCommand(@PathVariable("sessionId") String sessionId,
                                                          @PathVariable("planId") String planId,
                                                          @RequestBody(required = false) CommandIssueRequestDTO request) {
        return Response.success(commandDispatchCommandService.issue(sessionId, planId, request));
    }

    @DeleteMapping("/plans/{planId}/commands")
    public Response<CommandCounterResetResponseDTO> resetCounter(@PathVariable("sessionId") String sessionId,
                                                                 @PathVariable("planId") String planId) {
        return Response.success(commandDispatchCommandService.reset(sessionId, planId));
    }

    @GetMapping("/commands/{commandId}")
    public Response<CommandLineageDTO> getLineage(@PathVariable("sessionId") String sessionId,
                                                  @PathVariable("commandId") String commandId) {
        return Response.success(commandLineageQueryService.getLineage(sessionId, commandId));
    }
}
