package com.voxelagent.trigger.http;

import com.voxelagent.api.dto.PlanningResultDTO;
import com.voxelagent.api.response.Response;
import com.voxelagent.trigger.application.command.PlanningCommandService;
import com.voxelagent.types.enums.ResponseCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 规划提交 API：请求体为上游规划服务的原始输出文本。
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}/plans")
public class PlanningController {

    private final PlanningCommandService planningCommandService;

    public PlanningController(PlanningCommandService planningCommandService) {
        this.planningCommandService = planningCommandService;
    }

    @PostMapping
    public Response<PlanningResultDTO> submitPlanning(@PathVariable("sessionId") String sessionId,
                                                      @RequestBody(required = false) String plannerOutput) {
        if (StringUtils.isBlank(plannerOutput)) {
            return Response.failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), "规划输出不能为空");
        }
        return Response.success(planningCommandService.submit(sessionId, plannerOutput));
    }
}
