package com.voxelagent.types.exception;

import com.voxelagent.types.enums.ResponseCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 依赖引用无法解析异常。
 * <p>
 * 携带无法解析的原始引用以及声明该依赖的计划的原始 ID，整次规划调用随之被拒绝。
 * </p>
 *
 * @author voxelagent
 * @since 2025-09-09
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class UnresolvedDependencyException extends AppException {

    private static final long serialVersionUID = 4471260938471805226L;

    /** 无法解析的原始依赖引用 */
    private final String rawReference;

    /** 声明依赖的计划原始 ID */
    private final String sourcePlanRawId;

    public UnresolvedDependencyException(String rawReference, String sourcePlanRawId) {
        super(ResponseCode.UNRESOLVED_DEPENDENCY,
                "依赖引用无法解析: reference=\"" + rawReference + "\", declaredBy=\"" + sourcePlanRawId + "\"");
        this.rawReference = rawReference;
        this.sourcePlanRawId = sourcePlanRawId;
    }
}
