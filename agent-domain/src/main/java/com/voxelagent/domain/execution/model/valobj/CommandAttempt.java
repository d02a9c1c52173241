package com.voxelagent.domain.execution.model.valobj;

import com.voxelagent.domain.identifier.model.valobj.CommandId;

/**
 * 一次命令下发尝试。重试总是拿到新的命令 ID，通过 attemptOf 指回被重试的命令。
 *
 * @param commandId     本次尝试的命令 ID
 * @param attemptOf     被重试的命令 ID，首次尝试为 null
 * @param attemptNumber 同一逻辑步骤的第几次尝试，从 1 开始
 */
public record CommandAttempt(CommandId commandId, CommandId attemptOf, int attemptNumber) {

    public boolean isRetry() {
        return attemptOf != null;
    }
}
