package com.voxelagent.domain.identifier.service;

import com.voxelagent.domain.identifier.model.valobj.CommandId;
import com.voxelagent.domain.identifier.model.valobj.GoalId;
import com.voxelagent.domain.identifier.model.valobj.PlanId;
import com.voxelagent.domain.identifier.model.valobj.SessionId;
import com.voxelagent.types.common.Constants;
import com.voxelagent.types.enums.EntityKindEnum;
import com.voxelagent.types.enums.ResponseCode;
import com.voxelagent.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 标识符格式化领域服务：负责各类实体规范 ID 的生成、结构校验与解析。
 */
public class IdentifierFormatDomainService implements IdentifierFormatter {

    /** 去掉 0/o、1/l/i 等易混淆字符 */
    public static final String DEFAULT_SUFFIX_ALPHABET = "abcdefghjkmnpqrstuvwxyz23456789";
    public static final int DEFAULT_SUFFIX_LENGTH = 4;

    private static final DateTimeFormatter SESSION_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_SUFFIX_LENGTH = 16;

    private final Clock clock;
    private final Random random;
    private final int suffixLength;
    private final char[] suffixAlphabet;

    private final Pattern sessionPattern;
    private final Pattern goalPattern;
    private final Pattern planPattern;
    private final Pattern commandPattern;

    public IdentifierFormatDomainService() {
        this(Clock.systemDefaultZone(), new SecureRandom(), DEFAULT_SUFFIX_LENGTH, DEFAULT_SUFFIX_ALPHABET);
    }

    public IdentifierFormatDomainService(Clock clock, Random random, int suffixLength, String suffixAlphabet) {
        if (clock == null || random == null) {
            throw new IllegalArgumentException("clock 和 random 不能为空");
        }
        if (suffixLength < 1 || suffixLength > MAX_SUFFIX_LENGTH) {
            throw new IllegalArgumentException("suffixLength 必须在 1.." + MAX_SUFFIX_LENGTH + " 之间: " + suffixLength);
        }
        if (StringUtils.isEmpty(suffixAlphabet) || !suffixAlphabet.matches("[a-z0-9]+")) {
            throw new IllegalArgumentException("suffixAlphabet 只能包含小写字母和数字: " + suffixAlphabet);
        }
        this.clock = clock;
        this.random = random;
        this.suffixLength = suffixLength;
        this.suffixAlphabet = suffixAlphabet.toCharArray();

        String suffix = "([a-z0-9]{" + suffixLength + "})";
        String plan = Constants.PLAN_PREFIX + "_(\\d{" + Constants.GOAL_SEQUENCE_WIDTH + "})_(\\d{" + Constants.PLAN_SEQUENCE_WIDTH + "})";
        this.sessionPattern = Pattern.compile("^" + Constants.SESSION_PREFIX + "_(\\d{8})_(\\d{6})_" + suffix + "$");
        this.goalPattern = Pattern.compile("^" + Constants.GOAL_PREFIX + "_" + suffix + "_(\\d{" + Constants.GOAL_SEQUENCE_WIDTH + "})$");
        this.planPattern = Pattern.compile("^" + plan + "$");
        this.commandPattern = Pattern.compile("^" + Constants.COMMAND_PREFIX + "_(" + plan + ")_(\\d{" + Constants.COMMAND_SEQUENCE_WIDTH + "})$");
    }

    @Override
    public SessionId formatSessionId() {
        String timestamp = LocalDateTime.now(clock).format(SESSION_TIMESTAMP);
        StringBuilder suffix = new StringBuilder(suffixLength);
        for (int i = 0; i < suffixLength; i++) {
            suffix.append(suffixAlphabet[random.nextInt(suffixAlphabet.length)]);
        }
        String value = join(Constants.SESSION_PREFIX, timestamp, suffix.toString());
        return new SessionId(value, suffix.toString());
    }

    @Override
    public GoalId formatGoalId(SessionId session, int sequence) {
        if (session == null || StringUtils.isBlank(session.suffix())) {
            throw new IllegalArgumentException("session 不能为空");
        }
        requireSequence(sequence, Constants.GOAL_SEQUENCE_WIDTH, "goal sequence");
        String value = join(Constants.GOAL_PREFIX, session.suffix(), pad(sequence, Constants.GOAL_SEQUENCE_WIDTH));
        return new GoalId(value, session.suffix(), sequence);
    }

    @Override
    public PlanId formatPlanId(int goalSequence, int planIndexInGoal) {
        requireSequence(goalSequence, Constants.GOAL_SEQUENCE_WIDTH, "goal sequence");
        requireSequence(planIndexInGoal, Constants.PLAN_SEQUENCE_WIDTH, "plan index");
        String value = join(Constants.PLAN_PREFIX,
                pad(goalSequence, Constants.GOAL_SEQUENCE_WIDTH),
                pad(planIndexInGoal, Constants.PLAN_SEQUENCE_WIDTH));
        return new PlanId(value, goalSequence, planIndexInGoal);
    }

    @Override
    public CommandId formatCommandId(PlanId plan, int commandSequence) {
        if (plan == null || StringUtils.isBlank(plan.value())) {
            throw new IllegalArgumentException("plan 不能为空");
        }
        requireSequence(commandSequence, Constants.COMMAND_SEQUENCE_WIDTH, "command sequence");
        String value = join(Constants.COMMAND_PREFIX, plan.value(), pad(commandSequence, Constants.COMMAND_SEQUENCE_WIDTH));
        return new CommandId(value, plan, commandSequence);
    }

    @Override
    public boolean isCanonical(String candidate, EntityKindEnum kind) {
        if (candidate == null || kind == null) {
            return false;
        }
        return switch (kind) {
            case SESSION -> sessionPattern.matcher(candidate).matches();
            case GOAL -> matchGoal(candidate) != null;
            case PLAN -> matchPlan(candidate) != null;
            case COMMAND -> matchCommand(candidate) != null;
        };
    }

    @Override
    public SessionId parseSessionId(String candidate) {
        Matcher matcher = candidate == null ? null : sessionPattern.matcher(candidate);
        if (matcher == null || !matcher.matches()) {
            throw new AppException(ResponseCode.INVALID_SESSION_FORMAT,
                    "会话ID格式不合法，请申请服务端签发的会话ID: " + candidate);
        }
        return new SessionId(candidate, matcher.group(3));
    }

    @Override
    public GoalId parseGoalId(String candidate) {
        Matcher matcher = matchGoal(candidate);
        if (matcher == null) {
            throw notCanonical(EntityKindEnum.GOAL, candidate);
        }
        return new GoalId(candidate, matcher.group(1), Integer.parseInt(matcher.group(2)));
    }

    @Override
    public PlanId parsePlanId(String candidate) {
        Matcher matcher = matchPlan(candidate);
        if (matcher == null) {
            throw notCanonical(EntityKindEnum.PLAN, candidate);
        }
        return new PlanId(candidate, Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    @Override
    public CommandId parseCommandId(String candidate) {
        Matcher matcher = matchCommand(candidate);
        if (matcher == null) {
            throw notCanonical(EntityKindEnum.COMMAND, candidate);
        }
        PlanId plan = new PlanId(matcher.group(1), Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(3)));
        return new CommandId(candidate, plan, Integer.parseInt(matcher.group(4)));
    }

    private Matcher matchGoal(String candidate) {
        if (candidate == null) {
            return null;
        }
        Matcher matcher = goalPattern.matcher(candidate);
        if (!matcher.matches() || isZero(matcher.group(2))) {
            return null;
        }
        return matcher;
    }

    private Matcher matchPlan(String candidate) {
        if (candidate == null) {
            return null;
        }
        Matcher matcher = planPattern.matcher(candidate);
        if (!matcher.matches() || isZero(matcher.group(1)) || isZero(matcher.group(2))) {
            return null;
        }
        return matcher;
    }

    private Matcher matchCommand(String candidate) {
        if (candidate == null) {
            return null;
        }
        Matcher matcher = commandPattern.matcher(candidate);
        if (!matcher.matches()
                || isZero(matcher.group(2))
                || isZero(matcher.group(3))
                || isZero(matcher.group(4))) {
            return null;
        }
        return matcher;
    }

    private void requireSequence(int sequence, int width, String field) {
        int max = maxValue(width);
        if (sequence < 1 || sequence > max) {
            throw new AppException(ResponseCode.INVALID_SEQUENCE,
                    field + " 必须在 1.." + max + " 之间: " + sequence);
        }
    }

    private AppException notCanonical(EntityKindEnum kind, String candidate) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER,
                "不是规范的" + kind.getCode() + " ID: " + candidate);
    }

    private static int maxValue(int width) {
        int max = 1;
        for (int i = 0; i < width; i++) {
            max *= 10;
        }
        return max - 1;
    }

    private static boolean isZero(String digits) {
        return Integer.parseInt(digits) == 0;
    }

    private static String pad(int value, int width) {
        return StringUtils.leftPad(String.valueOf(value), width, '0');
    }

    private static String join(String... parts) {
        return String.join(Constants.ID_SEPARATOR, parts);
    }
}
