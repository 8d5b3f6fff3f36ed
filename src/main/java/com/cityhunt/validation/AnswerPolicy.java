package com.cityhunt.validation;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.BiPredicate;

public enum AnswerPolicy {
    DEFAULT(AnswerPolicy::exact),
    STAGE1(AnswerPolicy::exact),
    STAGE2((answer, spec) -> Arrays.stream(spec.split(","))
            .map(AnswerPolicy::normalize)
            .anyMatch(normalize(answer)::equals)),
    STAGE3((answer, spec) -> normalize(answer).contains(normalize(spec)));

    private final BiPredicate<String, String> rule;

    AnswerPolicy(BiPredicate<String, String> rule) {
        this.rule = rule;
    }

    public boolean matches(String userAnswer, String answerSpec) {
        if (userAnswer == null || answerSpec == null) return false;
        return rule.test(userAnswer, answerSpec);
    }

    public String policyName() {
        return name().toLowerCase(Locale.ROOT);
    }

    private static boolean exact(String answer, String spec) {
        return normalize(answer).equals(normalize(spec));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
