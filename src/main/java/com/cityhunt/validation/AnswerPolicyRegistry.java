package com.cityhunt.validation;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class AnswerPolicyRegistry {
    private final Map<String, AnswerPolicy> byName = Arrays.stream(AnswerPolicy.values())
            .collect(Collectors.toUnmodifiableMap(AnswerPolicy::policyName, Function.identity()));

    public AnswerPolicy resolve(String policyName) {
        if (policyName == null || policyName.isBlank()) return AnswerPolicy.DEFAULT;
        return byName.getOrDefault(policyName.trim().toLowerCase(Locale.ROOT), AnswerPolicy.DEFAULT);
    }
}
