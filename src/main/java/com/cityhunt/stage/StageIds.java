package com.cityhunt.stage;

import com.cityhunt.error.HuntException;

import java.util.OptionalInt;

/**
 * Stage identifiers arrive as {@code 3}, {@code "3"} or {@code "stage3"}; the
 * content store keys stages as {@code stage<N>}.
 */
public final class StageIds {
    private static final String PREFIX = "stage";

    private StageIds() {}

    public static String key(int stageNumber) {
        return PREFIX + stageNumber;
    }

    public static OptionalInt tryParse(String stageId) {
        if (stageId == null) return OptionalInt.empty();
        String raw = stageId.trim();
        if (raw.startsWith(PREFIX)) raw = raw.substring(PREFIX.length());
        if (raw.isEmpty() || !raw.chars().allMatch(Character::isDigit)) return OptionalInt.empty();
        try {
            int value = Integer.parseInt(raw);
            return value > 0 ? OptionalInt.of(value) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public static int parse(String stageId) {
        return tryParse(stageId).orElseThrow(() ->
                HuntException.invalidArgument("stageId must be a positive stage number, got: " + stageId));
    }
}
