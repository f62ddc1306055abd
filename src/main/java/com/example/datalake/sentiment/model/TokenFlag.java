package com.example.datalake.sentiment.model;

import java.util.EnumSet;
import java.util.Set;

/** Non-exclusive token traits, packed into an int bit mask on {@link TokenMetadata}. */
public enum TokenFlag {
    POSITIVE,
    NEGATIVE,
    EMOTIONAL,
    DOMAIN_SPECIFIC,
    INTENSE,
    AMBIGUOUS,
    SARCASTIC,
    CONTEXT_DEPENDENT;

    public int mask() {
        return 1 << ordinal();
    }

    public boolean isSetIn(int flags) {
        return (flags & mask()) != 0;
    }

    public static Set<TokenFlag> unpack(int flags) {
        Set<TokenFlag> out = EnumSet.noneOf(TokenFlag.class);
        for (TokenFlag flag : values()) {
            if (flag.isSetIn(flags)) {
                out.add(flag);
            }
        }
        return out;
    }
}
