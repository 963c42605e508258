package com.tabletop.workstation.game;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public interface RandomSource {
    int nextInt(int bound);

    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            Collections.swap(list, i, nextInt(i + 1));
        }
    }

    static RandomSource secure() {
        SecureRandom random = new SecureRandom();
        return random::nextInt;
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextInt;
    }
}
