package com.example.barshift.schedule;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Random;

@Component
public class DefaultRandomSource implements RandomSource {

    private final Random random;

    @Autowired
    public DefaultRandomSource() {
        this(new Random());
    }

    public DefaultRandomSource(Random random) {
        this.random = random;
    }

    @Override
    public int pick(int bound) {
        return random.nextInt(bound);
    }
}
