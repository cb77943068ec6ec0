package com.example.barshift.schedule;

/**
 * Source of the random choices made while generating a week.
 */
public interface RandomSource {

    /**
     * @return an index in {@code [0, bound)}
     */
    int pick(int bound);
}
