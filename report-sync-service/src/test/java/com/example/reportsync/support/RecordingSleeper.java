package com.example.reportsync.support;

import com.example.reportsync.service.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that returns at once and remembers every requested delay.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new ArrayList<>();

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
    }

    public List<Long> getSleeps() {
        return sleeps;
    }
}
