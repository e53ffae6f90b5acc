package com.example.reportsync.service;

/**
 * Blocking pause between retry attempts and batch calls. Tests replace it to avoid wall-clock waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
